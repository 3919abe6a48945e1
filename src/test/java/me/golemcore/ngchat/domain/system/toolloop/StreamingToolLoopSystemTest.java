package me.golemcore.ngchat.domain.system.toolloop;

import me.golemcore.ngchat.domain.model.ChatEvent;
import me.golemcore.ngchat.domain.model.ChatEventType;
import me.golemcore.ngchat.domain.model.LlmChunk;
import me.golemcore.ngchat.domain.model.LlmRequest;
import me.golemcore.ngchat.domain.model.LlmResponse;
import me.golemcore.ngchat.domain.model.LlmUsage;
import me.golemcore.ngchat.domain.model.Message;
import me.golemcore.ngchat.domain.model.ToolCallDelta;
import me.golemcore.ngchat.domain.model.ToolDefinition;
import me.golemcore.ngchat.domain.model.ToolResult;
import me.golemcore.ngchat.domain.model.ViewerSession;
import me.golemcore.ngchat.domain.model.ViewerState;
import me.golemcore.ngchat.domain.service.SystemPromptProvider;
import me.golemcore.ngchat.domain.service.ViewerLinkMasker;
import me.golemcore.ngchat.domain.service.ViewerStateCodec;
import me.golemcore.ngchat.domain.service.ViewerStateSummarizer;
import me.golemcore.ngchat.infrastructure.config.AutoConfiguration;
import me.golemcore.ngchat.infrastructure.config.NgChatProperties;
import me.golemcore.ngchat.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StreamingToolLoopSystemTest {

    private static final String TOOL_NAME = "ng_set_view";
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Mock
    private LlmPort llmPort;

    @Mock
    private ToolExecutorPort toolExecutor;

    @Mock
    private SystemPromptProvider promptProvider;

    private NgChatProperties.ToolLoopProperties settings;
    private ViewerSession session;
    private StreamingToolLoopSystem system;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(promptProvider.getSystemPrompt()).thenReturn("prompt");
        when(llmPort.supportsStreaming()).thenReturn(true);

        NgChatProperties properties = new NgChatProperties();
        settings = properties.getToolLoop();
        settings.setStreamMaxIterations(4);
        ViewerStateCodec codec = new ViewerStateCodec(AutoConfiguration.objectMapper(), properties);
        Clock clock = Clock.fixed(Instant.parse("2026-02-14T00:00:00Z"), ZoneId.of("UTC"));

        session = new ViewerSession("sess-1", ViewerState.createDefault(), Instant.EPOCH);
        system = new StreamingToolLoopSystem(llmPort, toolExecutor, new DefaultHistoryWriter(clock),
                new ConversationAssembler(promptProvider, new ViewerStateSummarizer()),
                new StateLinkFactory(codec, new ViewerLinkMasker(properties)),
                () -> List.of(ToolDefinition.simple(TOOL_NAME, "Move the view")), settings,
                AutoConfiguration.objectMapper());
    }

    private static LlmChunk deltas(ToolCallDelta... deltas) {
        return LlmChunk.builder().toolCallDeltas(List.of(deltas)).build();
    }

    private static LlmChunk done() {
        return LlmChunk.builder().done(true).usage(LlmUsage.of(10, 5)).finishReason("stop").build();
    }

    private static ToolExecutionOutcome success(String id, boolean mutating) {
        return new ToolExecutionOutcome(id, TOOL_NAME, ToolResult.success("ok", Map.of("ok", true)),
                "{\"ok\":true}", mutating, false);
    }

    private List<ChatEvent> collect(Flux<ChatEvent> events) {
        List<ChatEvent> collected = events.collectList().block(TIMEOUT);
        assertNotNull(collected);
        return collected;
    }

    private static List<ChatEventType> types(List<ChatEvent> events) {
        return events.stream().map(ChatEvent::type).toList();
    }

    // ==================== event order ====================

    @Test
    void shouldEmitEventsInProtocolOrder() {
        when(llmPort.chatStream(any()))
                .thenReturn(Flux.just(
                        LlmChunk.text("Moving"),
                        deltas(new ToolCallDelta(0, "tc-1", TOOL_NAME, "{\"center\":")),
                        deltas(new ToolCallDelta(0, null, null, "{\"x\":1,\"y\":2,\"z\":3}}")),
                        done()))
                .thenReturn(Flux.just(LlmChunk.text(" Done."), done()));
        when(toolExecutor.execute(any(), any(), anyInt())).thenReturn(success("tc-1", true));

        List<ChatEvent> events = collect(system.streamTurn(session, List.of(Message.user("go"))));

        assertEquals(List.of(ChatEventType.ITERATION, ChatEventType.CONTENT, ChatEventType.TOOL_CALLS,
                ChatEventType.LLM_DONE, ChatEventType.TOOL_START, ChatEventType.TOOL_DONE,
                ChatEventType.ITERATION, ChatEventType.CONTENT, ChatEventType.LLM_DONE,
                ChatEventType.FINAL, ChatEventType.COMPLETE), types(events));
        assertEquals(0, events.get(0).iteration());
        assertEquals(1, events.get(6).iteration());
        assertEquals(List.of(Map.of("id", "tc-1", "name", TOOL_NAME)), events.get(2).toolCalls());
        assertEquals(15, events.get(3).usage().getTotalTokens());
        assertEquals("{\"ok\":true}", events.get(5).result());

        ChatEvent finalEvent = events.get(9);
        assertEquals("Moving Done.", finalEvent.content());
        assertTrue(finalEvent.mutated());
        assertNotNull(finalEvent.stateLink());
    }

    @Test
    void shouldAssembleArgumentsFromFragmentsBeforeExecuting() {
        when(llmPort.chatStream(any()))
                .thenReturn(Flux.just(
                        deltas(new ToolCallDelta(0, "tc-1", TOOL_NAME, "{\"center\":{\"x\":1,")),
                        deltas(new ToolCallDelta(0, null, null, "\"y\":2,")),
                        deltas(new ToolCallDelta(0, null, null, "\"z\":3}}")),
                        done()))
                .thenReturn(Flux.just(LlmChunk.text("ok"), done()));
        when(toolExecutor.execute(any(), any(), anyInt())).thenReturn(success("tc-1", true));

        List<ChatEvent> events = collect(system.streamTurn(session, List.of(Message.user("go"))));

        ArgumentCaptor<Message.ToolCall> captor = ArgumentCaptor.forClass(Message.ToolCall.class);
        verify(toolExecutor).execute(any(), captor.capture(), anyInt());
        assertEquals(Map.of("center", Map.of("x", 1, "y", 2, "z", 3)), captor.getValue().getArguments());
        ChatEvent start = events.stream().filter(e -> e.type() == ChatEventType.TOOL_START).findFirst()
                .orElseThrow();
        assertEquals(captor.getValue().getArguments(), start.args());
    }

    @Test
    void shouldReportInvalidArgumentsAsToolErrorWithoutExecuting() {
        when(llmPort.chatStream(any()))
                .thenReturn(Flux.just(deltas(new ToolCallDelta(0, "tc-1", TOOL_NAME, "{\"center\":")), done()))
                .thenReturn(Flux.just(LlmChunk.text("Let me retry."), done()));

        List<ChatEvent> events = collect(system.streamTurn(session, List.of(Message.user("go"))));

        ChatEvent error = events.stream().filter(e -> e.type() == ChatEventType.TOOL_ERROR).findFirst()
                .orElseThrow();
        assertTrue(error.error().startsWith("Invalid tool arguments JSON"));
        verify(toolExecutor, never()).execute(any(), any(), anyInt());
        ChatEvent finalEvent = events.get(events.size() - 2);
        assertEquals("Let me retry.", finalEvent.content());
        assertFalse(finalEvent.mutated());
        assertNull(finalEvent.stateLink());
    }

    // ==================== ceiling & failures ====================

    @Test
    void shouldSummarizeWithoutToolsAtCeiling() {
        settings.setStreamMaxIterations(2);
        when(llmPort.chatStream(any())).thenReturn(Flux.just(
                deltas(new ToolCallDelta(0, "tc", TOOL_NAME, "{}")), done()));
        when(toolExecutor.execute(any(), any(), anyInt())).thenReturn(success("tc", false));

        List<ChatEvent> events = collect(system.streamTurn(session, List.of(Message.user("loop"))));

        verify(toolExecutor, times(1)).execute(any(), any(), anyInt());
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort, times(2)).chatStream(captor.capture());
        assertTrue(captor.getAllValues().get(1).getTools().isEmpty());
        assertEquals("Tool loop stopped: reached max iterations (2).", events.get(events.size() - 2).content());
        assertEquals(1, events.stream().filter(e -> e.type() == ChatEventType.TOOL_CALLS).count());
    }

    @Test
    void shouldFinishWithFallbackWhenModelStreamFails() {
        when(llmPort.chatStream(any())).thenReturn(Flux.error(new IllegalStateException("connection reset")));

        List<ChatEvent> events = collect(system.streamTurn(session, List.of(Message.user("hi"))));

        assertEquals(List.of(ChatEventType.ITERATION, ChatEventType.FINAL, ChatEventType.COMPLETE), types(events));
        assertEquals("(no response)", events.get(1).content());
    }

    @Test
    void shouldFallBackToBufferedCallWithoutStreamingSupport() {
        when(llmPort.supportsStreaming()).thenReturn(false);
        when(llmPort.chat(any()))
                .thenReturn(CompletableFuture.completedFuture(LlmResponse.builder()
                        .toolCalls(List.of(Message.ToolCall.builder().id("tc-1").name(TOOL_NAME)
                                .arguments(Map.of("zoom", "fit")).build()))
                        .build()))
                .thenReturn(CompletableFuture.completedFuture(LlmResponse.builder().content("Reset.").build()));
        when(toolExecutor.execute(any(), any(), anyInt())).thenReturn(success("tc-1", true));

        List<ChatEvent> events = collect(system.streamTurn(session, List.of(Message.user("fit"))));

        verify(llmPort, never()).chatStream(any());
        ArgumentCaptor<Message.ToolCall> captor = ArgumentCaptor.forClass(Message.ToolCall.class);
        verify(toolExecutor).execute(any(), captor.capture(), anyInt());
        assertEquals(Map.of("zoom", "fit"), captor.getValue().getArguments());
        assertEquals("Reset.", events.get(events.size() - 2).content());
    }

    // ==================== cancellation ====================

    @Test
    void shouldStopWithoutRunningToolsWhenCancelled() {
        when(llmPort.chatStream(any())).thenReturn(Flux.concat(
                Flux.just(LlmChunk.text("Thinking")),
                Flux.<LlmChunk>never()));

        StepVerifier.create(system.streamTurn(session, List.of(Message.user("go"))))
                .expectNextMatches(event -> event.type() == ChatEventType.ITERATION)
                .expectNextMatches(event -> event.type() == ChatEventType.CONTENT
                        && "Thinking".equals(event.delta()))
                .thenCancel()
                .verify(TIMEOUT);

        verify(toolExecutor, never()).execute(any(), any(), anyInt());
    }
}
