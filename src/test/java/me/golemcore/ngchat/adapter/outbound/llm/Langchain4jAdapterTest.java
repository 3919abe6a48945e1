package me.golemcore.ngchat.adapter.outbound.llm;

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.output.FinishReason;
import dev.langchain4j.model.output.TokenUsage;
import me.golemcore.ngchat.domain.model.LlmRequest;
import me.golemcore.ngchat.domain.model.LlmResponse;
import me.golemcore.ngchat.domain.model.Message;
import me.golemcore.ngchat.domain.model.ToolCallDelta;
import me.golemcore.ngchat.domain.model.ToolDefinition;
import me.golemcore.ngchat.infrastructure.config.AutoConfiguration;
import me.golemcore.ngchat.infrastructure.config.NgChatProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class Langchain4jAdapterTest {

    private static final String CONVERT_MESSAGES = "convertMessages";
    private static final String CONVERT_TOOL_DEFINITION = "convertToolDefinition";
    private static final String PARSE_JSON_ARGS = "parseJsonArgs";
    private static final String TEST_MODEL = "test-model";

    private NgChatProperties properties;
    private Langchain4jAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new NgChatProperties();
        properties.getLlm().setModel(TEST_MODEL);
        adapter = new Langchain4jAdapter(properties, AutoConfiguration.objectMapper());
    }

    @Test
    void shouldReportProviderAndModel() {
        assertEquals("langchain4j", adapter.getProviderId());
        assertEquals(TEST_MODEL, adapter.getCurrentModel());
        assertTrue(adapter.supportsStreaming());
    }

    @Test
    void shouldBeAvailableOnlyWithApiKey() {
        assertFalse(adapter.isAvailable());

        properties.getLlm().setApiKey("  ");
        assertFalse(adapter.isAvailable());

        properties.getLlm().setApiKey("sk-test");
        assertTrue(adapter.isAvailable());
    }

    @Test
    void shouldConvertConversationMessages() {
        Message assistantCall = Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .toolCalls(List.of(Message.ToolCall.builder()
                        .id("call_1")
                        .name("ng_set_view")
                        .arguments(Map.of("zoom", 2))
                        .build()))
                .build();
        Message toolResult = Message.builder()
                .role(Message.ROLE_TOOL)
                .toolCallId("call_1")
                .toolName("ng_set_view")
                .content("{\"ok\":true}")
                .build();
        LlmRequest request = LlmRequest.builder()
                .messages(List.of(
                        Message.system("You drive the viewer."),
                        Message.system(" "),
                        Message.user("zoom in"),
                        assistantCall,
                        toolResult,
                        Message.assistant("Done.")))
                .build();

        List<ChatMessage> messages = ReflectionTestUtils.invokeMethod(adapter, CONVERT_MESSAGES, request);

        assertNotNull(messages);
        assertEquals(5, messages.size());
        assertInstanceOf(SystemMessage.class, messages.get(0));
        assertEquals("zoom in", ((UserMessage) messages.get(1)).singleText());
        AiMessage call = (AiMessage) messages.get(2);
        assertTrue(call.hasToolExecutionRequests());
        assertEquals("call_1", call.toolExecutionRequests().get(0).id());
        assertEquals("{\"zoom\":2}", call.toolExecutionRequests().get(0).arguments());
        ToolExecutionResultMessage result = (ToolExecutionResultMessage) messages.get(3);
        assertEquals("call_1", result.id());
        assertEquals("ng_set_view", result.toolName());
        assertEquals("Done.", ((AiMessage) messages.get(4)).text());
    }

    @Test
    void shouldConvertToolSchema() {
        ToolDefinition definition = ToolDefinition.builder()
                .name("ng_state_summary")
                .description("Describe the view")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "detail", Map.of("type", "string", "enum", List.of("minimal", "full")),
                                "limit", Map.of("type", "integer", "description", "Row cap")),
                        "required", List.of("detail")))
                .build();

        ToolSpecification specification = ReflectionTestUtils.invokeMethod(adapter, CONVERT_TOOL_DEFINITION,
                definition);

        assertNotNull(specification);
        assertEquals("ng_state_summary", specification.name());
        JsonObjectSchema parameters = specification.parameters();
        assertInstanceOf(JsonEnumSchema.class, parameters.properties().get("detail"));
        assertInstanceOf(JsonIntegerSchema.class, parameters.properties().get("limit"));
        assertEquals(List.of("detail"), parameters.required());
    }

    @Test
    void shouldParseToolArgumentsLeniently() {
        Map<String, Object> parsed = ReflectionTestUtils.invokeMethod(adapter, PARSE_JSON_ARGS, "{\"zoom\":3}");
        assertEquals(Map.of("zoom", 3), parsed);

        Map<String, Object> broken = ReflectionTestUtils.invokeMethod(adapter, PARSE_JSON_ARGS, "{zoom");
        assertEquals(Map.of(), broken);

        Map<String, Object> blank = ReflectionTestUtils.invokeMethod(adapter, PARSE_JSON_ARGS, "");
        assertEquals(Map.of(), blank);
    }

    @Test
    void shouldReturnNullForMissingResponse() {
        LlmResponse response = ReflectionTestUtils.invokeMethod(adapter, "convertResponse", (ChatResponse) null);
        assertNull(response);
    }

    @Test
    void shouldFailChatWhenModelMissing() {
        ReflectionTestUtils.setField(adapter, "initialized", true);

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> adapter.chat(LlmRequest.builder().messages(List.of(Message.user("hi"))).build()).get());
        assertTrue(error.getCause().getMessage().contains("not available"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldChatWithoutToolsUsingMessageList() throws Exception {
        ChatModel model = mock(ChatModel.class);
        injectModels(model, null);
        when(model.chat((List<ChatMessage>) any())).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("Hello"))
                .tokenUsage(new TokenUsage(10, 5, 15))
                .finishReason(FinishReason.STOP)
                .build());

        LlmResponse response = adapter.chat(LlmRequest.builder().messages(List.of(Message.user("hi"))).build())
                .get();

        assertEquals("Hello", response.getContent());
        assertEquals("STOP", response.getFinishReason());
        assertEquals(15, response.getUsage().getTotalTokens());
        assertEquals(TEST_MODEL, response.getModel());
        assertFalse(response.hasToolCalls());
    }

    @Test
    void shouldChatWithToolsAndParseCalls() throws Exception {
        ChatModel model = mock(ChatModel.class);
        injectModels(model, null);
        when(model.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from(List.of(ToolExecutionRequest.builder()
                        .id("call_9")
                        .name("ng_set_view")
                        .arguments("{\"center\":{\"x\":1,\"y\":2,\"z\":3}}")
                        .build())))
                .finishReason(FinishReason.TOOL_EXECUTION)
                .build());
        ToolDefinition tool = ToolDefinition.builder()
                .name("ng_set_view")
                .description("Move")
                .inputSchema(Map.of("type", "object", "properties", Map.of()))
                .build();

        LlmResponse response = adapter.chat(LlmRequest.builder()
                .messages(List.of(Message.user("go")))
                .tools(List.of(tool))
                .build()).get();

        assertTrue(response.hasToolCalls());
        Message.ToolCall call = response.getToolCalls().get(0);
        assertEquals("call_9", call.getId());
        assertEquals(Map.of("x", 1, "y", 2, "z", 3), call.getArguments().get("center"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldWrapModelFailure() {
        ChatModel model = mock(ChatModel.class);
        injectModels(model, null);
        when(model.chat((List<ChatMessage>) any())).thenThrow(new RuntimeException("Connection refused"));

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> adapter.chat(LlmRequest.builder().messages(List.of(Message.user("hi"))).build()).get());
        assertTrue(error.getCause().getMessage().contains("Connection refused"));
    }

    @Test
    void shouldStreamTextThenToolCallDeltas() {
        StreamingChatModel streamingModel = mock(StreamingChatModel.class);
        injectModels(null, streamingModel);
        doAnswer(invocation -> {
            StreamingChatResponseHandler handler = invocation.getArgument(1);
            handler.onPartialResponse("Mov");
            handler.onPartialResponse("ing");
            handler.onCompleteResponse(ChatResponse.builder()
                    .aiMessage(AiMessage.from("Moving", List.of(ToolExecutionRequest.builder()
                            .id("call_1")
                            .name("ng_set_view")
                            .arguments("{}")
                            .build())))
                    .finishReason(FinishReason.TOOL_EXECUTION)
                    .build());
            return null;
        }).when(streamingModel).chat(any(ChatRequest.class), any(StreamingChatResponseHandler.class));

        StepVerifier.create(adapter.chatStream(LlmRequest.builder().messages(List.of(Message.user("go"))).build()))
                .assertNext(chunk -> assertEquals("Mov", chunk.getText()))
                .assertNext(chunk -> assertEquals("ing", chunk.getText()))
                .assertNext(chunk -> {
                    assertTrue(chunk.isDone());
                    assertEquals(List.of(new ToolCallDelta(0, "call_1", "ng_set_view", "{}")),
                            chunk.getToolCallDeltas());
                    assertEquals("TOOL_EXECUTION", chunk.getFinishReason());
                })
                .verifyComplete();
    }

    @Test
    void shouldPropagateStreamingError() {
        StreamingChatModel streamingModel = mock(StreamingChatModel.class);
        injectModels(null, streamingModel);
        doAnswer(invocation -> {
            StreamingChatResponseHandler handler = invocation.getArgument(1);
            handler.onError(new IllegalStateException("socket closed"));
            return null;
        }).when(streamingModel).chat(any(ChatRequest.class), any(StreamingChatResponseHandler.class));

        StepVerifier.create(adapter.chatStream(LlmRequest.builder().messages(List.of(Message.user("go"))).build()))
                .expectErrorMessage("socket closed")
                .verify();
    }

    @Test
    void shouldErrorWhenStreamingModelMissing() {
        ReflectionTestUtils.setField(adapter, "initialized", true);

        StepVerifier.create(adapter.chatStream(LlmRequest.builder().build()))
                .expectError(IllegalStateException.class)
                .verify();
    }

    private void injectModels(ChatModel chatModel, StreamingChatModel streamingModel) {
        ReflectionTestUtils.setField(adapter, "chatModel", chatModel);
        ReflectionTestUtils.setField(adapter, "streamingChatModel", streamingModel);
        ReflectionTestUtils.setField(adapter, "currentModel", TEST_MODEL);
        ReflectionTestUtils.setField(adapter, "initialized", true);
    }
}
