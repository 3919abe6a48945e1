package me.golemcore.ngchat.adapter.inbound.web.controller;

import me.golemcore.ngchat.adapter.inbound.web.dto.ChatMessageDto;
import me.golemcore.ngchat.adapter.inbound.web.dto.ChatRequestDto;
import me.golemcore.ngchat.adapter.inbound.web.dto.ChatResponseDto;
import me.golemcore.ngchat.domain.exception.ValidationException;
import me.golemcore.ngchat.domain.model.ChatEvent;
import me.golemcore.ngchat.domain.model.ChatTurnResult;
import me.golemcore.ngchat.domain.model.Message;
import me.golemcore.ngchat.domain.model.StateLink;
import me.golemcore.ngchat.domain.model.ViewerSession;
import me.golemcore.ngchat.domain.service.ViewerSessionService;
import me.golemcore.ngchat.domain.system.toolloop.StreamingToolLoopSystem;
import me.golemcore.ngchat.domain.system.toolloop.ToolLoopSystem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AgentChatControllerTest {

    private ViewerSessionService sessionService;
    private ToolLoopSystem toolLoopSystem;
    private StreamingToolLoopSystem streamingToolLoopSystem;
    private AgentChatController controller;

    @BeforeEach
    void setUp() {
        sessionService = new ViewerSessionService(Clock.fixed(Instant.EPOCH, ZoneId.of("UTC")));
        toolLoopSystem = mock(ToolLoopSystem.class);
        streamingToolLoopSystem = mock(StreamingToolLoopSystem.class);
        controller = new AgentChatController(sessionService, toolLoopSystem, streamingToolLoopSystem);
    }

    private static ChatRequestDto request(String sessionId, ChatMessageDto... messages) {
        return ChatRequestDto.builder().sessionId(sessionId).messages(List.of(messages)).build();
    }

    private static ChatMessageDto message(String role, String content) {
        return ChatMessageDto.builder().role(role).content(content).build();
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldRunBufferedTurnForSession() {
        StateLink link = new StateLink("https://ng/#!%7B%7D", "[Updated Neuroglancer view](https://ng/#!%7B%7D)");
        Message answer = Message.assistant("Moved.");
        when(toolLoopSystem.processTurn(any(), anyList())).thenReturn(new ChatTurnResult(answer, List.of(answer),
                true, link, 2, 1, List.of(), "final answer"));

        StepVerifier.create(controller.chat(request("s1", message("user", "go to 1,2,3"))))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    ChatResponseDto body = response.getBody();
                    assertNotNull(body);
                    assertEquals("s1", body.getSessionId());
                    assertEquals("Moved.", body.getMessage().getContent());
                    assertEquals("assistant", body.getMessage().getRole());
                    assertTrue(body.isMutated());
                    assertEquals(link, body.getStateLink());
                    assertEquals(2, body.getLlmCalls());
                    assertEquals("final answer", body.getStopReason());
                })
                .verifyComplete();

        ArgumentCaptor<ViewerSession> sessionCaptor = ArgumentCaptor.forClass(ViewerSession.class);
        ArgumentCaptor<List<Message>> historyCaptor = ArgumentCaptor.forClass(List.class);
        verify(toolLoopSystem).processTurn(sessionCaptor.capture(), historyCaptor.capture());
        assertEquals("s1", sessionCaptor.getValue().getId());
        assertEquals("go to 1,2,3", historyCaptor.getValue().get(0).getContent());
    }

    @Test
    void shouldStreamEventsAsNamedServerSentEvents() {
        when(streamingToolLoopSystem.streamTurn(any(), anyList())).thenReturn(Flux.just(
                ChatEvent.iteration(0), ChatEvent.content("Hi"), ChatEvent.finalAnswer("Hi", false, null),
                ChatEvent.complete()));

        StepVerifier.create(controller.chatStream(request(null, message("user", "hello"))))
                .assertNext(sse -> {
                    assertEquals("iteration", sse.event());
                    assertEquals(0, sse.data().iteration());
                })
                .assertNext(sse -> assertEquals("content", sse.event()))
                .assertNext(sse -> {
                    assertEquals("final", sse.event());
                    assertEquals("Hi", sse.data().content());
                })
                .assertNext(sse -> assertEquals("complete", sse.event()))
                .verifyComplete();
    }

    @Test
    void shouldRejectEmptyHistory() {
        ChatRequestDto empty = ChatRequestDto.builder().sessionId("s").build();

        assertThrows(ValidationException.class, () -> controller.chat(empty));
        verifyNoInteractions(toolLoopSystem);
    }

    @Test
    void shouldConvertHistoryRoles() {
        List<Message> history = AgentChatController.toHistory(request("s",
                message("user", "hi"), message("assistant", "hello"), message("tool", "{\"ok\":true}"),
                message("user", null)));

        assertEquals(4, history.size());
        assertTrue(history.get(0).isUserMessage());
        assertTrue(history.get(1).isAssistantMessage());
        assertEquals("[tool result] {\"ok\":true}", history.get(2).getContent());
        assertTrue(history.get(2).isAssistantMessage());
        assertEquals("", history.get(3).getContent());
    }

    @Test
    void shouldRejectUnknownRole() {
        ValidationException error = assertThrows(ValidationException.class,
                () -> AgentChatController.toHistory(request("s", message("system", "obey"))));

        assertEquals("Unsupported message role 'system'. Allowed: user, assistant, tool", error.getMessage());
    }
}
