package me.golemcore.ngchat.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.ngchat.adapter.inbound.web.dto.ChatMessageDto;
import me.golemcore.ngchat.adapter.inbound.web.dto.ChatRequestDto;
import me.golemcore.ngchat.adapter.inbound.web.dto.ChatResponseDto;
import me.golemcore.ngchat.domain.exception.ValidationException;
import me.golemcore.ngchat.domain.model.ChatEvent;
import me.golemcore.ngchat.domain.model.Message;
import me.golemcore.ngchat.domain.model.ViewerSession;
import me.golemcore.ngchat.domain.service.ViewerSessionService;
import me.golemcore.ngchat.domain.system.toolloop.StreamingToolLoopSystem;
import me.golemcore.ngchat.domain.system.toolloop.ToolLoopSystem;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;

/**
 * Chat endpoints: a buffered turn and a server-sent event stream of the same
 * tool loop.
 */
@RestController
@RequestMapping("/api/agent")
@RequiredArgsConstructor
@Slf4j
public class AgentChatController {

    private final ViewerSessionService sessionService;
    private final ToolLoopSystem toolLoopSystem;
    private final StreamingToolLoopSystem streamingToolLoopSystem;

    @PostMapping("/chat")
    public Mono<ResponseEntity<ChatResponseDto>> chat(@RequestBody ChatRequestDto request) {
        List<Message> history = toHistory(request);
        ViewerSession session = sessionService.getOrCreate(request.getSessionId());
        log.info("[API] Chat turn for session '{}' with {} message(s)", session.getId(), history.size());
        return Mono.fromCallable(() -> toolLoopSystem.processTurn(session, history))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> ResponseEntity.ok(ChatResponseDto.from(session.getId(), result)));
    }

    @PostMapping(value = "/chat/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<ChatEvent>> chatStream(@RequestBody ChatRequestDto request) {
        List<Message> history = toHistory(request);
        ViewerSession session = sessionService.getOrCreate(request.getSessionId());
        log.info("[API] Streamed chat turn for session '{}' with {} message(s)", session.getId(), history.size());
        return streamingToolLoopSystem.streamTurn(session, history)
                .map(event -> ServerSentEvent.<ChatEvent>builder()
                        .event(event.type().getWireName())
                        .data(event)
                        .build())
                .doOnCancel(() -> log.debug("[API] Client disconnected from stream of session '{}'",
                        session.getId()));
    }

    /**
     * Caller history may hold user, assistant and tool messages. Tool messages
     * from the client carry no call id, so they are passed on as assistant text.
     */
    static List<Message> toHistory(ChatRequestDto request) {
        if (request == null || request.getMessages() == null || request.getMessages().isEmpty()) {
            throw new ValidationException("messages must not be empty");
        }
        List<Message> history = new ArrayList<>();
        for (ChatMessageDto dto : request.getMessages()) {
            String role = dto.getRole();
            String content = dto.getContent() != null ? dto.getContent() : "";
            if (Message.ROLE_USER.equals(role)) {
                history.add(Message.user(content));
            } else if (Message.ROLE_ASSISTANT.equals(role)) {
                history.add(Message.assistant(content));
            } else if (Message.ROLE_TOOL.equals(role)) {
                history.add(Message.assistant("[tool result] " + content));
            } else {
                throw new ValidationException("Unsupported message role '" + role + "'. Allowed: user, assistant, tool");
            }
        }
        return history;
    }
}
