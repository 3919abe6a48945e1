package me.golemcore.ngchat.domain.system.toolloop;

import me.golemcore.ngchat.domain.model.LlmResponse;
import me.golemcore.ngchat.domain.model.Message;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Default implementation that appends timestamped messages to the turn's
 * conversation. An assistant tool-call message without text gets a short
 * {@code Applied tools: ...} placeholder.
 */
public class DefaultHistoryWriter implements HistoryWriter {

    private final Clock clock;

    public DefaultHistoryWriter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void appendAssistantToolCalls(List<Message> conversation, LlmResponse llmResponse,
            List<Message.ToolCall> toolCalls) {
        String content = llmResponse != null ? llmResponse.getContent() : null;
        if (content == null || content.isBlank()) {
            content = appliedToolsText(toolCalls);
        }
        conversation.add(Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(content)
                .toolCalls(toolCalls)
                .timestamp(now())
                .build());
    }

    @Override
    public void appendToolResult(List<Message> conversation, ToolExecutionOutcome outcome) {
        conversation.add(Message.builder()
                .role(Message.ROLE_TOOL)
                .toolCallId(outcome.toolCallId())
                .toolName(outcome.toolName())
                .content(outcome.messageContent())
                .timestamp(now())
                .build());
    }

    @Override
    public Message appendFinalAssistantAnswer(List<Message> conversation, String finalText) {
        Message assistant = Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(finalText)
                .timestamp(now())
                .build();
        conversation.add(assistant);
        return assistant;
    }

    static String appliedToolsText(List<Message.ToolCall> toolCalls) {
        if (toolCalls == null || toolCalls.isEmpty()) {
            return "";
        }
        return "Applied tools: " + toolCalls.stream()
                .map(Message.ToolCall::getName)
                .collect(Collectors.joining(", ")) + ".";
    }

    private Instant now() {
        return clock != null ? clock.instant() : Instant.now();
    }
}
