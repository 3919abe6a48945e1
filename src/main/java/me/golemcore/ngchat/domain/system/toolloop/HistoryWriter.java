package me.golemcore.ngchat.domain.system.toolloop;

import me.golemcore.ngchat.domain.model.LlmResponse;
import me.golemcore.ngchat.domain.model.Message;

import java.util.List;

/**
 * Single point of mutation for the conversation during a turn.
 *
 * <p>
 * Tool loops should not write messages directly.
 */
public interface HistoryWriter {

    void appendAssistantToolCalls(List<Message> conversation, LlmResponse llmResponse,
            List<Message.ToolCall> toolCalls);

    void appendToolResult(List<Message> conversation, ToolExecutionOutcome outcome);

    Message appendFinalAssistantAnswer(List<Message> conversation, String finalText);
}
