package me.golemcore.ngchat.domain.system.toolloop;

import me.golemcore.ngchat.domain.model.Message;
import me.golemcore.ngchat.domain.model.ToolFailureKind;
import me.golemcore.ngchat.domain.model.ToolResult;

/**
 * Result of a single tool execution (real or synthetic).
 *
 * @param toolCallId
 *            tool_call_id as provided by the LLM
 * @param toolName
 *            tool name (as used in history)
 * @param toolResult
 *            raw ToolResult (success/failure + structured data)
 * @param messageContent
 *            content to write into the "tool" message (possibly truncated)
 * @param mutating
 *            whether the dispatched tool is classified as state-mutating
 * @param synthetic
 *            whether this result was produced without executing the tool
 */
public record ToolExecutionOutcome(String toolCallId, String toolName, ToolResult toolResult,
        String messageContent, boolean mutating, boolean synthetic) {

    public static ToolExecutionOutcome synthetic(Message.ToolCall toolCall, ToolFailureKind kind, String reason) {
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), ToolResult.failure(kind, reason),
                reason, false, true);
    }
}
