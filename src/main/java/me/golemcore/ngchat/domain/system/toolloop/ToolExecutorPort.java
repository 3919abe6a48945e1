package me.golemcore.ngchat.domain.system.toolloop;

import me.golemcore.ngchat.domain.model.Message;
import me.golemcore.ngchat.domain.model.ViewerSession;

/**
 * Hexagonal outbound port for executing a single tool call.
 *
 * <p>
 * The tool loop is the owner of the loop; it invokes this port for each tool
 * call, one at a time.
 */
public interface ToolExecutorPort {

    ToolExecutionOutcome execute(ViewerSession session, Message.ToolCall toolCall, int maxContentChars);
}
