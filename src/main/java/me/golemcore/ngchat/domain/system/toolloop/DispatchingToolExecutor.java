package me.golemcore.ngchat.domain.system.toolloop;

import me.golemcore.ngchat.domain.model.Message;
import me.golemcore.ngchat.domain.model.ToolResult;
import me.golemcore.ngchat.domain.model.ViewerSession;
import me.golemcore.ngchat.domain.service.ToolDispatcher;

/**
 * {@link ToolExecutorPort} backed by the {@link ToolDispatcher} registry.
 */
public class DispatchingToolExecutor implements ToolExecutorPort {

    private final ToolDispatcher dispatcher;

    public DispatchingToolExecutor(ToolDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public ToolExecutionOutcome execute(ViewerSession session, Message.ToolCall toolCall, int maxContentChars) {
        ToolResult result = dispatcher.dispatch(session, toolCall.getName(), toolCall.getArguments());
        String content = dispatcher.toMessageContent(result, maxContentChars);
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), result, content,
                dispatcher.isMutating(toolCall.getName()), false);
    }
}
