package me.golemcore.ngchat.domain.system.toolloop;

import me.golemcore.ngchat.domain.model.ChatTurnResult;
import me.golemcore.ngchat.domain.model.Message;
import me.golemcore.ngchat.domain.model.ViewerSession;

import java.util.List;

/**
 * Executes LLM -> tools -> LLM loop for one chat request against a viewer
 * session.
 */
public interface ToolLoopSystem {

    ChatTurnResult processTurn(ViewerSession session, List<Message> history);
}
