package me.golemcore.ngchat.domain.system.toolloop;

import me.golemcore.ngchat.domain.model.Message;
import me.golemcore.ngchat.domain.model.ViewerSession;
import me.golemcore.ngchat.domain.service.SystemPromptProvider;
import me.golemcore.ngchat.domain.service.ViewerStateSummarizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the opening conversation of a turn: system prompt, a snapshot summary
 * of the session's viewer state, then the caller's history.
 */
public class ConversationAssembler {

    static final String SUMMARY_PREFIX = "Current viewer state summary:\n";

    private final SystemPromptProvider promptProvider;
    private final ViewerStateSummarizer summarizer;

    public ConversationAssembler(SystemPromptProvider promptProvider, ViewerStateSummarizer summarizer) {
        this.promptProvider = promptProvider;
        this.summarizer = summarizer;
    }

    public List<Message> assemble(ViewerSession session, List<Message> history) {
        List<Message> conversation = new ArrayList<>();
        conversation.add(Message.system(promptProvider.getSystemPrompt()));
        conversation.add(Message.system(SUMMARY_PREFIX + summarizer.summarizeText(session.getState())));
        if (history != null) {
            conversation.addAll(history);
        }
        return conversation;
    }
}
