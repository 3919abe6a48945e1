package me.golemcore.ngchat.domain.system.toolloop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.ngchat.domain.service.SystemPromptProvider;
import me.golemcore.ngchat.domain.service.ToolDispatcher;
import me.golemcore.ngchat.domain.service.ViewerLinkMasker;
import me.golemcore.ngchat.domain.service.ViewerStateCodec;
import me.golemcore.ngchat.domain.service.ViewerStateSummarizer;
import me.golemcore.ngchat.infrastructure.config.NgChatProperties;
import me.golemcore.ngchat.port.outbound.LlmPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/** Spring wiring for the tool loops (domain orchestrators + ports). */
@Configuration
public class ToolLoopConfiguration {

    @Bean
    public ToolExecutorPort toolExecutorPort(ToolDispatcher toolDispatcher) {
        return new DispatchingToolExecutor(toolDispatcher);
    }

    @Bean
    public HistoryWriter toolLoopHistoryWriter(Clock clock) {
        return new DefaultHistoryWriter(clock);
    }

    @Bean
    public ConversationAssembler conversationAssembler(SystemPromptProvider promptProvider,
            ViewerStateSummarizer summarizer) {
        return new ConversationAssembler(promptProvider, summarizer);
    }

    @Bean
    public StateLinkFactory stateLinkFactory(ViewerStateCodec codec, ViewerLinkMasker masker) {
        return new StateLinkFactory(codec, masker);
    }

    @Bean
    public ToolLoopSystem toolLoopSystem(LlmPort llmPort, ToolExecutorPort toolExecutorPort,
            HistoryWriter historyWriter, ConversationAssembler assembler, StateLinkFactory stateLinkFactory,
            ToolDispatcher toolDispatcher, NgChatProperties properties) {
        return new DefaultToolLoopSystem(llmPort, toolExecutorPort, historyWriter, assembler, stateLinkFactory,
                toolDispatcher::getDefinitions, properties.getToolLoop());
    }

    @Bean
    public StreamingToolLoopSystem streamingToolLoopSystem(LlmPort llmPort, ToolExecutorPort toolExecutorPort,
            HistoryWriter historyWriter, ConversationAssembler assembler, StateLinkFactory stateLinkFactory,
            ToolDispatcher toolDispatcher, NgChatProperties properties, ObjectMapper objectMapper) {
        return new StreamingToolLoopSystem(llmPort, toolExecutorPort, historyWriter, assembler, stateLinkFactory,
                toolDispatcher::getDefinitions, properties.getToolLoop(), objectMapper);
    }
}
