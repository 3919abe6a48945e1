package me.golemcore.ngchat.domain.system.toolloop;

import me.golemcore.ngchat.domain.model.ChatTurnResult;
import me.golemcore.ngchat.domain.model.LlmRequest;
import me.golemcore.ngchat.domain.model.LlmResponse;
import me.golemcore.ngchat.domain.model.Message;
import me.golemcore.ngchat.domain.model.StateLink;
import me.golemcore.ngchat.domain.model.ToolDefinition;
import me.golemcore.ngchat.domain.model.ToolFailureKind;
import me.golemcore.ngchat.domain.model.ToolTraceEntry;
import me.golemcore.ngchat.domain.model.ViewerSession;
import me.golemcore.ngchat.infrastructure.config.NgChatProperties;
import me.golemcore.ngchat.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Buffered tool loop orchestrator.
 *
 * <p>
 * One {@link #processTurn} call: 1) LLM returns tool calls, 2) tools executed
 * sequentially, 3) repeat until the LLM answers without tool calls or the
 * iteration ceiling is hit. The last allowed LLM call, when the conversation
 * ends in tool results, is made without the tool catalog so the model has to
 * summarize; tool calls it still returns are dropped.
 */
public class DefaultToolLoopSystem implements ToolLoopSystem {

    private static final Logger log = LoggerFactory.getLogger(DefaultToolLoopSystem.class);

    static final String NO_RESPONSE = "(no response)";
    static final String STOP_FINAL_ANSWER = "final answer";
    static final String STOP_MAX_ITERATIONS = "max iterations";
    static final String STOP_LLM_FAILURE = "llm failure";

    private final LlmPort llmPort;
    private final ToolExecutorPort toolExecutor;
    private final HistoryWriter historyWriter;
    private final ConversationAssembler assembler;
    private final StateLinkFactory stateLinkFactory;
    private final Supplier<List<ToolDefinition>> toolCatalog;
    private final NgChatProperties.ToolLoopProperties settings;

    public DefaultToolLoopSystem(LlmPort llmPort, ToolExecutorPort toolExecutor, HistoryWriter historyWriter,
            ConversationAssembler assembler, StateLinkFactory stateLinkFactory,
            Supplier<List<ToolDefinition>> toolCatalog, NgChatProperties.ToolLoopProperties settings) {
        this.llmPort = llmPort;
        this.toolExecutor = toolExecutor;
        this.historyWriter = historyWriter;
        this.assembler = assembler;
        this.stateLinkFactory = stateLinkFactory;
        this.toolCatalog = toolCatalog;
        this.settings = settings;
    }

    @Override
    public ChatTurnResult processTurn(ViewerSession session, List<Message> history) {
        List<Message> conversation = assembler.assemble(session, history);

        int maxIterations = Math.max(1, settings != null ? settings.getMaxIterations() : 6);
        int maxChars = settings != null ? settings.getToolResultMaxChars() : 4000;

        int llmCalls = 0;
        int toolExecutions = 0;
        boolean mutated = false;
        List<ToolTraceEntry> trace = new ArrayList<>();
        String lastAssistantText = null;
        String finalText = null;
        String stopReason = null;

        for (int iteration = 0; iteration < maxIterations; iteration++) {
            boolean summaryCall = iteration == maxIterations - 1 && endsWithToolResult(conversation);

            // 1) LLM call
            LlmResponse response = callModel(session, conversation, !summaryCall);
            llmCalls++;

            if (response == null) {
                finalText = lastAssistantText != null ? lastAssistantText : NO_RESPONSE;
                stopReason = STOP_LLM_FAILURE;
                break;
            }

            // 2) Final answer, or the forced summary at the ceiling
            if (!response.hasToolCalls() || summaryCall) {
                if (summaryCall && response.hasToolCalls()) {
                    log.info("[ToolLoop] Dropping {} tool call(s) requested at the iteration ceiling",
                            response.getToolCalls().size());
                }
                finalText = hasText(response.getContent()) ? response.getContent()
                        : summaryCall ? maxIterationsText(maxIterations)
                                : lastAssistantText != null ? lastAssistantText : NO_RESPONSE;
                stopReason = summaryCall ? STOP_MAX_ITERATIONS : STOP_FINAL_ANSWER;
                break;
            }

            // 3) Append assistant message with tool calls
            if (hasText(response.getContent())) {
                lastAssistantText = response.getContent();
            }
            historyWriter.appendAssistantToolCalls(conversation, response, response.getToolCalls());

            // 4) Execute tools sequentially and append results
            for (Message.ToolCall tc : response.getToolCalls()) {
                ToolExecutionOutcome outcome = executeTool(session, tc, maxChars);
                toolExecutions++;
                mutated |= outcome.mutating();
                trace.add(ToolTraceEntry.of(tc.getName(), tc.getArguments(), outcome.toolResult()));
                historyWriter.appendToolResult(conversation, outcome);
            }
        }

        if (finalText == null) {
            // ceiling of one call that still asked for tools
            finalText = maxIterationsText(maxIterations);
            stopReason = STOP_MAX_ITERATIONS;
        }

        Message finalMessage = historyWriter.appendFinalAssistantAnswer(conversation,
                stateLinkFactory.mask(finalText));
        StateLink stateLink = mutated ? stateLinkFactory.create(session) : null;

        log.debug("[ToolLoop] Turn finished: {} LLM call(s), {} tool execution(s), stop={}", llmCalls,
                toolExecutions, stopReason);
        return new ChatTurnResult(finalMessage, conversation, mutated, stateLink, llmCalls, toolExecutions,
                trace, stopReason);
    }

    private LlmResponse callModel(ViewerSession session, List<Message> conversation, boolean withTools) {
        LlmRequest request = LlmRequest.builder()
                .messages(new ArrayList<>(conversation))
                .tools(withTools ? toolCatalog.get() : new ArrayList<>())
                .sessionId(session.getId())
                .build();
        try {
            return llmPort.chat(request).join();
        } catch (RuntimeException e) {
            log.warn("[ToolLoop] LLM call failed, stopping turn: {}", e.getMessage());
            return null;
        }
    }

    private ToolExecutionOutcome executeTool(ViewerSession session, Message.ToolCall tc, int maxChars) {
        try {
            ToolExecutionOutcome outcome = toolExecutor.execute(session, tc, maxChars);
            if (outcome != null) {
                return outcome;
            }
            return ToolExecutionOutcome.synthetic(tc, ToolFailureKind.EXECUTION_FAILED, "Tool returned no result");
        } catch (RuntimeException e) {
            log.warn("[ToolLoop] Tool {} failed outside the dispatcher: {}", tc.getName(), e.getMessage());
            return ToolExecutionOutcome.synthetic(tc, ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: " + e.getMessage());
        }
    }

    static boolean endsWithToolResult(List<Message> conversation) {
        return !conversation.isEmpty() && conversation.get(conversation.size() - 1).isToolMessage();
    }

    static String maxIterationsText(int maxIterations) {
        return "Tool loop stopped: reached max iterations (" + maxIterations + ").";
    }

    private static boolean hasText(String text) {
        return text != null && !text.isBlank();
    }
}
