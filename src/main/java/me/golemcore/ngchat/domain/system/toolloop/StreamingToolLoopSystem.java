package me.golemcore.ngchat.domain.system.toolloop;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.ngchat.domain.model.ChatEvent;
import me.golemcore.ngchat.domain.model.LlmChunk;
import me.golemcore.ngchat.domain.model.LlmRequest;
import me.golemcore.ngchat.domain.model.LlmResponse;
import me.golemcore.ngchat.domain.model.LlmUsage;
import me.golemcore.ngchat.domain.model.Message;
import me.golemcore.ngchat.domain.model.StateLink;
import me.golemcore.ngchat.domain.model.ToolCallDelta;
import me.golemcore.ngchat.domain.model.ToolDefinition;
import me.golemcore.ngchat.domain.model.ToolFailureKind;
import me.golemcore.ngchat.domain.model.ToolResult;
import me.golemcore.ngchat.domain.model.ViewerSession;
import me.golemcore.ngchat.infrastructure.config.NgChatProperties;
import me.golemcore.ngchat.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Streamed variant of the tool loop.
 *
 * <p>
 * Runs the same machine as {@link DefaultToolLoopSystem} but reports progress
 * as a {@link ChatEvent} stream. Per model round trip:
 * {@code iteration -> content* -> tool_calls? -> llm_done -> (tool_start ->
 * tool_done | tool_error)*}; the turn ends with {@code final} and
 * {@code complete}.
 *
 * <p>
 * The loop runs on a {@code boundedElastic} worker. Cancelling the
 * subscription stops the model stream and skips every tool call not yet
 * dispatched; calls already dispatched stay applied.
 */
public class StreamingToolLoopSystem {

    private static final Logger log = LoggerFactory.getLogger(StreamingToolLoopSystem.class);

    private final LlmPort llmPort;
    private final ToolExecutorPort toolExecutor;
    private final HistoryWriter historyWriter;
    private final ConversationAssembler assembler;
    private final StateLinkFactory stateLinkFactory;
    private final Supplier<List<ToolDefinition>> toolCatalog;
    private final NgChatProperties.ToolLoopProperties settings;
    private final ObjectMapper objectMapper;

    public StreamingToolLoopSystem(LlmPort llmPort, ToolExecutorPort toolExecutor, HistoryWriter historyWriter,
            ConversationAssembler assembler, StateLinkFactory stateLinkFactory,
            Supplier<List<ToolDefinition>> toolCatalog, NgChatProperties.ToolLoopProperties settings,
            ObjectMapper objectMapper) {
        this.llmPort = llmPort;
        this.toolExecutor = toolExecutor;
        this.historyWriter = historyWriter;
        this.assembler = assembler;
        this.stateLinkFactory = stateLinkFactory;
        this.toolCatalog = toolCatalog;
        this.settings = settings;
        this.objectMapper = objectMapper;
    }

    public Flux<ChatEvent> streamTurn(ViewerSession session, List<Message> history) {
        return Flux.<ChatEvent>create(sink -> {
            Sinks.Empty<Void> cancelled = Sinks.empty();
            sink.onCancel(cancelled::tryEmitEmpty);
            try {
                runTurn(session, history, sink, cancelled);
            } catch (RuntimeException e) {
                log.error("[ToolLoop] Streamed turn failed", e);
                emit(sink, ChatEvent.error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
            }
            sink.complete();
        }, FluxSink.OverflowStrategy.BUFFER).subscribeOn(Schedulers.boundedElastic());
    }

    private void runTurn(ViewerSession session, List<Message> history, FluxSink<ChatEvent> sink,
            Sinks.Empty<Void> cancelled) {
        List<Message> conversation = assembler.assemble(session, history);

        int maxIterations = Math.max(1, settings != null ? settings.getStreamMaxIterations() : 10);
        int maxChars = settings != null ? settings.getStreamResultMaxChars() : 5000;

        StringBuilder totalContent = new StringBuilder();
        boolean mutated = false;
        boolean reachedCeiling = false;
        boolean modelFailed = false;

        for (int iteration = 0; iteration < maxIterations; iteration++) {
            if (!emit(sink, ChatEvent.iteration(iteration))) {
                return;
            }
            boolean summaryCall = iteration == maxIterations - 1
                    && DefaultToolLoopSystem.endsWithToolResult(conversation);

            LlmRequest request = LlmRequest.builder()
                    .messages(new ArrayList<>(conversation))
                    .tools(summaryCall ? new ArrayList<>() : toolCatalog.get())
                    .sessionId(session.getId())
                    .build();

            RoundTrip roundTrip = new RoundTrip(new ToolCallAccumulator(objectMapper));
            try {
                if (llmPort.supportsStreaming()) {
                    streamModel(request, roundTrip, sink, cancelled);
                } else {
                    callModel(request, roundTrip, sink);
                }
            } catch (RuntimeException e) {
                log.warn("[ToolLoop] LLM stream failed, stopping turn: {}", e.getMessage());
                modelFailed = true;
            }
            if (sink.isCancelled()) {
                log.debug("[ToolLoop] Stream cancelled during LLM call, iteration {}", iteration);
                return;
            }
            totalContent.append(roundTrip.text);
            if (modelFailed) {
                break;
            }

            List<ToolCallAccumulator.PendingToolCall> pending = summaryCall
                    ? List.of()
                    : roundTrip.accumulator.complete();
            if (!pending.isEmpty()) {
                emit(sink, ChatEvent.toolCalls(pending.stream().map(ToolCallAccumulator.PendingToolCall::call)
                        .toList()));
            }
            if (!emit(sink, ChatEvent.llmDone(roundTrip.usage))) {
                return;
            }
            if (pending.isEmpty()) {
                reachedCeiling = summaryCall;
                break;
            }

            List<Message.ToolCall> calls = pending.stream().map(ToolCallAccumulator.PendingToolCall::call).toList();
            historyWriter.appendAssistantToolCalls(conversation,
                    LlmResponse.builder().content(roundTrip.text.toString()).toolCalls(calls).build(), calls);

            for (ToolCallAccumulator.PendingToolCall pendingCall : pending) {
                if (sink.isCancelled()) {
                    log.debug("[ToolLoop] Stream cancelled, skipping remaining tool calls");
                    return;
                }
                Message.ToolCall tc = pendingCall.call();
                emit(sink, ChatEvent.toolStart(tc.getName(), tc.getArguments()));

                ToolExecutionOutcome outcome;
                if (!pendingCall.isValid()) {
                    outcome = new ToolExecutionOutcome(tc.getId(), tc.getName(),
                            ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, pendingCall.parseError()),
                            errorContent(pendingCall.parseError()), false, true);
                } else {
                    outcome = executeTool(session, tc, maxChars);
                }
                mutated |= outcome.mutating();
                historyWriter.appendToolResult(conversation, outcome);

                if (outcome.toolResult() != null && outcome.toolResult().isSuccess()) {
                    emit(sink, ChatEvent.toolDone(tc.getName(), outcome.messageContent()));
                } else {
                    String error = outcome.toolResult() != null ? outcome.toolResult().getError()
                            : "unknown error";
                    emit(sink, ChatEvent.toolError(tc.getName(), error));
                }
            }
            if (iteration == maxIterations - 1) {
                reachedCeiling = true;
            }
        }

        if (sink.isCancelled()) {
            return;
        }
        String finalText = totalContent.toString();
        if (finalText.isBlank()) {
            finalText = reachedCeiling ? DefaultToolLoopSystem.maxIterationsText(maxIterations)
                    : DefaultToolLoopSystem.NO_RESPONSE;
        }
        StateLink stateLink = mutated ? stateLinkFactory.create(session) : null;
        emit(sink, ChatEvent.finalAnswer(stateLinkFactory.mask(finalText), mutated, stateLink));
        emit(sink, ChatEvent.complete());
    }

    private void streamModel(LlmRequest request, RoundTrip roundTrip, FluxSink<ChatEvent> sink,
            Sinks.Empty<Void> cancelled) {
        llmPort.chatStream(request)
                .takeUntilOther(cancelled.asMono())
                .doOnNext(chunk -> onChunk(chunk, roundTrip, sink))
                .blockLast();
    }

    private void onChunk(LlmChunk chunk, RoundTrip roundTrip, FluxSink<ChatEvent> sink) {
        if (chunk.hasText()) {
            roundTrip.text.append(chunk.getText());
            emit(sink, ChatEvent.content(chunk.getText()));
        }
        if (chunk.hasToolCallDeltas()) {
            for (ToolCallDelta delta : chunk.getToolCallDeltas()) {
                roundTrip.accumulator.add(delta);
            }
        }
        if (chunk.getUsage() != null) {
            roundTrip.usage = chunk.getUsage();
        }
    }

    private void callModel(LlmRequest request, RoundTrip roundTrip, FluxSink<ChatEvent> sink) {
        LlmResponse response = llmPort.chat(request).join();
        if (response == null) {
            throw new IllegalStateException("LLM returned no response");
        }
        if (response.getContent() != null && !response.getContent().isEmpty()) {
            roundTrip.text.append(response.getContent());
            emit(sink, ChatEvent.content(response.getContent()));
        }
        if (response.hasToolCalls()) {
            List<Message.ToolCall> calls = response.getToolCalls();
            for (int i = 0; i < calls.size(); i++) {
                Message.ToolCall tc = calls.get(i);
                roundTrip.accumulator.add(new ToolCallDelta(i, tc.getId(), tc.getName(), toJson(tc)));
            }
        }
        roundTrip.usage = response.getUsage();
    }

    private String toJson(Message.ToolCall tc) {
        try {
            return objectMapper.writeValueAsString(tc.getArguments() != null ? tc.getArguments() : Map.of());
        } catch (JsonProcessingException e) {
            return "{}";
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

    private String errorContent(String error) {
        try {
            return objectMapper.writeValueAsString(Map.of("error", error));
        } catch (JsonProcessingException e) {
            return error;
        }
    }

    private static boolean emit(FluxSink<ChatEvent> sink, ChatEvent event) {
        if (sink.isCancelled()) {
            return false;
        }
        sink.next(event);
        return true;
    }

    private static final class RoundTrip {
        private final ToolCallAccumulator accumulator;
        private final StringBuilder text = new StringBuilder();
        private LlmUsage usage;

        private RoundTrip(ToolCallAccumulator accumulator) {
            this.accumulator = accumulator;
        }
    }
}
