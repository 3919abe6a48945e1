package me.golemcore.ngchat.adapter.outbound.llm;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.ngchat.domain.model.LlmChunk;
import me.golemcore.ngchat.domain.model.LlmRequest;
import me.golemcore.ngchat.domain.model.LlmResponse;
import me.golemcore.ngchat.domain.model.LlmUsage;
import me.golemcore.ngchat.domain.model.Message;
import me.golemcore.ngchat.domain.model.ToolCallDelta;
import me.golemcore.ngchat.domain.model.ToolDefinition;
import me.golemcore.ngchat.infrastructure.config.NgChatProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.output.TokenUsage;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * LLM adapter using the langchain4j library.
 *
 * <p>
 * Talks to any OpenAI-compatible chat completions endpoint. Supports:
 * <ul>
 * <li>Function calling (tool use) with JSON-schema tool catalogs
 * <li>Native token streaming; tool calls are reported once the stream
 * completes, as one {@link ToolCallDelta} per call
 * </ul>
 *
 * <p>
 * Model calls are never retried here. A failed call surfaces as an exceptional
 * future or an error signal and the tool loop decides how to degrade.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 *
 * <p>
 * Configuration via {@code ngchat.llm.*}.
 *
 * @see LlmProviderAdapter
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmProviderAdapter {

    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final String SCHEMA_KEY_REQUIRED = "required";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final NgChatProperties properties;
    private final ObjectMapper objectMapper;

    private ChatModel chatModel;
    private StreamingChatModel streamingChatModel;
    private String currentModel;
    private volatile boolean initialized = false;

    @Override
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        NgChatProperties.LlmProperties llm = properties.getLlm();
        currentModel = llm.getModel();
        try {
            chatModel = createChatModel(llm);
            streamingChatModel = createStreamingModel(llm);
            log.info("[LLM] Initialized langchain4j model: {}", currentModel);
        } catch (RuntimeException e) {
            log.error("[LLM] Failed to initialize langchain4j model {}", currentModel, e);
        }
        initialized = true;
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }

    private ChatModel createChatModel(NgChatProperties.LlmProperties llm) {
        var builder = OpenAiChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModel())
                .maxRetries(0)
                .timeout(Duration.ofMillis(llm.getTimeoutMs()));
        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        builder.temperature(llm.getTemperature());
        if (llm.getMaxTokens() != null) {
            builder.maxTokens(llm.getMaxTokens());
        }
        return builder.build();
    }

    private StreamingChatModel createStreamingModel(NgChatProperties.LlmProperties llm) {
        var builder = OpenAiStreamingChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModel())
                .timeout(Duration.ofMillis(llm.getTimeoutMs()));
        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        builder.temperature(llm.getTemperature());
        if (llm.getMaxTokens() != null) {
            builder.maxTokens(llm.getMaxTokens());
        }
        return builder.build();
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            if (chatModel == null) {
                throw new IllegalStateException("Langchain4j adapter not available");
            }

            List<ChatMessage> messages = convertMessages(request);
            List<ToolSpecification> tools = convertTools(request);
            try {
                ChatResponse response;
                if (!tools.isEmpty()) {
                    log.trace("Calling LLM with {} tools", tools.size());
                    response = chatModel.chat(ChatRequest.builder()
                            .messages(messages)
                            .toolSpecifications(tools)
                            .build());
                } else {
                    response = chatModel.chat(messages);
                }
                return convertResponse(response);
            } catch (RuntimeException e) {
                log.error("[LLM] Chat failed", e);
                throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        ensureInitialized();
        if (streamingChatModel == null) {
            return Flux.error(new IllegalStateException("Langchain4j streaming model not available"));
        }
        List<ChatMessage> messages = convertMessages(request);
        List<ToolSpecification> tools = convertTools(request);
        ChatRequest.Builder chatRequest = ChatRequest.builder().messages(messages);
        if (!tools.isEmpty()) {
            chatRequest.toolSpecifications(tools);
        }
        ChatRequest built = chatRequest.build();

        return Flux.create(sink -> streamingChatModel.chat(built, new StreamingChatResponseHandler() {
            @Override
            public void onPartialResponse(String partialResponse) {
                if (!sink.isCancelled() && partialResponse != null && !partialResponse.isEmpty()) {
                    sink.next(LlmChunk.text(partialResponse));
                }
            }

            @Override
            public void onCompleteResponse(ChatResponse completeResponse) {
                emitCompletion(sink, completeResponse);
            }

            @Override
            public void onError(Throwable error) {
                log.error("[LLM] Streaming chat failed", error);
                sink.error(error);
            }
        }), FluxSink.OverflowStrategy.BUFFER);
    }

    private void emitCompletion(FluxSink<LlmChunk> sink, ChatResponse response) {
        if (sink.isCancelled()) {
            return;
        }
        List<ToolCallDelta> deltas = null;
        AiMessage aiMessage = response.aiMessage();
        if (aiMessage != null && aiMessage.hasToolExecutionRequests()) {
            deltas = new ArrayList<>();
            List<ToolExecutionRequest> requests = aiMessage.toolExecutionRequests();
            for (int i = 0; i < requests.size(); i++) {
                ToolExecutionRequest ter = requests.get(i);
                deltas.add(new ToolCallDelta(i, ter.id(), ter.name(), ter.arguments()));
            }
        }
        sink.next(LlmChunk.builder()
                .toolCallDeltas(deltas)
                .usage(convertUsage(response.tokenUsage()))
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .done(true)
                .build());
        sink.complete();
    }

    @Override
    public boolean supportsStreaming() {
        return true;
    }

    @Override
    public String getCurrentModel() {
        return currentModel != null ? currentModel : properties.getLlm().getModel();
    }

    @Override
    public boolean isAvailable() {
        String apiKey = properties.getLlm().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    private List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getMessages() == null) {
            return messages;
        }

        for (Message msg : request.getMessages()) {
            String content = msg.getContent() != null ? msg.getContent() : "";
            switch (msg.getRole()) {
            case Message.ROLE_USER -> messages.add(UserMessage.from(content));
            case Message.ROLE_ASSISTANT -> {
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                            .map(tc -> ToolExecutionRequest.builder()
                                    .id(tc.getId())
                                    .name(tc.getName())
                                    .arguments(convertArgsToJson(tc.getArguments()))
                                    .build())
                            .toList();
                    messages.add(content.isBlank()
                            ? AiMessage.from(toolRequests)
                            : AiMessage.from(content, toolRequests));
                } else {
                    messages.add(AiMessage.from(content));
                }
            }
            case Message.ROLE_TOOL -> messages.add(ToolExecutionResultMessage.from(
                    msg.getToolCallId(),
                    msg.getToolName(),
                    content));
            case Message.ROLE_SYSTEM -> {
                // SystemMessage rejects blank text
                if (!content.isBlank()) {
                    messages.add(SystemMessage.from(content));
                }
            }
            default -> {
                log.warn("Unknown message role: {}, treating as user message", msg.getRole());
                messages.add(UserMessage.from(content));
            }
            }
        }

        return messages;
    }

    private List<ToolSpecification> convertTools(LlmRequest request) {
        if (request.getTools() == null || request.getTools().isEmpty()) {
            return Collections.emptyList();
        }

        return request.getTools().stream()
                .map(this::convertToolDefinition)
                .collect(Collectors.toList());
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        Map<String, Object> schema = tool.getInputSchema();
        if (schema != null && schema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?>) {
            builder.parameters((JsonObjectSchema) toObjectSchema(schema, null));
        }

        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toObjectSchema(Map<String, Object> schema, String description) {
        JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
        if (description != null && !description.isBlank()) {
            builder.description(description);
        }
        Map<String, Object> props = (Map<String, Object>) schema.get(SCHEMA_KEY_PROPERTIES);
        if (props != null) {
            for (Map.Entry<String, Object> entry : props.entrySet()) {
                builder.addProperty(entry.getKey(), toJsonSchemaElement((Map<String, Object>) entry.getValue()));
            }
        }
        List<String> required = (List<String>) schema.get(SCHEMA_KEY_REQUIRED);
        if (required != null && !required.isEmpty()) {
            builder.required(required);
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.get("type");
        String description = (String) paramSchema.get("description");
        List<String> enumValues = (List<String>) paramSchema.get("enum");
        boolean described = description != null && !description.isBlank();

        if (enumValues != null && !enumValues.isEmpty()) {
            JsonEnumSchema.Builder builder = JsonEnumSchema.builder().enumValues(enumValues);
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }

        if (type == null) {
            type = "string";
        }

        switch (type) {
        case "integer" -> {
            JsonIntegerSchema.Builder builder = JsonIntegerSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "number" -> {
            JsonNumberSchema.Builder builder = JsonNumberSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "boolean" -> {
            JsonBooleanSchema.Builder builder = JsonBooleanSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder();
            if (described) {
                builder.description(description);
            }
            Object items = paramSchema.get("items");
            builder.items(items instanceof Map<?, ?>
                    ? toJsonSchemaElement((Map<String, Object>) items)
                    : JsonStringSchema.builder().build());
            return builder.build();
        }
        case "object" -> {
            return toObjectSchema(paramSchema, description);
        }
        default -> {
            // strings and anything unrecognized
            JsonStringSchema.Builder builder = JsonStringSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        }
    }

    private LlmResponse convertResponse(ChatResponse response) {
        if (response == null) {
            return null;
        }
        AiMessage aiMessage = response.aiMessage();

        List<Message.ToolCall> toolCalls = null;
        if (aiMessage.hasToolExecutionRequests()) {
            toolCalls = aiMessage.toolExecutionRequests().stream()
                    .map(ter -> Message.ToolCall.builder()
                            .id(ter.id())
                            .name(ter.name())
                            .arguments(parseJsonArgs(ter.arguments()))
                            .build())
                    .toList();
            log.trace("Parsed {} tool calls from response", toolCalls.size());
        }

        return LlmResponse.builder()
                .content(aiMessage.text())
                .toolCalls(toolCalls)
                .usage(convertUsage(response.tokenUsage()))
                .model(getCurrentModel())
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    private LlmUsage convertUsage(TokenUsage tokenUsage) {
        if (tokenUsage == null) {
            return null;
        }
        return LlmUsage.builder()
                .inputTokens(orZero(tokenUsage.inputTokenCount()))
                .outputTokens(orZero(tokenUsage.outputTokenCount()))
                .totalTokens(orZero(tokenUsage.totalTokenCount()))
                .model(getCurrentModel())
                .build();
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (Exception e) {
            log.warn("Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (Exception e) {
            log.warn("Failed to parse tool arguments: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
