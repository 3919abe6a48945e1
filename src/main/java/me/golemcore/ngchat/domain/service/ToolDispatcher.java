package me.golemcore.ngchat.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.ngchat.domain.component.ToolComponent;
import me.golemcore.ngchat.domain.exception.NotFoundException;
import me.golemcore.ngchat.domain.exception.PointerResolutionException;
import me.golemcore.ngchat.domain.exception.SerializationException;
import me.golemcore.ngchat.domain.exception.ValidationException;
import me.golemcore.ngchat.domain.model.ToolDefinition;
import me.golemcore.ngchat.domain.model.ToolFailureKind;
import me.golemcore.ngchat.domain.model.ToolResult;
import me.golemcore.ngchat.domain.model.ViewerSession;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Name-keyed registry of tools and the boundary that turns every tool error
 * into data.
 *
 * <p>
 * {@link #dispatch} never throws: unknown names, invalid arguments and handler
 * exceptions all come back as failed {@link ToolResult}s with a
 * {@link ToolFailureKind}.
 */
@Component
@Slf4j
public class ToolDispatcher {

    private final Map<String, RegisteredTool> registry = new LinkedHashMap<>();
    private final ToolArgumentValidator validator;
    private final ObjectMapper objectMapper;

    public ToolDispatcher(List<ToolComponent> tools, ToolArgumentValidator validator, ObjectMapper objectMapper) {
        this.validator = validator;
        this.objectMapper = objectMapper;
        for (ToolComponent tool : tools) {
            register(tool);
        }
    }

    /**
     * Registers a tool under its definition name.
     *
     * @throws IllegalStateException
     *             if another tool already uses the name
     */
    public final void register(ToolComponent tool) {
        String name = tool.getToolName();
        if (name == null || name.isBlank()) {
            throw new IllegalStateException("Tool has no name: " + tool.getClass().getName());
        }
        RegisteredTool previous = registry.putIfAbsent(name, new RegisteredTool(tool, tool.isStateMutating()));
        if (previous != null) {
            throw new IllegalStateException("Duplicate tool name '" + name + "': "
                    + previous.tool().getClass().getName() + " and " + tool.getClass().getName());
        }
        log.debug("[Tools] Registered '{}' (mutating={})", name, tool.isStateMutating());
    }

    public ToolResult dispatch(ViewerSession session, String name, Map<String, Object> rawArgs) {
        String toolName = sanitizeToolName(name);
        RegisteredTool registered = toolName != null ? registry.get(toolName) : null;
        if (registered == null) {
            return ToolResult.failure(ToolFailureKind.UNKNOWN_TOOL,
                    "Unknown tool: " + name + ". Available tools: " + String.join(", ", registry.keySet()));
        }
        ToolComponent tool = registered.tool();
        if (!tool.isEnabled()) {
            return ToolResult.failure(ToolFailureKind.UNKNOWN_TOOL, "Tool is disabled: " + toolName);
        }

        try {
            Map<String, Object> args = validator.validate(tool.getDefinition().getInputSchema(), rawArgs);
            log.debug("[Tools] Executing '{}' with {}", toolName, args);
            ToolResult result = tool.execute(session, args);
            if (result == null) {
                return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool returned no result: " + toolName);
            }
            return result;
        } catch (ValidationException e) {
            log.debug("[Tools] '{}' rejected arguments: {}", toolName, e.getMessage());
            return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, e.getMessage());
        } catch (NotFoundException e) {
            return ToolResult.failure(ToolFailureKind.NOT_FOUND, e.getMessage());
        } catch (SerializationException e) {
            log.warn("[Tools] '{}' serialization failure: {}", toolName, e.getMessage());
            return ToolResult.failure(ToolFailureKind.SERIALIZATION_FAILED, e.getMessage());
        } catch (PointerResolutionException e) {
            log.warn("[Tools] '{}' could not resolve pointer {}: {}", toolName, e.getUrl(), e.getMessage());
            return ToolResult.failure(ToolFailureKind.POINTER_RESOLUTION_FAILED, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[Tools] Tool execution failed: {}", toolName, e);
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: " + safeCauseMessage(e));
        }
    }

    public boolean isMutating(String name) {
        RegisteredTool registered = registry.get(sanitizeToolName(name));
        return registered != null && registered.mutating();
    }

    /**
     * Definitions of the enabled tools, in registration order.
     */
    public List<ToolDefinition> getDefinitions() {
        return registry.values().stream()
                .map(RegisteredTool::tool)
                .filter(ToolComponent::isEnabled)
                .map(ToolComponent::getDefinition)
                .toList();
    }

    public Set<String> getToolNames() {
        return Set.copyOf(registry.keySet());
    }

    /**
     * Content of the tool message sent back to the model: the result data as
     * JSON, or {@code {"error": ...}} for failures, cut to {@code maxChars}.
     */
    public String toMessageContent(ToolResult result, int maxChars) {
        Object payload;
        if (result.isSuccess()) {
            payload = result.getData() != null ? result.getData() : Map.of("ok", true, "output",
                    result.getOutput() != null ? result.getOutput() : "");
        } else {
            payload = Map.of("error", result.getError() != null ? result.getError() : "unknown error");
        }
        String content;
        try {
            content = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("[Tools] Failed to serialize tool result: {}", e.getOriginalMessage());
            content = result.isSuccess() ? String.valueOf(result.getOutput()) : "Error: " + result.getError();
        }
        return truncate(content, maxChars);
    }

    static String truncate(String content, int maxChars) {
        if (content == null || maxChars <= 0 || content.length() <= maxChars) {
            return content;
        }
        String suffix = "\n\n[OUTPUT TRUNCATED: " + content.length() + " chars total, showing first "
                + maxChars + " chars.]";
        int cutPoint = Math.max(0, maxChars - suffix.length());
        return content.substring(0, cutPoint) + suffix;
    }

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && !cause.equals(cursor)) {
            cursor = cause;
            cause = cursor.getCause();
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * Strip special tokens and garbage from tool names. Some models leak special
     * tokens like {@code <|channel|>} into tool call names.
     */
    private String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Tools] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }

    /**
     * A registered tool and whether it mutates viewer state.
     */
    public record RegisteredTool(ToolComponent tool, boolean mutating) {
    }
}
