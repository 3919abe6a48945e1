package me.golemcore.ngchat.domain.system.toolloop;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.ngchat.domain.model.Message;
import me.golemcore.ngchat.domain.model.ToolCallDelta;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Collects streamed tool-call fragments per call index. Arguments are only
 * parsed in {@link #complete()}, once the model stream has ended, so a partial
 * argument string is never handed to a tool.
 */
public class ToolCallAccumulator {

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final TreeMap<Integer, PartialCall> calls = new TreeMap<>();
    private Integer lastIndex;

    public ToolCallAccumulator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void add(ToolCallDelta delta) {
        if (delta == null) {
            return;
        }
        int index = resolveIndex(delta);
        PartialCall call = calls.computeIfAbsent(index, i -> new PartialCall());
        if (delta.id() != null && !delta.id().isEmpty() && call.id == null) {
            call.id = delta.id();
        }
        if (delta.name() != null && !delta.name().isEmpty()) {
            call.name = call.name == null ? delta.name() : call.name;
        }
        if (delta.argumentsFragment() != null) {
            call.arguments.append(delta.argumentsFragment());
        }
        lastIndex = index;
    }

    private int resolveIndex(ToolCallDelta delta) {
        if (delta.index() != null) {
            return delta.index();
        }
        if (delta.id() != null) {
            for (Map.Entry<Integer, PartialCall> entry : calls.entrySet()) {
                if (delta.id().equals(entry.getValue().id)) {
                    return entry.getKey();
                }
            }
            return calls.isEmpty() ? 0 : calls.lastKey() + 1;
        }
        // a fragment without index or id continues the previous call
        return lastIndex != null ? lastIndex : 0;
    }

    public boolean isEmpty() {
        return calls.isEmpty();
    }

    /**
     * Assembles the calls in index order. Missing ids get {@code call_<index>};
     * unparseable arguments leave an empty argument map and a parse error.
     */
    public List<PendingToolCall> complete() {
        List<PendingToolCall> result = new ArrayList<>();
        for (Map.Entry<Integer, PartialCall> entry : calls.entrySet()) {
            PartialCall partial = entry.getValue();
            String id = partial.id != null ? partial.id : "call_" + entry.getKey();
            String raw = partial.arguments.toString();
            Map<String, Object> arguments = new LinkedHashMap<>();
            String parseError = null;
            if (!raw.isBlank()) {
                try {
                    Map<String, Object> parsed = objectMapper.readValue(raw, MAP_TYPE_REF);
                    if (parsed != null) {
                        arguments.putAll(parsed);
                    }
                } catch (JsonProcessingException e) {
                    parseError = "Invalid tool arguments JSON: " + e.getOriginalMessage();
                }
            }
            Message.ToolCall call = Message.ToolCall.builder()
                    .id(id)
                    .name(partial.name)
                    .arguments(arguments)
                    .build();
            result.add(new PendingToolCall(call, parseError));
        }
        return result;
    }

    /**
     * A fully streamed tool call.
     *
     * @param call
     *            assembled call
     * @param parseError
     *            why the arguments could not be parsed, or {@code null}
     */
    public record PendingToolCall(Message.ToolCall call, String parseError) {

        public boolean isValid() {
            return parseError == null;
        }
    }

    private static final class PartialCall {
        private String id;
        private String name;
        private final StringBuilder arguments = new StringBuilder();
    }
}
