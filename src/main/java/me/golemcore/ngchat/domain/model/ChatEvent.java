package me.golemcore.ngchat.domain.model;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * One event of a streamed chat turn. Only the fields relevant to the event
 * type are set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatEvent(
        ChatEventType type,
        Integer iteration,
        String delta,
        @JsonProperty("tool_calls") List<Map<String, Object>> toolCalls,
        LlmUsage usage,
        String tool,
        Map<String, Object> args,
        String result,
        String error,
        String content,
        Boolean mutated,
        @JsonProperty("state_link") StateLink stateLink) {

    public static ChatEvent iteration(int iteration) {
        return new ChatEvent(ChatEventType.ITERATION, iteration, null, null, null, null, null, null, null, null,
                null, null);
    }

    public static ChatEvent content(String delta) {
        return new ChatEvent(ChatEventType.CONTENT, null, delta, null, null, null, null, null, null, null, null,
                null);
    }

    public static ChatEvent toolCalls(List<Message.ToolCall> calls) {
        List<Map<String, Object>> summary = calls.stream()
                .map(call -> Map.<String, Object>of(
                        "id", call.getId() != null ? call.getId() : "",
                        "name", call.getName() != null ? call.getName() : ""))
                .toList();
        return new ChatEvent(ChatEventType.TOOL_CALLS, null, null, summary, null, null, null, null, null, null,
                null, null);
    }

    public static ChatEvent llmDone(LlmUsage usage) {
        return new ChatEvent(ChatEventType.LLM_DONE, null, null, null, usage, null, null, null, null, null, null,
                null);
    }

    public static ChatEvent toolStart(String tool, Map<String, Object> args) {
        return new ChatEvent(ChatEventType.TOOL_START, null, null, null, null, tool, args, null, null, null, null,
                null);
    }

    public static ChatEvent toolDone(String tool, String result) {
        return new ChatEvent(ChatEventType.TOOL_DONE, null, null, null, null, tool, null, result, null, null, null,
                null);
    }

    public static ChatEvent toolError(String tool, String error) {
        return new ChatEvent(ChatEventType.TOOL_ERROR, null, null, null, null, tool, null, null, error, null, null,
                null);
    }

    public static ChatEvent finalAnswer(String content, boolean mutated, StateLink stateLink) {
        return new ChatEvent(ChatEventType.FINAL, null, null, null, null, null, null, null, null, content, mutated,
                stateLink);
    }

    public static ChatEvent complete() {
        return new ChatEvent(ChatEventType.COMPLETE, null, null, null, null, null, null, null, null, null, null,
                null);
    }

    public static ChatEvent error(String error) {
        return new ChatEvent(ChatEventType.ERROR, null, null, null, null, null, null, null, error, null, null,
                null);
    }
}
