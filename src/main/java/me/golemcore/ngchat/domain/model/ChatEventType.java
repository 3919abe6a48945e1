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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of streamed chat events, with their wire names.
 */
public enum ChatEventType {

    ITERATION("iteration"),
    CONTENT("content"),
    TOOL_CALLS("tool_calls"),
    LLM_DONE("llm_done"),
    TOOL_START("tool_start"),
    TOOL_DONE("tool_done"),
    TOOL_ERROR("tool_error"),
    FINAL("final"),
    COMPLETE("complete"),
    ERROR("error");

    private final String wireName;

    ChatEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
