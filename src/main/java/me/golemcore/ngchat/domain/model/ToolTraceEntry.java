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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Compact record of one dispatched tool call, returned alongside a chat answer.
 * Long string arguments are shortened.
 */
public record ToolTraceEntry(String tool, Map<String, Object> args, boolean success, String error) {

    static final int MAX_ARG_CHARS = 200;

    public static ToolTraceEntry of(String tool, Map<String, Object> args, ToolResult result) {
        Map<String, Object> shortened = new LinkedHashMap<>();
        if (args != null) {
            args.forEach((key, value) -> shortened.put(key, shorten(value)));
        }
        boolean success = result != null && result.isSuccess();
        return new ToolTraceEntry(tool, shortened, success, success || result == null ? null : result.getError());
    }

    private static Object shorten(Object value) {
        if (value instanceof String text && text.length() > MAX_ARG_CHARS) {
            return text.substring(0, MAX_ARG_CHARS) + "...";
        }
        return value;
    }
}
