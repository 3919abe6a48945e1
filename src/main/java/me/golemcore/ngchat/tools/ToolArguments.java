package me.golemcore.ngchat.tools;

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

import me.golemcore.ngchat.domain.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Typed reads of already-validated tool arguments, plus the schema fragments
 * several tools share.
 */
final class ToolArguments {

    static final String TYPE = "type";
    static final String OBJECT = "object";
    static final String PROPERTIES = "properties";
    static final String REQUIRED = "required";
    static final String DESCRIPTION = "description";

    private ToolArguments() {
    }

    static Map<String, Object> vectorSchema(String description) {
        return Map.of(
                TYPE, OBJECT,
                DESCRIPTION, description,
                PROPERTIES, Map.of(
                        "x", Map.of(TYPE, "number"),
                        "y", Map.of(TYPE, "number"),
                        "z", Map.of(TYPE, "number")),
                REQUIRED, List.of("x", "y", "z"));
    }

    static String string(Map<String, Object> args, String key) {
        Object value = args.get(key);
        return value != null ? value.toString() : null;
    }

    static String requireString(Map<String, Object> args, String key) {
        String value = string(args, key);
        if (value == null || value.isBlank()) {
            throw new ValidationException(key + " is required");
        }
        return value;
    }

    static Double number(Map<String, Object> args, String key) {
        Object value = args.get(key);
        return value instanceof Number n ? n.doubleValue() : null;
    }

    static double requireNumber(Map<String, Object> args, String key) {
        Double value = number(args, key);
        if (value == null) {
            throw new ValidationException(key + " is required");
        }
        return value;
    }

    static Boolean bool(Map<String, Object> args, String key) {
        Object value = args.get(key);
        return value instanceof Boolean b ? b : null;
    }

    static int integer(Map<String, Object> args, String key, int defaultValue) {
        Object value = args.get(key);
        return value instanceof Number n ? n.intValue() : defaultValue;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> object(Map<String, Object> args, String key) {
        Object value = args.get(key);
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : null;
    }

    @SuppressWarnings("unchecked")
    static List<Map<String, Object>> objects(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object item : list) {
            if (item instanceof Map<?, ?> map) {
                result.add((Map<String, Object>) map);
            }
        }
        return result;
    }

    /**
     * Reads an {@code {x, y, z}} object as a coordinate list.
     */
    static List<Double> vector(Map<String, Object> args, String key) {
        Map<String, Object> value = object(args, key);
        if (value == null) {
            return null;
        }
        return List.of(requireNumber(value, "x"), requireNumber(value, "y"), requireNumber(value, "z"));
    }
}
