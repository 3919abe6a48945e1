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

import me.golemcore.ngchat.domain.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks tool arguments against the subset of JSON Schema the tool
 * definitions use ({@code type}, {@code properties}, {@code required},
 * {@code items}, {@code enum}) and coerces loosely typed model output: numeric
 * strings become numbers, {@code "true"}/{@code "false"} become booleans,
 * numbers become strings where a string is expected.
 */
@Component
public class ToolArgumentValidator {

    private static final String TYPE = "type";
    private static final String PROPERTIES = "properties";
    private static final String REQUIRED = "required";
    private static final String ITEMS = "items";
    private static final String ENUM = "enum";

    /**
     * Returns a coerced copy of {@code arguments}.
     *
     * @throws ValidationException
     *             listing every problem found
     */
    public Map<String, Object> validate(Map<String, Object> schema, Map<String, Object> arguments) {
        List<String> problems = new ArrayList<>();
        Object coerced = coerceObject("arguments", arguments != null ? arguments : Map.of(), schema, problems);
        if (!problems.isEmpty()) {
            throw new ValidationException("Invalid arguments: " + String.join("; ", problems));
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> result = (Map<String, Object>) coerced;
        return result;
    }

    @SuppressWarnings("unchecked")
    private Object coerce(String path, Object value, Map<String, Object> schema, List<String> problems) {
        if (value == null || schema == null) {
            return value;
        }
        Object type = schema.get(TYPE);
        Object coerced;
        if (type == null) {
            coerced = value;
        } else {
            coerced = switch (type.toString()) {
            case "string" -> coerceString(path, value, problems);
            case "number" -> coerceNumber(path, value, problems);
            case "integer" -> coerceInteger(path, value, problems);
            case "boolean" -> coerceBoolean(path, value, problems);
            case "array" -> coerceArray(path, value, schema, problems);
            case "object" -> coerceObject(path, value, schema, problems);
            default -> value;
            };
        }
        Object allowed = schema.get(ENUM);
        if (coerced != null && allowed instanceof List<?> options && !options.contains(coerced)) {
            problems.add(path + " must be one of " + options + ", got '" + coerced + "'");
        }
        return coerced;
    }

    private Object coerceString(String path, Object value, List<String> problems) {
        if (value instanceof String) {
            return value;
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        problems.add(path + " must be a string");
        return null;
    }

    private Object coerceNumber(String path, Object value, List<String> problems) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                problems.add(path + " must be a number, got '" + text + "'");
                return null;
            }
        }
        problems.add(path + " must be a number");
        return null;
    }

    private Object coerceInteger(String path, Object value, List<String> problems) {
        if (value instanceof Number number) {
            double raw = number.doubleValue();
            if (raw == Math.rint(raw)) {
                return number.longValue();
            }
            problems.add(path + " must be an integer, got " + number);
            return null;
        }
        if (value instanceof String text) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                problems.add(path + " must be an integer, got '" + text + "'");
                return null;
            }
        }
        problems.add(path + " must be an integer");
        return null;
    }

    private Object coerceBoolean(String path, Object value, List<String> problems) {
        if (value instanceof Boolean) {
            return value;
        }
        if (value instanceof String text) {
            String normalized = text.trim();
            if ("true".equalsIgnoreCase(normalized)) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(normalized)) {
                return Boolean.FALSE;
            }
        }
        problems.add(path + " must be a boolean");
        return null;
    }

    @SuppressWarnings("unchecked")
    private Object coerceArray(String path, Object value, Map<String, Object> schema, List<String> problems) {
        if (!(value instanceof List<?> list)) {
            problems.add(path + " must be an array");
            return null;
        }
        Map<String, Object> itemSchema = schema.get(ITEMS) instanceof Map<?, ?> items
                ? (Map<String, Object>) items
                : null;
        List<Object> result = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            result.add(coerce(path + "[" + i + "]", list.get(i), itemSchema, problems));
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private Object coerceObject(String path, Object value, Map<String, Object> schema, List<String> problems) {
        if (!(value instanceof Map<?, ?> map)) {
            problems.add(path + " must be an object");
            return null;
        }
        Map<String, Object> result = new LinkedHashMap<>((Map<String, Object>) map);
        if (schema == null) {
            return result;
        }
        if (schema.get(REQUIRED) instanceof List<?> required) {
            for (Object field : required) {
                if (result.get(String.valueOf(field)) == null) {
                    problems.add("missing required field '" + qualify(path, String.valueOf(field)) + "'");
                }
            }
        }
        if (schema.get(PROPERTIES) instanceof Map<?, ?> properties) {
            for (Map.Entry<?, ?> entry : properties.entrySet()) {
                String field = String.valueOf(entry.getKey());
                if (result.get(field) != null && entry.getValue() instanceof Map<?, ?> fieldSchema) {
                    result.put(field, coerce(qualify(path, field), result.get(field),
                            (Map<String, Object>) fieldSchema, problems));
                }
            }
        }
        return result;
    }

    private static String qualify(String path, String field) {
        return "arguments".equals(path) ? field : path + "." + field;
    }
}
