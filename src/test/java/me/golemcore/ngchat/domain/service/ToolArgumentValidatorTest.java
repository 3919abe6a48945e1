package me.golemcore.ngchat.domain.service;

import me.golemcore.ngchat.domain.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolArgumentValidatorTest {

    private static final Map<String, Object> SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of(
                    "center", Map.of("type", "array", "items", Map.of("type", "number")),
                    "zoom", Map.of("type", "number"),
                    "limit", Map.of("type", "integer"),
                    "visible", Map.of("type", "boolean"),
                    "orientation", Map.of("type", "string", "enum", List.of("xy", "xz", "yz", "3d")),
                    "item", Map.of("type", "object", "required", List.of("point"),
                            "properties", Map.of("point", Map.of("type", "array")))),
            "required", List.of("center"));

    private final ToolArgumentValidator validator = new ToolArgumentValidator();

    @Test
    void shouldCoerceNumericStringsAndBooleans() {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("center", List.of("1.5", 2, 3L));
        args.put("zoom", "4");
        args.put("limit", 10.0);
        args.put("visible", "TRUE");

        Map<String, Object> result = validator.validate(SCHEMA, args);

        assertEquals(List.of(1.5, 2.0, 3.0), result.get("center"));
        assertEquals(4.0, result.get("zoom"));
        assertEquals(10L, result.get("limit"));
        assertEquals(Boolean.TRUE, result.get("visible"));
    }

    @Test
    void shouldKeepUnknownFieldsAndNotMutateInput() {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("center", List.of(1, 2, 3));
        args.put("note", "extra");

        Map<String, Object> result = validator.validate(SCHEMA, args);

        assertEquals("extra", result.get("note"));
        assertEquals(List.of(1, 2, 3), args.get("center"));
    }

    @Test
    void shouldReportEveryProblem() {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("zoom", "far");
        args.put("limit", 2.5);
        args.put("orientation", "diagonal");
        args.put("item", Map.of("label", "x"));

        ValidationException error = assertThrows(ValidationException.class, () -> validator.validate(SCHEMA, args));

        String message = error.getMessage();
        assertTrue(message.contains("missing required field 'center'"));
        assertTrue(message.contains("zoom must be a number"));
        assertTrue(message.contains("limit must be an integer"));
        assertTrue(message.contains("orientation must be one of"));
        assertTrue(message.contains("missing required field 'item.point'"));
    }

    @Test
    void shouldRejectWrongContainerTypes() {
        Map<String, Object> args = Map.of("center", "1,2,3");

        ValidationException error = assertThrows(ValidationException.class, () -> validator.validate(SCHEMA, args));
        assertTrue(error.getMessage().contains("center must be an array"));
    }

    @Test
    void shouldTreatNullArgumentsAsEmptyObject() {
        Map<String, Object> schema = Map.of("type", "object", "properties", Map.of());

        assertTrue(validator.validate(schema, null).isEmpty());
    }
}
