package me.golemcore.runtime.domain.service;

import me.golemcore.runtime.domain.model.OperationException;
import me.golemcore.runtime.domain.model.ToolDefinition;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolArgumentValidatorTest {

    private final ToolArgumentValidator validator = new ToolArgumentValidator();

    private static final ToolDefinition DEFINITION = ToolDefinition.builder()
            .name("sample")
            .inputSchema(Map.of(
                    "type", "object",
                    "properties", Map.of(
                            "name", Map.of("type", "string"),
                            "count", Map.of("type", "integer"),
                            "ratio", Map.of("type", "number"),
                            "force", Map.of("type", "boolean"),
                            "tags", Map.of("type", "array"),
                            "mode", Map.of("type", "string", "enum", List.of("fast", "slow"))),
                    "required", List.of("name")))
            .build();

    @Test
    void coercesLooseModelOutput() {
        Map<String, Object> args = Map.of("name", 42, "count", "30", "ratio", 2, "force", "TRUE");

        Map<String, Object> result = validator.validate(DEFINITION, args);

        assertEquals("42", result.get("name"));
        assertEquals(30, result.get("count"));
        assertEquals(2.0, result.get("ratio"));
        assertEquals(Boolean.TRUE, result.get("force"));
    }

    @Test
    void acceptsIntegralDoubleForInteger() {
        assertEquals(5, validator.validate(DEFINITION, Map.of("name", "n", "count", 5.0)).get("count"));
    }

    @Test
    void rejectsFractionalInteger() {
        OperationException e = assertThrows(OperationException.class,
                () -> validator.validate(DEFINITION, Map.of("name", "n", "count", 1.5)));

        assertEquals("count", e.getField());
    }

    @Test
    void rejectsMissingOrBlankRequired() {
        assertEquals("name", assertThrows(OperationException.class,
                () -> validator.validate(DEFINITION, Map.of())).getField());
        assertEquals("name", assertThrows(OperationException.class,
                () -> validator.validate(DEFINITION, Map.of("name", "  "))).getField());
    }

    @Test
    void rejectsValueOutsideEnum() {
        OperationException e = assertThrows(OperationException.class,
                () -> validator.validate(DEFINITION, Map.of("name", "n", "mode", "medium")));

        assertEquals("mode", e.getField());
        assertTrue(e.getMessage().contains("fast"));
    }

    @Test
    void rejectsWrongContainerType() {
        assertThrows(OperationException.class,
                () -> validator.validate(DEFINITION, Map.of("name", "n", "tags", "a,b")));
    }

    @Test
    void passesUndeclaredAndDropsNullValues() {
        Map<String, Object> args = new HashMap<>();
        args.put("name", "n");
        args.put("extra", "kept");
        args.put("count", null);

        Map<String, Object> result = validator.validate(DEFINITION, args);

        assertEquals("kept", result.get("extra"));
        assertFalse(result.containsKey("count"));
    }
}
