package me.golemcore.runtime.tools;

import me.golemcore.runtime.domain.model.OperationException;
import me.golemcore.runtime.domain.model.ToolErrorKind;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolSchemasTest {

    @Test
    void optionalIntReadsIntegersAndAbsentValues() {
        assertEquals(5, ToolSchemas.optionalInt(Map.of("count", 5), "count"));
        assertEquals(7, ToolSchemas.optionalInt(Map.of("count", 7L), "count"));
        assertNull(ToolSchemas.optionalInt(Map.of(), "count"));
    }

    @Test
    void optionalIntRejectsValuesOutsideIntRange() {
        OperationException error = assertThrows(OperationException.class,
                () -> ToolSchemas.optionalInt(Map.of("max_chars", 4294967297L), "max_chars"));

        assertEquals(ToolErrorKind.VALIDATION_ERROR, error.getKind());
        assertEquals("max_chars", error.getField());
    }

    @Test
    void optionalLongKeepsFullValue() {
        assertEquals(4294967297L, ToolSchemas.optionalLong(Map.of("every_seconds", 4294967297L), "every_seconds"));
    }
}
