package me.golemcore.runtime.domain.service;

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

import me.golemcore.runtime.domain.model.OperationException;
import me.golemcore.runtime.domain.model.ToolDefinition;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Checks tool arguments against the JSON-schema subset tools declare
 * ({@code type}, {@code enum}, {@code required}) and coerces loosely typed
 * values produced by models, e.g. {@code "30"} for an integer.
 */
@Component
public class ToolArgumentValidator {

    private static final String TYPE = "type";

    /**
     * @return a new map with coerced values; parameters not declared in the
     *         schema are passed through untouched
     * @throws OperationException
     *             VALIDATION_ERROR naming the first offending field
     */
    public Map<String, Object> validate(ToolDefinition definition, Map<String, Object> arguments) {
        Map<String, Object> args = arguments != null ? arguments : Map.of();
        Map<String, Object> coerced = new LinkedHashMap<>();

        for (String required : definition.requiredParameters()) {
            Object value = args.get(required);
            if (value == null || (value instanceof String s && s.isBlank())) {
                throw OperationException.validation(required, "Missing required parameter: " + required);
            }
        }

        Map<String, Map<String, Object>> schemas = definition.parameterSchemas();
        for (Map.Entry<String, Object> entry : args.entrySet()) {
            String name = entry.getKey();
            Object value = entry.getValue();
            Map<String, Object> schema = schemas.get(name);
            if (value == null || schema == null) {
                if (value != null) {
                    coerced.put(name, value);
                }
                continue;
            }
            Object converted = coerce(name, value, (String) schema.get(TYPE));
            checkEnum(name, converted, schema.get("enum"));
            coerced.put(name, converted);
        }
        return coerced;
    }

    private Object coerce(String field, Object value, String type) {
        if (type == null) {
            return value;
        }
        return switch (type) {
        case "string" -> toStringValue(field, value);
        case "integer" -> toInteger(field, value);
        case "number" -> toNumber(field, value);
        case "boolean" -> toBoolean(field, value);
        case "array" -> requireType(field, value, List.class, "array");
        case "object" -> requireType(field, value, Map.class, "object");
        default -> value;
        };
    }

    private String toStringValue(String field, Object value) {
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Number || value instanceof Boolean) {
            return String.valueOf(value);
        }
        throw typeMismatch(field, "string", value);
    }

    private Object toInteger(String field, Object value) {
        long result;
        if (value instanceof Integer || value instanceof Long) {
            result = ((Number) value).longValue();
        } else if (value instanceof Number n) {
            double d = n.doubleValue();
            if (d != Math.rint(d) || d >= 0x1p63 || d < -0x1p63) {
                throw typeMismatch(field, "integer", value);
            }
            result = (long) d;
        } else if (value instanceof String s) {
            try {
                result = Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                throw typeMismatch(field, "integer", value);
            }
        } else {
            throw typeMismatch(field, "integer", value);
        }
        if (result >= Integer.MIN_VALUE && result <= Integer.MAX_VALUE) {
            return (int) result;
        }
        return result;
    }

    private Double toNumber(String field, Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw typeMismatch(field, "number", value);
            }
        }
        throw typeMismatch(field, "number", value);
    }

    private Boolean toBoolean(String field, Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            String normalized = s.trim().toLowerCase(Locale.ROOT);
            if ("true".equals(normalized)) {
                return true;
            }
            if ("false".equals(normalized)) {
                return false;
            }
        }
        throw typeMismatch(field, "boolean", value);
    }

    private Object requireType(String field, Object value, Class<?> type, String typeName) {
        if (!type.isInstance(value)) {
            throw typeMismatch(field, typeName, value);
        }
        return value;
    }

    private void checkEnum(String field, Object value, Object allowed) {
        if (allowed instanceof List<?> values && !values.isEmpty() && !values.contains(value)) {
            throw OperationException.validation(field,
                    "Invalid value '" + value + "' for " + field + ". Allowed: " + values);
        }
    }

    private OperationException typeMismatch(String field, String expected, Object value) {
        return OperationException.validation(field,
                "Expected " + expected + " for " + field + ", got " + value.getClass().getSimpleName()
                        + " '" + value + "'");
    }
}
