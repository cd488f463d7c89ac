package me.golemcore.runtime.tools;

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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builders for the JSON-schema fragments tools declare as input schema.
 */
final class ToolSchemas {

    private static final String TYPE = "type";
    private static final String DESCRIPTION = "description";

    private ToolSchemas() {
    }

    static Map<String, Object> object(Map<String, Object> properties, List<String> required) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put(TYPE, "object");
        schema.put("properties", properties);
        schema.put("required", required);
        return schema;
    }

    static Map<String, Object> string(String description) {
        return Map.of(TYPE, "string", DESCRIPTION, description);
    }

    static Map<String, Object> integer(String description) {
        return Map.of(TYPE, "integer", DESCRIPTION, description);
    }

    static Map<String, Object> stringEnum(String description, List<String> values) {
        return Map.of(TYPE, "string", DESCRIPTION, description, "enum", values);
    }

    static String optionalString(Map<String, Object> parameters, String name) {
        Object value = parameters.get(name);
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }

    static Integer optionalInt(Map<String, Object> parameters, String name) {
        Long value = optionalLong(parameters, name);
        if (value == null) {
            return null;
        }
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw OperationException.validation(name, name + " is out of range: " + value);
        }
        return value.intValue();
    }

    static Long optionalLong(Map<String, Object> parameters, String name) {
        Object value = parameters.get(name);
        return value instanceof Number n ? n.longValue() : null;
    }
}
