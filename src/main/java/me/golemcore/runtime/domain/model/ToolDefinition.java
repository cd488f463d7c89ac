package me.golemcore.runtime.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Name, description and parameter shape of a registered tool. The shape is a
 * JSON-schema object ({@code type}, {@code properties}, {@code required}); the
 * dispatcher validates call arguments against it before execution.
 */
@Data
@Builder
public class ToolDefinition {

    private static final String KEY_PROPERTIES = "properties";
    private static final String KEY_REQUIRED = "required";

    private String name;
    private String description;
    private Map<String, Object> inputSchema;

    /**
     * Declared parameter schemas keyed by parameter name.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Map<String, Object>> parameterSchemas() {
        if (inputSchema == null || !(inputSchema.get(KEY_PROPERTIES) instanceof Map<?, ?> props)) {
            return Map.of();
        }
        return (Map<String, Map<String, Object>>) props;
    }

    /**
     * Names of parameters that must be present in every call.
     */
    @SuppressWarnings("unchecked")
    public List<String> requiredParameters() {
        if (inputSchema == null || !(inputSchema.get(KEY_REQUIRED) instanceof List<?> required)) {
            return List.of();
        }
        return (List<String>) required;
    }
}
