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

/**
 * Outcome of one tool call. Exactly one result is produced per
 * {@link ToolCallRequest}; the dispatcher stamps {@code callId} before
 * returning it.
 */
@Data
@Builder(toBuilder = true)
public class ToolResult {

    private String callId;

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String output;
    private Object data;
    private String error;
    private ToolErrorKind errorKind;

    /**
     * Creates a successful tool result with output text.
     */
    public static ToolResult success(String output) {
        return ToolResult.builder()
                .success(true)
                .output(output)
                .build();
    }

    /**
     * Creates a successful tool result with output text and structured data.
     */
    public static ToolResult success(String output, Object data) {
        return ToolResult.builder()
                .success(true)
                .output(output)
                .data(data)
                .build();
    }

    /**
     * Creates a failed tool result classified as an execution failure.
     */
    public static ToolResult failure(String error) {
        return failure(ToolErrorKind.EXECUTION_FAILED, error);
    }

    public static ToolResult failure(ToolErrorKind kind, String error) {
        return ToolResult.builder()
                .success(false)
                .error(error)
                .errorKind(kind)
                .build();
    }

    public static ToolResult failure(OperationException e) {
        return failure(e.getKind(), e.describe());
    }

    /**
     * Text handed back to the reasoning loop.
     */
    public String toContent() {
        if (success) {
            return output;
        }
        if (output != null && !output.isBlank()) {
            return "Error (" + errorKind + "): " + error + "\n" + output;
        }
        return "Error (" + errorKind + "): " + error;
    }
}
