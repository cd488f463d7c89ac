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

import lombok.Getter;

/**
 * Failure of a runtime operation with enough detail (kind and offending field)
 * to be explained to the caller without re-querying internal state.
 */
@Getter
public class OperationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ToolErrorKind kind;
    private final String field;

    public OperationException(ToolErrorKind kind, String field, String message) {
        super(message);
        this.kind = kind;
        this.field = field;
    }

    public OperationException(ToolErrorKind kind, String field, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.field = field;
    }

    public static OperationException validation(String field, String message) {
        return new OperationException(ToolErrorKind.VALIDATION_ERROR, field, message);
    }

    public static OperationException notFound(String field, String id) {
        return new OperationException(ToolErrorKind.JOB_NOT_FOUND, field, "Not found: " + id);
    }

    public static OperationException conflict(String field, String message) {
        return new OperationException(ToolErrorKind.CONFLICT, field, message);
    }

    public static OperationException resourceExhausted(String message) {
        return new OperationException(ToolErrorKind.RESOURCE_EXHAUSTED, null, message);
    }

    public static OperationException timeout(String message) {
        return new OperationException(ToolErrorKind.EXECUTION_TIMEOUT, null, message);
    }

    public static OperationException infrastructure(String message, Throwable cause) {
        return new OperationException(ToolErrorKind.INFRASTRUCTURE_FAILURE, null, message, cause);
    }

    /**
     * Message prefixed with the kind and, when known, the offending field.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder(kind.name());
        if (field != null && !field.isBlank()) {
            sb.append(" [").append(field).append(']');
        }
        sb.append(": ").append(getMessage());
        return sb.toString();
    }
}
