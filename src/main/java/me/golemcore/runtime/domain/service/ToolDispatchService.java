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

import me.golemcore.runtime.domain.component.ToolComponent;
import me.golemcore.runtime.domain.model.OperationException;
import me.golemcore.runtime.domain.model.ToolCallContext;
import me.golemcore.runtime.domain.model.ToolCallRequest;
import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.domain.model.ToolErrorKind;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Routes a model-issued tool call to the registered {@link ToolComponent} and
 * always answers with exactly one {@link ToolResult}.
 *
 * <p>
 * Pipeline: resolve tool, validate and coerce arguments, safety check,
 * execute with the call context bound, bounded wait, truncate. Nothing is
 * executed when resolution, validation or the safety check fails.
 */
@Service
@Slf4j
public class ToolDispatchService {

    private final Map<String, ToolComponent> toolRegistry = new TreeMap<>();
    private final ToolArgumentValidator argumentValidator;
    private final ToolSafetyPolicy safetyPolicy;
    private final RuntimeProperties properties;

    public ToolDispatchService(List<ToolComponent> tools, ToolArgumentValidator argumentValidator,
            ToolSafetyPolicy safetyPolicy, RuntimeProperties properties) {
        for (ToolComponent tool : tools) {
            toolRegistry.put(tool.getToolName(), tool);
        }
        this.argumentValidator = argumentValidator;
        this.safetyPolicy = safetyPolicy;
        this.properties = properties;
    }

    /**
     * Dispatch on behalf of the main session with the context already bound to
     * this thread, or with no origin when nothing is bound.
     */
    public ToolResult dispatch(ToolCallRequest request) {
        ToolCallContext current = ToolCallContextHolder.get();
        return dispatch(request, current != null ? current : ToolCallContext.of(null, ToolCallContext.ACTOR_MAIN));
    }

    public ToolResult dispatch(ToolCallRequest request, ToolCallContext context) {
        return dispatch(request, context, null);
    }

    /**
     * @param allowedTools
     *            tool names this caller may use, {@code null} for all
     */
    public ToolResult dispatch(ToolCallRequest request, ToolCallContext context, Set<String> allowedTools) {
        String callId = request.getId();
        String toolName = sanitizeToolName(request.getName());

        ToolComponent tool = toolName != null ? toolRegistry.get(toolName) : null;
        if (tool == null || (allowedTools != null && !allowedTools.contains(toolName))) {
            log.warn("[Dispatch] Rejected unknown tool '{}' from {}", request.getName(), context.actor());
            return withCallId(ToolResult.failure(ToolErrorKind.VALIDATION_ERROR,
                    "Unknown tool: " + request.getName() + ". Available tools: "
                            + String.join(", ", availableNames(allowedTools))),
                    callId);
        }
        if (!tool.isEnabled()) {
            return withCallId(ToolResult.failure(ToolErrorKind.VALIDATION_ERROR, "Tool is disabled: " + toolName),
                    callId);
        }

        Map<String, Object> arguments;
        try {
            arguments = argumentValidator.validate(tool.getDefinition(), request.getArguments());
        } catch (OperationException e) {
            log.debug("[Dispatch] Invalid arguments for '{}': {}", toolName, e.getMessage());
            return withCallId(ToolResult.failure(e), callId);
        }

        Optional<String> hazard = safetyPolicy.findHazard(ToolCallRequest.of(callId, toolName, arguments));
        if (hazard.isPresent()) {
            return withCallId(ToolResult.failure(ToolErrorKind.SAFETY_WARNING, hazard.get()), callId);
        }

        log.debug("[Dispatch] {} -> {} ({})", context.actor(), toolName, callId);
        ToolResult result = execute(tool, arguments, context.withCallId(callId));
        return withCallId(truncate(result, toolName), callId);
    }

    public Collection<ToolDefinition> getDefinitions(Set<String> allowedTools) {
        List<ToolDefinition> definitions = new ArrayList<>();
        for (ToolComponent tool : toolRegistry.values()) {
            if (tool.isEnabled() && (allowedTools == null || allowedTools.contains(tool.getToolName()))) {
                definitions.add(tool.getDefinition());
            }
        }
        return definitions;
    }

    public boolean hasTool(String name) {
        return toolRegistry.containsKey(name);
    }

    private ToolResult execute(ToolComponent tool, Map<String, Object> arguments, ToolCallContext context) {
        ToolCallContext previous = ToolCallContextHolder.get();
        ToolCallContextHolder.set(context);
        CompletableFuture<ToolResult> future = null;
        try {
            future = tool.execute(arguments);
            ToolResult result = future.get(properties.getTools().getTimeoutSeconds(), TimeUnit.SECONDS);
            return result != null ? result : ToolResult.failure("Tool returned no result");
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Dispatch] Tool '{}' timed out after {}s", tool.getToolName(),
                    properties.getTools().getTimeoutSeconds());
            return ToolResult.failure(ToolErrorKind.EXECUTION_TIMEOUT,
                    "Tool '" + tool.getToolName() + "' timed out after "
                            + properties.getTools().getTimeoutSeconds() + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure("Interrupted while waiting for " + tool.getToolName());
        } catch (ExecutionException | RuntimeException e) {
            return mapFailure(tool.getToolName(), e);
        } finally {
            if (previous != null) {
                ToolCallContextHolder.set(previous);
            } else {
                ToolCallContextHolder.clear();
            }
        }
    }

    private ToolResult mapFailure(String toolName, Throwable error) {
        Throwable cursor = error;
        while (cursor != null) {
            if (cursor instanceof OperationException op) {
                log.debug("[Dispatch] Tool '{}' failed: {}", toolName, op.describe());
                return ToolResult.failure(op);
            }
            if (cursor.getCause() == cursor) {
                break;
            }
            cursor = cursor.getCause();
        }
        log.error("[Dispatch] Tool execution failed: {}", toolName, error);
        return ToolResult.failure(ToolErrorKind.EXECUTION_FAILED, "Tool execution failed: " + safeCauseMessage(error));
    }

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && !cause.equals(cursor)) {
            cursor = cause;
            cause = cursor.getCause();
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * Some models leak special tokens like {@code <|channel|>} into tool call
     * names.
     */
    private String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.trim().replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Dispatch] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }

    private List<String> availableNames(Set<String> allowedTools) {
        return toolRegistry.keySet().stream()
                .filter(name -> allowedTools == null || allowedTools.contains(name))
                .toList();
    }

    private ToolResult truncate(ToolResult result, String toolName) {
        int maxChars = properties.getTools().getMaxResultChars();
        String output = result.getOutput();
        if (maxChars <= 0 || output == null || output.length() <= maxChars) {
            return result;
        }
        String suffix = "\n\n[OUTPUT TRUNCATED: " + output.length() + " chars total, showing first "
                + maxChars + " chars. Use a more specific query or process the data in smaller chunks.]";
        int cutPoint = Math.max(0, maxChars - suffix.length());
        log.warn("[Dispatch] Truncating '{}' result: {} chars -> ~{} chars", toolName, output.length(), maxChars);
        return result.toBuilder().output(output.substring(0, cutPoint) + suffix).build();
    }

    private static ToolResult withCallId(ToolResult result, String callId) {
        result.setCallId(callId);
        return result;
    }
}
