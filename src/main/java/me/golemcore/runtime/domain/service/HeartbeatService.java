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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.runtime.domain.model.ChecklistItem;
import me.golemcore.runtime.domain.model.HeartbeatReport;
import me.golemcore.runtime.domain.model.SessionKey;
import me.golemcore.runtime.domain.model.SubAgentStatus;
import me.golemcore.runtime.domain.model.SubAgentTask;
import me.golemcore.runtime.domain.model.ToolCallContext;
import me.golemcore.runtime.domain.model.ToolCallRequest;
import me.golemcore.runtime.domain.model.ToolErrorKind;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.port.outbound.WorkspacePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Processes the workspace checklist ({@code HEARTBEAT.md}) once.
 *
 * <p>
 * Each unchecked item is an action. An item written as
 * {@code `tool_name {"arg": "value"}`} is dispatched as that tool call; any
 * other text is handed to a sub-agent and awaited. An item is checked off
 * only after its action succeeded, so a second pass without edits does
 * nothing and a failed item is retried next time.
 */
@Service
@Slf4j
public class HeartbeatService {

    private static final Pattern TOOL_ITEM = Pattern.compile("^`([a-zA-Z0-9_-]+)\\s*(\\{.*})?\\s*`$");
    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {
    };
    static final String SPAWN_TOOL = "spawn";

    private final WorkspacePort workspace;
    private final ToolDispatchService dispatchService;
    private final SubAgentService subAgentService;
    private final MemoryService memoryService;
    private final ObjectMapper objectMapper;
    private final RuntimeProperties properties;

    public HeartbeatService(WorkspacePort workspace, ToolDispatchService dispatchService,
            SubAgentService subAgentService, MemoryService memoryService, ObjectMapper objectMapper,
            RuntimeProperties properties) {
        this.workspace = workspace;
        this.dispatchService = dispatchService;
        this.subAgentService = subAgentService;
        this.memoryService = memoryService;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public synchronized HeartbeatReport runOnce() {
        String checklistFile = properties.getWorkspace().getChecklistFile();
        List<ChecklistItem> items = ChecklistParser.parse(workspace.read(checklistFile));
        List<ChecklistItem> pending = items.stream().filter(item -> !item.done()).toList();
        if (pending.isEmpty()) {
            log.debug("[Heartbeat] Nothing to do in {}", checklistFile);
            return new HeartbeatReport(0, 0, 0, items.size());
        }

        log.info("[Heartbeat] Processing {} unchecked item(s)", pending.size());
        ToolCallContext context = ToolCallContext.of(notifyOrigin(), ToolCallContext.ACTOR_HEARTBEAT);
        int completed = 0;
        int failed = 0;
        for (ChecklistItem item : pending) {
            ToolResult result;
            try {
                result = execute(item, context);
            } catch (RuntimeException e) {
                log.error("[Heartbeat] Item at line {} crashed: {}", item.lineNumber(), item.text(), e);
                result = ToolResult.failure(e.getMessage());
            }

            if (!result.isSuccess()) {
                failed++;
                log.warn("[Heartbeat] Item at line {} failed ({}): {}", item.lineNumber(), result.getErrorKind(),
                        result.getError());
                continue;
            }
            try {
                workspace.readModifyWrite(checklistFile, content -> ChecklistParser.markDone(content, item));
                memoryService.appendHistory("Heartbeat completed: " + item.text());
                completed++;
                log.info("[Heartbeat] Completed: {}", item.text());
            } catch (RuntimeException e) {
                failed++;
                log.error("[Heartbeat] Could not check off line {}", item.lineNumber(), e);
            }
        }
        return new HeartbeatReport(pending.size(), completed, failed, items.size() - pending.size());
    }

    private ToolResult execute(ChecklistItem item, ToolCallContext context) {
        String callId = "hb-" + UUID.randomUUID().toString().substring(0, 8);
        Matcher toolMatcher = TOOL_ITEM.matcher(item.text().trim());
        if (toolMatcher.matches()) {
            Map<String, Object> args;
            try {
                args = toolMatcher.group(2) != null ? objectMapper.readValue(toolMatcher.group(2), ARGS_TYPE) : Map.of();
            } catch (JsonProcessingException e) {
                return ToolResult.failure(ToolErrorKind.VALIDATION_ERROR,
                        "Invalid JSON arguments in checklist item: " + e.getOriginalMessage());
            }
            return dispatchService.dispatch(ToolCallRequest.of(callId, toolMatcher.group(1), args), context);
        }
        return runAsSubAgent(item, callId, context);
    }

    private ToolResult runAsSubAgent(ChecklistItem item, String callId, ToolCallContext context) {
        ToolResult spawned = dispatchService.dispatch(
                ToolCallRequest.of(callId, SPAWN_TOOL, Map.of("task", item.text(), "label", "heartbeat")), context);
        if (!spawned.isSuccess() || !(spawned.getData() instanceof Map<?, ?> data)) {
            return spawned;
        }
        String taskId = String.valueOf(data.get("task_id"));
        Duration timeout = Duration.ofSeconds(properties.getHeartbeat().getItemTimeoutSeconds());
        SubAgentTask task;
        try {
            task = subAgentService.awaitTermination(taskId, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            subAgentService.cancel(taskId);
            return ToolResult.failure("Interrupted while waiting for " + taskId);
        }
        subAgentService.consumeResult(taskId);
        if (task.getStatus() == SubAgentStatus.COMPLETED) {
            return ToolResult.success(task.getResult());
        }
        if (!task.getStatus().isTerminal()) {
            subAgentService.cancel(taskId);
            return ToolResult.failure(ToolErrorKind.EXECUTION_TIMEOUT,
                    "Sub-agent " + taskId + " did not finish within " + timeout.toSeconds() + "s");
        }
        return ToolResult.failure("Sub-agent " + taskId + " ended " + task.getStatus() + ": " + task.getResult());
    }

    private SessionKey notifyOrigin() {
        RuntimeProperties.HeartbeatProperties config = properties.getHeartbeat();
        if (config.getNotifyChannel() == null || config.getNotifyChannel().isBlank()
                || config.getNotifyRecipient() == null || config.getNotifyRecipient().isBlank()) {
            return null;
        }
        return new SessionKey(config.getNotifyChannel(), config.getNotifyRecipient());
    }
}
