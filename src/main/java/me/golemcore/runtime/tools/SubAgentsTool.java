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

import me.golemcore.runtime.domain.component.ToolComponent;
import me.golemcore.runtime.domain.model.OperationException;
import me.golemcore.runtime.domain.model.SubAgentTask;
import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.domain.service.SubAgentService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Inspects and cancels sub-agent tasks by id. Reading a finished task's
 * status hands over its result.
 */
@Component
@RequiredArgsConstructor
public class SubAgentsTool implements ToolComponent {

    private static final String PARAM_ACTION = "action";
    private static final String PARAM_TASK_ID = "task_id";
    private static final String ACTION_LIST = "list";
    private static final String ACTION_STATUS = "status";
    private static final String ACTION_CANCEL = "cancel";

    private final SubAgentService subAgentService;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("subagents")
                .description("List sub-agent tasks, get the status and result of one, or cancel one.")
                .inputSchema(ToolSchemas.object(Map.of(
                        PARAM_ACTION, ToolSchemas.stringEnum("Action to perform",
                                List.of(ACTION_LIST, ACTION_STATUS, ACTION_CANCEL)),
                        PARAM_TASK_ID, ToolSchemas.string("Task id (for status and cancel)")),
                        List.of(PARAM_ACTION)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        String action = (String) parameters.get(PARAM_ACTION);
        ToolResult result = switch (action) {
        case ACTION_LIST -> list();
        case ACTION_STATUS -> status(requireTaskId(parameters));
        case ACTION_CANCEL -> cancel(requireTaskId(parameters));
        default -> throw OperationException.validation(PARAM_ACTION, "Unknown action: " + action);
        };
        return CompletableFuture.completedFuture(result);
    }

    private ToolResult list() {
        List<SubAgentTask> tasks = subAgentService.listTasks();
        if (tasks.isEmpty()) {
            return ToolResult.success("No sub-agent tasks.", Map.of("tasks", List.of()));
        }
        StringBuilder sb = new StringBuilder();
        for (SubAgentTask task : tasks) {
            sb.append("- ").append(task.getId()).append(" [").append(task.getStatus()).append("] ")
                    .append(task.displayName()).append('\n');
        }
        return ToolResult.success(sb.toString().stripTrailing(),
                Map.of("tasks", tasks.stream().map(SubAgentsTool::describe).toList()));
    }

    private ToolResult status(String taskId) {
        SubAgentTask task = subAgentService.consumeResult(taskId);
        StringBuilder sb = new StringBuilder()
                .append("Task ").append(task.getId()).append(" '").append(task.displayName()).append("': ")
                .append(task.getStatus());
        if (task.getResult() != null) {
            sb.append("\n\nResult:\n").append(task.getResult());
        }
        return ToolResult.success(sb.toString(), describe(task));
    }

    private ToolResult cancel(String taskId) {
        boolean cancelled = subAgentService.cancel(taskId);
        SubAgentTask task = subAgentService.getTask(taskId).orElseThrow();
        String message = cancelled
                ? "Cancellation of " + taskId + " accepted (" + task.getStatus() + ")"
                : "Task " + taskId + " already finished (" + task.getStatus() + ")";
        return ToolResult.success(message, describe(task));
    }

    private static String requireTaskId(Map<String, Object> parameters) {
        String taskId = ToolSchemas.optionalString(parameters, PARAM_TASK_ID);
        if (taskId == null) {
            throw OperationException.validation(PARAM_TASK_ID, "task_id is required for this action");
        }
        return taskId;
    }

    private static Map<String, Object> describe(SubAgentTask task) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(PARAM_TASK_ID, task.getId());
        data.put("status", task.getStatus().name());
        data.put("label", task.displayName());
        if (task.getResult() != null) {
            data.put("result", task.getResult());
        }
        return data;
    }
}
