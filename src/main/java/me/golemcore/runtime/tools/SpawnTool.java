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
import me.golemcore.runtime.domain.model.SubAgentTask;
import me.golemcore.runtime.domain.model.ToolCallContext;
import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.domain.service.SubAgentService;
import me.golemcore.runtime.domain.service.ToolCallContextHolder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Starts a background sub-agent and returns its task id without waiting.
 * The calling session is told when the task ends.
 */
@Component
@RequiredArgsConstructor
public class SpawnTool implements ToolComponent {

    private static final String PARAM_TASK = "task";
    private static final String PARAM_LABEL = "label";

    private final SubAgentService subAgentService;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("spawn")
                .description("""
                        Spawn a sub-agent to handle a task in the background.
                        Use this for complex or time-consuming tasks that can run independently.
                        The sub-agent reports back when done; check progress with the subagents tool.
                        """)
                .inputSchema(ToolSchemas.object(Map.of(
                        PARAM_TASK, ToolSchemas.string("The task for the sub-agent to complete"),
                        PARAM_LABEL, ToolSchemas.string("Optional short label for the task")),
                        List.of(PARAM_TASK)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        ToolCallContext context = ToolCallContextHolder.get();
        SubAgentTask task = subAgentService.spawn((String) parameters.get(PARAM_TASK),
                ToolSchemas.optionalString(parameters, PARAM_LABEL),
                context != null ? context.origin() : null);
        return CompletableFuture.completedFuture(ToolResult.success(
                "Sub-agent '" + task.displayName() + "' started (id: " + task.getId()
                        + "). I'll be notified when it completes.",
                Map.of("task_id", task.getId(), "status", task.getStatus().name())));
    }
}
