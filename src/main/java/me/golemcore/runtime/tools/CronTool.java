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
import me.golemcore.runtime.domain.model.CronJob;
import me.golemcore.runtime.domain.model.CronTrigger;
import me.golemcore.runtime.domain.model.DeliveryTarget;
import me.golemcore.runtime.domain.model.OperationException;
import me.golemcore.runtime.domain.model.SessionKey;
import me.golemcore.runtime.domain.model.ToolCallContext;
import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.domain.service.CronService;
import me.golemcore.runtime.domain.service.CronTriggers;
import me.golemcore.runtime.domain.service.ToolCallContextHolder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Schedules reminders and recurring messages. Deliveries go to the calling
 * session unless {@code channel} and {@code to} name another recipient.
 */
@Component
@RequiredArgsConstructor
public class CronTool implements ToolComponent {

    private static final String PARAM_ACTION = "action";
    private static final String PARAM_NAME = "name";
    private static final String PARAM_MESSAGE = "message";
    private static final String PARAM_AT = "at";
    private static final String PARAM_CRON_EXPR = "cron_expr";
    private static final String PARAM_EVERY_SECONDS = "every_seconds";
    private static final String PARAM_TZ = "tz";
    private static final String PARAM_JOB_ID = "job_id";
    private static final String PARAM_CHANNEL = "channel";
    private static final String PARAM_TO = "to";
    private static final int DEFAULT_NAME_LENGTH = 30;

    private final CronService cronService;

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(PARAM_ACTION, ToolSchemas.stringEnum("Action to perform",
                List.of("add", "list", "remove", "enable", "disable")));
        props.put(PARAM_NAME, ToolSchemas.string("Unique job name (add; defaults to the message start)"));
        props.put(PARAM_MESSAGE, ToolSchemas.string("Message delivered when the job fires (add)"));
        props.put(PARAM_AT, ToolSchemas.string("ISO-8601 date-time for a one-time job, e.g. 2026-02-12T10:30:00"));
        props.put(PARAM_CRON_EXPR, ToolSchemas.string("5-field cron expression, e.g. '0 9 * * *'"));
        props.put(PARAM_EVERY_SECONDS, ToolSchemas.integer("Interval in seconds for a repeating job"));
        props.put(PARAM_TZ, ToolSchemas.string("IANA timezone for cron_expr and a local 'at', e.g. Europe/Berlin"));
        props.put(PARAM_JOB_ID, ToolSchemas.string("Job id (remove, enable, disable)"));
        props.put(PARAM_CHANNEL, ToolSchemas.string("Delivery channel (defaults to this session's)"));
        props.put(PARAM_TO, ToolSchemas.string("Delivery recipient (defaults to this session's)"));
        return ToolDefinition.builder()
                .name("cron")
                .description("""
                        Schedule reminders and recurring tasks. Actions: add, list, remove, enable, disable.
                        For add give exactly one of at (one-time), cron_expr (recurring) or every_seconds (interval).
                        """)
                .inputSchema(ToolSchemas.object(props, List.of(PARAM_ACTION)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        ToolCallContext context = ToolCallContextHolder.get();
        String action = (String) parameters.get(PARAM_ACTION);
        ToolResult result = switch (action) {
        case "add" -> add(parameters, context != null ? context.origin() : null);
        case "list" -> list();
        case "remove" -> remove(requireJobId(parameters));
        case "enable" -> setEnabled(requireJobId(parameters), true);
        case "disable" -> setEnabled(requireJobId(parameters), false);
        default -> throw OperationException.validation(PARAM_ACTION, "Unknown action: " + action);
        };
        return CompletableFuture.completedFuture(result);
    }

    private ToolResult add(Map<String, Object> parameters, SessionKey origin) {
        String message = ToolSchemas.optionalString(parameters, PARAM_MESSAGE);
        if (message == null) {
            throw OperationException.validation(PARAM_MESSAGE, "message is required for add");
        }
        String name = ToolSchemas.optionalString(parameters, PARAM_NAME);
        if (name == null) {
            name = defaultName(message);
        }

        String channel = ToolSchemas.optionalString(parameters, PARAM_CHANNEL);
        String to = ToolSchemas.optionalString(parameters, PARAM_TO);
        if (channel == null && origin != null) {
            channel = origin.channel();
        }
        if (to == null && origin != null) {
            to = origin.recipientId();
        }
        if (channel == null || to == null) {
            throw OperationException.validation(channel == null ? PARAM_CHANNEL : PARAM_TO,
                    "No delivery target: specify channel and to");
        }

        CronJob job = cronService.addJob(name, message, parseTrigger(parameters), new DeliveryTarget(channel, to));
        return ToolResult.success("Created job '" + job.getName() + "' (id: " + job.getId() + "), "
                + job.getTrigger().describe() + ", next run " + job.getState().getNextRunAt(),
                Map.of(PARAM_JOB_ID, job.getId()));
    }

    private ToolResult list() {
        List<CronJob> jobs = cronService.listJobs(true);
        if (jobs.isEmpty()) {
            return ToolResult.success("No scheduled jobs.", Map.of("jobs", List.of()));
        }
        StringBuilder sb = new StringBuilder("Scheduled jobs:\n");
        for (CronJob job : jobs) {
            sb.append("- ").append(job.getName()).append(" (id: ").append(job.getId()).append(", ")
                    .append(job.getTrigger().describe());
            if (!job.isEnabled()) {
                sb.append(", disabled");
            } else {
                sb.append(", next ").append(job.getState().getNextRunAt());
            }
            sb.append(")\n");
        }
        return ToolResult.success(sb.toString().stripTrailing(),
                Map.of("jobs", jobs.stream().map(CronJob::getId).toList()));
    }

    private ToolResult remove(String jobId) {
        CronJob removed = cronService.removeJob(jobId);
        return ToolResult.success("Removed job '" + removed.getName() + "' (" + jobId + ")",
                Map.of(PARAM_JOB_ID, jobId));
    }

    private ToolResult setEnabled(String jobId, boolean enabled) {
        CronJob job = cronService.enableJob(jobId, enabled);
        return ToolResult.success("Job '" + job.getName() + "' " + (enabled ? "enabled" : "disabled"),
                Map.of(PARAM_JOB_ID, jobId));
    }

    /**
     * Message prefix plus a short random suffix, so reminders that start alike
     * do not collide on the unique job name.
     */
    static String defaultName(String message) {
        String prefix = message.length() > DEFAULT_NAME_LENGTH
                ? message.substring(0, DEFAULT_NAME_LENGTH).stripTrailing()
                : message.strip();
        return prefix + " #" + UUID.randomUUID().toString().substring(0, 4);
    }

    private static CronTrigger parseTrigger(Map<String, Object> parameters) {
        return CronTriggers.fromOptions(
                ToolSchemas.optionalString(parameters, PARAM_AT),
                ToolSchemas.optionalString(parameters, PARAM_CRON_EXPR),
                ToolSchemas.optionalLong(parameters, PARAM_EVERY_SECONDS),
                ToolSchemas.optionalString(parameters, PARAM_TZ));
    }

    private static String requireJobId(Map<String, Object> parameters) {
        String jobId = ToolSchemas.optionalString(parameters, PARAM_JOB_ID);
        if (jobId == null) {
            throw OperationException.validation(PARAM_JOB_ID, "job_id is required for this action");
        }
        return jobId;
    }
}
