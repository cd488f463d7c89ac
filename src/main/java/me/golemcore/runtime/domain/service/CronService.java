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
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.runtime.domain.model.CronJob;
import me.golemcore.runtime.domain.model.CronJobState;
import me.golemcore.runtime.domain.model.CronTrigger;
import me.golemcore.runtime.domain.model.DeliveryTarget;
import me.golemcore.runtime.domain.model.OperationException;
import me.golemcore.runtime.domain.model.OutboundMessage;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.port.outbound.WorkspacePort;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Durable cron job store and firing logic.
 *
 * <p>
 * Jobs live in {@code cron/jobs.json} inside the workspace. Every operation
 * is a single exclusive read-modify-write of that file, so the {@code cron}
 * CLI and a running daemon see the same jobs and a job is on disk before
 * {@link #addJob} returns. There is no in-memory copy.
 *
 * <p>
 * Firing consumes a due job (removes ONE_TIME, advances RECURRING and
 * INTERVAL from the current time) and persists that before delivering, so a
 * crash between the two loses at most one delivery and never fires twice.
 * Occurrences missed while the process was down collapse into one firing.
 */
@Service
@Slf4j
public class CronService {

    private static final int CRON_FIVE_FIELDS = 5;
    private static final int STORE_VERSION = 1;
    private static final long DELIVERY_TIMEOUT_SECONDS = 30;

    private final WorkspacePort workspace;
    private final OutboundMessageService outboundMessageService;
    private final ObjectMapper objectMapper;
    private final RuntimeProperties properties;
    private final Clock clock;

    public CronService(WorkspacePort workspace, OutboundMessageService outboundMessageService,
            ObjectMapper objectMapper, RuntimeProperties properties, Clock clock) {
        this.workspace = workspace;
        this.outboundMessageService = outboundMessageService;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    public CronJob addJob(String name, String message, CronTrigger trigger, DeliveryTarget delivery) {
        requireText("name", name);
        requireText("message", message);
        if (delivery == null) {
            throw OperationException.validation("to", "Delivery target is required");
        }
        requireText("channel", delivery.getChannel());
        requireText("to", delivery.getRecipientId());

        Instant now = clock.instant();
        CronTrigger normalized = validateTrigger(trigger, now);

        CronJob job = CronJob.builder()
                .id(UUID.randomUUID().toString().substring(0, 8))
                .name(name.strip())
                .message(message)
                .trigger(normalized)
                .delivery(new DeliveryTarget(delivery.getChannel(), delivery.getRecipientId()))
                .enabled(true)
                .createdAt(now)
                .updatedAt(now)
                .state(CronJobState.builder().nextRunAt(computeNextRun(normalized, now)).build())
                .build();

        mutate(jobs -> {
            boolean duplicate = jobs.stream().anyMatch(existing -> existing.getName().equalsIgnoreCase(job.getName()));
            if (duplicate) {
                throw OperationException.conflict("name", "A job named '" + job.getName() + "' already exists");
            }
            jobs.add(job);
            return job;
        });

        log.info("[Cron] Added job '{}' ({}) {} next run {}", job.getName(), job.getId(),
                normalized.describe(), job.getState().getNextRunAt());
        return job;
    }

    /**
     * @return jobs ordered by next run, disabled ones only when asked for
     */
    public List<CronJob> listJobs(boolean includeDisabled) {
        return loadJobs().stream()
                .filter(job -> includeDisabled || job.isEnabled())
                .sorted(Comparator.comparing(
                        (CronJob job) -> job.getState().getNextRunAt(),
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    public CronJob getJob(String jobId) {
        return loadJobs().stream()
                .filter(job -> job.getId().equals(jobId))
                .findFirst()
                .orElseThrow(() -> OperationException.notFound("job_id", jobId));
    }

    public CronJob removeJob(String jobId) {
        requireText("job_id", jobId);
        CronJob removed = mutate(jobs -> {
            Iterator<CronJob> iterator = jobs.iterator();
            while (iterator.hasNext()) {
                CronJob job = iterator.next();
                if (job.getId().equals(jobId)) {
                    iterator.remove();
                    return job;
                }
            }
            throw OperationException.notFound("job_id", jobId);
        });
        log.info("[Cron] Removed job '{}' ({})", removed.getName(), removed.getId());
        return removed;
    }

    public CronJob enableJob(String jobId, boolean enabled) {
        requireText("job_id", jobId);
        Instant now = clock.instant();
        CronJob updated = mutate(jobs -> {
            CronJob job = find(jobs, jobId);
            job.setEnabled(enabled);
            job.setUpdatedAt(now);
            job.getState().setNextRunAt(enabled ? computeNextRun(job.getTrigger(), now) : null);
            return job;
        });
        log.info("[Cron] Job '{}' ({}) {}", updated.getName(), updated.getId(), enabled ? "enabled" : "disabled");
        return updated;
    }

    /**
     * Fire every due job once: consume and persist first, then deliver.
     *
     * @return the jobs that fired, in the state they had when they fired
     */
    public List<CronJob> fireDueJobs() {
        Instant now = clock.instant();
        List<CronJob> fired = mutate(jobs -> {
            List<CronJob> due = new ArrayList<>();
            Iterator<CronJob> iterator = jobs.iterator();
            while (iterator.hasNext()) {
                CronJob job = iterator.next();
                if (!job.isDue(now)) {
                    continue;
                }
                due.add(copyOf(job));
                if (job.isOneTime()) {
                    iterator.remove();
                } else {
                    recordRun(job, now);
                    job.getState().setNextRunAt(computeNextRun(job.getTrigger(), now));
                }
            }
            return due.isEmpty() ? null : due;
        });
        if (fired == null) {
            return List.of();
        }

        for (CronJob job : fired) {
            log.info("[Cron] Firing job '{}' ({}) scheduled for {}", job.getName(), job.getId(),
                    job.getState().getNextRunAt());
            deliver(job);
        }
        return fired;
    }

    /**
     * Fire one job now regardless of its schedule. A ONE_TIME job is consumed;
     * the next scheduled run of a repeating job is kept.
     */
    public CronJob runJob(String jobId) {
        requireText("job_id", jobId);
        Instant now = clock.instant();
        CronJob fired = mutate(jobs -> {
            CronJob job = find(jobs, jobId);
            CronJob snapshot = copyOf(job);
            if (job.isOneTime()) {
                jobs.remove(job);
            } else {
                recordRun(job, now);
            }
            return snapshot;
        });
        log.info("[Cron] Manually running job '{}' ({})", fired.getName(), fired.getId());
        String error = deliver(fired);
        fired.getState().setLastStatus(error == null ? CronJobState.STATUS_OK : CronJobState.STATUS_ERROR);
        fired.getState().setLastError(error);
        return fired;
    }

    /**
     * Next run instant of a trigger strictly after {@code after}, or null when
     * the trigger will not fire again.
     */
    public Instant computeNextRun(CronTrigger trigger, Instant after) {
        return switch (trigger.getKind()) {
        case ONE_TIME -> trigger.getAt();
        case INTERVAL -> after.plusSeconds(trigger.getEverySeconds());
        case RECURRING -> {
            CronExpression cron = CronExpression.parse(toSixFields(trigger.getCronExpression()));
            ZonedDateTime next = cron.next(after.atZone(resolveZone(trigger.getTimezone())));
            yield next != null ? next.toInstant() : null;
        }
        };
    }

    private String deliver(CronJob job) {
        OutboundMessage message = OutboundMessage.builder()
                .channel(job.getDelivery().getChannel())
                .chatId(job.getDelivery().getRecipientId())
                .content(job.getMessage())
                .source(OutboundMessage.Source.CRON)
                .metadata(Map.of("jobId", job.getId(), "jobName", job.getName()))
                .build();
        String error = null;
        try {
            CompletableFuture<Void> sent = outboundMessageService.send(message);
            sent.get(DELIVERY_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            error = "interrupted";
        } catch (ExecutionException e) {
            error = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
        } catch (TimeoutException e) {
            error = "delivery timed out after " + DELIVERY_TIMEOUT_SECONDS + "s";
        }

        if (error != null) {
            log.warn("[Cron] Delivery of job '{}' ({}) failed: {}", job.getName(), job.getId(), error);
        }
        if (!job.isOneTime()) {
            recordDeliveryStatus(job.getId(), error);
        }
        return error;
    }

    private void recordDeliveryStatus(String jobId, String error) {
        try {
            mutate(jobs -> {
                for (CronJob job : jobs) {
                    if (job.getId().equals(jobId)) {
                        job.getState().setLastStatus(error == null ? CronJobState.STATUS_OK : CronJobState.STATUS_ERROR);
                        job.getState().setLastError(error);
                        return job;
                    }
                }
                return null;
            });
        } catch (OperationException e) {
            log.warn("[Cron] Failed to record delivery status of {}: {}", jobId, e.getMessage());
        }
    }

    private void recordRun(CronJob job, Instant now) {
        CronJobState state = job.getState();
        state.setLastRunAt(now);
        state.setRunCount(state.getRunCount() + 1);
        job.setUpdatedAt(now);
    }

    private CronTrigger validateTrigger(CronTrigger trigger, Instant now) {
        if (trigger == null || trigger.getKind() == null) {
            throw OperationException.validation("schedule", "One of at, cron_expr or every_seconds is required");
        }
        return switch (trigger.getKind()) {
        case ONE_TIME -> {
            if (trigger.getAt() == null) {
                throw OperationException.validation("at", "Timestamp is required");
            }
            if (!trigger.getAt().isAfter(now)) {
                throw OperationException.validation("at", "Timestamp is in the past: " + trigger.getAt());
            }
            yield CronTrigger.oneTime(trigger.getAt());
        }
        case INTERVAL -> {
            if (trigger.getEverySeconds() == null || trigger.getEverySeconds() <= 0) {
                throw OperationException.validation("every_seconds", "Interval must be a positive number of seconds");
            }
            try {
                now.plusSeconds(trigger.getEverySeconds());
            } catch (ArithmeticException | DateTimeException e) {
                throw OperationException.validation("every_seconds", "Interval is too large: "
                        + trigger.getEverySeconds() + "s");
            }
            yield CronTrigger.interval(trigger.getEverySeconds());
        }
        case RECURRING -> {
            String expression = normalizeCronExpression(trigger.getCronExpression());
            resolveZone(trigger.getTimezone());
            yield CronTrigger.recurring(expression, blankToNull(trigger.getTimezone()));
        }
        };
    }

    /**
     * Validates a standard 5-field cron expression and returns it with
     * collapsed whitespace.
     */
    static String normalizeCronExpression(String input) {
        if (input == null || input.isBlank()) {
            throw OperationException.validation("cron_expr", "Cron expression is required");
        }
        String[] parts = input.trim().split("\\s+");
        if (parts.length != CRON_FIVE_FIELDS) {
            throw OperationException.validation("cron_expr",
                    "Cron expression must have 5 fields (minute hour day month weekday), got "
                            + parts.length + ": " + input);
        }
        String normalized = String.join(" ", parts);
        try {
            CronExpression.parse(toSixFields(normalized));
        } catch (IllegalArgumentException e) {
            throw OperationException.validation("cron_expr", "Invalid cron expression '" + input + "': "
                    + e.getMessage());
        }
        return normalized;
    }

    private static String toSixFields(String fiveFieldCron) {
        return "0 " + fiveFieldCron;
    }

    private static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw OperationException.validation("tz", "Unknown timezone: " + timezone);
        }
    }

    private static CronJob find(List<CronJob> jobs, String jobId) {
        return jobs.stream()
                .filter(job -> job.getId().equals(jobId))
                .findFirst()
                .orElseThrow(() -> OperationException.notFound("job_id", jobId));
    }

    private CronJob copyOf(CronJob job) {
        return objectMapper.convertValue(job, CronJob.class);
    }

    private List<CronJob> loadJobs() {
        String content = workspace.read(storePath());
        return parse(content).getJobs();
    }

    /**
     * Apply {@code change} to the stored jobs under the store's exclusive lock.
     * The file is rewritten only when {@code change} returns non-null.
     */
    private <T> T mutate(Function<List<CronJob>, T> change) {
        AtomicReference<T> outcome = new AtomicReference<>();
        workspace.readModifyWrite(storePath(), current -> {
            CronStoreFile store = parse(current);
            T result = change.apply(store.getJobs());
            outcome.set(result);
            if (result == null) {
                return current;
            }
            store.setVersion(STORE_VERSION);
            return serialize(store);
        });
        return outcome.get();
    }

    private CronStoreFile parse(String content) {
        if (content == null || content.isBlank()) {
            return new CronStoreFile(STORE_VERSION, new ArrayList<>());
        }
        try {
            CronStoreFile store = objectMapper.readValue(content, CronStoreFile.class);
            if (store.getJobs() == null) {
                store.setJobs(new ArrayList<>());
            }
            return store;
        } catch (JsonProcessingException e) {
            throw OperationException.infrastructure("Job store " + storePath() + " is corrupt", e);
        }
    }

    private String serialize(CronStoreFile store) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(store);
        } catch (JsonProcessingException e) {
            throw OperationException.infrastructure("Failed to serialize job store", e);
        }
    }

    private String storePath() {
        return properties.getWorkspace().getCronStoreFile();
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw OperationException.validation(field, field + " is required");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    /**
     * On-disk shape of {@code cron/jobs.json}.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class CronStoreFile {
        private int version;
        private List<CronJob> jobs = new ArrayList<>();
    }
}
