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

import me.golemcore.runtime.domain.model.OperationException;
import me.golemcore.runtime.domain.model.OutboundMessage;
import me.golemcore.runtime.domain.model.SessionKey;
import me.golemcore.runtime.domain.model.SubAgentStatus;
import me.golemcore.runtime.domain.model.SubAgentTask;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spawns background sub-agent tasks with bounded concurrency.
 *
 * <p>
 * At most {@code runtime.subagents.max-concurrent} tasks run at once. With
 * the QUEUE policy extra tasks wait as PENDING (up to
 * {@code queue-capacity}); with REJECT a spawn beyond the bound fails with
 * RESOURCE_EXHAUSTED. The caller only keeps the task id: status and result
 * are read back through {@link #getTask} and {@link #consumeResult}, and the
 * origin session receives an announcement when the task ends.
 */
@Service
@Slf4j
public class SubAgentService {

    private static final String ID_PREFIX = "sa-";

    private final SubAgentExecutor executor;
    private final OutboundMessageService outboundMessageService;
    private final RuntimeProperties properties;
    private final Clock clock;

    private final Map<String, SubAgentTask> tasks = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<SubAgentTask>> completions = new ConcurrentHashMap<>();
    private final ThreadPoolExecutor workers;
    // null under QUEUE; the pool queue bounds the backlog there
    private final Semaphore rejectSlots;

    public SubAgentService(SubAgentExecutor executor, OutboundMessageService outboundMessageService,
            RuntimeProperties properties, Clock clock) {
        this.executor = executor;
        this.outboundMessageService = outboundMessageService;
        this.properties = properties;
        this.clock = clock;
        this.workers = createWorkers(properties.getSubagents());
        this.rejectSlots = properties.getSubagents().getOverflowPolicy() == RuntimeProperties.OverflowPolicy.REJECT
                ? new Semaphore(Math.max(1, properties.getSubagents().getMaxConcurrent()))
                : null;
    }

    private static ThreadPoolExecutor createWorkers(RuntimeProperties.SubAgentProperties config) {
        int slots = Math.max(1, config.getMaxConcurrent());
        // under REJECT the slot semaphore admits at most `slots` tasks, so the
        // queue only holds a task whose predecessor is still leaving run()
        BlockingQueue<Runnable> queue = config.getOverflowPolicy() == RuntimeProperties.OverflowPolicy.REJECT
                ? new LinkedBlockingQueue<>()
                : new LinkedBlockingQueue<>(Math.max(1, config.getQueueCapacity()));
        AtomicInteger counter = new AtomicInteger();
        return new ThreadPoolExecutor(slots, slots, 60, TimeUnit.SECONDS, queue, runnable -> {
            Thread thread = new Thread(runnable, "subagent-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }, new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Start a task and return immediately; the task is PENDING or RUNNING.
     *
     * @throws OperationException
     *             VALIDATION_ERROR for a blank description, RESOURCE_EXHAUSTED
     *             when no slot (or queue space) is free
     */
    public SubAgentTask spawn(String description, String label, SessionKey origin) {
        if (description == null || description.isBlank()) {
            throw OperationException.validation("task", "Task description is required");
        }
        pruneConsumed();

        if (rejectSlots != null && !rejectSlots.tryAcquire()) {
            log.warn("[SubAgent] Rejected '{}': all {} slots busy", description.strip(),
                    properties.getSubagents().getMaxConcurrent());
            throw exhausted();
        }

        String id = ID_PREFIX + UUID.randomUUID().toString().substring(0, 8);
        SubAgentTask task = new SubAgentTask(id, description.strip(), label, origin, clock.instant());
        tasks.put(id, task);
        completions.put(id, new CompletableFuture<>());

        try {
            workers.execute(() -> run(task));
        } catch (RejectedExecutionException e) {
            tasks.remove(id);
            completions.remove(id);
            releaseSlot();
            log.warn("[SubAgent] Rejected '{}': {} running, policy {}", task.displayName(),
                    workers.getActiveCount(), properties.getSubagents().getOverflowPolicy());
            throw exhausted();
        }
        log.info("[SubAgent] Spawned {} '{}'", id, task.displayName());
        return task;
    }

    /**
     * Cancel a task. A PENDING task never starts; a RUNNING task stops at its
     * executor's next checkpoint.
     *
     * @return false when the task already ended
     */
    public boolean cancel(String taskId) {
        SubAgentTask task = requireTask(taskId);
        if (task.getStatus() == SubAgentStatus.PENDING
                && task.transition(SubAgentStatus.CANCELLED, "Cancelled before start", clock.instant())) {
            log.info("[SubAgent] Cancelled pending {}", taskId);
            finish(task);
            return true;
        }
        if (task.getStatus() == SubAgentStatus.RUNNING) {
            task.requestCancellation();
            log.info("[SubAgent] Cancellation requested for running {}", taskId);
            return true;
        }
        return false;
    }

    public Optional<SubAgentTask> getTask(String taskId) {
        return Optional.ofNullable(taskId != null ? tasks.get(taskId) : null);
    }

    /**
     * Tasks newest first.
     */
    public List<SubAgentTask> listTasks() {
        return tasks.values().stream()
                .sorted(Comparator.comparing(SubAgentTask::getCreatedAt).reversed())
                .toList();
    }

    /**
     * Wait up to {@code timeout} for the task to end.
     *
     * @return the task, terminal unless the wait timed out
     */
    public SubAgentTask awaitTermination(String taskId, Duration timeout) throws InterruptedException {
        SubAgentTask task = requireTask(taskId);
        CompletableFuture<SubAgentTask> done = completions.get(taskId);
        if (done == null) {
            return task;
        }
        try {
            return done.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | ExecutionException e) {
            return task;
        }
    }

    /**
     * Read a task and, when it has ended, mark its result as delivered so it
     * can be pruned after the retention window.
     */
    public SubAgentTask consumeResult(String taskId) {
        SubAgentTask task = requireTask(taskId);
        task.markResultConsumed();
        return task;
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
        log.info("[SubAgent] Worker pool stopped");
    }

    private void run(SubAgentTask task) {
        // slot released before completion is signalled
        try {
            if (!task.transition(SubAgentStatus.RUNNING, null, clock.instant())) {
                return;
            }
            log.info("[SubAgent] Running {} '{}'", task.getId(), task.displayName());
            SubAgentStatus outcome;
            String result;
            try {
                result = executor.execute(task);
                outcome = task.isCancellationRequested() ? SubAgentStatus.CANCELLED : SubAgentStatus.COMPLETED;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcome = SubAgentStatus.CANCELLED;
                result = "Interrupted";
            } catch (Exception e) {
                outcome = task.isCancellationRequested() ? SubAgentStatus.CANCELLED : SubAgentStatus.FAILED;
                result = "Error: " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
                log.warn("[SubAgent] {} failed: {}", task.getId(), result);
            }
            task.transition(outcome, result, clock.instant());
        } finally {
            releaseSlot();
        }
        log.info("[SubAgent] {} finished: {}", task.getId(), task.getStatus());
        finish(task);
    }

    private void releaseSlot() {
        if (rejectSlots != null) {
            rejectSlots.release();
        }
    }

    private OperationException exhausted() {
        return OperationException.resourceExhausted("Sub-agent limit reached ("
                + properties.getSubagents().getMaxConcurrent() + " running). Try again later.");
    }

    private void finish(SubAgentTask task) {
        announce(task);
        CompletableFuture<SubAgentTask> done = completions.get(task.getId());
        if (done != null) {
            done.complete(task);
        }
    }

    private void announce(SubAgentTask task) {
        if (task.getOrigin() == null) {
            return;
        }
        String content = "[Sub-agent '" + task.displayName() + "' " + task.getStatus().name().toLowerCase(Locale.ROOT)
                + "]\n\nTask: " + task.getDescription()
                + "\n\nResult:\n" + (task.getResult() != null ? task.getResult() : "")
                + "\n\n(task id: " + task.getId() + ")";
        OutboundMessage message = OutboundMessage.to(task.getOrigin(), content, OutboundMessage.Source.SUBAGENT);
        message.setMetadata(Map.of("taskId", task.getId(), "status", task.getStatus().name()));
        outboundMessageService.send(message).whenComplete((ignored, error) -> {
            if (error != null) {
                log.warn("[SubAgent] Failed to announce {} to {}: {}", task.getId(), task.getOrigin(),
                        error.getMessage());
            }
        });
    }

    private void pruneConsumed() {
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(properties.getSubagents().getRetentionMinutes()));
        tasks.values().removeIf(task -> {
            boolean expired = task.isResultConsumed() && task.getFinishedAt() != null
                    && task.getFinishedAt().isBefore(cutoff);
            if (expired) {
                completions.remove(task.getId());
            }
            return expired;
        });
    }

    private SubAgentTask requireTask(String taskId) {
        return getTask(taskId).orElseThrow(() -> OperationException.notFound("task_id", taskId));
    }
}
