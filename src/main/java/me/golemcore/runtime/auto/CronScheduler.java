package me.golemcore.runtime.auto;

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

import me.golemcore.runtime.domain.model.CronJob;
import me.golemcore.runtime.domain.service.CronService;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Timer of the cron subsystem: asks {@link CronService} to fire due jobs every
 * {@code runtime.cron.tick-seconds}. The first tick runs right after startup,
 * which is when jobs missed while the process was down catch up.
 */
@Component
@Slf4j
public class CronScheduler {

    private final CronService cronService;
    private final RuntimeProperties properties;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public CronScheduler(CronService cronService, RuntimeProperties properties) {
        this.cronService = cronService;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        if (!properties.isBackgroundEnabled() || !properties.getCron().isEnabled()) {
            log.info("[Cron] Scheduler disabled");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cron-scheduler");
            t.setDaemon(true);
            return t;
        });

        int tickSeconds = Math.max(1, properties.getCron().getTickSeconds());
        tickTask = scheduler.scheduleWithFixedDelay(this::tick, 0, tickSeconds, TimeUnit.SECONDS);
        log.info("[Cron] Scheduler started with tick interval: {}s", tickSeconds);
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Cron] Scheduler shut down");
    }

    void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[Cron] Tick skipped: previous tick still in progress");
            return;
        }
        try {
            List<CronJob> fired = cronService.fireDueJobs();
            if (!fired.isEmpty()) {
                log.info("[Cron] Tick fired {} job(s)", fired.size());
            }
        } catch (Exception e) {
            log.error("[Cron] Tick failed: {}", e.getMessage(), e);
        } finally {
            executing.set(false);
        }
    }

    public boolean isRunning() {
        return scheduler != null && !scheduler.isShutdown();
    }
}
