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

import me.golemcore.runtime.domain.model.HeartbeatReport;
import me.golemcore.runtime.domain.service.HeartbeatService;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the heartbeat checklist every {@code runtime.heartbeat.interval-seconds},
 * first after one full interval.
 */
@Component
@Slf4j
public class HeartbeatRunner {

    private final HeartbeatService heartbeatService;
    private final RuntimeProperties properties;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public HeartbeatRunner(HeartbeatService heartbeatService, RuntimeProperties properties) {
        this.heartbeatService = heartbeatService;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        if (!properties.isBackgroundEnabled() || !properties.getHeartbeat().isEnabled()) {
            log.info("[Heartbeat] Runner disabled");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "heartbeat-runner");
            t.setDaemon(true);
            return t;
        });

        int interval = Math.max(1, properties.getHeartbeat().getIntervalSeconds());
        tickTask = scheduler.scheduleWithFixedDelay(this::tick, interval, interval, TimeUnit.SECONDS);
        log.info("[Heartbeat] Runner started, every {}s", interval);
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        log.info("[Heartbeat] Runner shut down");
    }

    void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[Heartbeat] Tick skipped: previous run still in progress");
            return;
        }
        try {
            HeartbeatReport report = heartbeatService.runOnce();
            if (report.executed() > 0) {
                log.info("[Heartbeat] Run finished: {}", report);
            }
        } catch (Exception e) {
            log.error("[Heartbeat] Run failed: {}", e.getMessage(), e);
        } finally {
            executing.set(false);
        }
    }

    public boolean isRunning() {
        return scheduler != null && !scheduler.isShutdown();
    }
}
