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

import java.time.Instant;

/**
 * A unit of work running in its own sub-agent loop. Owned by the spawner;
 * other components refer to it by id and observe it through the read-only
 * getters. Status changes go through {@link #transition} and only move
 * forward.
 */
@Getter
public class SubAgentTask {

    private final String id;
    private final String description;
    private final String label;
    private final SessionKey origin;
    private final Instant createdAt;

    private volatile SubAgentStatus status = SubAgentStatus.PENDING;
    private volatile String result;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;
    private volatile boolean cancellationRequested;
    private volatile boolean resultConsumed;

    public SubAgentTask(String id, String description, String label, SessionKey origin, Instant createdAt) {
        this.id = id;
        this.description = description;
        this.label = label;
        this.origin = origin;
        this.createdAt = createdAt;
    }

    /**
     * Move to {@code next} if the lifecycle allows it.
     *
     * @return false when the task is already past that point (e.g. cancelled
     *         before it started)
     */
    public synchronized boolean transition(SubAgentStatus next, String resultText, Instant at) {
        if (!status.canTransitionTo(next)) {
            return false;
        }
        status = next;
        if (next == SubAgentStatus.RUNNING) {
            startedAt = at;
        }
        if (next.isTerminal()) {
            result = resultText;
            finishedAt = at;
        }
        return true;
    }

    public void requestCancellation() {
        cancellationRequested = true;
    }

    public void markResultConsumed() {
        if (status.isTerminal()) {
            resultConsumed = true;
        }
    }

    public String displayName() {
        if (label != null && !label.isBlank()) {
            return label;
        }
        return description.length() > 30 ? description.substring(0, 30) + "..." : description;
    }
}
