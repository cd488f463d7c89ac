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

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a sub-agent task. Transitions only move forward.
 */
public enum SubAgentStatus {

    PENDING, RUNNING, COMPLETED, FAILED, CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(SubAgentStatus next) {
        return allowedNext().contains(next);
    }

    private Set<SubAgentStatus> allowedNext() {
        return switch (this) {
        case PENDING -> EnumSet.of(RUNNING, CANCELLED);
        case RUNNING -> EnumSet.of(COMPLETED, FAILED, CANCELLED);
        default -> EnumSet.noneOf(SubAgentStatus.class);
        };
    }
}
