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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A persisted, time-triggered delivery. Stored in {@code cron/jobs.json} and
 * evaluated by the scheduler tick loop.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CronJob {

    private String id;
    private String name;
    private String message;
    private CronTrigger trigger;
    private DeliveryTarget delivery;

    @Builder.Default
    private boolean enabled = true;

    private Instant createdAt;
    private Instant updatedAt;

    @Builder.Default
    private CronJobState state = new CronJobState();

    /**
     * Whether the job is enabled and its next run is at or before {@code now}.
     */
    @JsonIgnore
    public boolean isDue(Instant now) {
        return enabled && state != null && state.getNextRunAt() != null && !state.getNextRunAt().isAfter(now);
    }

    @JsonIgnore
    public boolean isOneTime() {
        return trigger != null && trigger.getKind() == CronTrigger.Kind.ONE_TIME;
    }
}
