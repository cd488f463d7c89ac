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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * When a cron job fires: once at a timestamp, on a 5-field cron expression,
 * or every N seconds.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CronTrigger {

    private Kind kind;
    private Instant at;
    private String cronExpression;
    private Long everySeconds;
    private String timezone;

    public enum Kind {
        ONE_TIME, RECURRING, INTERVAL
    }

    public static CronTrigger oneTime(Instant at) {
        return CronTrigger.builder().kind(Kind.ONE_TIME).at(at).build();
    }

    public static CronTrigger recurring(String cronExpression, String timezone) {
        return CronTrigger.builder().kind(Kind.RECURRING).cronExpression(cronExpression).timezone(timezone).build();
    }

    public static CronTrigger interval(long everySeconds) {
        return CronTrigger.builder().kind(Kind.INTERVAL).everySeconds(everySeconds).build();
    }

    public String describe() {
        if (kind == null) {
            return "unknown";
        }
        return switch (kind) {
        case ONE_TIME -> "at " + at;
        case RECURRING -> "cron '" + cronExpression + "'" + (timezone != null ? " (" + timezone + ")" : "");
        case INTERVAL -> "every " + everySeconds + "s";
        };
    }
}
