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

import me.golemcore.runtime.domain.model.CronTrigger;
import me.golemcore.runtime.domain.model.OperationException;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Builds a {@link CronTrigger} from the loose schedule options accepted by the
 * {@code cron} tool and the command line.
 */
public final class CronTriggers {

    private CronTriggers() {
    }

    /**
     * Exactly one of {@code at}, {@code cronExpr} or {@code everySeconds} must be
     * set. {@code tz} applies to a cron expression or a local {@code at}.
     */
    public static CronTrigger fromOptions(String at, String cronExpr, Long everySeconds, String tz) {
        int given = (at != null ? 1 : 0) + (cronExpr != null ? 1 : 0) + (everySeconds != null ? 1 : 0);
        if (given != 1) {
            throw OperationException.validation("schedule",
                    "Exactly one of at, cron_expr or every_seconds is required");
        }
        if (at != null) {
            return CronTrigger.oneTime(parseInstant(at, tz));
        }
        if (cronExpr != null) {
            return CronTrigger.recurring(cronExpr, tz);
        }
        if (tz != null) {
            throw OperationException.validation("tz", "tz can only be used with cron_expr or at");
        }
        return CronTrigger.interval(everySeconds);
    }

    /**
     * Accepts an instant ({@code ...Z}), an offset date-time or a local
     * date-time interpreted in {@code tz} (UTC when absent).
     */
    public static Instant parseInstant(String value, String tz) {
        TemporalAccessor parsed;
        try {
            parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(value, OffsetDateTime::from, LocalDateTime::from);
        } catch (DateTimeParseException e) {
            throw OperationException.validation("at", "Invalid ISO-8601 date-time: " + value);
        }
        if (parsed instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant();
        }
        try {
            ZoneId zone = tz != null ? ZoneId.of(tz) : ZoneOffset.UTC;
            return ((LocalDateTime) parsed).atZone(zone).toInstant();
        } catch (DateTimeException e) {
            throw OperationException.validation("tz", "Unknown timezone: " + tz);
        }
    }
}
