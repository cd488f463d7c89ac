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

import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.port.outbound.WorkspacePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.function.UnaryOperator;

/**
 * Two-layer workspace memory: {@code memory/MEMORY.md} holds long-term facts
 * and is rewritten as a whole, {@code memory/HISTORY.md} is an append-only
 * log of timestamped paragraphs written by the main session, sub-agents, cron
 * and the heartbeat runner concurrently.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryService {

    private static final DateTimeFormatter HISTORY_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final WorkspacePort workspace;
    private final RuntimeProperties properties;
    private final Clock clock;

    public String readLongTerm() {
        String content = workspace.read(properties.getWorkspace().getMemoryFile());
        return content != null ? content : "";
    }

    public void writeLongTerm(String content) {
        workspace.write(properties.getWorkspace().getMemoryFile(), content);
    }

    public String updateLongTerm(UnaryOperator<String> update) {
        return workspace.readModifyWrite(properties.getWorkspace().getMemoryFile(),
                current -> update.apply(current != null ? current : ""));
    }

    /**
     * Append one history paragraph, {@code [yyyy-MM-dd HH:mm] entry}.
     */
    public void appendHistory(String entry) {
        String timestamp = HISTORY_TIMESTAMP.format(clock.instant().atZone(zoneId()));
        workspace.append(properties.getWorkspace().getHistoryFile(),
                "[" + timestamp + "] " + entry.strip() + "\n\n");
        log.debug("[Memory] History entry appended");
    }

    public String readHistory() {
        String content = workspace.read(properties.getWorkspace().getHistoryFile());
        return content != null ? content : "";
    }

    /**
     * Long-term memory section for system prompts, empty when nothing is
     * stored.
     */
    public String getMemoryContext() {
        String longTerm = readLongTerm();
        if (longTerm.isBlank()) {
            return "";
        }
        return "## Long-term Memory\n" + longTerm.strip();
    }

    private ZoneId zoneId() {
        return clock.getZone();
    }
}
