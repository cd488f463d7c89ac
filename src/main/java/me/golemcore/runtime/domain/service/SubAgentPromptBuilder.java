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

import me.golemcore.runtime.domain.model.SubAgentTask;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.port.outbound.WorkspacePort;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the system prompt of a sub-agent: identity and rules, clock and
 * runtime, workspace layout, bootstrap files, long-term memory and skills.
 */
@Component
@RequiredArgsConstructor
public class SubAgentPromptBuilder {

    static final List<String> BOOTSTRAP_FILES = List.of("AGENTS.md", "SOUL.md", "USER.md");
    private static final String SECTION_SEPARATOR = "\n\n---\n\n";
    private static final DateTimeFormatter NOW_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm (EEEE)",
            Locale.ENGLISH);

    private final WorkspacePort workspace;
    private final MemoryService memoryService;
    private final SkillService skillService;
    private final RuntimeProperties properties;
    private final Clock clock;

    public String build(SubAgentTask task) {
        List<String> parts = new ArrayList<>();
        parts.add(identity(task));

        String bootstrap = bootstrapFiles();
        if (!bootstrap.isEmpty()) {
            parts.add(bootstrap);
        }

        String memory = memoryService.getMemoryContext();
        if (!memory.isEmpty()) {
            parts.add("# Memory\n\n" + memory);
        }

        String alwaysSkills = skillService.buildAlwaysSkillsContext();
        if (!alwaysSkills.isEmpty()) {
            parts.add("# Active Skills\n\n" + alwaysSkills);
        }

        String summary = skillService.buildSkillsSummary();
        if (!summary.isEmpty()) {
            parts.add("# Skills\n\n"
                    + "The following skills extend your capabilities. To use a skill, read its SKILL.md file "
                    + "using the read_file tool.\n\n" + summary);
        }
        return String.join(SECTION_SEPARATOR, parts);
    }

    private String identity(SubAgentTask task) {
        RuntimeProperties.WorkspaceProperties ws = properties.getWorkspace();
        ZonedDateTime now = clock.instant().atZone(clock.getZone());
        String root = workspace.getRoot().toString();
        return "# Sub-agent\n\n"
                + "You are a sub-agent spawned by the main agent to complete one specific task.\n\n"
                + "## Your Task\n" + task.getDescription() + "\n\n"
                + "## Rules\n"
                + "1. Stay focused on the assigned task, nothing else.\n"
                + "2. Your final response is reported back to the main agent.\n"
                + "3. You cannot message users, schedule jobs or spawn other sub-agents.\n"
                + "4. Be concise but informative in your findings.\n\n"
                + "## Current Time\n" + NOW_FORMAT.format(now) + " (" + clock.getZone().getId() + ")\n\n"
                + "## Runtime\n" + System.getProperty("os.name") + " " + System.getProperty("os.arch")
                + ", Java " + System.getProperty("java.version") + "\n\n"
                + "## Workspace\n"
                + "Your workspace is at: " + root + "\n"
                + "- Long-term memory: " + root + "/" + ws.getMemoryFile() + "\n"
                + "- History log: " + root + "/" + ws.getHistoryFile() + " (grep-searchable)\n"
                + "- Custom skills: " + root + "/" + ws.getSkillsDirectory() + "/{skill-name}/SKILL.md";
    }

    private String bootstrapFiles() {
        List<String> sections = new ArrayList<>();
        for (String fileName : BOOTSTRAP_FILES) {
            String content = workspace.read(fileName);
            if (content != null && !content.isBlank()) {
                sections.add("## " + fileName + "\n\n" + content.strip());
            }
        }
        return String.join("\n\n", sections);
    }
}
