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

import me.golemcore.runtime.domain.model.Skill;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.port.outbound.WorkspacePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Discovers workspace skills ({@code skills/<name>/SKILL.md}) and renders the
 * summaries placed in sub-agent prompts. Skill bodies are loaded by the model
 * itself through {@code read_file}; only {@code always} skills are inlined.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SkillService {

    private static final String SKILL_FILE = "SKILL.md";
    private static final String FRONT_MATTER_DELIMITER = "---";

    private final WorkspacePort workspace;
    private final RuntimeProperties properties;

    public List<Skill> listSkills() {
        String skillsDir = properties.getWorkspace().getSkillsDirectory();
        List<Skill> skills = new ArrayList<>();
        for (String entry : workspace.list(skillsDir)) {
            if (!entry.endsWith("/")) {
                continue;
            }
            String name = entry.substring(0, entry.length() - 1);
            String location = skillsDir + "/" + name + "/" + SKILL_FILE;
            String content = workspace.read(location);
            if (content != null) {
                skills.add(parse(name, location, content));
            }
        }
        log.debug("[Skills] Found {} skills", skills.size());
        return skills;
    }

    /**
     * Full bodies of skills marked {@code always: true}, front matter removed.
     */
    public String buildAlwaysSkillsContext() {
        StringBuilder sb = new StringBuilder();
        for (Skill skill : listSkills()) {
            if (!skill.isAlways()) {
                continue;
            }
            String body = stripFrontMatter(workspace.read(skill.getLocation()));
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            sb.append("### Skill: ").append(skill.getName()).append("\n\n").append(body.strip());
        }
        return sb.toString();
    }

    /**
     * One line per skill with its location; empty when there are none.
     */
    public String buildSkillsSummary() {
        List<Skill> skills = listSkills();
        if (skills.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (Skill skill : skills) {
            sb.append("- **").append(skill.getName()).append("**");
            if (skill.getDescription() != null && !skill.getDescription().isBlank()) {
                sb.append(": ").append(skill.getDescription());
            }
            sb.append(" (").append(skill.getLocation()).append(")\n");
        }
        return sb.toString().stripTrailing();
    }

    Skill parse(String directoryName, String location, String content) {
        Skill skill = Skill.builder().name(directoryName).location(location).build();
        String[] lines = content.split("\\R");
        if (lines.length == 0 || !FRONT_MATTER_DELIMITER.equals(lines[0].trim())) {
            return skill;
        }
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i].trim();
            if (FRONT_MATTER_DELIMITER.equals(line)) {
                break;
            }
            int colon = line.indexOf(':');
            if (colon <= 0) {
                continue;
            }
            String key = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = unquote(line.substring(colon + 1).trim());
            switch (key) {
            case "name" -> {
                if (!value.isBlank()) {
                    skill.setName(value);
                }
            }
            case "description" -> skill.setDescription(value);
            case "always" -> skill.setAlways(Boolean.parseBoolean(value));
            default -> {
                // other metadata is not interpreted
            }
            }
        }
        return skill;
    }

    private static String stripFrontMatter(String content) {
        if (content == null) {
            return "";
        }
        if (!content.startsWith(FRONT_MATTER_DELIMITER)) {
            return content;
        }
        int end = content.indexOf("\n" + FRONT_MATTER_DELIMITER, FRONT_MATTER_DELIMITER.length());
        if (end < 0) {
            return content;
        }
        int bodyStart = content.indexOf('\n', end + 1);
        return bodyStart < 0 ? "" : content.substring(bodyStart + 1);
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && (value.startsWith("\"") && value.endsWith("\"")
                || value.startsWith("'") && value.endsWith("'"))) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
