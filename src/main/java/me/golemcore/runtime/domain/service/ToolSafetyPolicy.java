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

import me.golemcore.runtime.domain.model.ToolCallRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Pattern-based guard that refuses obviously destructive shell commands
 * before they run. Best effort only: it is not a sandbox, and commands it
 * lets through still run with the runtime's privileges.
 */
@Component
@Slf4j
public class ToolSafetyPolicy {

    static final String EXEC_TOOL = "exec";
    private static final int COMMAND_LENGTH_THRESHOLD = 80;

    private static final List<Hazard> EXEC_HAZARDS = List.of(
            new Hazard(Pattern.compile("\\brm\\s+(-[a-zA-Z]*[rRf][a-zA-Z]*\\s+)+"), "recursive or forced delete"),
            new Hazard(Pattern.compile("\\b(del|rmdir)\\s+/[sq]\\b", Pattern.CASE_INSENSITIVE),
                    "recursive delete"),
            new Hazard(Pattern.compile("(^|[;&|\\s])(kill|pkill|killall)\\b"), "process termination"),
            new Hazard(Pattern.compile("\\b(mkfs(\\.\\w+)?|diskpart|format\\s+[a-zA-Z]:)"), "disk formatting"),
            new Hazard(Pattern.compile("\\bdd\\s+.*\\bof=/dev/"), "raw device write"),
            new Hazard(Pattern.compile(">\\s*/dev/(sd|hd|nvme|disk)"), "raw device write"),
            new Hazard(Pattern.compile("\\b(shutdown|reboot|poweroff|halt)\\b"), "system shutdown"),
            new Hazard(Pattern.compile(":\\(\\)\\s*\\{\\s*:\\|:&\\s*\\};:"), "fork bomb"));

    /**
     * @return the reason the call is refused, empty when it may run
     */
    public Optional<String> findHazard(ToolCallRequest call) {
        if (!EXEC_TOOL.equals(call.getName())) {
            return Optional.empty();
        }
        Map<String, Object> args = call.getArguments();
        Object command = args != null ? args.get("command") : null;
        if (!(command instanceof String text)) {
            return Optional.empty();
        }
        for (Hazard hazard : EXEC_HAZARDS) {
            if (hazard.pattern().matcher(text).find()) {
                log.warn("[Dispatch] Refusing exec ({}): {}", hazard.reason(), abbreviate(text));
                return Optional.of("Command blocked by safety guard (" + hazard.reason() + "): "
                        + abbreviate(text));
            }
        }
        return Optional.empty();
    }

    private static String abbreviate(String command) {
        if (command.length() > COMMAND_LENGTH_THRESHOLD) {
            return command.substring(0, COMMAND_LENGTH_THRESHOLD) + "...";
        }
        return command;
    }

    private record Hazard(Pattern pattern, String reason) {
    }
}
