package me.golemcore.runtime.adapter.inbound.cli;

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
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * CLI command: golemcore-runtime heartbeat run
 */
@Command(name = "heartbeat", mixinStandardHelpOptions = true,
        description = "Heartbeat checklist operations",
        subcommands = HeartbeatCommand.Run.class)
@Component
public class HeartbeatCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    /**
     * Processes every unchecked checklist item once. Exits 1 when any item
     * failed.
     */
    @Command(name = "run", mixinStandardHelpOptions = true, description = "Run the checklist once")
    @Component
    public static class Run implements Callable<Integer> {

        private final HeartbeatService heartbeatService;

        @Spec
        private CommandSpec spec;

        public Run(HeartbeatService heartbeatService) {
            this.heartbeatService = heartbeatService;
        }

        @Override
        public Integer call() {
            HeartbeatReport report = heartbeatService.runOnce();
            if (report.executed() == 0) {
                ConsoleOutput.info(spec.commandLine().getOut(), "Nothing to do: no unchecked items");
                return 0;
            }
            if (report.failed() > 0) {
                ConsoleOutput.error(spec.commandLine().getErr(), "Heartbeat finished with failures: " + report);
                return 1;
            }
            ConsoleOutput.success(spec.commandLine().getOut(), "Heartbeat finished: " + report);
            return 0;
        }
    }
}
