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

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level command. Routes to {@code serve}, {@code cron} and
 * {@code heartbeat}.
 */
@Command(
        name = "golemcore-runtime",
        mixinStandardHelpOptions = true,
        version = "golemcore-runtime 0.1.0",
        description = "Orchestration runtime for an LLM agent: cron jobs, heartbeat and sub-agents",
        subcommands = {
                ServeCommand.class,
                CronCommand.class,
                HeartbeatCommand.class,
                CommandLine.HelpCommand.class
        })
@Component
public class RuntimeCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
