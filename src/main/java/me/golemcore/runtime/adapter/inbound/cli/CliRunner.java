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

import me.golemcore.runtime.domain.model.OperationException;
import me.golemcore.runtime.domain.model.ToolErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with the Spring Boot lifecycle. Parses the arguments,
 * delegates to the matching command and exposes its exit code:
 * <ul>
 * <li>0 - success</li>
 * <li>1 - operation failure (unknown job, conflict, delivery or I/O error)</li>
 * <li>2 - invalid input, including picocli usage errors</li>
 * </ul>
 */
@Component
@Slf4j
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_FAILURE = 1;
    static final int EXIT_VALIDATION = 2;

    private final RuntimeCommand runtimeCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(RuntimeCommand runtimeCommand, IFactory factory) {
        this.runtimeCommand = runtimeCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = createCommandLine(runtimeCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static CommandLine createCommandLine(RuntimeCommand command, IFactory factory) {
        CommandLine commandLine = new CommandLine(command, factory);
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof OperationException operationException) {
                ConsoleOutput.error(cmd.getErr(), operationException.describe());
                return operationException.getKind() == ToolErrorKind.VALIDATION_ERROR
                        ? EXIT_VALIDATION
                        : EXIT_FAILURE;
            }
            log.error("[Cli] Command '{}' failed", cmd.getCommandName(), ex);
            ConsoleOutput.error(cmd.getErr(), "Unexpected error: " + ex.getMessage());
            return EXIT_FAILURE;
        });
        return commandLine;
    }
}
