package me.golemcore.runtime.tools;

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

import me.golemcore.runtime.domain.component.ToolComponent;
import me.golemcore.runtime.domain.model.OperationException;
import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.domain.model.ToolErrorKind;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.port.outbound.WorkspacePort;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Runs a shell command in the workspace (or a subdirectory of it) and returns
 * combined stdout/stderr and the exit code.
 *
 * <p>
 * The child gets a filtered environment ({@code runtime.tools.exec.allowed-env-vars}
 * on top of a fixed safe set) with HOME pointing at the workspace. A command
 * that outlives its timeout is killed and reported as EXECUTION_TIMEOUT. The
 * timeout never exceeds the dispatcher's ceiling, so the process is always
 * reaped by this tool. Destructive commands are refused earlier by the
 * dispatcher's safety check.
 */
@Component
@Slf4j
public class ExecTool implements ToolComponent {

    private static final String PARAM_COMMAND = "command";
    private static final String PARAM_TIMEOUT = "timeout";
    private static final String PARAM_WORKDIR = "workdir";
    private static final int MAX_OUTPUT_LENGTH = 100_000;
    private static final int LOG_COMMAND_LENGTH = 200;

    private static final Set<String> DEFAULT_ALLOWED_ENV_VARS = Set.of(
            "PATH", "LANG", "LC_ALL", "LC_CTYPE", "TERM", "TMPDIR", "TZ", "SHELL", "USER", "LOGNAME");

    private final WorkspacePort workspace;
    private final RuntimeProperties.ExecToolProperties config;
    private final int maxTimeout;
    private final Set<String> allowedEnvVars;
    private final ExecutorService executor;

    public ExecTool(WorkspacePort workspace, RuntimeProperties properties) {
        this.workspace = workspace;
        this.config = properties.getTools().getExec();
        this.maxTimeout = Math.max(1, Math.min(config.getMaxTimeout(), properties.getTools().innerTimeoutSeconds()));
        this.allowedEnvVars = buildAllowedEnvVars(config.getAllowedEnvVars());
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "exec-tool");
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("exec")
                .description("""
                        Execute a shell command in the workspace directory and return its output.
                        Commands run with a timeout (default %ds, max %ds).
                        Destructive commands (recursive delete, kill, disk formatting, shutdown) are refused.
                        """.formatted(Math.min(config.getDefaultTimeout(), maxTimeout), maxTimeout))
                .inputSchema(ToolSchemas.object(Map.of(
                        PARAM_COMMAND, ToolSchemas.string("Shell command to execute"),
                        PARAM_TIMEOUT, ToolSchemas.integer("Timeout in seconds"),
                        PARAM_WORKDIR, ToolSchemas.string("Working directory relative to the workspace (optional)")),
                        List.of(PARAM_COMMAND)))
                .build();
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        String command = (String) parameters.get(PARAM_COMMAND);
        Long requested = ToolSchemas.optionalLong(parameters, PARAM_TIMEOUT);
        long timeout = requested != null ? requested : config.getDefaultTimeout();
        timeout = Math.max(1, Math.min(timeout, maxTimeout));
        Path workDir = resolveWorkDir(ToolSchemas.optionalString(parameters, PARAM_WORKDIR));

        int effectiveTimeout = (int) timeout;
        return CompletableFuture.supplyAsync(() -> run(command, workDir, effectiveTimeout), executor);
    }

    private Path resolveWorkDir(String workdir) {
        if (workdir == null) {
            return workspace.getRoot();
        }
        Path dir = workspace.resolve(workdir);
        if (!Files.isDirectory(dir)) {
            throw OperationException.validation(PARAM_WORKDIR, "Working directory does not exist: " + workdir);
        }
        try {
            if (!dir.toRealPath().startsWith(workspace.getRoot().toRealPath())) {
                throw OperationException.validation(PARAM_WORKDIR, "Working directory must be within workspace");
            }
        } catch (IOException e) {
            throw OperationException.validation(PARAM_WORKDIR, "Invalid working directory: " + workdir);
        }
        return dir;
    }

    private ToolResult run(String command, Path workDir, int timeoutSeconds) {
        log.info("[Exec] Running '{}' in {} (timeout {}s)", abbreviate(command), workDir, timeoutSeconds);

        ProcessBuilder pb = new ProcessBuilder();
        if (System.getProperty("os.name").toLowerCase(Locale.ROOT).contains("win")) {
            pb.command("cmd.exe", "/c", command);
        } else {
            pb.command("/bin/sh", "-c", command);
        }
        pb.directory(workDir.toFile());
        pb.redirectErrorStream(true);

        Map<String, String> env = pb.environment();
        env.keySet().retainAll(allowedEnvVars);
        env.put("HOME", workspace.getRoot().toString());
        env.put("PWD", workDir.toString());

        long startTime = System.currentTimeMillis();
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return ToolResult.failure("Failed to execute command: " + e.getMessage());
        }

        try {
            Future<String> outputFuture = executor.submit(() -> readOutput(process));
            boolean completed = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            long duration = System.currentTimeMillis() - startTime;

            if (!completed) {
                destroyTree(process);
                log.warn("[Exec] Killed after {}s: {}", timeoutSeconds, abbreviate(command));
                return ToolResult.failure(ToolErrorKind.EXECUTION_TIMEOUT,
                        "Command timed out after " + timeoutSeconds + " seconds");
            }

            String output;
            try {
                output = outputFuture.get(1, TimeUnit.SECONDS);
            } catch (TimeoutException e) {
                output = "[Output read timeout]";
            }
            if (output.length() > MAX_OUTPUT_LENGTH) {
                output = output.substring(0, MAX_OUTPUT_LENGTH) + "\n[Output truncated...]";
            }

            int exitCode = process.exitValue();
            Map<String, Object> data = Map.of("exitCode", exitCode, "duration", duration,
                    PARAM_WORKDIR, workDir.toString());
            log.debug("[Exec] Exit code {} after {}ms", exitCode, duration);
            if (exitCode == 0) {
                return ToolResult.success(output.isEmpty() ? "(no output)" : output, data);
            }
            return ToolResult.builder()
                    .success(false)
                    .output("Exit code: " + exitCode + "\n" + output)
                    .data(data)
                    .error("Command failed with exit code " + exitCode)
                    .errorKind(ToolErrorKind.EXECUTION_FAILED)
                    .build();
        } catch (InterruptedException e) {
            destroyTree(process);
            Thread.currentThread().interrupt();
            return ToolResult.failure("Command execution interrupted");
        } catch (ExecutionException e) {
            return ToolResult.failure("Error reading output: " + e.getMessage());
        }
    }

    // children of the shell survive its death unless killed explicitly
    private static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static String readOutput(Process process) throws IOException {
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line = reader.readLine();
            while (line != null) {
                if (output.length() < MAX_OUTPUT_LENGTH) {
                    output.append(line).append('\n');
                }
                line = reader.readLine();
            }
        }
        return output.toString();
    }

    private static Set<String> buildAllowedEnvVars(String configValue) {
        if (configValue == null || configValue.isBlank()) {
            return DEFAULT_ALLOWED_ENV_VARS;
        }
        Set<String> merged = new HashSet<>(DEFAULT_ALLOWED_ENV_VARS);
        merged.addAll(Arrays.stream(configValue.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet()));
        return Collections.unmodifiableSet(merged);
    }

    private static String abbreviate(String command) {
        return command.length() <= LOG_COMMAND_LENGTH ? command : command.substring(0, LOG_COMMAND_LENGTH) + "...";
    }
}
