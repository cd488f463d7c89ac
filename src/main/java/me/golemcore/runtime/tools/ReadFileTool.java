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
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.port.outbound.WorkspacePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Reads a text file from the workspace.
 */
@Component
@Slf4j
public class ReadFileTool implements ToolComponent {

    private static final String PARAM_PATH = "path";

    private final WorkspacePort workspace;
    private final RuntimeProperties.FilesystemToolProperties config;

    public ReadFileTool(WorkspacePort workspace, RuntimeProperties properties) {
        this.workspace = workspace;
        this.config = properties.getTools().getFilesystem();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("read_file")
                .description("Read the contents of a text file in the workspace.")
                .inputSchema(ToolSchemas.object(
                        Map.of(PARAM_PATH, ToolSchemas.string("File path relative to the workspace")),
                        List.of(PARAM_PATH)))
                .build();
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        String path = (String) parameters.get(PARAM_PATH);
        Path file = workspace.resolve(path);
        if (Files.isDirectory(file)) {
            throw OperationException.validation(PARAM_PATH, "Not a file: " + path + " (use list_dir)");
        }
        if (!Files.exists(file)) {
            throw OperationException.validation(PARAM_PATH, "File not found: " + path);
        }
        try {
            long size = Files.size(file);
            if (size > config.getMaxReadBytes()) {
                throw OperationException.validation(PARAM_PATH,
                        "File too large: " + size + " bytes (max " + config.getMaxReadBytes() + ")");
            }
        } catch (IOException e) {
            throw OperationException.infrastructure("Cannot stat " + path, e);
        }

        String content = workspace.read(path);
        log.debug("[Files] Read {} ({} chars)", path, content != null ? content.length() : 0);
        return CompletableFuture.completedFuture(ToolResult.success(content != null ? content : "",
                Map.of(PARAM_PATH, path)));
    }
}
