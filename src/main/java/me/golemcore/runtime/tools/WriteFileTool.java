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

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Writes (creates or replaces) a workspace file atomically; parent
 * directories are created as needed.
 */
@Component
@Slf4j
public class WriteFileTool implements ToolComponent {

    private static final String PARAM_PATH = "path";
    private static final String PARAM_CONTENT = "content";

    private final WorkspacePort workspace;
    private final RuntimeProperties properties;

    public WriteFileTool(WorkspacePort workspace, RuntimeProperties properties) {
        this.workspace = workspace;
        this.properties = properties;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("write_file")
                .description("Write content to a file in the workspace. Creates parent directories if needed "
                        + "and replaces existing content.")
                .inputSchema(ToolSchemas.object(Map.of(
                        PARAM_PATH, ToolSchemas.string("File path relative to the workspace"),
                        PARAM_CONTENT, ToolSchemas.string("Full file content")),
                        List.of(PARAM_PATH, PARAM_CONTENT)))
                .build();
    }

    @Override
    public boolean isEnabled() {
        return properties.getTools().getFilesystem().isEnabled();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        String path = (String) parameters.get(PARAM_PATH);
        Object content = parameters.get(PARAM_CONTENT);
        if (!(content instanceof String text)) {
            throw OperationException.validation(PARAM_CONTENT, "Missing required parameter: content");
        }
        if (workspace.isDirectory(path)) {
            throw OperationException.validation(PARAM_PATH, "Path is a directory: " + path);
        }

        workspace.write(path, text);
        int bytes = text.getBytes(StandardCharsets.UTF_8).length;
        log.info("[Files] Wrote {} ({} bytes)", path, bytes);
        return CompletableFuture.completedFuture(ToolResult.success(
                "Successfully wrote " + bytes + " bytes to " + path,
                Map.of(PARAM_PATH, path, "bytes", bytes)));
    }
}
