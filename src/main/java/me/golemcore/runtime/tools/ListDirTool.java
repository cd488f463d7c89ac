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
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Lists the direct children of a workspace directory.
 */
@Component
public class ListDirTool implements ToolComponent {

    private static final String PARAM_PATH = "path";

    private final WorkspacePort workspace;
    private final RuntimeProperties.FilesystemToolProperties config;

    public ListDirTool(WorkspacePort workspace, RuntimeProperties properties) {
        this.workspace = workspace;
        this.config = properties.getTools().getFilesystem();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("list_dir")
                .description("List the contents of a workspace directory.")
                .inputSchema(ToolSchemas.object(
                        Map.of(PARAM_PATH, ToolSchemas.string("Directory relative to the workspace (default: .)")),
                        List.of()))
                .build();
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        String path = ToolSchemas.optionalString(parameters, PARAM_PATH);
        String dir = path != null ? path : ".";
        if (!workspace.isDirectory(dir)) {
            throw OperationException.validation(PARAM_PATH, "Not a directory: " + dir);
        }

        List<String> entries = workspace.list(dir);
        if (entries.isEmpty()) {
            return CompletableFuture.completedFuture(ToolResult.success("Directory " + dir + " is empty",
                    Map.of("entries", entries)));
        }
        StringBuilder sb = new StringBuilder();
        int shown = Math.min(entries.size(), config.getMaxListEntries());
        for (String entry : entries.subList(0, shown)) {
            if (entry.endsWith("/")) {
                sb.append("[dir]  ").append(entry, 0, entry.length() - 1);
            } else {
                sb.append("[file] ").append(entry);
            }
            sb.append('\n');
        }
        if (entries.size() > shown) {
            sb.append("... and ").append(entries.size() - shown).append(" more\n");
        }
        return CompletableFuture.completedFuture(ToolResult.success(sb.toString().stripTrailing(),
                Map.of("entries", entries)));
    }
}
