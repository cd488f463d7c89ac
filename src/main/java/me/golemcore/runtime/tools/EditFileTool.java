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

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Replaces one exact occurrence of a text fragment inside a workspace file.
 * The read and the write happen under one exclusive workspace cycle.
 */
@Component
@Slf4j
public class EditFileTool implements ToolComponent {

    private static final String PARAM_PATH = "path";
    private static final String PARAM_OLD_TEXT = "old_text";
    private static final String PARAM_NEW_TEXT = "new_text";

    private final WorkspacePort workspace;
    private final RuntimeProperties properties;

    public EditFileTool(WorkspacePort workspace, RuntimeProperties properties) {
        this.workspace = workspace;
        this.properties = properties;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("edit_file")
                .description("Edit a file by replacing old_text with new_text. old_text must occur exactly once "
                        + "in the file.")
                .inputSchema(ToolSchemas.object(Map.of(
                        PARAM_PATH, ToolSchemas.string("File path relative to the workspace"),
                        PARAM_OLD_TEXT, ToolSchemas.string("Exact text to find"),
                        PARAM_NEW_TEXT, ToolSchemas.string("Replacement text")),
                        List.of(PARAM_PATH, PARAM_OLD_TEXT, PARAM_NEW_TEXT)))
                .build();
    }

    @Override
    public boolean isEnabled() {
        return properties.getTools().getFilesystem().isEnabled();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        String path = (String) parameters.get(PARAM_PATH);
        String oldText = (String) parameters.get(PARAM_OLD_TEXT);
        Object newValue = parameters.get(PARAM_NEW_TEXT);
        String newText = newValue != null ? newValue.toString() : "";

        workspace.readModifyWrite(path, current -> {
            if (current == null) {
                throw OperationException.validation(PARAM_PATH, "File not found: " + path);
            }
            int first = current.indexOf(oldText);
            if (first < 0) {
                throw OperationException.validation(PARAM_OLD_TEXT, "old_text not found in " + path);
            }
            if (current.indexOf(oldText, first + 1) >= 0) {
                throw OperationException.validation(PARAM_OLD_TEXT,
                        "old_text appears more than once in " + path + ". Provide more context to make it unique.");
            }
            return current.substring(0, first) + newText + current.substring(first + oldText.length());
        });

        log.info("[Files] Edited {}", path);
        return CompletableFuture.completedFuture(ToolResult.success("Successfully edited " + path,
                Map.of(PARAM_PATH, path)));
    }
}
