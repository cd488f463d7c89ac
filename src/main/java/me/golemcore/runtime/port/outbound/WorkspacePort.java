package me.golemcore.runtime.port.outbound;

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

import java.nio.file.Path;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Port for all access to workspace files (memory, history, checklist, job
 * store, and files touched by the file tools). No component opens workspace
 * files directly.
 *
 * <p>
 * Paths are relative to the workspace root. Concurrent writers, including
 * other processes sharing the workspace, are serialized per file:
 * <ul>
 * <li>{@link #append} writes its text in one piece, never interleaved with
 * another writer's bytes</li>
 * <li>{@link #readModifyWrite} holds the file exclusively for the whole
 * read-transform-write cycle, so no update is lost</li>
 * <li>whole-file writes replace the file via temp file and atomic rename, so
 * readers never observe a torn file</li>
 * </ul>
 *
 * <p>
 * IO failures are reported as
 * {@link me.golemcore.runtime.domain.model.OperationException} with kind
 * {@code INFRASTRUCTURE_FAILURE}.
 */
public interface WorkspacePort {

    /**
     * Absolute workspace root.
     */
    Path getRoot();

    /**
     * Resolve a relative path inside the workspace.
     *
     * @throws me.golemcore.runtime.domain.model.OperationException
     *             with kind VALIDATION_ERROR on traversal outside the root
     */
    Path resolve(String path);

    /**
     * Read text content, or {@code null} if the file does not exist.
     */
    String read(String path);

    /**
     * Atomically append text, creating the file if needed.
     */
    void append(String path, String text);

    /**
     * Atomically replace the file content.
     */
    void write(String path, String content);

    /**
     * Run {@code transform} on the current content ({@code null} if absent) and
     * write its result, holding the file exclusively throughout. Returning the
     * same instance skips the write.
     *
     * @return the content after the cycle
     */
    String readModifyWrite(String path, UnaryOperator<String> transform);

    boolean exists(String path);

    boolean isDirectory(String path);

    /**
     * Direct children of a directory as relative names; directories end with
     * {@code /}. Empty when the directory does not exist.
     */
    List<String> list(String directory);
}
