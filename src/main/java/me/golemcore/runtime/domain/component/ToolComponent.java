package me.golemcore.runtime.domain.component;

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

import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A tool the dispatcher can route calls to. Implementations are Spring beans
 * collected into the dispatcher's registry at startup.
 */
public interface ToolComponent extends Component {

    @Override
    default String getComponentType() {
        return "tool";
    }

    /**
     * Returns the tool definition with the JSON Schema of its arguments.
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool. Arguments have already been validated and coerced by
     * the dispatcher. Tools that need the calling session must read
     * {@link me.golemcore.runtime.domain.service.ToolCallContextHolder} before
     * leaving the calling thread.
     *
     * @param parameters
     *            validated arguments
     * @return a future with the result; the dispatcher bounds how long it waits
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters);

    default String getToolName() {
        return getDefinition().getName();
    }
}
