package me.golemcore.runtime.domain.service;

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

import me.golemcore.runtime.domain.model.SubAgentTask;

/**
 * Runs the body of one sub-agent task on a spawner worker thread.
 *
 * <p>
 * Implementations must poll {@link SubAgentTask#isCancellationRequested()}
 * between steps and return early when it is set; the spawner then records
 * the task as cancelled whatever is returned.
 */
public interface SubAgentExecutor {

    /**
     * @return the final answer reported back to the origin session
     * @throws Exception
     *             any failure, recorded as the task's result with status FAILED
     */
    String execute(SubAgentTask task) throws Exception;
}
