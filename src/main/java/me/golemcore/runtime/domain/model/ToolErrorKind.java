package me.golemcore.runtime.domain.model;

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

/**
 * Classification of a failed tool call or runtime operation. Carried on
 * {@link ToolResult} so the reasoning loop can decide whether to retry, fix
 * its arguments, or give up.
 */
public enum ToolErrorKind {

    /**
     * Unknown tool, malformed arguments or an invalid schedule specification.
     * Nothing was executed.
     */
    VALIDATION_ERROR,

    /**
     * A synchronous tool exceeded its time ceiling and was stopped.
     */
    EXECUTION_TIMEOUT,

    /**
     * The referenced cron job or sub-agent task does not exist.
     */
    JOB_NOT_FOUND,

    /**
     * The operation collides with existing state (e.g. duplicate job name).
     */
    CONFLICT,

    /**
     * The sub-agent concurrency bound is reached.
     */
    RESOURCE_EXHAUSTED,

    /**
     * The call violates a tool's documented safety contract and was not run.
     */
    SAFETY_WARNING,

    /**
     * The tool ran and failed (non-zero exit, HTTP error, exception).
     */
    EXECUTION_FAILED,

    /**
     * The workspace or the job store is unreachable or corrupt.
     */
    INFRASTRUCTURE_FAILURE
}
