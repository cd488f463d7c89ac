package me.golemcore.runtime.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties for the runtime, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code runtime.*} prefix:
 * <ul>
 * <li>{@link WorkspaceProperties} - workspace root and file names</li>
 * <li>{@link ToolsProperties} - dispatcher ceiling and per-tool settings</li>
 * <li>{@link SubAgentProperties} - spawner concurrency and loop limits</li>
 * <li>{@link CronProperties} - scheduler tick</li>
 * <li>{@link HeartbeatProperties} - checklist period</li>
 * <li>{@link LlmProperties} - OpenAI-compatible provider for sub-agents</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "runtime")
@Data
public class RuntimeProperties {

    /**
     * Master switch for the cron scheduler and heartbeat threads. The CLI turns
     * it off for every command except {@code serve}.
     */
    private boolean backgroundEnabled = true;

    private WorkspaceProperties workspace = new WorkspaceProperties();
    private ToolsProperties tools = new ToolsProperties();
    private SubAgentProperties subagents = new SubAgentProperties();
    private CronProperties cron = new CronProperties();
    private HeartbeatProperties heartbeat = new HeartbeatProperties();
    private LlmProperties llm = new LlmProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class WorkspaceProperties {
        private String path = "${user.home}/.golemcore/workspace";
        private String memoryFile = "memory/MEMORY.md";
        private String historyFile = "memory/HISTORY.md";
        private String checklistFile = "HEARTBEAT.md";
        private String skillsDirectory = "skills";
        private String cronStoreFile = "cron/jobs.json";
    }

    @Data
    public static class ToolsProperties {
        private int timeoutSeconds = 60;
        private int maxResultChars = 50_000;
        private ExecToolProperties exec = new ExecToolProperties();
        private FilesystemToolProperties filesystem = new FilesystemToolProperties();
        private WebSearchToolProperties webSearch = new WebSearchToolProperties();
        private WebFetchToolProperties webFetch = new WebFetchToolProperties();

        /**
         * Time a tool may spend on its own I/O: one second under the
         * dispatcher ceiling, so it gives up before the dispatcher does.
         */
        public int innerTimeoutSeconds() {
            return Math.max(1, timeoutSeconds - 1);
        }
    }

    @Data
    public static class ExecToolProperties {
        private boolean enabled = true;
        private int defaultTimeout = 30;
        private int maxTimeout = 300;
        private String allowedEnvVars = "";
    }

    @Data
    public static class FilesystemToolProperties {
        private boolean enabled = true;
        private long maxReadBytes = 10L * 1024 * 1024;
        private int maxListEntries = 200;
    }

    @Data
    public static class WebSearchToolProperties {
        private boolean enabled = true;
        private String apiKey;
        private String baseUrl = "https://api.search.brave.com";
        private int defaultCount = 5;
    }

    @Data
    public static class WebFetchToolProperties {
        private boolean enabled = true;
        private int maxChars = 50_000;
    }

    @Data
    public static class SubAgentProperties {
        private int maxConcurrent = 4;
        private OverflowPolicy overflowPolicy = OverflowPolicy.QUEUE;
        private int queueCapacity = 64;
        private int maxIterations = 15;
        private int llmTimeoutSeconds = 120;
        private int retentionMinutes = 60;
    }

    /**
     * What happens to a spawn request when all sub-agent slots are busy.
     */
    public enum OverflowPolicy {
        QUEUE, REJECT
    }

    @Data
    public static class CronProperties {
        private boolean enabled = true;
        private int tickSeconds = 5;
    }

    @Data
    public static class HeartbeatProperties {
        private boolean enabled = true;
        private int intervalSeconds = 1800;
        private int itemTimeoutSeconds = 600;
        private String notifyChannel;
        private String notifyRecipient;
    }

    @Data
    public static class LlmProperties {
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private double temperature = 0.7;
        private int maxTokens = 4096;
        private long timeoutMs = 120_000;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
