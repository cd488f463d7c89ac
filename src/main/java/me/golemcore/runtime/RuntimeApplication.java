package me.golemcore.runtime;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.util.Map;

/**
 * GolemCore Runtime - orchestration core for an LLM agent.
 *
 * <h2>Parts</h2>
 * <ul>
 * <li><b>Tool dispatcher</b> - validates and routes model tool calls, never
 * throws</li>
 * <li><b>Sub-agent spawner</b> - bounded background tasks with their own
 * reasoning loop</li>
 * <li><b>Cron scheduler</b> - durable one-time, cron and interval jobs</li>
 * <li><b>Heartbeat runner</b> - periodic checklist processing</li>
 * <li><b>Workspace</b> - the file tree holding all persistent state</li>
 * </ul>
 *
 * <h2>Modes</h2>
 * <p>
 * {@code serve} runs the cron and heartbeat loops until interrupted. Every
 * other command ({@code cron ...}, {@code heartbeat run}) operates on the
 * workspace once and exits, with the background loops switched off.
 *
 * <h2>Configuration</h2>
 * <p>
 * {@code application.properties} under the {@code runtime.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class RuntimeApplication {

    static final String SERVE_COMMAND = "serve";

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(RuntimeApplication.class);
        if (!isServe(args)) {
            application.setDefaultProperties(Map.of("runtime.background-enabled", "false"));
        }
        System.exit(SpringApplication.exit(application.run(args)));
    }

    static boolean isServe(String[] args) {
        for (String arg : args) {
            if (!arg.startsWith("-")) {
                return SERVE_COMMAND.equals(arg);
            }
        }
        return false;
    }
}
