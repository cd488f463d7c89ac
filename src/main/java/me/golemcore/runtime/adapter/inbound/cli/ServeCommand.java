package me.golemcore.runtime.adapter.inbound.cli;

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

import me.golemcore.runtime.auto.CronScheduler;
import me.golemcore.runtime.auto.HeartbeatRunner;
import me.golemcore.runtime.domain.service.OutboundMessageService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

/**
 * CLI command: golemcore-runtime serve
 * <p>
 * Keeps the process alive while the cron scheduler and heartbeat runner work
 * on their daemon threads. Background loops are only switched on when
 * {@link me.golemcore.runtime.RuntimeApplication#main} sees {@code serve} as
 * the command. Returns when the application context closes (Ctrl+C).
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Run the cron scheduler and heartbeat until interrupted")
@Component
@Slf4j
public class ServeCommand implements Callable<Integer> {

    private final CronScheduler cronScheduler;
    private final HeartbeatRunner heartbeatRunner;
    private final OutboundMessageService outboundMessageService;
    private final CountDownLatch stopped = new CountDownLatch(1);

    @Spec
    private CommandSpec spec;

    public ServeCommand(CronScheduler cronScheduler, HeartbeatRunner heartbeatRunner,
            OutboundMessageService outboundMessageService) {
        this.cronScheduler = cronScheduler;
        this.heartbeatRunner = heartbeatRunner;
        this.outboundMessageService = outboundMessageService;
    }

    @Override
    public Integer call() throws InterruptedException {
        ConsoleOutput.info(spec.commandLine().getOut(), "Runtime serving. Cron: "
                + (cronScheduler.isRunning() ? "on" : "off") + ", heartbeat: "
                + (heartbeatRunner.isRunning() ? "on" : "off") + ", channels: "
                + outboundMessageService.getChannelTypes());
        ConsoleOutput.info(spec.commandLine().getOut(), "Press Ctrl+C to stop.");
        stopped.await();
        log.info("[Serve] Stopped");
        return 0;
    }

    @PreDestroy
    public void stop() {
        stopped.countDown();
    }
}
