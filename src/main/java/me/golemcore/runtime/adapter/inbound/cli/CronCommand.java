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

import me.golemcore.runtime.domain.model.CronJob;
import me.golemcore.runtime.domain.model.CronJobState;
import me.golemcore.runtime.domain.model.DeliveryTarget;
import me.golemcore.runtime.domain.service.CronService;
import me.golemcore.runtime.domain.service.CronTriggers;
import org.springframework.stereotype.Component;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: golemcore-runtime cron (add | list | remove | enable | run)
 * <p>
 * Works directly on the job store in the workspace, so jobs added here are
 * picked up by a running {@code serve} process on its next tick.
 */
@Command(name = "cron", mixinStandardHelpOptions = true,
        description = "Manage scheduled jobs",
        subcommands = {
                CronCommand.AddJob.class,
                CronCommand.ListJobs.class,
                CronCommand.RemoveJob.class,
                CronCommand.EnableJob.class,
                CronCommand.RunJob.class
        })
@Component
public class CronCommand implements Runnable {

    private static final String DEFAULT_CHANNEL = "cli";

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    @Command(name = "add", mixinStandardHelpOptions = true, description = "Add a scheduled job")
    @Component
    public static class AddJob implements Callable<Integer> {

        @Option(names = { "--name", "-n" }, required = true, description = "Unique job name")
        private String name;

        @Option(names = { "--message", "-m" }, required = true, description = "Message to deliver")
        private String message;

        @ArgGroup(exclusive = true, multiplicity = "1")
        private Schedule schedule;

        @Option(names = "--tz", description = "IANA timezone for --cron or a local --at")
        private String tz;

        @Option(names = "--to", required = true, description = "Recipient id")
        private String to;

        @Option(names = "--channel", defaultValue = DEFAULT_CHANNEL, description = "Delivery channel (default: ${DEFAULT-VALUE})")
        private String channel;

        @Spec
        private CommandSpec spec;

        private final CronService cronService;

        public AddJob(CronService cronService) {
            this.cronService = cronService;
        }

        static class Schedule {
            @Option(names = "--at", required = true, description = "ISO-8601 date-time of a one-time job")
            String at;

            @Option(names = "--cron", required = true, description = "5-field cron expression")
            String cronExpr;

            @Option(names = "--every", required = true, description = "Interval in seconds")
            Long everySeconds;
        }

        @Override
        public Integer call() {
            CronJob job = cronService.addJob(name, message,
                    CronTriggers.fromOptions(schedule.at, schedule.cronExpr, schedule.everySeconds, tz),
                    new DeliveryTarget(channel, to));
            ConsoleOutput.success(spec.commandLine().getOut(), "Added job '" + job.getName() + "' (id: "
                    + job.getId() + "), next run " + job.getState().getNextRunAt());
            return 0;
        }
    }

    @Command(name = "list", mixinStandardHelpOptions = true, description = "List scheduled jobs")
    @Component
    public static class ListJobs implements Callable<Integer> {

        @Option(names = { "--all", "-a" }, description = "Include disabled jobs")
        private boolean all;

        @Spec
        private CommandSpec spec;

        private final CronService cronService;

        public ListJobs(CronService cronService) {
            this.cronService = cronService;
        }

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            List<CronJob> jobs = cronService.listJobs(all);
            if (jobs.isEmpty()) {
                ConsoleOutput.info(out, "No scheduled jobs.");
                return 0;
            }
            out.printf("  %-10s %-24s %-28s %-8s %-22s %s%n", "ID", "NAME", "SCHEDULE", "STATUS", "NEXT RUN",
                    "LAST");
            out.println("  " + "-".repeat(100));
            for (CronJob job : jobs) {
                CronJobState state = job.getState();
                out.printf("  %-10s %-24s %-28s %-8s %-22s %s%n",
                        job.getId(),
                        truncate(job.getName(), 24),
                        truncate(job.getTrigger().describe(), 28),
                        job.isEnabled() ? "enabled" : "disabled",
                        state.getNextRunAt() != null ? state.getNextRunAt() : "-",
                        state.getLastStatus() != null ? state.getLastStatus() : "-");
            }
            out.flush();
            return 0;
        }
    }

    @Command(name = "remove", mixinStandardHelpOptions = true, description = "Remove a job")
    @Component
    public static class RemoveJob implements Callable<Integer> {

        @Parameters(index = "0", description = "Job id")
        private String jobId;

        @Spec
        private CommandSpec spec;

        private final CronService cronService;

        public RemoveJob(CronService cronService) {
            this.cronService = cronService;
        }

        @Override
        public Integer call() {
            CronJob removed = cronService.removeJob(jobId);
            ConsoleOutput.success(spec.commandLine().getOut(), "Removed job '" + removed.getName() + "' (" + jobId + ")");
            return 0;
        }
    }

    @Command(name = "enable", mixinStandardHelpOptions = true, description = "Enable or disable a job")
    @Component
    public static class EnableJob implements Callable<Integer> {

        @Parameters(index = "0", description = "Job id")
        private String jobId;

        @Option(names = "--disable", description = "Disable instead of enable")
        private boolean disable;

        @Spec
        private CommandSpec spec;

        private final CronService cronService;

        public EnableJob(CronService cronService) {
            this.cronService = cronService;
        }

        @Override
        public Integer call() {
            CronJob job = cronService.enableJob(jobId, !disable);
            ConsoleOutput.success(spec.commandLine().getOut(),
                    "Job '" + job.getName() + "' " + (disable ? "disabled" : "enabled"));
            return 0;
        }
    }

    @Command(name = "run", mixinStandardHelpOptions = true, description = "Fire a job now")
    @Component
    public static class RunJob implements Callable<Integer> {

        @Parameters(index = "0", description = "Job id")
        private String jobId;

        @Spec
        private CommandSpec spec;

        private final CronService cronService;

        public RunJob(CronService cronService) {
            this.cronService = cronService;
        }

        @Override
        public Integer call() {
            CronJob job = cronService.runJob(jobId);
            String status = job.getState().getLastStatus();
            if (CronJobState.STATUS_ERROR.equals(status)) {
                ConsoleOutput.error(spec.commandLine().getErr(),
                        "Job '" + job.getName() + "' fired, delivery failed: " + job.getState().getLastError());
                return 1;
            }
            ConsoleOutput.success(spec.commandLine().getOut(), "Job '" + job.getName() + "' fired");
            return 0;
        }
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) {
            return "-";
        }
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
