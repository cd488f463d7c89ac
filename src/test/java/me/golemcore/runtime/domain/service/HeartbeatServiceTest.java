package me.golemcore.runtime.domain.service;

import me.golemcore.runtime.adapter.outbound.storage.LocalWorkspaceAdapter;
import me.golemcore.runtime.domain.component.ToolComponent;
import me.golemcore.runtime.domain.model.HeartbeatReport;
import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.infrastructure.config.RuntimeConfiguration;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.testsupport.MutableClock;
import me.golemcore.runtime.tools.SpawnTool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class HeartbeatServiceTest {

    private static final String CHECKLIST = "HEARTBEAT.md";

    @TempDir
    Path tempDir;

    private LocalWorkspaceAdapter workspace;
    private RecordingTool ping;
    private SubAgentService subAgentService;
    private final List<String> subAgentTasks = new CopyOnWriteArrayList<>();
    private HeartbeatService heartbeatService;

    @BeforeEach
    void setUp() {
        RuntimeProperties properties = new RuntimeProperties();
        properties.getWorkspace().setPath(tempDir.toString());
        properties.getHeartbeat().setItemTimeoutSeconds(5);
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));

        workspace = new LocalWorkspaceAdapter(properties);
        workspace.init();
        OutboundMessageService outbound = new OutboundMessageService(List.of(), clock);
        subAgentService = new SubAgentService(task -> {
            subAgentTasks.add(task.getDescription());
            if (task.getDescription().contains("impossible")) {
                throw new IllegalStateException("cannot do that");
            }
            return "done: " + task.getDescription();
        }, outbound, properties, clock);

        ping = new RecordingTool();
        ToolDispatchService dispatcher = new ToolDispatchService(List.of(ping, new SpawnTool(subAgentService)),
                new ToolArgumentValidator(), new ToolSafetyPolicy(), properties);
        MemoryService memoryService = new MemoryService(workspace, properties, clock);
        heartbeatService = new HeartbeatService(workspace, dispatcher, subAgentService, memoryService,
                RuntimeConfiguration.objectMapper(), properties);
    }

    @AfterEach
    void tearDown() {
        subAgentService.shutdown();
    }

    @Test
    void runOnce_executesUncheckedItemsAndChecksThemOff() {
        workspace.write(CHECKLIST, """
                # Daily
                - [ ] `ping {"target": "a"}`
                - [x] `ping {"target": "old"}`
                - [ ] `ping`
                """);

        HeartbeatReport report = heartbeatService.runOnce();

        assertEquals(new HeartbeatReport(2, 2, 0, 1), report);
        assertEquals(List.of("a", "none"), ping.targets);
        String content = workspace.read(CHECKLIST);
        assertTrue(content.contains("- [x] `ping {\"target\": \"a\"}`"));
        assertTrue(content.contains("- [x] `ping`"));
        assertTrue(content.startsWith("# Daily\n"));
    }

    @Test
    void runOnce_isIdempotentWithoutEdits() {
        workspace.write(CHECKLIST, "- [ ] `ping {\"target\": \"a\"}`\n");

        heartbeatService.runOnce();
        String afterFirst = workspace.read(CHECKLIST);
        HeartbeatReport second = heartbeatService.runOnce();

        assertEquals(0, second.executed());
        assertEquals(1, ping.targets.size());
        assertEquals(afterFirst, workspace.read(CHECKLIST));
    }

    @Test
    void runOnce_failureDoesNotBlockLaterItems() {
        workspace.write(CHECKLIST, """
                - [ ] `unknown_tool`
                - [ ] `ping {"target": "b"}`
                """);

        HeartbeatReport report = heartbeatService.runOnce();

        assertEquals(1, report.failed());
        assertEquals(1, report.completed());
        String content = workspace.read(CHECKLIST);
        assertTrue(content.contains("- [ ] `unknown_tool`"));
        assertTrue(content.contains("- [x] `ping {\"target\": \"b\"}`"));
    }

    @Test
    void runOnce_invalidJsonArgumentsFailTheItem() {
        workspace.write(CHECKLIST, "- [ ] `ping {not json}`\n");

        HeartbeatReport report = heartbeatService.runOnce();

        assertEquals(1, report.failed());
        assertTrue(ping.targets.isEmpty());
    }

    @Test
    void runOnce_freeTextItemRunsAsSubAgent() {
        workspace.write(CHECKLIST, """
                - [ ] Summarize yesterday's notes
                - [ ] Do the impossible
                """);

        HeartbeatReport report = heartbeatService.runOnce();

        assertEquals(1, report.completed());
        assertEquals(1, report.failed());
        assertEquals(List.of("Summarize yesterday's notes", "Do the impossible"), subAgentTasks);
        assertTrue(workspace.read(CHECKLIST).contains("- [x] Summarize yesterday's notes"));
    }

    @Test
    void runOnce_recordsCompletedItemsInHistory() {
        workspace.write(CHECKLIST, "- [ ] `ping`\n");

        heartbeatService.runOnce();

        assertTrue(workspace.read("memory/HISTORY.md").contains("[2026-03-01 10:00] Heartbeat completed: `ping`"));
    }

    @Test
    void runOnce_missingChecklistIsNoop() {
        assertEquals(HeartbeatReport.empty(), heartbeatService.runOnce());
    }

    @Test
    void runOnce_keepsEditsMadeWhileRunning() {
        workspace.write(CHECKLIST, "- [ ] `ping {\"target\": \"edit\"}`\n");
        ping.onExecute = () -> workspace.readModifyWrite(CHECKLIST, c -> "# added by user\n" + c);

        heartbeatService.runOnce();

        String content = workspace.read(CHECKLIST);
        assertTrue(content.startsWith("# added by user\n"));
        assertTrue(content.contains("- [x] `ping {\"target\": \"edit\"}`"));
    }

    private static class RecordingTool implements ToolComponent {

        private final List<String> targets = new CopyOnWriteArrayList<>();
        private Runnable onExecute = () -> {
        };

        @Override
        public ToolDefinition getDefinition() {
            return ToolDefinition.builder()
                    .name("ping")
                    .description("ping")
                    .inputSchema(Map.of("type", "object",
                            "properties", Map.of("target", Map.of("type", "string")),
                            "required", List.of()))
                    .build();
        }

        @Override
        public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
            onExecute.run();
            targets.add(String.valueOf(parameters.getOrDefault("target", "none")));
            return CompletableFuture.completedFuture(ToolResult.success("pong"));
        }
    }
}
