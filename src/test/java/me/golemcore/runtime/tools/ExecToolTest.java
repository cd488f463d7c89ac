package me.golemcore.runtime.tools;

import me.golemcore.runtime.adapter.outbound.storage.LocalWorkspaceAdapter;
import me.golemcore.runtime.domain.model.OperationException;
import me.golemcore.runtime.domain.model.ToolErrorKind;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({ OS.LINUX, OS.MAC })
class ExecToolTest {

    @TempDir
    Path tempDir;

    private LocalWorkspaceAdapter workspace;
    private RuntimeProperties properties;
    private ExecTool tool;

    @BeforeEach
    void setUp() {
        properties = new RuntimeProperties();
        properties.getWorkspace().setPath(tempDir.toString());
        workspace = new LocalWorkspaceAdapter(properties);
        workspace.init();
        tool = new ExecTool(workspace, properties);
    }

    @AfterEach
    void tearDown() {
        tool.shutdown();
    }

    @Test
    void returnsOutputOfSuccessfulCommand() throws Exception {
        ToolResult result = tool.execute(Map.of("command", "echo hello")).get();

        assertTrue(result.isSuccess());
        assertEquals("hello\n", result.getOutput());
        assertEquals(0, ((Map<?, ?>) result.getData()).get("exitCode"));
    }

    @Test
    void mergesStderrAndReportsNonZeroExit() throws Exception {
        ToolResult result = tool.execute(Map.of("command", "echo oops 1>&2; exit 3")).get();

        assertFalse(result.isSuccess());
        assertEquals(ToolErrorKind.EXECUTION_FAILED, result.getErrorKind());
        assertEquals("Exit code: 3\noops\n", result.getOutput());
        assertEquals("Command failed with exit code 3", result.getError());
    }

    @Test
    void runsInWorkspaceWithHomeAtWorkspace() throws Exception {
        ToolResult pwd = tool.execute(Map.of("command", "pwd -P")).get();
        ToolResult home = tool.execute(Map.of("command", "echo $HOME")).get();

        assertEquals(tempDir.toRealPath().toString(), pwd.getOutput().strip());
        assertEquals(workspace.getRoot().toString(), home.getOutput().strip());
    }

    @Test
    void honoursWorkdirInsideWorkspace() throws Exception {
        ToolResult result = tool.execute(Map.of("command", "ls", "workdir", "memory")).get();

        assertTrue(result.isSuccess());
        assertEquals("(no output)", result.getOutput());
    }

    @Test
    void rejectsMissingOrEscapingWorkdir() {
        assertThrows(OperationException.class,
                () -> tool.execute(Map.of("command", "ls", "workdir", "nope")));
        assertThrows(OperationException.class,
                () -> tool.execute(Map.of("command", "ls", "workdir", "..")));
    }

    @Test
    void killsCommandThatOutlivesTimeout() throws Exception {
        long start = System.currentTimeMillis();

        ToolResult result = tool.execute(Map.of("command", "sleep 10", "timeout", 1)).get();

        assertFalse(result.isSuccess());
        assertEquals(ToolErrorKind.EXECUTION_TIMEOUT, result.getErrorKind());
        assertTrue(System.currentTimeMillis() - start < 8000);
    }

    @Test
    void timeoutAlsoKillsChildrenOfTheShell() throws Exception {
        ToolResult result = tool.execute(Map.of("command", "sleep 53; echo done", "timeout", 1)).get();

        assertEquals(ToolErrorKind.EXECUTION_TIMEOUT, result.getErrorKind());
        long deadline = System.currentTimeMillis() + 3000;
        while (countProcesses("sleep 53") > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }
        assertEquals(0, countProcesses("sleep 53"));
    }

    @Test
    void hugeTimeoutIsClampedInsteadOfTruncated() throws Exception {
        ToolResult result = tool.execute(Map.of("command", "echo ok", "timeout", 4294967297L)).get();

        assertTrue(result.isSuccess());
        assertEquals("ok\n", result.getOutput());
    }

    private static long countProcesses(String commandLine) {
        return ProcessHandle.allProcesses()
                .filter(ProcessHandle::isAlive)
                .filter(p -> p.info().commandLine().map(c -> c.contains(commandLine)).orElse(false))
                .count();
    }

    @Test
    void timeoutStaysBelowDispatcherCeiling() {
        properties.getTools().setTimeoutSeconds(10);
        properties.getTools().getExec().setMaxTimeout(300);
        ExecTool clamped = new ExecTool(workspace, properties);
        try {
            assertTrue(clamped.getDefinition().getDescription().contains("max 9s"));
        } finally {
            clamped.shutdown();
        }
    }
}
