package me.golemcore.runtime.tools;

import me.golemcore.runtime.adapter.outbound.storage.LocalWorkspaceAdapter;
import me.golemcore.runtime.domain.model.OperationException;
import me.golemcore.runtime.domain.model.ToolErrorKind;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FileToolsTest {

    @TempDir
    Path tempDir;

    private RuntimeProperties properties;
    private LocalWorkspaceAdapter workspace;
    private ReadFileTool readFile;
    private WriteFileTool writeFile;
    private EditFileTool editFile;
    private ListDirTool listDir;

    @BeforeEach
    void setUp() {
        properties = new RuntimeProperties();
        properties.getWorkspace().setPath(tempDir.toString());
        workspace = new LocalWorkspaceAdapter(properties);
        workspace.init();
        readFile = new ReadFileTool(workspace, properties);
        writeFile = new WriteFileTool(workspace, properties);
        editFile = new EditFileTool(workspace, properties);
        listDir = new ListDirTool(workspace, properties);
    }

    // ==================== write_file / read_file ====================

    @Test
    void writeCreatesParentsAndReadReturnsContent() throws Exception {
        ToolResult written = writeFile.execute(Map.of("path", "notes/today.md", "content", "hello")).get();
        ToolResult read = readFile.execute(Map.of("path", "notes/today.md")).get();

        assertTrue(written.isSuccess());
        assertEquals("Successfully wrote 5 bytes to notes/today.md", written.getOutput());
        assertEquals("hello", read.getOutput());
        assertEquals("hello", Files.readString(tempDir.resolve("notes/today.md")));
    }

    @Test
    void readRejectsMissingFileAndDirectory() {
        OperationException missing = assertThrows(OperationException.class,
                () -> readFile.execute(Map.of("path", "nope.txt")));
        OperationException dir = assertThrows(OperationException.class,
                () -> readFile.execute(Map.of("path", "memory")));

        assertEquals(ToolErrorKind.VALIDATION_ERROR, missing.getKind());
        assertTrue(dir.getMessage().contains("list_dir"));
    }

    @Test
    void readRejectsOversizedFile() throws Exception {
        properties.getTools().getFilesystem().setMaxReadBytes(4);
        Files.writeString(tempDir.resolve("big.txt"), "0123456789");

        OperationException error = assertThrows(OperationException.class,
                () -> readFile.execute(Map.of("path", "big.txt")));

        assertTrue(error.getMessage().contains("too large"));
    }

    @Test
    void pathsOutsideWorkspaceAreRejected() {
        assertThrows(OperationException.class, () -> readFile.execute(Map.of("path", "../etc/passwd")));
        assertThrows(OperationException.class,
                () -> writeFile.execute(Map.of("path", "../escape.txt", "content", "x")));
        assertFalse(Files.exists(tempDir.getParent().resolve("escape.txt")));
    }

    @Test
    void writeRefusesDirectoryTarget() {
        OperationException error = assertThrows(OperationException.class,
                () -> writeFile.execute(Map.of("path", "memory", "content", "x")));

        assertTrue(error.getMessage().contains("directory"));
    }

    // ==================== edit_file ====================

    @Test
    void editReplacesSingleOccurrence() throws Exception {
        workspace.write("config.txt", "mode=dev\nport=8080\n");

        ToolResult result = editFile.execute(Map.of("path", "config.txt", "old_text", "mode=dev",
                "new_text", "mode=prod")).get();

        assertTrue(result.isSuccess());
        assertEquals("mode=prod\nport=8080\n", workspace.read("config.txt"));
    }

    @Test
    void editRejectsAmbiguousOrMissingTextAndKeepsFile() {
        workspace.write("dup.txt", "a a");

        OperationException ambiguous = assertThrows(OperationException.class,
                () -> editFile.execute(Map.of("path", "dup.txt", "old_text", "a", "new_text", "b")));
        OperationException absent = assertThrows(OperationException.class,
                () -> editFile.execute(Map.of("path", "dup.txt", "old_text", "z", "new_text", "b")));
        OperationException noFile = assertThrows(OperationException.class,
                () -> editFile.execute(Map.of("path", "ghost.txt", "old_text", "a", "new_text", "b")));

        assertTrue(ambiguous.getMessage().contains("more than once"));
        assertTrue(absent.getMessage().contains("not found"));
        assertTrue(noFile.getMessage().contains("File not found"));
        assertEquals("a a", workspace.read("dup.txt"));
    }

    // ==================== list_dir ====================

    @Test
    void listShowsFilesAndDirectoriesWithoutLockDir() throws Exception {
        workspace.write("a.txt", "x");

        ToolResult result = listDir.execute(Map.of()).get();

        assertEquals("[file] a.txt\n[dir]  cron\n[dir]  memory\n[dir]  skills", result.getOutput());
    }

    @Test
    void listTruncatesLongDirectories() throws Exception {
        properties.getTools().getFilesystem().setMaxListEntries(2);
        for (int i = 0; i < 5; i++) {
            workspace.write("many/f" + i + ".txt", "x");
        }

        ToolResult result = listDir.execute(Map.of("path", "many")).get();

        assertEquals("[file] f0.txt\n[file] f1.txt\n... and 3 more", result.getOutput());
    }

    @Test
    void listReportsEmptyAndMissingDirectories() throws Exception {
        assertEquals("Directory skills is empty", listDir.execute(Map.of("path", "skills")).get().getOutput());
        assertThrows(OperationException.class, () -> listDir.execute(Map.of("path", "missing")));
    }
}
