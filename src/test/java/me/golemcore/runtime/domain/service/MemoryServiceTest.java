package me.golemcore.runtime.domain.service;

import me.golemcore.runtime.adapter.outbound.storage.LocalWorkspaceAdapter;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class MemoryServiceTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private LocalWorkspaceAdapter workspace;
    private MemoryService memoryService;

    @BeforeEach
    void setUp() {
        RuntimeProperties properties = new RuntimeProperties();
        properties.getWorkspace().setPath(tempDir.toString());
        workspace = new LocalWorkspaceAdapter(properties);
        workspace.init();
        clock = new MutableClock(Instant.parse("2026-03-01T10:15:00Z"), ZoneId.of("Europe/Berlin"));
        memoryService = new MemoryService(workspace, properties, clock);
    }

    @Test
    void longTermIsEmptyUntilWritten() {
        assertEquals("", memoryService.readLongTerm());
        assertEquals("", memoryService.getMemoryContext());

        memoryService.writeLongTerm("User prefers metric units.\n");

        assertEquals("User prefers metric units.\n", memoryService.readLongTerm());
        assertEquals("## Long-term Memory\nUser prefers metric units.", memoryService.getMemoryContext());
    }

    @Test
    void updateLongTermStartsFromEmptyString() {
        String result = memoryService.updateLongTerm(current -> current + "- fact one\n");

        assertEquals("- fact one\n", result);
        assertEquals("- fact one\n", workspace.read("memory/MEMORY.md"));
    }

    @Test
    void appendHistoryUsesClockZoneTimestamps() {
        memoryService.appendHistory("  First entry  ");
        clock.advance(Duration.ofHours(1));
        memoryService.appendHistory("Second entry");

        assertEquals("[2026-03-01 11:15] First entry\n\n[2026-03-01 12:15] Second entry\n\n",
                memoryService.readHistory());
    }

    @Test
    void concurrentHistoryAppendsAreAllKept() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                int n = i;
                futures.add(pool.submit(() -> memoryService.appendHistory("entry-" + n)));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        String history = memoryService.readHistory();
        for (int i = 0; i < 40; i++) {
            assertTrue(history.contains("] entry-" + i + "\n\n"), "missing entry-" + i);
        }
        assertEquals(40, history.split("\n\n").length);
    }
}
