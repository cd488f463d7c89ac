package me.golemcore.runtime.domain.service;

import me.golemcore.runtime.domain.model.ChecklistItem;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChecklistParserTest {

    private static final String CHECKLIST = """
            # Morning routine

            - [ ] Check the weather
            * [x] Water the plants
              - [X] Nested done item
            - [ ]
            Some prose - [ ] not an item
            - [ ] `exec {"command": "date"}`
            """;

    // ==================== parse ====================

    @Test
    void parseFindsTaskItemsWithLineNumbers() {
        List<ChecklistItem> items = ChecklistParser.parse(CHECKLIST);

        assertEquals(4, items.size());
        assertEquals(new ChecklistItem(3, "Check the weather", false, "- [ ] Check the weather"), items.get(0));
        assertTrue(items.get(1).done());
        assertEquals("Water the plants", items.get(1).text());
        assertTrue(items.get(2).done());
        assertEquals(8, items.get(3).lineNumber());
        assertEquals("`exec {\"command\": \"date\"}`", items.get(3).text());
    }

    @Test
    void parseHandlesMissingOrBlankContent() {
        assertTrue(ChecklistParser.parse(null).isEmpty());
        assertTrue(ChecklistParser.parse("  \n").isEmpty());
    }

    @Test
    void parseAcceptsWindowsLineEndings() {
        List<ChecklistItem> items = ChecklistParser.parse("- [ ] one\r\n- [x] two\r\n");

        assertEquals(2, items.size());
        assertEquals("one", items.get(0).text());
        assertEquals(2, items.get(1).lineNumber());
    }

    // ==================== markDone ====================

    @Test
    void markDoneChecksOnlyTheTargetLine() {
        ChecklistItem weather = ChecklistParser.parse(CHECKLIST).get(0);

        String updated = ChecklistParser.markDone(CHECKLIST, weather);

        assertTrue(updated.contains("- [x] Check the weather"));
        assertTrue(updated.contains("- [ ] `exec {\"command\": \"date\"}`"));
        assertEquals(CHECKLIST.replace("- [ ] Check the weather", "- [x] Check the weather"), updated);
    }

    @Test
    void markDoneKeepsWindowsLineEndings() {
        String content = "# Tasks\r\n- [ ] one\r\n- [ ] two\r\n";
        ChecklistItem two = ChecklistParser.parse(content).get(1);

        String updated = ChecklistParser.markDone(content, two);

        assertEquals("# Tasks\r\n- [ ] one\r\n- [x] two\r\n", updated);
    }

    @Test
    void markDoneFindsItemAfterLinesWereInserted() {
        ChecklistItem item = ChecklistParser.parse("- [ ] Task A\n").get(0);
        String edited = "# New header\n\n- [ ] Task A\n";

        assertEquals("# New header\n\n- [x] Task A\n", ChecklistParser.markDone(edited, item));
    }

    @Test
    void markDoneReturnsSameInstanceWhenNothingToChange() {
        ChecklistItem item = ChecklistParser.parse("- [ ] Task A\n").get(0);
        String removed = "- [ ] Task B\n";
        String alreadyDone = "- [x] Task A\n";

        assertSame(removed, ChecklistParser.markDone(removed, item));
        assertSame(alreadyDone, ChecklistParser.markDone(alreadyDone, item));
        assertNull(ChecklistParser.markDone(null, item));
    }

    @Test
    void markDoneIsIdempotent() {
        String content = "- [ ] Task A\n";
        ChecklistItem item = ChecklistParser.parse(content).get(0);

        String once = ChecklistParser.markDone(content, item);
        String twice = ChecklistParser.markDone(once, item);

        assertEquals(once, twice);
    }
}
