package me.golemcore.runtime.domain.service;

import me.golemcore.runtime.domain.model.Skill;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.port.outbound.WorkspacePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SkillServiceTest {

    private static final String SKILLS_DIR = "skills";

    private static final String WEATHER_SKILL = """
            ---
            name: weather
            description: "Look up the forecast"
            ---
            Use web_search for forecasts.
            """;

    private static final String STYLE_SKILL = """
            ---
            description: House style
            always: true
            ---
            Answer in short sentences.
            """;

    private WorkspacePort workspace;
    private SkillService service;

    @BeforeEach
    void setUp() {
        workspace = mock(WorkspacePort.class);
        service = new SkillService(workspace, new RuntimeProperties());
    }

    private void stubSkills() {
        when(workspace.list(SKILLS_DIR)).thenReturn(List.of("README.md", "style/", "weather/", "empty/"));
        when(workspace.read("skills/weather/SKILL.md")).thenReturn(WEATHER_SKILL);
        when(workspace.read("skills/style/SKILL.md")).thenReturn(STYLE_SKILL);
        when(workspace.read("skills/empty/SKILL.md")).thenReturn(null);
    }

    // ==================== listSkills ====================

    @Test
    void listSkillsReadsFrontMatterOfEachSkillDirectory() {
        stubSkills();

        List<Skill> skills = service.listSkills();

        assertEquals(2, skills.size());
        Skill style = skills.get(0);
        assertEquals("style", style.getName());
        assertEquals("House style", style.getDescription());
        assertTrue(style.isAlways());
        Skill weather = skills.get(1);
        assertEquals("weather", weather.getName());
        assertEquals("Look up the forecast", weather.getDescription());
        assertFalse(weather.isAlways());
        assertEquals("skills/weather/SKILL.md", weather.getLocation());
    }

    @Test
    void parseWithoutFrontMatterUsesDirectoryName() {
        Skill skill = service.parse("notes", "skills/notes/SKILL.md", "Just a body\n");

        assertEquals("notes", skill.getName());
        assertNull(skill.getDescription());
        assertFalse(skill.isAlways());
    }

    // ==================== prompt sections ====================

    @Test
    void alwaysSkillsContextInlinesBodiesWithoutFrontMatter() {
        stubSkills();

        String context = service.buildAlwaysSkillsContext();

        assertEquals("### Skill: style\n\nAnswer in short sentences.", context);
    }

    @Test
    void summaryListsEverySkillWithLocation() {
        stubSkills();

        String summary = service.buildSkillsSummary();

        assertEquals("- **style**: House style (skills/style/SKILL.md)\n"
                + "- **weather**: Look up the forecast (skills/weather/SKILL.md)", summary);
    }

    @Test
    void summaryIsEmptyWithoutSkills() {
        when(workspace.list(SKILLS_DIR)).thenReturn(List.of());

        assertEquals("", service.buildSkillsSummary());
        assertEquals("", service.buildAlwaysSkillsContext());
    }
}
