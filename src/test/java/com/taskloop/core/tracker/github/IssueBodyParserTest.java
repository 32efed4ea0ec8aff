package com.taskloop.core.tracker.github;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IssueBodyParserTest {

    @Test
    @DisplayName("splits description, acceptance and notes around the acceptance heading")
    void threeZones() {
        var parsed = IssueBodyParser.parse("## Description\nX\n## Acceptance Criteria\n- [ ] A\n- [ ] B\n## Notes\nC");

        assertEquals("X", parsed.description());
        assertEquals(List.of("A", "B"), parsed.acceptance());
        assertEquals("C", parsed.notes());
    }

    @Test
    @DisplayName("check state is ignored and non-checkbox lines are skipped")
    void checkStateIgnored() {
        var parsed = IssueBodyParser.parse("""
                Intro text

                ### acceptance criteria
                - [x] Done already
                Some prose
                * [ ] Star bullet
                """);

        assertEquals("Intro text", parsed.description());
        assertEquals(List.of("Done already", "Star bullet"), parsed.acceptance());
        assertEquals("", parsed.notes());
    }

    @Test
    @DisplayName("a body without the heading is all description")
    void noPivot() {
        var parsed = IssueBodyParser.parse("  Just do it.\r\n- [ ] not criteria  ");

        assertEquals("Just do it.\r\n- [ ] not criteria", parsed.description());
        assertTrue(parsed.acceptance().isEmpty());
    }

    @Test
    @DisplayName("empty and null bodies parse to empty parts")
    void emptyBody() {
        assertEquals(new IssueBodyParser.ParsedBody("", List.of(), ""), IssueBodyParser.parse(null));
        assertEquals(new IssueBodyParser.ParsedBody("", List.of(), ""), IssueBodyParser.parse("  "));
    }

    @Test
    @DisplayName("draft titles and labels mark the issue as a draft task")
    void drafts() {
        assertTrue(new IssueSnapshot(1, "[WIP] thing", "", List.of(), null, false).toTask().draft());
        assertTrue(new IssueSnapshot(2, "thing", "", List.of("Draft"), null, false).toTask().draft());
        assertFalse(new IssueSnapshot(3, "thing", "", List.of(), null, false).toTask().draft());
    }
}
