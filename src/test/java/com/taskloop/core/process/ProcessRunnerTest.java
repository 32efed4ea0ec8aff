package com.taskloop.core.process;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessRunnerTest {

    private final ProcessRunner runner = new ProcessRunner();

    @TempDir
    Path dir;

    @Test
    @DisplayName("captures combined output and exit status")
    void capturesOutput() throws Exception {
        ProcessOutcome outcome = runner.run(List.of("sh", "-c", "echo out; echo err 1>&2; exit 3"), dir, null,
                Duration.ofSeconds(10));

        assertEquals(3, outcome.exitCode());
        assertFalse(outcome.timedOut());
        assertFalse(outcome.succeeded());
        assertTrue(outcome.output().contains("out"));
        assertTrue(outcome.output().contains("err"));
    }

    @Test
    @DisplayName("feeds stdin to the child")
    void feedsStdin() throws Exception {
        ProcessOutcome outcome = runner.run(List.of("cat"), dir, "prompt text", Duration.ofSeconds(10));

        assertTrue(outcome.succeeded());
        assertEquals("prompt text", outcome.output());
    }

    @Test
    @DisplayName("runs in the given working directory")
    void workingDirectory() throws Exception {
        ProcessOutcome outcome = runner.run(List.of("pwd"), dir, null, Duration.ofSeconds(10));

        assertEquals(dir.toRealPath().toString(), outcome.output().strip());
    }

    @Test
    @DisplayName("kills the process when the timeout fires")
    void timeout() throws Exception {
        ProcessOutcome outcome = runner.run(List.of("sleep", "30"), dir, null, Duration.ofMillis(300));

        assertTrue(outcome.timedOut());
        assertEquals(-1, outcome.exitCode());
        assertTrue(outcome.durationMs() < 20_000);
    }

    @Test
    @DisplayName("a child that never reads a large stdin still times out")
    void unreadStdinHonoursTimeout() {
        String prompt = "x".repeat(4 * 1024 * 1024);

        ProcessOutcome outcome = assertTimeoutPreemptively(Duration.ofSeconds(15),
                () -> runner.run(List.of("sleep", "30"), dir, prompt, Duration.ofMillis(300)));

        assertTrue(outcome.timedOut());
    }

    @Test
    @DisplayName("a missing executable raises IOException")
    void missingExecutable() {
        assertThrows(IOException.class, () -> runner.run(List.of("definitely-not-a-real-binary-xyz"), dir, null,
                Duration.ofSeconds(5)));
    }

    @Test
    @DisplayName("long output keeps its tail")
    void truncatesHead() {
        var small = new ProcessRunner(5);

        assertEquals("...[truncated]\n56789", small.truncate("0123456789"));
        assertEquals("abc", small.truncate("abc"));
    }
}
