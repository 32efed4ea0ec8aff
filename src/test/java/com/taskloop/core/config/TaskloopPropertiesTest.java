package com.taskloop.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskloopPropertiesTest {

    @Test
    @DisplayName("built-in modes exist with empty overrides")
    void builtInModes() {
        var properties = new TaskloopProperties();

        var overrides = properties.modeOverrides();

        assertEquals(List.of("speed", "quality", "exploration"), List.copyOf(overrides.keySet()));
        assertTrue(overrides.values().stream().allMatch(o -> o.isEmpty()));
    }

    @Test
    @DisplayName("configured mode replaces the built-in entry")
    void configuredModeWins() {
        var properties = new TaskloopProperties();
        var speed = new TaskloopProperties.Mode();
        speed.setMaxIterations(3);
        properties.getLoop().getModes().put("speed", speed);

        var resolved = new ModeResolver().resolve("speed", properties.toLoopConfig(), properties.modeOverrides());

        assertEquals(3, resolved.maxIterations());
    }

    @Test
    @DisplayName("a mode can override the hourly invocation limit and attempt settings")
    void modeOverridesAttemptSettings() {
        var properties = new TaskloopProperties();
        properties.getLoop().setRateLimitPerHour(30);
        var quality = new TaskloopProperties.Mode();
        quality.setRateLimitPerHour(5);
        quality.setMaxAttemptsPerTask(6);
        properties.getLoop().getModes().put("quality", quality);

        var base = properties.toLoopConfig();
        var resolved = new ModeResolver().resolve("quality", base, properties.modeOverrides());

        assertEquals(3, base.maxAttemptsPerTask());
        assertTrue(base.skipBlockedTasks());
        assertEquals(5, resolved.rateLimitPerHour());
        assertEquals(6, resolved.maxAttemptsPerTask());
        assertTrue(resolved.skipBlockedTasks());
    }

    @Test
    @DisplayName("gate commands get the shared gate timeout")
    void gatesUseSharedTimeout() {
        var properties = new TaskloopProperties();
        properties.getLoop().setGates(List.of(" mvn -q test ", "npm run lint"));
        properties.getLoop().setGateTimeoutSeconds(120);

        var gates = properties.toLoopConfig().gates();

        assertEquals(2, gates.size());
        assertEquals("mvn -q test", gates.get(0).command());
        assertEquals(120, gates.get(1).timeoutSeconds());
    }

    @Test
    @DisplayName("state directory resolves against the project root")
    void stateDirUnderProjectRoot() {
        var properties = new TaskloopProperties();
        properties.setProjectRoot("/tmp/work");
        properties.setStateDir(".taskloop");

        assertEquals("/tmp/work/.taskloop", properties.resolveStateDir().toString());
    }
}
