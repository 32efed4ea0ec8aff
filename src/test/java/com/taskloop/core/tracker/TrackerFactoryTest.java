package com.taskloop.core.tracker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskloop.core.config.ConfigException;
import com.taskloop.core.config.TaskloopProperties;
import com.taskloop.core.metrics.LoopMetrics;
import com.taskloop.core.process.ProcessRunner;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class TrackerFactoryTest {

    @TempDir
    Path dir;

    private TaskloopProperties properties;
    private ProcessRunner processRunner;

    @BeforeEach
    void setUp() {
        properties = new TaskloopProperties();
        properties.setProjectRoot(dir.toString());
        processRunner = mock(ProcessRunner.class);
    }

    private TrackerFactory factory(Map<String, String> env) {
        return new TrackerFactory(properties, new ObjectMapper().findAndRegisterModules(), Clock.systemUTC(),
                new LoopMetrics(new SimpleMeterRegistry()), env::get, processRunner);
    }

    @Test
    @DisplayName("local kind reads the task file under the project root")
    void local() throws Exception {
        Files.writeString(dir.resolve("tasks.json"), "{\"version\": 1, \"tasks\": [{\"id\": \"1\", \"title\": \"One\"}]}");

        TaskTracker tracker = factory(Map.of()).create();

        assertEquals("local", tracker.kind());
        assertEquals(1, tracker.counts().total());
    }

    @Test
    @DisplayName("github kind with a token builds without touching the network")
    void github() {
        properties.getTracker().setKind("GitHub");
        properties.getTracker().getGithub().setRepo("acme/widgets");
        properties.getTracker().getGithub().setAuthMethod("token");

        TaskTracker tracker = factory(Map.of("GITHUB_TOKEN", "ghp_test")).create();

        assertEquals("github", tracker.kind());
        verifyNoInteractions(processRunner);
    }

    @Test
    void unknownKind() {
        properties.getTracker().setKind("jira");

        var e = assertThrows(ConfigException.class, () -> factory(Map.of()).create());
        assertTrue(e.getMessage().contains("Supported: local, github"));
    }

    @Test
    void malformedRepo() {
        properties.getTracker().setKind("github");
        properties.getTracker().getGithub().setRepo("widgets");

        assertThrows(ConfigException.class, () -> factory(Map.of("GITHUB_TOKEN", "t")).create());
    }

    @Test
    @DisplayName("missing credentials fail with remediation text")
    void missingCredentials() {
        properties.getTracker().setKind("github");
        properties.getTracker().getGithub().setRepo("acme/widgets");
        properties.getTracker().getGithub().setAuthMethod("token");

        assertThrows(TrackerAuthException.class, () -> factory(Map.of()).create());
    }

    @Test
    void invalidRetrySettings() {
        properties.getTracker().setKind("github");
        properties.getTracker().getGithub().setRepo("acme/widgets");
        properties.getTracker().getGithub().setMaxAttempts(0);

        assertThrows(ConfigException.class, () -> factory(Map.of("GITHUB_TOKEN", "t")).create());
    }

    @Test
    void filterFromProperties() {
        properties.getTracker().setLabelFilter("ready");
        properties.getTracker().setExcludeLabels(List.of("wip"));

        TaskFilter filter = factory(Map.of()).filter();

        assertEquals(Set.of("ready"), filter.requiredLabels());
        assertEquals(Set.of("wip"), filter.excludedLabels());
        assertTrue(filter.excludeDrafts());
    }
}
