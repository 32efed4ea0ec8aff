package com.taskloop.core.agent;

import com.taskloop.core.config.ConfigException;
import com.taskloop.core.model.SelectedTask;
import com.taskloop.core.model.Task;
import com.taskloop.core.process.ProcessOutcome;
import com.taskloop.core.process.ProcessRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ProcessAgentInvokerTest {

    private static final Path ROOT = Path.of("/tmp/project");

    private ProcessRunner processRunner;
    private AgentRequest request;

    @BeforeEach
    void setUp() {
        processRunner = mock(ProcessRunner.class);
        var task = new Task("3", "Fix bug", "", List.of(), "", Set.of(), null, false, false);
        request = new AgentRequest(new SelectedTask(task, Instant.EPOCH), ROOT, "PROMPT", Duration.ofSeconds(60), 1);
    }

    @Test
    @DisplayName("Stdin mode pipes the prompt and keeps argv unchanged")
    void stdinMode() throws Exception {
        when(processRunner.run(anyList(), any(), any(), any(Duration.class)))
                .thenReturn(new ProcessOutcome(0, false, "ok", 12));
        var invoker = new ProcessAgentInvoker(List.of("agent", "--yes"), ProcessAgentInvoker.PromptMode.STDIN, processRunner);

        AgentResult result = invoker.invoke(request);

        assertTrue(result.succeeded());
        verify(processRunner).run(List.of("agent", "--yes"), ROOT, "PROMPT", Duration.ofSeconds(60));
    }

    @Test
    @DisplayName("Argument mode appends the prompt and sends no stdin")
    void argumentMode() throws Exception {
        when(processRunner.run(anyList(), any(), any(), any(Duration.class)))
                .thenReturn(new ProcessOutcome(0, false, "ok", 12));
        var invoker = new ProcessAgentInvoker(List.of("agent"), ProcessAgentInvoker.PromptMode.ARGUMENT, processRunner);

        invoker.invoke(request);

        verify(processRunner).run(eq(List.of("agent", "PROMPT")), eq(ROOT), isNull(), eq(Duration.ofSeconds(60)));
    }

    @Test
    @DisplayName("Timeout and non-zero exit are reported as failures")
    void failures() throws Exception {
        when(processRunner.run(anyList(), any(), any(), any(Duration.class)))
                .thenReturn(new ProcessOutcome(-1, true, "", 60_000));
        var invoker = new ProcessAgentInvoker(List.of("agent"), ProcessAgentInvoker.PromptMode.STDIN, processRunner);

        AgentResult result = invoker.invoke(request);

        assertFalse(result.succeeded());
        assertTrue(result.timedOut());
    }

    @Test
    @DisplayName("A process that cannot start yields exit code -1")
    void cannotStart() throws Exception {
        when(processRunner.run(anyList(), any(), any(), any(Duration.class)))
                .thenThrow(new IOException("No such file"));
        var invoker = new ProcessAgentInvoker(List.of("missing"), ProcessAgentInvoker.PromptMode.STDIN, processRunner);

        AgentResult result = invoker.invoke(request);

        assertEquals(-1, result.exitCode());
        assertTrue(result.output().contains("No such file"));
    }

    @Test
    void promptModeParsing() {
        assertEquals(ProcessAgentInvoker.PromptMode.ARGUMENT, ProcessAgentInvoker.PromptMode.parse(" Argument "));
        assertEquals(ProcessAgentInvoker.PromptMode.STDIN, ProcessAgentInvoker.PromptMode.parse(null));
        assertEquals(ProcessAgentInvoker.PromptMode.STDIN, ProcessAgentInvoker.PromptMode.parse("STDIN"));
        var e = assertThrows(ConfigException.class, () -> ProcessAgentInvoker.PromptMode.parse("argv"));
        assertTrue(e.getMessage().contains("argv"));
        assertThrows(IllegalArgumentException.class,
                () -> new ProcessAgentInvoker(List.of(), ProcessAgentInvoker.PromptMode.STDIN, processRunner));
    }
}
