package com.taskloop.core.agent;

import com.taskloop.core.config.ConfigException;
import com.taskloop.core.process.ProcessOutcome;
import com.taskloop.core.process.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Runs the agent as an external process. The prompt goes either to stdin or as the last
 * command-line argument.
 */
public class ProcessAgentInvoker implements AgentInvoker {

    private static final Logger log = LoggerFactory.getLogger(ProcessAgentInvoker.class);

    public enum PromptMode {
        STDIN, ARGUMENT;

        /**
         * Blank means {@link #STDIN}.
         *
         * @throws ConfigException for anything other than {@code stdin} or {@code argument}
         */
        public static PromptMode parse(String value) {
            String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
            return switch (normalized) {
                case "", "stdin" -> STDIN;
                case "argument" -> ARGUMENT;
                default -> throw new ConfigException(
                        "Unknown prompt mode '" + value + "' (expected stdin or argument)");
            };
        }
    }

    private final List<String> argv;
    private final PromptMode promptMode;
    private final ProcessRunner processRunner;

    public ProcessAgentInvoker(List<String> argv, PromptMode promptMode, ProcessRunner processRunner) {
        if (argv == null || argv.isEmpty()) {
            throw new IllegalArgumentException("runner argv must not be empty");
        }
        this.argv = List.copyOf(argv);
        this.promptMode = promptMode;
        this.processRunner = processRunner;
    }

    @Override
    public AgentResult invoke(AgentRequest request) {
        var command = new ArrayList<>(argv);
        String stdin = request.prompt();
        if (promptMode == PromptMode.ARGUMENT) {
            command.add(request.prompt());
            stdin = null;
        }
        log.info("Starting agent '{}' for task {} (timeout {}s)", argv.get(0), request.task().id(),
                request.timeout().toSeconds());
        try {
            ProcessOutcome outcome = processRunner.run(command, request.projectRoot(), stdin, request.timeout());
            if (!outcome.succeeded()) {
                log.warn("Agent exited {}{} after {} ms", outcome.exitCode(),
                        outcome.timedOut() ? " (timed out)" : "", outcome.durationMs());
            }
            return new AgentResult(outcome.exitCode(), outcome.timedOut(), outcome.output(), outcome.durationMs());
        } catch (IOException e) {
            log.error("Agent '{}' could not be started: {}", argv.get(0), e.getMessage());
            return new AgentResult(-1, false, "failed to start: " + e.getMessage(), 0);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new AgentResult(-1, false, "interrupted", 0);
        }
    }
}
