package com.taskloop.core.gate;

import com.taskloop.core.metrics.LoopMetrics;
import com.taskloop.core.model.GateCommand;
import com.taskloop.core.model.GateResult;
import com.taskloop.core.process.ProcessOutcome;
import com.taskloop.core.process.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs gate commands through a shell in the project root.
 * Every gate runs, in order; a gate passes only on exit status zero within its timeout.
 */
public class GateRunner {

    private static final Logger log = LoggerFactory.getLogger(GateRunner.class);

    private final ProcessRunner processRunner;
    private final Path projectRoot;
    private final LoopMetrics metrics;
    private final List<String> shell;

    public GateRunner(ProcessRunner processRunner, Path projectRoot, LoopMetrics metrics) {
        this(processRunner, projectRoot, metrics, defaultShell());
    }

    GateRunner(ProcessRunner processRunner, Path projectRoot, LoopMetrics metrics, List<String> shell) {
        this.processRunner = processRunner;
        this.projectRoot = projectRoot;
        this.metrics = metrics;
        this.shell = List.copyOf(shell);
    }

    public List<GateResult> runAll(List<GateCommand> gates) {
        var results = new ArrayList<GateResult>(gates.size());
        for (GateCommand gate : gates) {
            results.add(run(gate));
        }
        return results;
    }

    public GateResult run(GateCommand gate) {
        var argv = new ArrayList<>(shell);
        argv.add(gate.command());
        log.info("Gate '{}' running", gate.name());
        GateResult result;
        try {
            ProcessOutcome outcome = processRunner.run(argv, projectRoot, null,
                    Duration.ofSeconds(gate.timeoutSeconds()));
            result = new GateResult(gate.name(), gate.command(), outcome.exitCode(), outcome.timedOut(),
                    outcome.durationMs(), outcome.output());
        } catch (IOException e) {
            log.error("Gate '{}' could not start: {}", gate.name(), e.getMessage());
            result = new GateResult(gate.name(), gate.command(), -1, false, 0, "failed to start: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = new GateResult(gate.name(), gate.command(), -1, false, 0, "interrupted");
        }
        metrics.recordGate(gate.name(), result.passed());
        if (result.passed()) {
            log.info("Gate '{}' passed in {} ms", gate.name(), result.durationMs());
        } else {
            log.warn("Gate '{}' failed (exit={}, timedOut={})", gate.name(), result.exitCode(), result.timedOut());
        }
        return result;
    }

    static List<String> defaultShell() {
        if (Files.isExecutable(Path.of("/bin/bash"))) {
            return List.of("bash", "-lc");
        }
        return List.of("sh", "-c");
    }
}
