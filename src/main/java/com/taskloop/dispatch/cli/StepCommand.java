package com.taskloop.dispatch.cli;

import com.taskloop.core.engine.LoopEngine;
import com.taskloop.core.engine.RunControl;
import com.taskloop.core.engine.RunRequest;
import com.taskloop.core.model.IterationResult;
import com.taskloop.core.model.LoopOutcome;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: taskloop step [--mode NAME]
 * <p>
 * Runs exactly one iteration and keeps the persisted no-progress streak.
 */
@Command(name = "step", mixinStandardHelpOptions = true, description = "Run a single iteration")
@Component
public class StepCommand implements Callable<Integer> {

    @Option(names = {"--mode", "-m"}, description = "Loop mode for this iteration")
    private String mode;

    private final LoopEngine loopEngine;

    public StepCommand(LoopEngine loopEngine) {
        this.loopEngine = loopEngine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            Optional<IterationResult> result = loopEngine.step(new RunRequest(mode, null), new RunControl(),
                    loopEngine.generateRunId());
            if (result.isEmpty()) {
                ConsoleOutput.warn("Stopped before the agent ran");
                return LoopOutcome.EXIT_INCOMPLETE;
            }
            ConsoleOutput.iteration(result.get());
            return switch (result.get().outcome()) {
                case DONE, NO_TASK -> LoopOutcome.EXIT_COMPLETE;
                case BLOCKED -> LoopOutcome.EXIT_INCOMPLETE;
                case FAILED -> LoopOutcome.EXIT_FAILURE;
            };
        } catch (RuntimeException e) {
            return CliFailures.report("Step", e);
        }
    }
}
