package com.taskloop.dispatch.cli;

import com.taskloop.core.engine.LoopEngine;
import com.taskloop.core.engine.LoopStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: taskloop status
 * <p>
 * Shows backlog counts, the task that would be selected next and the last iteration.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show backlog and loop status")
@Component
public class StatusCommand implements Callable<Integer> {

    private final LoopEngine loopEngine;

    public StatusCommand(LoopEngine loopEngine) {
        this.loopEngine = loopEngine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        LoopStatus status;
        try {
            status = loopEngine.status();
        } catch (RuntimeException e) {
            return CliFailures.report("Status", e);
        }

        ConsoleOutput.info("Tracker: " + status.trackerKind() + " | Mode: " + status.mode());
        if (status.counts() != null) {
            ConsoleOutput.info("Tasks: %d open of %d".formatted(status.counts().open(), status.counts().total()));
        }
        if (status.next() != null) {
            ConsoleOutput.info("Next: " + status.next().id() + " " + status.next().title());
        } else if (status.counts() != null) {
            ConsoleOutput.info(status.counts().open() == 0 ? "Next: none, all tasks done" : "Next: none eligible");
        }
        ConsoleOutput.info("No-progress streak: " + status.noProgressStreak());
        if (status.lastResult() != null) {
            System.out.println();
            ConsoleOutput.iteration(status.lastResult());
        }
        if (status.warning() != null) {
            ConsoleOutput.warn(status.warning());
        }
        return 0;
    }
}
