package com.taskloop.dispatch.cli;

import com.taskloop.core.engine.LoopEngine;
import com.taskloop.core.model.TaskCounts;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: taskloop sync
 * <p>
 * Refreshes the tracker's cached backlog regardless of its age.
 */
@Command(name = "sync", mixinStandardHelpOptions = true, description = "Refresh the cached backlog now")
@Component
public class SyncCommand implements Callable<Integer> {

    private final LoopEngine loopEngine;

    public SyncCommand(LoopEngine loopEngine) {
        this.loopEngine = loopEngine;
    }

    @Override
    public Integer call() {
        try {
            var tracker = loopEngine.tracker();
            tracker.sync();
            TaskCounts counts = tracker.counts();
            ConsoleOutput.success("Synced %s tracker: %d open task(s)".formatted(tracker.kind(), counts.open()));
            return 0;
        } catch (RuntimeException e) {
            return CliFailures.report("Sync", e);
        }
    }
}
