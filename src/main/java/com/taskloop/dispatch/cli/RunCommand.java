package com.taskloop.dispatch.cli;

import com.taskloop.core.engine.LoopEngine;
import com.taskloop.core.engine.RunControl;
import com.taskloop.core.engine.RunRequest;
import com.taskloop.core.events.EventBus;
import com.taskloop.core.events.LoopEvent;
import com.taskloop.core.model.LoopOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: taskloop run [--max-iterations N] [--mode NAME]
 * <p>
 * Runs iterations until the backlog is done or blocked, the no-progress limit or the
 * iteration cap is reached. Exit code 0 when all tasks are done, 2 when any iteration
 * failed, 1 otherwise.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run the loop until done, blocked or limited")
@Component
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Option(names = {"--max-iterations", "-n"}, description = "Iteration cap for this run")
    private Integer maxIterations;

    @Option(names = {"--mode", "-m"}, description = "Loop mode: default, speed, quality, exploration or a configured name")
    private String mode;

    private final LoopEngine loopEngine;
    private final EventBus eventBus;

    public RunCommand(LoopEngine loopEngine, EventBus eventBus) {
        this.loopEngine = loopEngine;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        String runId = loopEngine.generateRunId();
        var control = new RunControl();
        Thread stopHook = new Thread(control::requestStop, "taskloop-stop");
        Runtime.getRuntime().addShutdownHook(stopHook);
        var subscription = eventBus.subscribe(runId, RunCommand::print);
        try {
            LoopOutcome outcome = loopEngine.run(new RunRequest(mode, maxIterations), control, runId);
            ConsoleOutput.outcome(outcome);
            return outcome.exitCode();
        } catch (RuntimeException e) {
            return CliFailures.report("Run", e);
        } finally {
            subscription.unsubscribe();
            removeHook(stopHook);
        }
    }

    private static void print(LoopEvent event) {
        if (LoopEvent.ITERATION_FINISHED.equals(event.eventType())) {
            Object title = event.payload().get("title");
            Object outcome = event.payload().get("outcome");
            ConsoleOutput.info("Iteration " + event.payload().get("iteration") + ": " + outcome
                    + (event.taskId() != null ? " (task " + event.taskId() + (title != null ? ", " + title : "") + ")" : ""));
        } else {
            ConsoleOutput.event(event);
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("Shutdown in progress; stop hook already ran");
        }
    }
}
