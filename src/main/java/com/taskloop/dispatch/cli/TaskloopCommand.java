package com.taskloop.dispatch.cli;

import com.taskloop.TaskloopApplication;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for taskloop.
 * Routes to subcommands: run, step, status, sync, bridge.
 */
@Command(
        name = "taskloop",
        mixinStandardHelpOptions = true,
        version = "taskloop " + TaskloopApplication.VERSION,
        description = "Gate-checked agent iteration loop over a task tracker",
        subcommands = {
                RunCommand.class,
                StepCommand.class,
                StatusCommand.class,
                SyncCommand.class,
                BridgeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TaskloopCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
