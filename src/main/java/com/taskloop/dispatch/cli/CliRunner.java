package com.taskloop.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command; the command's exit code
 * becomes the process exit code.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final TaskloopCommand taskloopCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(TaskloopCommand taskloopCommand, IFactory factory) {
        this.taskloopCommand = taskloopCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = commandLine(taskloopCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Command line with taskloop's conventions: case-insensitive option values and any
     * exception that escapes a command reported as a one-line failure with exit code 2.
     */
    static CommandLine commandLine(TaskloopCommand command, IFactory factory) {
        return new CommandLine(command, factory)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setExecutionExceptionHandler((ex, cmd, parseResult) ->
                        CliFailures.report(cmd.getCommandName(), ex));
    }
}
