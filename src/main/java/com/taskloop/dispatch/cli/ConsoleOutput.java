package com.taskloop.dispatch.cli;

import com.taskloop.TaskloopApplication;
import com.taskloop.core.events.LoopEvent;
import com.taskloop.core.model.GateResult;
import com.taskloop.core.model.IterationOutcome;
import com.taskloop.core.model.IterationResult;
import com.taskloop.core.model.LoopOutcome;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the taskloop CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TASKLOOP v" + TaskloopApplication.VERSION + "|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(cyan) [TASKLOOP]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(red) x|@ " + message));
    }

    public static void gate(GateResult result) {
        String status = result.passed() ? "@|fg(green) PASS|@" : "@|fg(red) FAIL|@";
        String suffix = result.timedOut() ? " (timed out)" : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(yellow) [GATE]|@ " + status + " " + result.name()
                        + " (" + formatDuration(result.durationMs()) + ")" + suffix));
    }

    public static void iteration(IterationResult result) {
        String outcome = switch (result.outcome()) {
            case DONE -> "@|fg(green),bold DONE|@";
            case FAILED -> "@|fg(red),bold FAILED|@";
            case BLOCKED -> "@|fg(yellow),bold BLOCKED|@";
            case NO_TASK -> "@|fg(green) NO TASK|@";
        };
        String task = result.taskId() == null ? "" : " task " + result.taskId();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [ITERATION " + result.iteration() + "]|@ " + outcome + task
                        + " (" + formatDuration(result.durationMs()) + ")"));
        result.gateResults().forEach(ConsoleOutput::gate);
        if (result.outcome() != IterationOutcome.DONE && result.commentText() != null) {
            System.out.println("  " + result.commentText());
        }
    }

    public static void event(LoopEvent event) {
        switch (event.eventType()) {
            case LoopEvent.ITERATION_STARTED -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(blue) [ITERATION " + event.payload().get("iteration") + "]|@ selecting task..."));
            case LoopEvent.RUN_STARTED -> info("Run " + event.runId() + " started (mode "
                    + event.payload().get("mode") + ", up to " + event.payload().get("maxIterations")
                    + " iteration(s), " + event.payload().get("tracker") + " tracker)");
            default -> {
                // iteration results are printed from the result itself
            }
        }
    }

    public static void outcome(LoopOutcome outcome) {
        System.out.println("──────────────────────────────────");
        String state = switch (outcome.terminalState()) {
            case DONE -> "@|fg(green),bold ALL TASKS DONE|@";
            case BLOCKED -> "@|fg(yellow),bold BLOCKED|@";
            case NO_PROGRESS -> "@|fg(red),bold NO PROGRESS|@";
            case LIMIT_REACHED -> "@|fg(yellow),bold ITERATION LIMIT REACHED|@";
            case STOPPED -> "@|fg(yellow),bold STOPPED|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(state));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Iterations: " + outcome.iterations().size()
                        + ", tasks completed: @|fg(green) " + outcome.tasksCompleted() + "|@"
                        + (outcome.hadFailures() ? ", @|fg(red) with failures|@" : "")));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
