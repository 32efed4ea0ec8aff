package com.taskloop.core.agent;

import com.taskloop.core.model.Task;

/**
 * Converts a task into the agent's prompt. Pure function, no Spring dependencies.
 */
public final class PromptBuilder {

    private PromptBuilder() {}

    public static String build(Task task) {
        return build(task, 0);
    }

    /**
     * @param noProgressStreak iterations in a row that ended without a commit
     */
    public static String build(Task task, int noProgressStreak) {
        var sb = new StringBuilder();

        sb.append("# Task ").append(task.id()).append(": ").append(task.title()).append("\n\n");

        if (!task.description().isBlank()) {
            sb.append("## Description\n\n");
            sb.append(task.description()).append("\n\n");
        }

        if (!task.acceptance().isEmpty()) {
            sb.append("## Acceptance Criteria\n\n");
            for (String criterion : task.acceptance()) {
                sb.append("- [ ] ").append(criterion).append("\n");
            }
            sb.append("\n");
        }

        if (!task.notes().isBlank()) {
            sb.append("## Notes\n\n");
            sb.append(task.notes()).append("\n\n");
        }

        if (noProgressStreak > 0) {
            sb.append("## Previous Attempts\n\n");
            sb.append("The last ").append(noProgressStreak)
                    .append(" iteration(s) ended without passing the gates. ")
                    .append("Read the failing gate output before changing anything.\n\n");
        }

        sb.append("## Instructions\n\n");
        sb.append("- Work only on this task; leave other tasks untouched\n");
        sb.append("- Make every acceptance criterion true\n");
        sb.append("- The gate commands will be run after you exit; the task is only closed if all pass\n");
        sb.append("- Do not close or relabel the task yourself\n");

        return sb.toString();
    }
}
