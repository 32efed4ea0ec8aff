package com.taskloop.core.tracker;

import com.taskloop.core.model.Task;

import java.util.Comparator;
import java.util.Locale;
import java.util.Map;

/**
 * Deterministic selection order.
 * <p>
 * Label rank first (highest {@code priority:*} label wins), then milestone (tasks with a
 * milestone before tasks without, lower milestone number first), then ascending numeric
 * id. Ids that are not numeric sort after numeric ones, lexicographically.
 */
public final class TaskPriority {

    private static final String PREFIX = "priority:";

    private static final Map<String, Integer> NAMED_RANKS = Map.of(
            "critical", 4,
            "high", 3,
            "medium", 2,
            "low", 1);

    public static final Comparator<Task> ORDER = Comparator
            .comparingInt(TaskPriority::labelRank).reversed()
            .thenComparingLong(TaskPriority::milestoneKey)
            .thenComparing(Task::id, TaskPriority::compareIds);

    private TaskPriority() {
        // utility class
    }

    /**
     * Rank from {@code priority:critical|high|medium|low} or {@code priority:<n>} labels;
     * 0 when none is present.
     */
    public static int labelRank(Task task) {
        int best = 0;
        for (String label : task.labels()) {
            String lower = label.toLowerCase(Locale.ROOT);
            if (!lower.startsWith(PREFIX)) {
                continue;
            }
            String value = lower.substring(PREFIX.length()).trim();
            Integer named = NAMED_RANKS.get(value);
            int rank = named != null ? named : parseOrZero(value);
            best = Math.max(best, rank);
        }
        return best;
    }

    private static long milestoneKey(Task task) {
        return task.milestone() != null ? task.milestone() : Long.MAX_VALUE;
    }

    static int compareIds(String a, String b) {
        Long na = parseLong(a);
        Long nb = parseLong(b);
        if (na != null && nb != null) {
            return Long.compare(na, nb);
        }
        if (na != null) {
            return -1;
        }
        if (nb != null) {
            return 1;
        }
        return a.compareTo(b);
    }

    private static int parseOrZero(String value) {
        try {
            return Math.max(0, Integer.parseInt(value));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static Long parseLong(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
