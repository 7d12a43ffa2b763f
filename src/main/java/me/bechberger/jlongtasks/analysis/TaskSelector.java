package me.bechberger.jlongtasks.analysis;

import me.bechberger.jlongtasks.model.TaskForest;
import me.bechberger.jlongtasks.model.TaskNode;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Selects the long tasks of a task forest.
 * <p>
 * A long task is a top-level, bounded task whose duration reaches the threshold.
 * Nested tasks are never selected, their time is already part of the parent's duration.
 */
public final class TaskSelector {

    /** Maximum number of tasks reported */
    public static final int MAX_LONG_TASKS = 20;

    private static final Comparator<TaskNode> BY_DURATION_DESC =
            Comparator.comparingDouble(TaskNode::getDuration).reversed();

    private TaskSelector() {
    }

    /**
     * Select the long tasks of a forest using the default 50ms threshold
     */
    public static List<TaskNode> selectLongTasks(@NotNull TaskForest forest) {
        return selectLongTasks(forest, AnalysisOptions.DEFAULT_LONG_TASK_THRESHOLD_MS);
    }

    public static List<TaskNode> selectLongTasks(@NotNull TaskForest forest, double thresholdMs) {
        return selectLongTasks(forest.allTasks(), thresholdMs);
    }

    /**
     * Select the longest qualifying tasks, longest first.
     * Tasks of equal duration keep their order in {@code tasks} (the sort is stable).
     *
     * @param tasks all tasks, in traversal order
     * @param thresholdMs minimum duration of a long task
     * @return at most {@link #MAX_LONG_TASKS} tasks
     */
    public static List<TaskNode> selectLongTasks(@NotNull Collection<TaskNode> tasks, double thresholdMs) {
        return tasks.stream()
                .filter(TaskNode::isTopLevel)
                .filter(t -> !t.isUnbounded())
                .filter(t -> t.getDuration() >= thresholdMs)
                .sorted(BY_DURATION_DESC)
                .limit(MAX_LONG_TASKS)
                .toList();
    }
}
