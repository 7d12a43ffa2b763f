package me.bechberger.jlongtasks.analysis.analyzers;

import com.fasterxml.jackson.annotation.JsonInclude;
import me.bechberger.jlongtasks.analysis.*;
import me.bechberger.jlongtasks.model.AttributedTask;
import me.bechberger.jlongtasks.model.TaskNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Analyzer that lists the longest top-level main-thread tasks and attributes each
 * to the script, browser work or garbage collection that caused it.
 * Useful for identifying the worst contributors to input delay.
 */
public class LongTasksAnalyzer implements Analyzer<LongTasksAnalyzer.LongTasksResult> {

    private static final String NAME = "LongTasksAnalyzer";

    @Override
    public @NotNull String getName() {
        return NAME;
    }

    @Override
    public @NotNull String getDescription() {
        return "Lists the longest tasks on the main thread, useful for identifying worst contributors to input delay";
    }

    @Override
    public boolean canAnalyze(@NotNull AnalysisContext context) {
        return true;
    }

    @Override
    public int getPriority() {
        return 100;
    }

    @Override
    public boolean requiresNetworkRecords() {
        return true;
    }

    @Override
    public @NotNull LongTasksResult analyze(@NotNull AnalysisContext context) {
        List<TaskNode> longTasks = context.getLongTasks();
        List<AttributedTask> rows = UrlAttributor.attribute(longTasks, context.getJavaScriptUrls());

        List<AnalysisResult.Finding> findings = new ArrayList<>();
        for (AttributedTask row : rows) {
            findings.add(AnalysisResult.Finding.builder(
                    AnalysisResult.Severity.INFO, "long-task",
                    String.format(Locale.US, "%.0fms %s task caused by %s",
                            row.duration(), row.group(), row.url()))
                    .detail("url", row.url())
                    .detail("group", row.group())
                    .detail("start", row.start())
                    .detail("duration", row.duration())
                    .build());
        }

        AnalysisResult.Severity severity = rows.isEmpty()
                ? AnalysisResult.Severity.OK
                : AnalysisResult.Severity.INFO;

        return new LongTasksResult(severity, findings, rows, context.getOptions().getLongTaskThresholdMs());
    }

    /**
     * Summary phrase for a number of long tasks, empty when there are none
     */
    public static Optional<String> formatDisplayValue(int taskCount) {
        if (taskCount <= 0) {
            return Optional.empty();
        }
        if (taskCount == 1) {
            return Optional.of("1 long task found");
        }
        return Optional.of(taskCount + " long tasks found");
    }

    public static class LongTasksResult extends AnalysisResult {
        private final List<AttributedTask> tasks;
        private final double thresholdMs;

        public LongTasksResult(Severity severity, List<Finding> findings,
                               List<AttributedTask> tasks, double thresholdMs) {
            super(NAME, severity, findings);
            this.tasks = List.copyOf(tasks);
            this.thresholdMs = thresholdMs;
        }

        /**
         * The long tasks, longest first
         */
        public List<AttributedTask> getTasks() {
            return tasks;
        }

        public int getTaskCount() {
            return tasks.size();
        }

        public double getThresholdMs() {
            return thresholdMs;
        }

        /**
         * Summary phrase ("N long tasks found"), empty when no long task was found
         */
        public Optional<String> displayValue() {
            return formatDisplayValue(tasks.size());
        }

        @JsonInclude(JsonInclude.Include.NON_NULL)
        public @Nullable String getDisplayValue() {
            return displayValue().orElse(null);
        }

        /**
         * Total duration of the reported tasks
         */
        public double getTotalDuration() {
            return tasks.stream().mapToDouble(AttributedTask::duration).sum();
        }

        @Override
        public String getSummary() {
            return displayValue().orElse("No long tasks found");
        }
    }
}
