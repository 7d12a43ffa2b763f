package me.bechberger.jlongtasks.analysis.analyzers;

import me.bechberger.jlongtasks.analysis.*;
import me.bechberger.jlongtasks.model.AttributedTask;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Locale;

/**
 * Analyzer that lists the top-level main-thread tasks of the page load with their
 * start and end times. Selection and attribution match {@link LongTasksAnalyzer}.
 */
public class MainThreadTasksAnalyzer implements Analyzer<MainThreadTasksAnalyzer.MainThreadTasksResult> {

    private static final String NAME = "MainThreadTasksAnalyzer";

    @Override
    public @NotNull String getName() {
        return NAME;
    }

    @Override
    public @NotNull String getDescription() {
        return "Lists the toplevel main thread tasks that executed during page load";
    }

    @Override
    public boolean canAnalyze(@NotNull AnalysisContext context) {
        return true;
    }

    @Override
    public int getPriority() {
        return 50;
    }

    @Override
    public boolean requiresNetworkRecords() {
        return true;
    }

    @Override
    public @NotNull MainThreadTasksResult analyze(@NotNull AnalysisContext context) {
        List<AttributedTask> rows = UrlAttributor.attribute(context.getLongTasks(), context.getJavaScriptUrls());
        return new MainThreadTasksResult(rows, context.getForest().getTaskCount());
    }

    public static class MainThreadTasksResult extends AnalysisResult {
        private final List<AttributedTask> tasks;
        private final int totalTaskCount;

        public MainThreadTasksResult(List<AttributedTask> tasks, int totalTaskCount) {
            super(NAME, Severity.OK, List.of());
            this.tasks = List.copyOf(tasks);
            this.totalTaskCount = totalTaskCount;
        }

        public List<AttributedTask> getTasks() {
            return tasks;
        }

        /**
         * Number of tasks in the whole forest, nested ones included
         */
        public int getTotalTaskCount() {
            return totalTaskCount;
        }

        /**
         * Start of the first and end of the last listed task, 0 if nothing is listed
         */
        public double getSpanMs() {
            if (tasks.isEmpty()) {
                return 0;
            }
            double start = tasks.stream().mapToDouble(AttributedTask::start).min().orElse(0);
            double end = tasks.stream().mapToDouble(AttributedTask::end).max().orElse(0);
            return end - start;
        }

        @Override
        public String getSummary() {
            return String.format(Locale.US, "%d of %d tasks listed", tasks.size(), totalTaskCount);
        }
    }
}
