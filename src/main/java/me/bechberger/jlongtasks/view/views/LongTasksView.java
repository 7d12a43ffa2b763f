package me.bechberger.jlongtasks.view.views;

import me.bechberger.jlongtasks.analysis.AnalysisResult;
import me.bechberger.jlongtasks.analysis.analyzers.LongTasksAnalyzer;
import me.bechberger.jlongtasks.view.HandlebarsEngine;
import me.bechberger.jlongtasks.view.HandlebarsViewRenderer;
import me.bechberger.jlongtasks.view.OutputOptions;
import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * View renderer for LongTasksAnalyzer results.
 * Shows the ranked long tasks with the URL each one is attributed to.
 */
public class LongTasksView extends HandlebarsViewRenderer {

    private static final double GRANULARITY_MS = 10;

    public LongTasksView() {
        super("long-tasks", "long-tasks", LongTasksAnalyzer.LongTasksResult.class);
    }

    @Override
    protected Map<String, Object> buildContext(@NotNull AnalysisResult result, @NotNull OutputOptions options) {
        Map<String, Object> context = super.buildContext(result, options);

        if (result instanceof LongTasksAnalyzer.LongTasksResult longTasks) {
            List<Map<String, Object>> rows = TaskRows.format(longTasks.getTasks(), GRANULARITY_MS, options);
            context.put("rows", rows);
            context.put("hasTasks", !rows.isEmpty());
            context.put("taskCount", longTasks.getTaskCount());
            int hidden = TaskRows.hiddenCount(longTasks.getTasks(), options);
            context.put("hiddenCount", hidden);
            context.put("hasHidden", hidden > 0);
            context.put("displayValue", longTasks.getDisplayValue());
            context.put("threshold", HandlebarsEngine.formatMs(longTasks.getThresholdMs(), 1));
            context.put("totalDuration", HandlebarsEngine.formatMs(longTasks.getTotalDuration(), 1));
            context.put("urlWidth", TaskRows.urlWidth(rows));
        }

        return context;
    }
}
