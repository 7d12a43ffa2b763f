package me.bechberger.jlongtasks.view.views;

import me.bechberger.jlongtasks.analysis.AnalysisResult;
import me.bechberger.jlongtasks.analysis.analyzers.MainThreadTasksAnalyzer;
import me.bechberger.jlongtasks.view.HandlebarsEngine;
import me.bechberger.jlongtasks.view.HandlebarsViewRenderer;
import me.bechberger.jlongtasks.view.OutputOptions;
import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * View renderer for MainThreadTasksAnalyzer results, a start/end timeline of the listed tasks.
 */
public class MainThreadTasksView extends HandlebarsViewRenderer {

    private static final double GRANULARITY_MS = 1;

    public MainThreadTasksView() {
        super("main-thread-tasks", "main-thread-tasks", MainThreadTasksAnalyzer.MainThreadTasksResult.class);
    }

    @Override
    protected Map<String, Object> buildContext(@NotNull AnalysisResult result, @NotNull OutputOptions options) {
        Map<String, Object> context = super.buildContext(result, options);

        if (result instanceof MainThreadTasksAnalyzer.MainThreadTasksResult tasks) {
            List<Map<String, Object>> rows = TaskRows.format(tasks.getTasks(), GRANULARITY_MS, options);
            context.put("rows", rows);
            context.put("hasTasks", !rows.isEmpty());
            context.put("taskCount", tasks.getTasks().size());
            context.put("totalTaskCount", tasks.getTotalTaskCount());
            int hidden = TaskRows.hiddenCount(tasks.getTasks(), options);
            context.put("hiddenCount", hidden);
            context.put("hasHidden", hidden > 0);
            context.put("span", HandlebarsEngine.formatMs(tasks.getSpanMs(), 1));
            context.put("urlWidth", TaskRows.urlWidth(rows));
        }

        return context;
    }
}
