package me.bechberger.jlongtasks.view.views;

import me.bechberger.jlongtasks.model.AttributedTask;
import me.bechberger.jlongtasks.view.HandlebarsEngine;
import me.bechberger.jlongtasks.view.OutputFormat;
import me.bechberger.jlongtasks.view.OutputOptions;

import java.util.*;

/**
 * Formats attributed task rows for the task table templates.
 */
final class TaskRows {

    private TaskRows() {
    }

    static List<Map<String, Object>> format(List<AttributedTask> tasks, double granularity, OutputOptions options) {
        int shown = Math.min(tasks.size(), options.getMaxRows());
        List<Map<String, Object>> rows = new ArrayList<>(shown);
        for (int i = 0; i < shown; i++) {
            AttributedTask task = tasks.get(i);
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("index", i + 1);
            // HTML keeps the full URL, the terminal table shortens it
            row.put("url", options.getFormat() == OutputFormat.HTML
                    ? task.url()
                    : HandlebarsEngine.shorten(task.url(), options.getMaxUrlLength()));
            row.put("fullUrl", task.url());
            row.put("group", task.group());
            row.put("start", HandlebarsEngine.formatMs(task.start(), granularity));
            row.put("self", HandlebarsEngine.formatMs(task.self(), granularity));
            row.put("duration", HandlebarsEngine.formatMs(task.duration(), granularity));
            row.put("end", HandlebarsEngine.formatMs(task.end(), granularity));
            row.put("durationMs", task.duration());
            rows.add(row);
        }
        return rows;
    }

    static int hiddenCount(List<AttributedTask> tasks, OutputOptions options) {
        return Math.max(0, tasks.size() - options.getMaxRows());
    }

    /**
     * Width of the URL column, at least wide enough for the header
     */
    static int urlWidth(List<Map<String, Object>> rows) {
        int width = "URL".length();
        for (Map<String, Object> row : rows) {
            width = Math.max(width, row.get("url").toString().length());
        }
        return width;
    }
}
