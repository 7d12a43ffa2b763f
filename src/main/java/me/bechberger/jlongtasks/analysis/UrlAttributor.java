package me.bechberger.jlongtasks.analysis;

import me.bechberger.jlongtasks.model.AttributedTask;
import me.bechberger.jlongtasks.model.NetworkRecord;
import me.bechberger.jlongtasks.model.TaskNode;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves which resource caused a task.
 */
public final class UrlAttributor {

    public static final String BROWSER = "Browser";
    public static final String BROWSER_GC = "Browser GC";
    public static final String UNATTRIBUTABLE = "Unattributable";

    static final String ABOUT_BLANK = "about:blank";

    // Plain browser overhead when no script triggered the task
    static final Set<String> BROWSER_TASK_NAMES = Set.of(
            "CpuProfiler::StartProfiling"
    );

    // Garbage collection when no script triggered the task
    static final Set<String> BROWSER_GC_TASK_NAMES = Set.of(
            "V8.GCCompactor",
            "MajorGC",
            "MinorGC"
    );

    private UrlAttributor() {
    }

    /**
     * URLs of all network records that loaded scripts, in request order
     */
    public static Set<String> getJavaScriptUrls(@NotNull List<NetworkRecord> records) {
        Set<String> urls = new LinkedHashSet<>();
        for (NetworkRecord record : records) {
            if (record.isScript()) {
                urls.add(record.url());
            }
        }
        return Collections.unmodifiableSet(urls);
    }

    /**
     * Resolve the URL responsible for a task.
     * <ol>
     *     <li>the first candidate URL that is a known script</li>
     *     <li>otherwise the first candidate URL</li>
     *     <li>without a usable URL ({@code about:blank} is not one): {@value #BROWSER} or
     *     {@value #BROWSER_GC} by the task's event name, else {@value #UNATTRIBUTABLE}</li>
     * </ol>
     */
    public static String getAttributableUrl(@NotNull TaskNode task, @NotNull Set<String> javaScriptUrls) {
        List<String> candidates = task.getAttributableUrls();
        String url = null;
        for (String candidate : candidates) {
            if (javaScriptUrls.contains(candidate)) {
                url = candidate;
                break;
            }
        }
        if (url == null && !candidates.isEmpty()) {
            url = candidates.get(0);
        }

        if (url == null || url.isEmpty() || ABOUT_BLANK.equals(url)) {
            return classifyByEventName(task.getEventName());
        }
        return url;
    }

    /**
     * Build the report rows of the given tasks, keeping their order
     */
    public static List<AttributedTask> attribute(@NotNull List<TaskNode> tasks, @NotNull Set<String> javaScriptUrls) {
        List<AttributedTask> rows = new ArrayList<>(tasks.size());
        for (TaskNode task : tasks) {
            rows.add(new AttributedTask(
                    getAttributableUrl(task, javaScriptUrls),
                    task.getGroup().getLabel(),
                    task.getStartTime(),
                    task.getSelfTime(),
                    task.getDuration()));
        }
        return rows;
    }

    static String classifyByEventName(String eventName) {
        if (BROWSER_TASK_NAMES.contains(eventName)) {
            return BROWSER;
        }
        if (BROWSER_GC_TASK_NAMES.contains(eventName)) {
            return BROWSER_GC;
        }
        return UNATTRIBUTABLE;
    }
}
