package me.bechberger.jlongtasks.analysis;

import me.bechberger.jlongtasks.analysis.cache.CacheKey;
import me.bechberger.jlongtasks.analysis.cache.ComputedCache;
import me.bechberger.jlongtasks.analysis.cache.InMemoryComputedCache;
import me.bechberger.jlongtasks.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AnalysisContext and AnalysisOptions
 */
class AnalysisContextTest {

    private static final String APP_JS = "https://example.com/app.js";

    private static TraceInput input(String identity) {
        TaskForest forest = TaskForest.of(
                TaskNode.builder("RunTask", 0, 120).attributableUrl(APP_JS).build(),
                TaskNode.builder("RunTask", 200, 70).build(),
                TaskNode.builder("RunTask", 300, 20).build());
        return new TraceInput(identity, forest, List.of(new NetworkRecord(APP_JS, ResourceType.SCRIPT)));
    }

    @Test
    void shouldUseDefaults() {
        AnalysisContext context = AnalysisContext.of(input("id"));

        assertEquals(AnalysisOptions.DEFAULT_LONG_TASK_THRESHOLD_MS, context.getOptions().getLongTaskThresholdMs());
        assertTrue(context.getOptions().isUseNetworkRecords());
        assertInstanceOf(InMemoryComputedCache.class, context.getCache());
        assertTrue(context.hasNetworkRecords());
    }

    @Test
    void shouldStoreJavaScriptUrlsUnderInputIdentity() {
        InMemoryComputedCache cache = new InMemoryComputedCache();
        AnalysisContext context = AnalysisContext.of(input("trace-1"), AnalysisOptions.defaults(), cache);

        Set<String> urls = context.getJavaScriptUrls();

        assertEquals(Set.of(APP_JS), urls);
        assertSame(urls, cache.get(new CacheKey(AnalysisContext.JAVASCRIPT_URLS, "trace-1"), Set.class).orElseThrow());
    }

    @Test
    void shouldReuseCachedArtifactsAcrossContexts() {
        InMemoryComputedCache cache = new InMemoryComputedCache();
        AnalysisContext first = AnalysisContext.of(input("trace-1"), AnalysisOptions.defaults(), cache);
        AnalysisContext second = AnalysisContext.of(input("trace-1"), AnalysisOptions.defaults(), cache);

        assertSame(first.getLongTasks(), second.getLongTasks());
        assertSame(first.getJavaScriptUrls(), second.getJavaScriptUrls());
        assertEquals(2, cache.size());
    }

    @Test
    void shouldKeepSelectionsApartPerThreshold() {
        InMemoryComputedCache cache = new InMemoryComputedCache();
        AnalysisContext defaults = AnalysisContext.of(input("trace-1"), AnalysisOptions.defaults(), cache);
        AnalysisContext strict = AnalysisContext.of(input("trace-1"),
                AnalysisOptions.builder().longTaskThresholdMs(100).build(), cache);

        assertEquals(2, defaults.getLongTasks().size());
        assertEquals(1, strict.getLongTasks().size());
    }

    @Test
    void shouldComputeEveryTimeWithoutCache() {
        AnalysisContext context = AnalysisContext.of(input("trace-1"), AnalysisOptions.defaults(), ComputedCache.none());

        assertEquals(context.getLongTasks(), context.getLongTasks());
        assertNotSame(context.getJavaScriptUrls(), context.getJavaScriptUrls());
    }

    @Test
    void shouldIgnoreNetworkRecordsWhenDisabled() {
        AnalysisContext context = AnalysisContext.of(input("trace-1"),
                AnalysisOptions.builder().useNetworkRecords(false).build());

        assertTrue(context.getJavaScriptUrls().isEmpty());
    }

    @Test
    void shouldRejectInvalidThreshold() {
        assertThrows(IllegalArgumentException.class, () -> AnalysisOptions.builder().longTaskThresholdMs(-1));
        assertThrows(IllegalArgumentException.class,
                () -> AnalysisOptions.builder().longTaskThresholdMs(Double.NaN));
        assertEquals(0, AnalysisOptions.builder().longTaskThresholdMs(0).build().getLongTaskThresholdMs());
    }
}
