package me.bechberger.jlongtasks.analysis;

import me.bechberger.jlongtasks.analysis.cache.CacheKey;
import me.bechberger.jlongtasks.analysis.cache.ComputedCache;
import me.bechberger.jlongtasks.analysis.cache.InMemoryComputedCache;
import me.bechberger.jlongtasks.model.NetworkRecord;
import me.bechberger.jlongtasks.model.TaskForest;
import me.bechberger.jlongtasks.model.TaskNode;
import me.bechberger.jlongtasks.model.TraceInput;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Context for analysis operations, holding one trace input, the options and
 * the cache for artifacts derived from the input.
 */
public class AnalysisContext {

    static final String JAVASCRIPT_URLS = "JavaScriptUrls";
    static final String LONG_TASKS = "LongTasks";

    private final TraceInput input;
    private final AnalysisOptions options;
    private final ComputedCache cache;

    private AnalysisContext(TraceInput input, AnalysisOptions options, ComputedCache cache) {
        this.input = Objects.requireNonNull(input, "input");
        this.options = options != null ? options : AnalysisOptions.defaults();
        this.cache = cache != null ? cache : new InMemoryComputedCache();
    }

    /**
     * Create a context with default options and a private cache
     */
    public static AnalysisContext of(@NotNull TraceInput input) {
        return new AnalysisContext(input, null, null);
    }

    /**
     * Create a context with options and a private cache
     */
    public static AnalysisContext of(@NotNull TraceInput input, @NotNull AnalysisOptions options) {
        return new AnalysisContext(input, options, null);
    }

    /**
     * Create a context sharing a cache with other contexts
     */
    public static AnalysisContext of(@NotNull TraceInput input, @NotNull AnalysisOptions options,
                                     @NotNull ComputedCache cache) {
        return new AnalysisContext(input, options, cache);
    }

    // --- Getters ---

    public TraceInput getInput() {
        return input;
    }

    public TaskForest getForest() {
        return input.forest();
    }

    public List<NetworkRecord> getNetworkRecords() {
        return input.networkRecords();
    }

    public boolean hasNetworkRecords() {
        return !input.networkRecords().isEmpty();
    }

    public AnalysisOptions getOptions() {
        return options;
    }

    public ComputedCache getCache() {
        return cache;
    }

    // --- Computed artifacts ---

    /**
     * URLs of the scripts loaded by the page, empty if network records are disabled
     */
    @SuppressWarnings("unchecked")
    public Set<String> getJavaScriptUrls() {
        if (!options.isUseNetworkRecords()) {
            return Set.of();
        }
        return cache.getOrCompute(key(JAVASCRIPT_URLS), Set.class,
                () -> UrlAttributor.getJavaScriptUrls(input.networkRecords()));
    }

    /**
     * The long tasks of the forest for the configured threshold, longest first
     */
    @SuppressWarnings("unchecked")
    public List<TaskNode> getLongTasks() {
        double threshold = options.getLongTaskThresholdMs();
        return cache.getOrCompute(key(LONG_TASKS + "@" + threshold), List.class,
                () -> TaskSelector.selectLongTasks(input.forest(), threshold));
    }

    private CacheKey key(String computation) {
        return new CacheKey(computation, input.identity());
    }
}
