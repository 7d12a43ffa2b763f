package me.bechberger.jlongtasks.analysis.cache;

import org.jetbrains.annotations.NotNull;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Cache for artifacts computed from an analysis input, shared by all analyzers of a run
 * so that the same input is not processed twice.
 */
public interface ComputedCache {

    /**
     * Get a cached value
     *
     * @throws ClassCastException if the cached value is not of the requested type
     */
    <V> Optional<V> get(@NotNull CacheKey key, @NotNull Class<V> type);

    /**
     * Store a value, replacing any previous value for the key
     */
    void put(@NotNull CacheKey key, @NotNull Object value);

    /**
     * Get the cached value or compute and store it.
     * Exceptions of {@code compute} propagate unchanged and nothing is cached.
     */
    default <V> V getOrCompute(@NotNull CacheKey key, @NotNull Class<V> type, @NotNull Supplier<V> compute) {
        Optional<V> cached = get(key, type);
        if (cached.isPresent()) {
            return cached.get();
        }
        V value = compute.get();
        put(key, value);
        return value;
    }

    /**
     * A cache that never stores anything
     */
    static ComputedCache none() {
        return NoCache.INSTANCE;
    }

    final class NoCache implements ComputedCache {
        private static final NoCache INSTANCE = new NoCache();

        private NoCache() {
        }

        @Override
        public <V> Optional<V> get(@NotNull CacheKey key, @NotNull Class<V> type) {
            return Optional.empty();
        }

        @Override
        public void put(@NotNull CacheKey key, @NotNull Object value) {
        }
    }
}
