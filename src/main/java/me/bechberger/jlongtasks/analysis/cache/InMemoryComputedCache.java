package me.bechberger.jlongtasks.analysis.cache;

import org.jetbrains.annotations.NotNull;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Thread-safe in-memory {@link ComputedCache}
 */
public class InMemoryComputedCache implements ComputedCache {

    private final Map<CacheKey, Object> values = new ConcurrentHashMap<>();

    @Override
    public <V> Optional<V> get(@NotNull CacheKey key, @NotNull Class<V> type) {
        Object value = values.get(key);
        return value == null ? Optional.empty() : Optional.of(type.cast(value));
    }

    @Override
    public void put(@NotNull CacheKey key, @NotNull Object value) {
        values.put(key, Objects.requireNonNull(value, "value"));
    }

    /**
     * Computes at most once per key, concurrent callers for the same key wait for the first one
     */
    @Override
    public <V> V getOrCompute(@NotNull CacheKey key, @NotNull Class<V> type, @NotNull Supplier<V> compute) {
        return type.cast(values.computeIfAbsent(key, k -> compute.get()));
    }

    public int size() {
        return values.size();
    }

    public void clear() {
        values.clear();
    }
}
