package me.bechberger.jlongtasks.view;

import me.bechberger.jlongtasks.analysis.AnalysisResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry for mapping AnalysisResult types to their appropriate ViewRenderer implementations.
 * Falls back to generic renderers for result types without a dedicated one.
 */
public class ViewRendererRegistry {

    private static final ViewRendererRegistry INSTANCE = new ViewRendererRegistry();

    private final Map<Class<? extends AnalysisResult>, List<ViewRenderer>> renderersByType = new ConcurrentHashMap<>();
    private final Map<String, ViewRenderer> renderersByName = new ConcurrentHashMap<>();
    private final List<ViewRenderer> genericRenderers = new CopyOnWriteArrayList<>();

    public ViewRendererRegistry() {
    }

    public static ViewRendererRegistry getInstance() {
        return INSTANCE;
    }

    /**
     * Register a renderer for its result types
     */
    public void register(@NotNull ViewRenderer renderer) {
        renderersByName.put(renderer.getName(), renderer);

        Class<? extends AnalysisResult>[] resultTypes = renderer.getResultTypes();
        if (resultTypes == null || resultTypes.length == 0 ||
            (resultTypes.length == 1 && resultTypes[0] == AnalysisResult.class)) {
            genericRenderers.add(renderer);
        } else {
            for (Class<? extends AnalysisResult> type : resultTypes) {
                renderersByType.computeIfAbsent(type, k -> new CopyOnWriteArrayList<>()).add(renderer);
            }
        }
    }

    @Nullable
    public ViewRenderer getByName(@NotNull String name) {
        return renderersByName.get(name);
    }

    /**
     * Find renderers that can handle the given result type and format, most specific first
     */
    @NotNull
    public List<ViewRenderer> findRenderers(@NotNull Class<? extends AnalysisResult> resultType,
                                            @NotNull OutputFormat format) {
        List<ViewRenderer> matches = new ArrayList<>();

        Class<?> type = resultType;
        while (type != null && AnalysisResult.class.isAssignableFrom(type)) {
            List<ViewRenderer> typeRenderers = renderersByType.get(type);
            if (typeRenderers != null) {
                for (ViewRenderer renderer : typeRenderers) {
                    if (renderer.supports(format) && !matches.contains(renderer)) {
                        matches.add(renderer);
                    }
                }
            }
            type = type.getSuperclass();
        }

        for (ViewRenderer renderer : genericRenderers) {
            if (renderer.supports(format) && !matches.contains(renderer)) {
                matches.add(renderer);
            }
        }

        return matches;
    }

    @Nullable
    public ViewRenderer findBestRenderer(@NotNull AnalysisResult result, @NotNull OutputFormat format) {
        List<ViewRenderer> renderers = findRenderers(result.getClass(), format);
        return renderers.isEmpty() ? null : renderers.get(0);
    }

    @NotNull
    public Set<String> getRendererNames() {
        return Collections.unmodifiableSet(renderersByName.keySet());
    }

    /**
     * Clear all registrations
     */
    public void clear() {
        renderersByType.clear();
        renderersByName.clear();
        genericRenderers.clear();
    }
}
