package me.bechberger.jlongtasks.view;

import me.bechberger.jlongtasks.analysis.AnalysisResult;
import me.bechberger.jlongtasks.view.views.*;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Factory for creating and selecting ViewRenderers.
 * Provides convenient access to the renderer registry with auto-initialization.
 */
public class ViewRendererFactory {

    private static volatile boolean initialized = false;
    private static final Object initLock = new Object();

    private ViewRendererFactory() {
    }

    /**
     * Initialize the factory by registering all built-in renderers
     */
    public static void initialize() {
        if (initialized) return;

        synchronized (initLock) {
            if (initialized) return;

            ViewRendererRegistry registry = ViewRendererRegistry.getInstance();
            registry.register(new LongTasksView());
            registry.register(new MainThreadTasksView());
            registry.register(new CompositeView(registry));
            registry.register(new GenericResultView());

            initialized = true;
        }
    }

    /**
     * Get the best renderer for a result type and format
     */
    @Nullable
    public static ViewRenderer getRenderer(@NotNull AnalysisResult result, @NotNull OutputFormat format) {
        initialize();
        return ViewRendererRegistry.getInstance().findBestRenderer(result, format);
    }

    /**
     * Render a result using the best available renderer
     */
    @NotNull
    public static String render(@NotNull AnalysisResult result, @NotNull OutputOptions options) {
        ViewRenderer renderer = getRenderer(result, options.getFormat());
        if (renderer == null) {
            return result.getSummary();
        }
        return renderer.render(result, options);
    }

    @NotNull
    public static String render(@NotNull AnalysisResult result, @NotNull OutputFormat format) {
        return render(result, OutputOptions.builder().format(format).noColor().build());
    }

    /**
     * Reset the factory (mainly for testing)
     */
    public static void reset() {
        synchronized (initLock) {
            ViewRendererRegistry.getInstance().clear();
            initialized = false;
        }
    }
}
