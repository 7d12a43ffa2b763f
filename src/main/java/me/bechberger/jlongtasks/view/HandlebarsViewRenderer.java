package me.bechberger.jlongtasks.view;

import me.bechberger.jlongtasks.analysis.AnalysisResult;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ViewRenderer implementation that uses Handlebars templates for TEXT and HTML output.
 * Extends AbstractViewRenderer to inherit JSON/YAML serialization.
 */
public class HandlebarsViewRenderer extends AbstractViewRenderer {

    private final String templateName;
    private final Class<? extends AnalysisResult>[] resultTypes;

    /**
     * Create a renderer using {@code templates/cli/<templateName>.hbs} and
     * {@code templates/html/<templateName>.hbs}
     */
    @SafeVarargs
    public HandlebarsViewRenderer(String name, String templateName,
                                  Class<? extends AnalysisResult>... resultTypes) {
        super(name);
        this.templateName = templateName;
        this.resultTypes = resultTypes;
    }

    @Override
    public Class<? extends AnalysisResult>[] getResultTypes() {
        return resultTypes != null && resultTypes.length > 0 ? resultTypes : super.getResultTypes();
    }

    @Override
    protected String renderText(@NotNull AnalysisResult result, @NotNull OutputOptions options) {
        return renderTemplate(result, options);
    }

    @Override
    protected String renderHtml(@NotNull AnalysisResult result, @NotNull OutputOptions options) {
        return renderTemplate(result, options);
    }

    private String renderTemplate(AnalysisResult result, OutputOptions options) {
        try {
            Map<String, Object> context = buildContext(result, options);
            return HandlebarsEngine.getInstance().render(templateName, context, options);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render " + options.getFormat() + " template: " + templateName, e);
        }
    }

    /**
     * Build the context map for template rendering.
     * Subclasses can override to add custom data.
     */
    protected Map<String, Object> buildContext(@NotNull AnalysisResult result, @NotNull OutputOptions options) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("result", result);
        context.put("analyzerName", result.getAnalyzerName());
        context.put("timestamp", result.getTimestamp());
        context.put("severity", result.getSeverity());
        context.put("findings", result.getFindings());
        context.put("summary", result.getSummary());
        context.put("hasFindings", result.hasFindings());

        context.put("options", options);
        context.put("colorEnabled", options.isColorEnabled());
        context.put("verbose", options.isVerbose());
        context.put("maxUrlLength", options.getMaxUrlLength());
        return context;
    }
}
