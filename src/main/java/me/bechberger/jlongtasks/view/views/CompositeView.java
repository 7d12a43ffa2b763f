package me.bechberger.jlongtasks.view.views;

import me.bechberger.jlongtasks.analysis.AnalysisResult;
import me.bechberger.jlongtasks.view.*;
import org.jetbrains.annotations.NotNull;

import java.util.Locale;

/**
 * View renderer for CompositeResult that combines multiple analysis results.
 * Renders each sub-result using its appropriate renderer.
 */
public class CompositeView extends AbstractViewRenderer {

    private static final String HEADER = "═".repeat(79);
    private static final String SUB_HEADER = "─".repeat(79);

    private final ViewRendererRegistry registry;

    public CompositeView() {
        this(ViewRendererRegistry.getInstance());
    }

    public CompositeView(ViewRendererRegistry registry) {
        super("composite");
        this.registry = registry;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Class<? extends AnalysisResult>[] getResultTypes() {
        return new Class[] { AnalysisResult.CompositeResult.class };
    }

    @Override
    protected String renderText(@NotNull AnalysisResult result, @NotNull OutputOptions options) {
        if (!(result instanceof AnalysisResult.CompositeResult composite)) {
            return result.getSummary();
        }

        StringBuilder sb = new StringBuilder();
        sb.append(OutputOptions.Colors.bold(HEADER, options)).append("\n");
        sb.append(OutputOptions.Colors.bold("                         LONG TASK REPORT", options)).append("\n");
        sb.append(OutputOptions.Colors.bold(HEADER, options)).append("\n\n");

        AnalysisResult.Severity severity = composite.getSeverity();
        sb.append("Overall Severity: ")
          .append(OutputOptions.Colors.severity(severity, severity.toString(), options))
          .append("\n");
        sb.append("Analyzers Run: ").append(composite.getResults().size()).append("\n\n");

        for (AnalysisResult subResult : composite.getResults()) {
            sb.append(OutputOptions.Colors.cyan(SUB_HEADER, options)).append("\n");
            sb.append(OutputOptions.Colors.bold(subResult.getAnalyzerName(), options)).append("\n");
            sb.append(OutputOptions.Colors.cyan(SUB_HEADER, options)).append("\n\n");

            ViewRenderer renderer = registry.findBestRenderer(subResult, OutputFormat.TEXT);
            if (renderer != null && renderer != this) { // Avoid infinite recursion
                sb.append(renderer.render(subResult, options));
            } else {
                sb.append("Severity: ")
                  .append(OutputOptions.Colors.severity(subResult.getSeverity(),
                          subResult.getSeverity().toString(), options))
                  .append("\n");
                sb.append("Summary: ").append(subResult.getSummary()).append("\n");
            }
            sb.append("\n");
        }

        sb.append(OutputOptions.Colors.bold(HEADER, options)).append("\n");
        return sb.toString();
    }

    @Override
    protected String renderHtml(@NotNull AnalysisResult result, @NotNull OutputOptions options) {
        if (!(result instanceof AnalysisResult.CompositeResult composite)) {
            return "<p>" + escapeHtml(result.getSummary()) + "</p>";
        }

        StringBuilder sb = new StringBuilder();
        sb.append("<!DOCTYPE html>\n<html lang=\"en\">\n<head>\n");
        sb.append("<meta charset=\"UTF-8\">\n");
        sb.append("<meta name=\"viewport\" content=\"width=device-width, initial-scale=1.0\">\n");
        sb.append("<title>Long Task Report - jlongtasks</title>\n");
        sb.append("<style>\n");
        appendCss(sb);
        sb.append("</style>\n");
        sb.append("</head>\n<body>\n");

        sb.append("<header>\n");
        sb.append("<h1>Long Task Report</h1>\n");
        sb.append("<div class=\"overall-severity severity-")
          .append(composite.getSeverity().name().toLowerCase(Locale.ROOT))
          .append("\">Overall: ").append(composite.getSeverity()).append("</div>\n");
        sb.append("</header>\n\n");

        sb.append("<nav>\n<ul>\n");
        for (AnalysisResult subResult : composite.getResults()) {
            sb.append("<li><a href=\"#").append(toId(subResult.getAnalyzerName())).append("\">")
              .append(escapeHtml(subResult.getAnalyzerName())).append("</a></li>\n");
        }
        sb.append("</ul>\n</nav>\n\n");

        sb.append("<main>\n");
        for (AnalysisResult subResult : composite.getResults()) {
            sb.append("<section id=\"").append(toId(subResult.getAnalyzerName()))
              .append("\" class=\"result-section\">\n");
            sb.append("<h2>").append(escapeHtml(subResult.getAnalyzerName())).append("</h2>\n");

            ViewRenderer renderer = registry.findBestRenderer(subResult, OutputFormat.HTML);
            if (renderer != null && renderer != this) {
                sb.append(renderer.render(subResult, options));
            } else {
                sb.append("<p class=\"summary\">").append(escapeHtml(subResult.getSummary())).append("</p>\n");
            }
            sb.append("</section>\n\n");
        }
        sb.append("</main>\n\n");

        sb.append("<footer>\n");
        sb.append("<p>Generated by jlongtasks at ").append(result.getTimestamp()).append("</p>\n");
        sb.append("</footer>\n");
        sb.append("</body>\n</html>");
        return sb.toString();
    }

    private void appendCss(StringBuilder sb) {
        sb.append("""
            :root {
                --color-ok: #28a745;
                --color-info: #17a2b8;
                --color-warning: #ffc107;
                --color-error: #dc3545;
            }
            body {
                font-family: -apple-system, BlinkMacSystemFont, 'Segoe UI', Roboto, sans-serif;
                line-height: 1.6;
                max-width: 1200px;
                margin: 0 auto;
                padding: 20px;
                background: #f5f5f5;
                color: #333;
            }
            header, .result-section {
                background: #fff;
                padding: 20px;
                border-radius: 8px;
                margin-bottom: 20px;
                box-shadow: 0 2px 4px rgba(0,0,0,0.1);
            }
            h1, h2 { margin: 0 0 10px 0; }
            nav ul { list-style: none; padding: 0; display: flex; gap: 15px; flex-wrap: wrap; }
            nav a { color: #0066cc; text-decoration: none; }
            .severity-badge, .overall-severity {
                display: inline-block;
                padding: 4px 12px;
                border-radius: 4px;
                font-weight: bold;
                font-size: 0.9em;
            }
            .severity-ok { background: #d4edda; color: var(--color-ok); }
            .severity-info { background: #d1ecf1; color: var(--color-info); }
            .severity-warning { background: #fff3cd; color: #856404; }
            .severity-error { background: #f8d7da; color: var(--color-error); }
            .summary { color: #666; font-style: italic; }
            table.tasks { border-collapse: collapse; width: 100%; }
            table.tasks th, table.tasks td { text-align: left; padding: 6px 10px; border-bottom: 1px solid #eee; }
            table.tasks td.num, table.tasks th.num { text-align: right; font-variant-numeric: tabular-nums; }
            table.tasks td.url { word-break: break-all; }
            footer { text-align: center; color: #666; padding: 20px; }
            """);
    }

    private String escapeHtml(String text) {
        if (text == null) return "";
        return text.replace("&", "&amp;")
                   .replace("<", "&lt;")
                   .replace(">", "&gt;")
                   .replace("\"", "&quot;")
                   .replace("'", "&#39;");
    }

    private String toId(String name) {
        return name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
    }
}
