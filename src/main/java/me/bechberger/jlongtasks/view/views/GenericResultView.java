package me.bechberger.jlongtasks.view.views;

import me.bechberger.jlongtasks.analysis.AnalysisResult;
import me.bechberger.jlongtasks.view.HandlebarsViewRenderer;
import me.bechberger.jlongtasks.view.OutputOptions;
import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * Generic view renderer for any AnalysisResult.
 * Provides a basic representation of findings and summary.
 */
public class GenericResultView extends HandlebarsViewRenderer {

    public GenericResultView() {
        super("generic", "generic", AnalysisResult.class);
    }

    @Override
    protected Map<String, Object> buildContext(@NotNull AnalysisResult result, @NotNull OutputOptions options) {
        Map<String, Object> context = super.buildContext(result, options);

        List<Map<String, Object>> formattedFindings = new ArrayList<>();
        for (AnalysisResult.Finding finding : result.getFindings()) {
            formattedFindings.add(formatFinding(finding, options));
        }
        context.put("formattedFindings", formattedFindings);

        Map<AnalysisResult.Severity, Integer> findingsBySeverity = new EnumMap<>(AnalysisResult.Severity.class);
        for (AnalysisResult.Finding finding : result.getFindings()) {
            findingsBySeverity.merge(finding.severity(), 1, Integer::sum);
        }
        context.put("findingsBySeverity", findingsBySeverity);

        return context;
    }

    private Map<String, Object> formatFinding(AnalysisResult.Finding finding, OutputOptions options) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("severity", finding.severity());
        info.put("category", finding.category());
        info.put("message", finding.message());

        // Details only in verbose mode, they repeat the message
        if (options.isVerbose() && finding.details() != null && !finding.details().isEmpty()) {
            List<String> details = new ArrayList<>();
            finding.details().forEach((key, value) -> details.add(key + ": " + value));
            info.put("details", details);
        }
        return info;
    }
}
