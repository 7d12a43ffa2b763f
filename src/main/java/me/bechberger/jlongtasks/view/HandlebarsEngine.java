package me.bechberger.jlongtasks.view;

import com.github.jknack.handlebars.Handlebars;
import com.github.jknack.handlebars.Helper;
import com.github.jknack.handlebars.Options;
import com.github.jknack.handlebars.Template;
import com.github.jknack.handlebars.io.ClassPathTemplateLoader;
import com.github.jknack.handlebars.io.TemplateLoader;
import me.bechberger.jlongtasks.analysis.AnalysisResult;
import org.fusesource.jansi.Ansi;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Singleton wrapper around Handlebars template engine.
 * Provides template loading, caching, and custom helpers for CLI/HTML output.
 */
public class HandlebarsEngine {

    private static volatile HandlebarsEngine instance;

    private final Handlebars cliHandlebars;
    private final Handlebars htmlHandlebars;
    private final Map<String, Template> templateCache = new ConcurrentHashMap<>();

    private HandlebarsEngine() {
        TemplateLoader cliLoader = new ClassPathTemplateLoader("/templates/cli", ".hbs");
        TemplateLoader htmlLoader = new ClassPathTemplateLoader("/templates/html", ".hbs");

        this.cliHandlebars = new Handlebars(cliLoader).prettyPrint(true);
        this.htmlHandlebars = new Handlebars(htmlLoader).prettyPrint(true);

        registerHelpers(cliHandlebars);
        registerHelpers(htmlHandlebars);
    }

    public static HandlebarsEngine getInstance() {
        if (instance == null) {
            synchronized (HandlebarsEngine.class) {
                if (instance == null) {
                    instance = new HandlebarsEngine();
                }
            }
        }
        return instance;
    }

    /**
     * The engine used for TEXT templates
     */
    Handlebars getHandlebars() {
        return cliHandlebars;
    }

    private Handlebars getHandlebarsForFormat(OutputFormat format) {
        return format == OutputFormat.HTML ? htmlHandlebars : cliHandlebars;
    }

    /**
     * Get a compiled template by name for the specified format
     */
    public Template getTemplate(String name, OutputFormat format) throws IOException {
        String cacheKey = format.name() + "/" + name;
        try {
            return templateCache.computeIfAbsent(cacheKey, k -> {
                try {
                    return getHandlebarsForFormat(format).compile(name);
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed to compile template: " + k, e);
                }
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    /**
     * Render a template with the given context and output options
     */
    public String render(String templateName, Object context, OutputOptions options) throws IOException {
        Map<String, Object> fullContext = new HashMap<>();
        if (context instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> contextMap = (Map<String, Object>) context;
            fullContext.putAll(contextMap);
        } else {
            fullContext.put("data", context);
        }
        fullContext.put("options", options);
        fullContext.put("colorEnabled", options.isColorEnabled());
        fullContext.put("verbose", options.isVerbose());

        Template template = getTemplate(templateName, options.getFormat());
        return template.apply(fullContext);
    }

    /**
     * Format milliseconds rounded to the given granularity, e.g. {@code 1,250 ms}
     */
    public static String formatMs(double millis, double granularity) {
        double rounded = granularity > 0 ? Math.round(millis / granularity) * granularity : millis;
        if (granularity >= 1) {
            return String.format(Locale.US, "%,.0f ms", rounded);
        }
        return String.format(Locale.US, "%,.1f ms", rounded);
    }

    /**
     * Shorten text to at most {@code maxLength} characters, keeping the end (the file name of a URL)
     */
    public static String shorten(String text, int maxLength) {
        if (text == null) return "";
        if (text.length() <= maxLength) return text;
        String ellipsis = "...";
        return ellipsis + text.substring(text.length() - (maxLength - ellipsis.length()));
    }

    private void registerHelpers(Handlebars hb) {
        // Color helpers
        hb.registerHelper("red", colorHelper(Ansi.Color.RED));
        hb.registerHelper("green", colorHelper(Ansi.Color.GREEN));
        hb.registerHelper("yellow", colorHelper(Ansi.Color.YELLOW));
        hb.registerHelper("cyan", colorHelper(Ansi.Color.CYAN));

        hb.registerHelper("bold", (Object text, Options options) -> {
            String textStr = text != null ? text.toString() : "";
            if (getColorEnabled(options)) {
                return Ansi.ansi().bold().a(textStr).reset().toString();
            }
            return textStr;
        });

        hb.registerHelper("dim", (Object text, Options options) -> {
            String textStr = text != null ? text.toString() : "";
            if (getColorEnabled(options)) {
                return Ansi.ansi().a(Ansi.Attribute.INTENSITY_FAINT).a(textStr).reset().toString();
            }
            return textStr;
        });

        hb.registerHelper("severityColor", (AnalysisResult.Severity severity, Options options) -> {
            if (severity == null) return "OK";
            String text = severity.toString();
            if (!getColorEnabled(options)) return text;

            return switch (severity) {
                case ERROR -> Ansi.ansi().fgRed().a(text).reset().toString();
                case WARNING -> Ansi.ansi().fgYellow().a(text).reset().toString();
                case INFO -> Ansi.ansi().fgCyan().a(text).reset().toString();
                case OK -> Ansi.ansi().fgGreen().a(text).reset().toString();
            };
        });

        // Formatting helpers
        hb.registerHelper("pad", (Object text, Options options) -> {
            int width = options.hash("width", 20);
            String align = options.hash("align", "left");
            String textStr = text != null ? text.toString() : "";

            if ("right".equals(align)) {
                return String.format("%" + width + "s", textStr);
            }
            return String.format("%-" + width + "s", textStr);
        });

        hb.registerHelper("repeat", (Object text, Options options) -> {
            int count = options.hash("count", 1);
            String textStr = text != null ? text.toString() : "";
            return textStr.repeat(count);
        });

        hb.registerHelper("formatMs", (Number millis, Options options) -> {
            if (millis == null) return "N/A";
            Number granularity = options.hash("granularity", 1);
            return formatMs(millis.doubleValue(), granularity.doubleValue());
        });

        hb.registerHelper("shorten", (Object text, Options options) -> {
            int maxLength = options.hash("length", 80);
            return shorten(text != null ? text.toString() : "", maxLength);
        });

        hb.registerHelper("addOne", (Integer index, Options options) -> index + 1);

        hb.registerHelper("lowercase", (Object text, Options options) -> {
            if (text == null) return "";
            return text.toString().toLowerCase(Locale.ROOT);
        });
    }

    private Helper<Object> colorHelper(Ansi.Color color) {
        return (Object text, Options options) -> {
            String textStr = text != null ? text.toString() : "";
            if (getColorEnabled(options)) {
                return Ansi.ansi().fg(color).a(textStr).reset().toString();
            }
            return textStr;
        };
    }

    private boolean getColorEnabled(Options options) {
        Boolean colorParam = options.hash("color");
        if (colorParam != null) return colorParam;

        Object colorEnabled = options.context.get("colorEnabled");
        if (colorEnabled instanceof Boolean enabled) return enabled;

        Object opts = options.context.get("options");
        if (opts instanceof OutputOptions outputOptions) {
            return outputOptions.isColorEnabled();
        }
        return false;
    }

    /**
     * Clear the template cache (useful for testing or hot-reload scenarios)
     */
    public void clearCache() {
        templateCache.clear();
    }
}
