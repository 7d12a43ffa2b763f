package me.bechberger.jlongtasks.view;

import me.bechberger.jlongtasks.analysis.AnalysisResult;
import org.fusesource.jansi.Ansi;

/**
 * Options for controlling output rendering.
 */
public class OutputOptions {

    private OutputFormat format = OutputFormat.TEXT;
    private boolean colorEnabled;
    private int maxRows = Integer.MAX_VALUE;
    private int maxUrlLength = 80;
    private boolean verbose = false;

    private OutputOptions() {
        this.colorEnabled = detectColorSupport();
    }

    public static OutputOptions defaults() {
        return new OutputOptions();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static boolean detectColorSupport() {
        String term = System.getenv("TERM");
        String colorTerm = System.getenv("COLORTERM");
        String noColor = System.getenv("NO_COLOR");

        if (noColor != null && !noColor.isEmpty()) {
            return false;
        }

        if (colorTerm != null && !colorTerm.isEmpty()) {
            return true;
        }

        if (term != null) {
            return term.contains("color") || term.contains("xterm") ||
                   term.contains("256") || term.contains("ansi");
        }

        return System.console() != null;
    }

    // Getters
    public OutputFormat getFormat() { return format; }
    public boolean isColorEnabled() { return colorEnabled; }

    /**
     * Maximum number of task rows shown in TEXT and HTML output
     */
    public int getMaxRows() { return maxRows; }

    /**
     * URLs longer than this are shortened in TEXT output
     */
    public int getMaxUrlLength() { return maxUrlLength; }
    public boolean isVerbose() { return verbose; }

    /**
     * ANSI color helpers
     */
    public static class Colors {
        public static String red(String text, OutputOptions options) {
            if (!options.isColorEnabled()) return text;
            return Ansi.ansi().fgRed().a(text).reset().toString();
        }

        public static String green(String text, OutputOptions options) {
            if (!options.isColorEnabled()) return text;
            return Ansi.ansi().fgGreen().a(text).reset().toString();
        }

        public static String yellow(String text, OutputOptions options) {
            if (!options.isColorEnabled()) return text;
            return Ansi.ansi().fgYellow().a(text).reset().toString();
        }

        public static String cyan(String text, OutputOptions options) {
            if (!options.isColorEnabled()) return text;
            return Ansi.ansi().fgCyan().a(text).reset().toString();
        }

        public static String bold(String text, OutputOptions options) {
            if (!options.isColorEnabled()) return text;
            return Ansi.ansi().bold().a(text).reset().toString();
        }

        public static String severity(AnalysisResult.Severity severity, String text, OutputOptions options) {
            return switch (severity) {
                case ERROR -> red(text, options);
                case WARNING -> yellow(text, options);
                case INFO -> cyan(text, options);
                case OK -> green(text, options);
            };
        }
    }

    public static class Builder {
        private final OutputOptions options = new OutputOptions();

        public Builder format(OutputFormat format) {
            options.format = format;
            return this;
        }

        public Builder colorEnabled(boolean enabled) {
            options.colorEnabled = enabled;
            return this;
        }

        public Builder forceColor() {
            options.colorEnabled = true;
            return this;
        }

        public Builder noColor() {
            options.colorEnabled = false;
            return this;
        }

        public Builder maxRows(int max) {
            if (max <= 0) {
                throw new IllegalArgumentException("maxRows must be positive: " + max);
            }
            options.maxRows = max;
            return this;
        }

        public Builder maxUrlLength(int max) {
            if (max < 10) {
                throw new IllegalArgumentException("maxUrlLength must be at least 10: " + max);
            }
            options.maxUrlLength = max;
            return this;
        }

        public Builder verbose(boolean verbose) {
            options.verbose = verbose;
            return this;
        }

        public OutputOptions build() {
            return options;
        }
    }
}
