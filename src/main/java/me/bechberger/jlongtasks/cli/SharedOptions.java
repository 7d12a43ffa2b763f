package me.bechberger.jlongtasks.cli;

import me.bechberger.jlongtasks.analysis.AnalysisOptions;
import me.bechberger.jlongtasks.view.OutputFormat;
import me.bechberger.jlongtasks.view.OutputOptions;
import picocli.CommandLine.Option;

/**
 * Shared command options mixin.
 * Use with @Mixin annotation in commands.
 */
public class SharedOptions {

    @Option(names = {"--color"}, description = "Force colored output", negatable = true)
    private Boolean colorEnabled = null;

    @Option(names = {"-o", "--output"}, description = "Output format: text, json, yaml, html (default: ${DEFAULT-VALUE})")
    private String outputFormat = "text";

    @Option(names = {"-t", "--threshold"}, description = "Minimum duration of a long task in ms (default: ${DEFAULT-VALUE})")
    private double thresholdMs = AnalysisOptions.DEFAULT_LONG_TASK_THRESHOLD_MS;

    @Option(names = {"--ignore-network"}, description = "Attribute tasks without using the network records")
    private boolean ignoreNetworkRecords = false;

    @Option(names = {"--max-rows"}, description = "Maximum number of task rows to show in text and html output")
    private Integer maxRows = null;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose = false;

    @Option(names = {"-q", "--quiet"}, description = "Minimal output (only the summary)")
    private boolean quiet = false;

    // Getters

    public Boolean getColorEnabled() {
        return colorEnabled;
    }

    public String getOutputFormat() {
        return outputFormat;
    }

    public double getThresholdMs() {
        return thresholdMs;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Build AnalysisOptions from shared options
     *
     * @throws IllegalArgumentException for a negative or non-finite threshold
     */
    public AnalysisOptions buildAnalysisOptions() {
        return AnalysisOptions.builder()
                .longTaskThresholdMs(thresholdMs)
                .useNetworkRecords(!ignoreNetworkRecords)
                .build();
    }

    /**
     * Build OutputOptions from shared options
     *
     * @throws IllegalArgumentException for an unknown output format or a non-positive row limit
     */
    public OutputOptions buildOutputOptions() {
        OutputOptions.Builder builder = OutputOptions.builder()
                .format(OutputFormat.fromString(outputFormat))
                .verbose(verbose);

        if (colorEnabled != null) {
            if (colorEnabled) {
                builder.forceColor();
            } else {
                builder.noColor();
            }
        }
        if (maxRows != null) {
            builder.maxRows(maxRows);
        }

        return builder.build();
    }

    /**
     * Print verbose message if verbose mode is enabled
     */
    public void verboseLog(String message) {
        if (verbose) {
            System.err.println(message);
        }
    }

    /**
     * Print error message
     */
    public void errorLog(String message) {
        System.err.println("Error: " + message);
    }

    /**
     * Print warning message
     */
    public void warnLog(String message) {
        System.err.println("Warning: " + message);
    }
}
