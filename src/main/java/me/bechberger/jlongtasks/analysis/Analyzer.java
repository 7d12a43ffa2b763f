package me.bechberger.jlongtasks.analysis;

import org.jetbrains.annotations.NotNull;

/**
 * Base interface for all analyzers.
 * Each analyzer turns one trace input into a specific report.
 *
 * @param <R> The type of result this analyzer produces
 */
public interface Analyzer<R extends AnalysisResult> {

    /**
     * Get the unique name of this analyzer
     */
    @NotNull String getName();

    /**
     * Get a description of what this analyzer does
     */
    @NotNull String getDescription();

    /**
     * Check if this analyzer can operate on the given context
     */
    boolean canAnalyze(@NotNull AnalysisContext context);

    /**
     * Perform the analysis on the given context
     *
     * @param context The analysis context containing the input and options
     * @return The analysis result
     * @throws IllegalArgumentException if canAnalyze() returns false
     */
    @NotNull R analyze(@NotNull AnalysisContext context);

    /**
     * Get the priority of this analyzer (higher = runs first).
     * Used for ordering when running multiple analyzers.
     */
    default int getPriority() {
        return 0;
    }

    /**
     * Check if this analyzer uses the network records of the input
     */
    default boolean requiresNetworkRecords() {
        return false;
    }
}
