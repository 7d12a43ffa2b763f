package me.bechberger.jlongtasks.analysis;

/**
 * Options for configuring analysis behavior.
 */
public class AnalysisOptions {

    /** Tasks at least this long (ms) are long tasks */
    public static final double DEFAULT_LONG_TASK_THRESHOLD_MS = 50;

    private double longTaskThresholdMs = DEFAULT_LONG_TASK_THRESHOLD_MS;
    private boolean useNetworkRecords = true;

    private AnalysisOptions() {}

    public static AnalysisOptions defaults() {
        return new AnalysisOptions();
    }

    public static Builder builder() {
        return new Builder();
    }

    public double getLongTaskThresholdMs() { return longTaskThresholdMs; }

    /**
     * Whether script URLs from the network records are used for attribution.
     * Without them every task falls back to its first candidate URL.
     */
    public boolean isUseNetworkRecords() { return useNetworkRecords; }

    public static class Builder {
        private final AnalysisOptions options = new AnalysisOptions();

        public Builder longTaskThresholdMs(double ms) {
            if (!Double.isFinite(ms) || ms < 0) {
                throw new IllegalArgumentException("Threshold must be a non-negative number: " + ms);
            }
            options.longTaskThresholdMs = ms;
            return this;
        }

        public Builder useNetworkRecords(boolean use) { options.useNetworkRecords = use; return this; }

        public AnalysisOptions build() {
            return options;
        }
    }
}
