package io.runconfig.search.record;

/**
 * Which direction of a metric counts as an improvement.
 */
public enum Polarity {
    /** Greater values are better (throughput, utilization) */
    HIGHER_IS_BETTER,

    /** Lesser values are better (latency, memory) */
    LOWER_IS_BETTER
}
