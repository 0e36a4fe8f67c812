package io.runconfig.search.constraint;

import java.util.Objects;

/**
 * Inclusive bounds on one metric. Either bound may be absent.
 */
public record Constraint(
    /** Metric tag the bounds apply to */
    String metricTag,

    /** Lowest acceptable value, or null */
    Double min,

    /** Highest acceptable value, or null */
    Double max
) {
    public Constraint {
        Objects.requireNonNull(metricTag, "metricTag cannot be null");
        if (min == null && max == null) {
            throw new IllegalArgumentException("constraint on " + metricTag + " needs a min or a max");
        }
    }

    public static Constraint min(String metricTag, double min) {
        return new Constraint(metricTag, min, null);
    }

    public static Constraint max(String metricTag, double max) {
        return new Constraint(metricTag, null, max);
    }

    public static Constraint between(String metricTag, double min, double max) {
        return new Constraint(metricTag, min, max);
    }

    public boolean isSatisfiedBy(double value) {
        return (min == null || value >= min) && (max == null || value <= max);
    }

    /**
     * Relative amount by which a value misses the bounds, as a fraction (0 when satisfied).
     * A zero bound contributes the absolute miss instead of a relative one.
     */
    public double failureFraction(double value) {
        double failure = 0;
        if (min != null && value < min) {
            failure += relative(min - value, min);
        }
        if (max != null && value > max) {
            failure += relative(value - max, max);
        }
        return failure;
    }

    private static double relative(double miss, double bound) {
        return bound == 0 ? miss : miss / Math.abs(bound);
    }
}
