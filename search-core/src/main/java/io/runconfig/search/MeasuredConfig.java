package io.runconfig.search;

import io.runconfig.search.space.Coordinate;

/**
 * A configuration together with its measurement and constraint verdict.
 */
public record MeasuredConfig(
    /** Coordinate the configuration came from; null for the default configuration */
    Coordinate coordinate,

    RunConfig runConfig,

    RunMeasurement measurement,

    /** Whether every constraint is met */
    boolean feasible,

    /** Percentage by which the constraints are missed, 0 when feasible */
    double infeasibilityScore
) {
    /**
     * Returns true if this candidate should be preferred over another: feasible beats
     * infeasible, a lower infeasibility score wins among infeasible candidates, and the
     * objective gain decides between feasible ones.
     */
    public boolean isBetterThan(MeasuredConfig other) {
        if (other == null) return true;
        if (feasible != other.feasible) return feasible;
        if (!feasible) return infeasibilityScore < other.infeasibilityScore;
        return measurement.compareTo(other.measurement) > 0;
    }
}
