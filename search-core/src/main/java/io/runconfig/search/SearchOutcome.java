package io.runconfig.search;

import java.util.List;

/**
 * Result of a neighborhood search.
 */
public record SearchOutcome(
    /** Best candidate found, null if nothing could be measured */
    MeasuredConfig best,

    /** Every distinct configuration measured, in measurement order */
    List<MeasuredConfig> measured,

    /** Number of steps the home coordinate moved */
    int steps
) {
    public SearchOutcome {
        measured = List.copyOf(measured);
    }

    public boolean foundFeasible() {
        return best != null && best.feasible();
    }
}
