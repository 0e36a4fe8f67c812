package io.runconfig.search.constraint;

import io.runconfig.search.ModelMeasurement;
import io.runconfig.search.RunMeasurement;
import io.runconfig.search.record.Record;

import java.util.List;

/**
 * Checks run measurements against per-entity constraints.
 *
 * <p>Violations are results, not errors: the caller uses {@link #satisfies} to separate
 * feasible candidates and {@link #infeasibilityScore} to rank the infeasible ones.</p>
 */
public final class ConstraintEvaluator {

    private ConstraintEvaluator() {
    }

    /**
     * Returns true if every constrained metric of every entity lies within its bounds.
     *
     * @param constraints Constraints per entity position; null or missing positions are unconstrained
     * @param measurement Measurement of all entities
     */
    public static boolean satisfies(List<ModelConstraints> constraints, RunMeasurement measurement) {
        if (constraints == null) {
            return true;
        }
        List<ModelMeasurement> models = measurement.getModels();
        for (int i = 0; i < models.size() && i < constraints.size(); i++) {
            ModelConstraints modelConstraints = constraints.get(i);
            if (modelConstraints == null) continue;

            for (Record record : models.get(i).getRecords()) {
                Constraint constraint = modelConstraints.get(record.tag());
                if (constraint != null && !constraint.isSatisfiedBy(record.value())) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Sums, over every violated bound, the relative miss {@code (min - value) / min} or
     * {@code (value - max) / max}, expressed as a percentage. Zero iff {@link #satisfies}.
     */
    public static double infeasibilityScore(List<ModelConstraints> constraints, RunMeasurement measurement) {
        if (constraints == null) {
            return 0;
        }
        double failure = 0;
        List<ModelMeasurement> models = measurement.getModels();
        for (int i = 0; i < models.size() && i < constraints.size(); i++) {
            ModelConstraints modelConstraints = constraints.get(i);
            if (modelConstraints == null) continue;

            for (Record record : models.get(i).getRecords()) {
                Constraint constraint = modelConstraints.get(record.tag());
                if (constraint != null) {
                    failure += constraint.failureFraction(record.value());
                }
            }
        }
        return failure * 100;
    }
}
