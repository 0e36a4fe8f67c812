package io.runconfig.search;

import io.runconfig.search.record.PerfThroughput;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Measurements of every entity of one run configuration, in entity order.
 *
 * <p>Two run measurements are ranked by the weighted percentage gain of their
 * objective metrics, averaged over entities; {@code a.compareTo(b) > 0} means
 * {@code a} is better.</p>
 */
public final class RunMeasurement implements Comparable<RunMeasurement> {

    /** Objectives used when none are given: maximize throughput. */
    public static final Map<String, Integer> DEFAULT_OBJECTIVES = Map.of(PerfThroughput.TAG, 1);

    private final List<ModelMeasurement> models;
    private final Map<String, Integer> objectives;

    public RunMeasurement(List<ModelMeasurement> models) {
        this(models, DEFAULT_OBJECTIVES);
    }

    public RunMeasurement(List<ModelMeasurement> models, Map<String, Integer> objectives) {
        Objects.requireNonNull(models, "models cannot be null");
        Objects.requireNonNull(objectives, "objectives cannot be null");
        if (models.isEmpty()) throw new IllegalArgumentException("models cannot be empty");
        this.models = List.copyOf(models);
        this.objectives = Map.copyOf(objectives);
    }

    public List<ModelMeasurement> getModels() {
        return models;
    }

    public Map<String, Integer> getObjectives() {
        return objectives;
    }

    /**
     * Average per-entity weighted objective gain of this measurement over another.
     */
    public double gainOver(RunMeasurement other) {
        if (other.models.size() != models.size()) {
            throw new IllegalArgumentException(String.format(
                "Cannot compare measurements of %d and %d models", models.size(), other.models.size()));
        }
        double gain = 0;
        for (int i = 0; i < models.size(); i++) {
            gain += models.get(i).weightedGainOver(other.models.get(i), objectives);
        }
        return gain / models.size();
    }

    @Override
    public int compareTo(RunMeasurement other) {
        return Double.compare(gainOver(other), 0);
    }

    @Override
    public String toString() {
        return "RunMeasurement" + models;
    }
}
