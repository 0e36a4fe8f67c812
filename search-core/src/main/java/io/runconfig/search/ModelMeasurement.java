package io.runconfig.search;

import io.runconfig.search.record.Record;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The records measured for one entity of a run configuration, keyed by metric tag.
 */
public final class ModelMeasurement {

    private final String modelName;
    private final Map<String, Record> records;

    public ModelMeasurement(String modelName, Collection<? extends Record> records) {
        this.modelName = Objects.requireNonNull(modelName, "modelName cannot be null");
        Map<String, Record> byTag = new LinkedHashMap<>();
        for (Record record : records) {
            if (byTag.putIfAbsent(record.tag(), record) != null) {
                throw new IllegalArgumentException(String.format(
                    "Duplicate '%s' record for model %s", record.tag(), modelName));
            }
        }
        this.records = Collections.unmodifiableMap(byTag);
    }

    public String getModelName() {
        return modelName;
    }

    /**
     * Returns the record for a metric tag, or null if it was not measured.
     */
    public Record get(String tag) {
        return records.get(tag);
    }

    public Collection<Record> getRecords() {
        return records.values();
    }

    /**
     * Weighted sum of the percentage gains of this measurement over another, across the
     * given objectives. Metrics missing on either side are ignored.
     */
    public double weightedGainOver(ModelMeasurement other, Map<String, Integer> objectives) {
        int totalWeight = objectives.values().stream().mapToInt(Integer::intValue).sum();
        if (totalWeight == 0) {
            return 0;
        }

        double gain = 0;
        for (Map.Entry<String, Integer> objective : objectives.entrySet()) {
            Record mine = get(objective.getKey());
            Record theirs = other.get(objective.getKey());
            if (mine != null && theirs != null) {
                gain += objective.getValue() * mine.percentageGainOver(theirs);
            }
        }
        return gain / totalWeight;
    }

    @Override
    public String toString() {
        return modelName + records.values();
    }
}
