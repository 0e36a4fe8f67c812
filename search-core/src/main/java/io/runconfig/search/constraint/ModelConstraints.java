package io.runconfig.search.constraint;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The constraints declared for one entity, keyed by metric tag.
 */
public final class ModelConstraints {

    private static final ModelConstraints NONE = new ModelConstraints(Map.of());

    private final Map<String, Constraint> byTag;

    private ModelConstraints(Map<String, Constraint> byTag) {
        this.byTag = byTag;
    }

    public static ModelConstraints none() {
        return NONE;
    }

    public static ModelConstraints of(Collection<Constraint> constraints) {
        Map<String, Constraint> byTag = new LinkedHashMap<>();
        for (Constraint constraint : constraints) {
            if (byTag.putIfAbsent(constraint.metricTag(), constraint) != null) {
                throw new IllegalArgumentException("Duplicate constraint for " + constraint.metricTag());
            }
        }
        return new ModelConstraints(Collections.unmodifiableMap(byTag));
    }

    public static ModelConstraints of(Constraint... constraints) {
        return of(List.of(constraints));
    }

    /**
     * Returns the constraint on a metric, or null if none is declared.
     */
    public Constraint get(String metricTag) {
        return byTag.get(metricTag);
    }

    public Collection<Constraint> all() {
        return byTag.values();
    }

    public boolean isEmpty() {
        return byTag.isEmpty();
    }

    @Override
    public String toString() {
        return byTag.values().toString();
    }
}
