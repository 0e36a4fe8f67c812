package io.runconfig.search;

import io.runconfig.search.space.DimensionSet;

import java.util.Objects;

/**
 * Shape of a quick search: the space, the neighborhood radius, and how many
 * neighbors must be measured before a step may conclude.
 */
public record SearchConfig(
    DimensionSet dimensions,
    int radius,
    int minInitialized,
    ConcurrencyMode concurrencyMode
) {
    public SearchConfig {
        Objects.requireNonNull(dimensions, "dimensions cannot be null");
        Objects.requireNonNull(concurrencyMode, "concurrencyMode cannot be null");
        if (radius < 1) throw new IllegalArgumentException("radius must be >= 1");
        if (minInitialized < 1) throw new IllegalArgumentException("minInitialized must be >= 1");
    }

    public static SearchConfig of(DimensionSet dimensions, int radius, int minInitialized) {
        return new SearchConfig(dimensions, radius, minInitialized, ConcurrencyMode.FORMULA);
    }

    public SearchConfig withConcurrencyMode(ConcurrencyMode mode) {
        return new SearchConfig(dimensions, radius, minInitialized, mode);
    }
}
