package io.runconfig.search;

import java.util.List;
import java.util.Objects;

/**
 * One model's part of a run configuration: its variant, benchmarking parameters and,
 * for an ensemble, the variants of its stages in order.
 */
public record ModelRunConfig(
    /** Name of the model this entry belongs to */
    String modelName,

    /** The model's variant */
    ModelConfig modelConfig,

    /** Benchmarking parameters */
    PerfConfig perfConfig,

    /** Stage variants, empty unless the model is an ensemble */
    List<ModelConfig> ensembleSubconfigs
) {
    public ModelRunConfig {
        Objects.requireNonNull(modelName, "modelName cannot be null");
        Objects.requireNonNull(modelConfig, "modelConfig cannot be null");
        Objects.requireNonNull(perfConfig, "perfConfig cannot be null");
        ensembleSubconfigs = ensembleSubconfigs != null ? List.copyOf(ensembleSubconfigs) : List.of();
    }

    public boolean isEnsemble() {
        return !ensembleSubconfigs.isEmpty();
    }

    public String representation() {
        return perfConfig.representation();
    }
}
