package io.runconfig.search;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A complete multi-model configuration produced by one search step.
 */
public record RunConfig(
    /** Per-model entries, in model order */
    List<ModelRunConfig> modelRunConfigs,

    /** True for the baseline configuration emitted before any stepping */
    boolean isDefault
) {
    public RunConfig {
        if (modelRunConfigs == null || modelRunConfigs.isEmpty()) {
            throw new IllegalArgumentException("run config needs at least one model");
        }
        modelRunConfigs = List.copyOf(modelRunConfigs);
    }

    /**
     * Variant names of every model, in model order. Two run configs with the same
     * variant names are value-equal.
     */
    public List<String> variantNames() {
        return modelRunConfigs.stream().map(m -> m.modelConfig().getName()).toList();
    }

    public List<String> modelNames() {
        return modelRunConfigs.stream().map(ModelRunConfig::modelName).toList();
    }

    public String representation() {
        return modelRunConfigs.stream()
            .map(ModelRunConfig::representation)
            .collect(Collectors.joining(" "));
    }

    @Override
    public String toString() {
        return String.join(",", variantNames());
    }
}
