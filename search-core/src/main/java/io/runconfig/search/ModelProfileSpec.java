package io.runconfig.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A model taking part in a search: its baseline configuration plus the
 * benchmarking flags passed through to every generated variant.
 *
 * <p>A model whose baseline declares {@code platform: "ensemble"} is composite; its
 * stages are listed under {@code ensemble_scheduling.step[].model_name}.</p>
 */
public final class ModelProfileSpec {

    public static final String FIELD_NAME = "name";
    public static final String FIELD_INPUT = "input";
    public static final String FIELD_MAX_BATCH_SIZE = "max_batch_size";
    public static final String FIELD_INSTANCE_GROUP = "instance_group";
    public static final String FIELD_DYNAMIC_BATCHING = "dynamic_batching";
    public static final String FIELD_SEQUENCE_BATCHING = "sequence_batching";
    public static final String FIELD_PLATFORM = "platform";
    public static final String FIELD_ENSEMBLE_SCHEDULING = "ensemble_scheduling";
    public static final String ENSEMBLE_PLATFORM = "ensemble";

    private final String modelName;
    private final ObjectNode baseConfig;
    private final Map<String, Object> perfAnalyzerFlags;
    private final boolean cpuOnly;

    private ModelProfileSpec(String modelName, ObjectNode baseConfig, Map<String, Object> perfAnalyzerFlags,
                             boolean cpuOnly) {
        this.modelName = modelName;
        this.baseConfig = baseConfig;
        this.perfAnalyzerFlags = perfAnalyzerFlags;
        this.cpuOnly = cpuOnly;
    }

    /**
     * Creates a spec from an explicit baseline.
     *
     * @throws ConfigurationException if required baseline fields are missing
     */
    public static ModelProfileSpec of(String modelName, ObjectNode baseConfig, Map<String, Object> perfAnalyzerFlags,
                                      boolean cpuOnly) {
        Objects.requireNonNull(modelName, "modelName cannot be null");
        if (baseConfig == null) {
            throw new ConfigurationException(modelName, "no baseline configuration available");
        }
        validate(modelName, baseConfig);
        Map<String, Object> flags = perfAnalyzerFlags != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(perfAnalyzerFlags))
            : Map.of();
        return new ModelProfileSpec(modelName, baseConfig.deepCopy(), flags, cpuOnly);
    }

    public static ModelProfileSpec of(String modelName, ObjectNode baseConfig) {
        return of(modelName, baseConfig, Map.of(), false);
    }

    /**
     * Creates a spec by fetching the baseline from a provider.
     */
    public static ModelProfileSpec create(String modelName, BaselineConfigProvider provider,
                                          Map<String, Object> perfAnalyzerFlags, boolean cpuOnly) {
        return of(modelName, provider.baselineFor(modelName), perfAnalyzerFlags, cpuOnly);
    }

    /**
     * Creates one spec per ensemble stage. Stages inherit this model's flags and CPU setting.
     *
     * @throws ConfigurationException if this model is not an ensemble
     */
    public List<ModelProfileSpec> createSubmodels(BaselineConfigProvider provider) {
        if (!isEnsemble()) {
            throw new ConfigurationException(modelName, "not an ensemble");
        }
        List<ModelProfileSpec> submodels = new ArrayList<>();
        for (String stage : ensembleStepNames()) {
            submodels.add(create(stage, provider, perfAnalyzerFlags, cpuOnly));
        }
        return submodels;
    }

    private static void validate(String modelName, ObjectNode baseConfig) {
        JsonNode input = baseConfig.get(FIELD_INPUT);
        if (input == null || !input.isArray() || input.isEmpty()) {
            throw new ConfigurationException(modelName, "baseline has no '" + FIELD_INPUT + "' entries");
        }
        JsonNode maxBatchSize = baseConfig.get(FIELD_MAX_BATCH_SIZE);
        if (maxBatchSize == null || !maxBatchSize.canConvertToInt() || maxBatchSize.asInt() < 0) {
            throw new ConfigurationException(modelName,
                "baseline '" + FIELD_MAX_BATCH_SIZE + "' is missing or not a non-negative integer");
        }
        if (ENSEMBLE_PLATFORM.equals(baseConfig.path(FIELD_PLATFORM).asText())
                && stepNames(baseConfig).isEmpty()) {
            throw new ConfigurationException(modelName, "ensemble declares no scheduling steps");
        }
    }

    private static List<String> stepNames(ObjectNode baseConfig) {
        List<String> names = new ArrayList<>();
        for (JsonNode step : baseConfig.path(FIELD_ENSEMBLE_SCHEDULING).path("step")) {
            String name = step.path("model_name").asText(null);
            if (name != null && !name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }

    public String getModelName() {
        return modelName;
    }

    /**
     * Returns a copy of the baseline configuration.
     */
    public ObjectNode getBaseConfig() {
        return baseConfig.deepCopy();
    }

    public Map<String, Object> getPerfAnalyzerFlags() {
        return perfAnalyzerFlags;
    }

    public boolean isCpuOnly() {
        return cpuOnly;
    }

    public boolean isEnsemble() {
        return ENSEMBLE_PLATFORM.equals(baseConfig.path(FIELD_PLATFORM).asText());
    }

    public List<String> ensembleStepNames() {
        return stepNames(baseConfig);
    }

    public boolean supportsSequenceBatching() {
        return baseConfig.has(FIELD_SEQUENCE_BATCHING);
    }

    /**
     * A baseline max batch size of 0 means the model takes no batch dimension at all.
     */
    public boolean supportsBatching() {
        return baselineMaxBatchSize() > 0;
    }

    public int baselineMaxBatchSize() {
        return baseConfig.get(FIELD_MAX_BATCH_SIZE).asInt();
    }

    /**
     * Total instance count across the baseline's instance groups, 1 if none are declared.
     */
    public int baselineInstanceCount() {
        int count = 0;
        for (JsonNode group : baseConfig.path(FIELD_INSTANCE_GROUP)) {
            count += group.path("count").asInt(1);
        }
        return count > 0 ? count : 1;
    }

    public String instanceKind() {
        return cpuOnly ? "KIND_CPU" : "KIND_GPU";
    }

    @Override
    public String toString() {
        return isEnsemble() ? modelName + ensembleStepNames() : modelName;
    }
}
