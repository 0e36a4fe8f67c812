package io.runconfig.search;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.runconfig.search.space.Coordinate;
import io.runconfig.search.space.Dimension;
import io.runconfig.search.space.DimensionException;
import io.runconfig.search.space.DimensionSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Generates run configurations for a quick (coordinate-based) search.
 *
 * <p>The first call to {@link #next()} returns the default configuration, built from each
 * model's own baseline. Every later call resolves the current coordinate cursor into one
 * configuration per model. Moving the cursor between calls is the caller's job.</p>
 *
 * <p>Search entities are laid out in model order, with an ensemble contributing one entity
 * per stage instead of one for itself; the dimension set must cover exactly these entities.</p>
 *
 * <p>Not thread-safe: callers must serialize access to one engine's cursor.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * DimensionSet dims = new DimensionSet()
 *     .addDimensions(0, List.of(Dimension.exponential("max_batch_size"), Dimension.linear("instance_count")));
 * QuickSearchEngine engine = new QuickSearchEngine(SearchConfig.of(dims, 2, 3), SearchBounds.defaults(),
 *     List.of(model), Map.of(), new VariantNameRegistry());
 *
 * RunConfig baseline = engine.next();
 * engine.setCoordinateToMeasure(engine.getStartingCoordinate());
 * RunConfig first = engine.next();
 * }</pre>
 */
public class QuickSearchEngine {

    private static final Logger log = LoggerFactory.getLogger(QuickSearchEngine.class);

    private final SearchConfig searchConfig;
    private final SearchBounds bounds;
    private final List<ModelProfileSpec> models;
    private final Map<String, List<ModelProfileSpec>> ensembleSubmodels;
    private final VariantNameRegistry nameRegistry;

    private boolean defaultPhase = true;
    private Coordinate coordinateToMeasure;

    /**
     * Creates an engine.
     *
     * @param searchConfig Space, radius and minimum neighbor count
     * @param bounds Global clamp policy
     * @param models Models searched together, in order
     * @param ensembleSubmodels Stage specs per ensemble model name
     * @param nameRegistry Registry shared by every engine that must not duplicate variants
     * @throws ConfigurationException if an ensemble has no stage specs
     * @throws DimensionException if the dimension set does not cover every search entity
     */
    public QuickSearchEngine(SearchConfig searchConfig, SearchBounds bounds, List<ModelProfileSpec> models,
                             Map<String, List<ModelProfileSpec>> ensembleSubmodels,
                             VariantNameRegistry nameRegistry) {
        this.searchConfig = Objects.requireNonNull(searchConfig, "searchConfig cannot be null");
        this.bounds = Objects.requireNonNull(bounds, "bounds cannot be null");
        this.nameRegistry = Objects.requireNonNull(nameRegistry, "nameRegistry cannot be null");
        if (models == null || models.isEmpty()) {
            throw new IllegalArgumentException("at least one model is required");
        }
        this.models = List.copyOf(models);
        this.ensembleSubmodels = ensembleSubmodels != null ? Map.copyOf(ensembleSubmodels) : Map.of();

        int entities = 0;
        for (ModelProfileSpec model : this.models) {
            entities += model.isEnsemble() ? stagesOf(model).size() : 1;
        }
        int declared = searchConfig.dimensions().entityCount();
        if (declared != entities) {
            throw new DimensionException(String.format(
                "Dimension set covers %d entities but the models need %d", declared, entities));
        }

        this.coordinateToMeasure = searchConfig.dimensions().startingCoordinate();
        log.info("Quick search over {} model(s), {} entities, {} slots, radius {}",
            this.models.size(), entities, searchConfig.dimensions().slotCount(), searchConfig.radius());
    }

    // ==================== Stepping ====================

    /**
     * Returns the next configuration: the default one on the first call, the configuration
     * at the coordinate cursor afterwards.
     */
    public RunConfig next() {
        if (defaultPhase) {
            defaultPhase = false;
            RunConfig defaults = createDefaultRunConfig();
            log.info("Generated default configuration {}", defaults);
            return defaults;
        }
        return runConfigAt(coordinateToMeasure);
    }

    public boolean isDefaultPhase() {
        return defaultPhase;
    }

    public Coordinate getStartingCoordinate() {
        return searchConfig.dimensions().startingCoordinate();
    }

    public Coordinate getCoordinateToMeasure() {
        return coordinateToMeasure;
    }

    /**
     * Moves the cursor. The coordinate is checked against the dimension set when resolved.
     */
    public void setCoordinateToMeasure(Coordinate coordinate) {
        this.coordinateToMeasure = Objects.requireNonNull(coordinate, "coordinate cannot be null");
    }

    public SearchConfig getSearchConfig() {
        return searchConfig;
    }

    public List<ModelProfileSpec> getModels() {
        return models;
    }

    // ==================== Generation ====================

    /**
     * Builds the configuration from each model's baseline, without dimension-driven values.
     */
    public RunConfig createDefaultRunConfig() {
        List<ModelRunConfig> runConfigs = new ArrayList<>();
        for (ModelProfileSpec model : models) {
            if (model.isEnsemble()) {
                List<ModelConfig> stageConfigs = new ArrayList<>();
                List<Integer> stageConcurrencies = new ArrayList<>();
                for (ModelProfileSpec stage : stagesOf(model)) {
                    stageConfigs.add(defaultModelConfig(stage));
                    stageConcurrencies.add(defaultConcurrency(stage));
                }
                runConfigs.add(ensembleRunConfig(model, stageConfigs, stageConcurrencies, true));
            } else {
                ModelConfig modelConfig = defaultModelConfig(model);
                PerfConfig perfConfig = new PerfConfig(modelConfig.getName(), defaultConcurrency(model),
                    model.getPerfAnalyzerFlags());
                runConfigs.add(new ModelRunConfig(model.getModelName(), modelConfig, perfConfig, List.of()));
            }
        }
        return new RunConfig(runConfigs, true);
    }

    /**
     * Resolves a coordinate into a configuration without touching the cursor.
     *
     * @throws DimensionException if the coordinate does not match the dimension set
     */
    public RunConfig runConfigAt(Coordinate coordinate) {
        Map<Integer, Map<String, Integer>> values = searchConfig.dimensions().valuesFor(coordinate);

        List<ModelRunConfig> runConfigs = new ArrayList<>();
        int entity = 0;
        for (ModelProfileSpec model : models) {
            if (model.isEnsemble()) {
                List<ModelConfig> stageConfigs = new ArrayList<>();
                List<Integer> stageConcurrencies = new ArrayList<>();
                for (ModelProfileSpec stage : stagesOf(model)) {
                    Knobs knobs = resolveKnobs(stage, values.getOrDefault(entity++, Map.of()));
                    stageConfigs.add(searchedModelConfig(stage, knobs));
                    stageConcurrencies.add(knobs.concurrency());
                }
                runConfigs.add(ensembleRunConfig(model, stageConfigs, stageConcurrencies, false));
            } else {
                Knobs knobs = resolveKnobs(model, values.getOrDefault(entity++, Map.of()));
                ModelConfig modelConfig = searchedModelConfig(model, knobs);
                PerfConfig perfConfig = new PerfConfig(modelConfig.getName(), knobs.concurrency(),
                    model.getPerfAnalyzerFlags());
                runConfigs.add(new ModelRunConfig(model.getModelName(), modelConfig, perfConfig, List.of()));
            }
        }

        RunConfig runConfig = new RunConfig(runConfigs, false);
        log.debug("Coordinate {} -> {}", coordinate, runConfig.representation());
        return runConfig;
    }

    // ==================== Helper Methods ====================

    /**
     * Values one entity takes at a coordinate, after global clamping.
     */
    record Knobs(int maxBatchSize, int instanceCount, int concurrency) {}

    Knobs resolveKnobs(ModelProfileSpec model, Map<String, Integer> values) {
        int batchSize = 1;
        if (model.supportsBatching()) {
            batchSize = bounds.clampModelBatchSize(
                values.getOrDefault(Dimension.MAX_BATCH_SIZE, model.baselineMaxBatchSize()));
        }
        int instances = bounds.clampInstanceCount(values.getOrDefault(Dimension.INSTANCE_COUNT, 1));

        int concurrency;
        if (searchConfig.concurrencyMode() == ConcurrencyMode.COORDINATE) {
            Integer coordinateConcurrency = values.get(Dimension.CONCURRENCY);
            if (coordinateConcurrency == null) {
                throw new DimensionException(String.format(
                    "Model %s has no '%s' dimension in coordinate-driven concurrency mode",
                    model.getModelName(), Dimension.CONCURRENCY));
            }
            concurrency = bounds.clampConcurrency(coordinateConcurrency);
        } else {
            concurrency = bounds.concurrencyFor(batchSize, instances);
        }
        return new Knobs(batchSize, instances, concurrency);
    }

    private int defaultConcurrency(ModelProfileSpec model) {
        return bounds.concurrencyFor(Math.max(1, model.baselineMaxBatchSize()), model.baselineInstanceCount());
    }

    private ModelConfig defaultModelConfig(ModelProfileSpec model) {
        ObjectNode fields = model.getBaseConfig();
        applyBatchingMode(model, fields);
        fields.put(ModelProfileSpec.FIELD_NAME, nameRegistry.nameFor(model.getModelName(), fields, true));
        return new ModelConfig(fields, model.isCpuOnly());
    }

    private ModelConfig searchedModelConfig(ModelProfileSpec model, Knobs knobs) {
        ObjectNode fields = model.getBaseConfig();
        if (model.supportsBatching()) {
            fields.put(ModelProfileSpec.FIELD_MAX_BATCH_SIZE, knobs.maxBatchSize());
        }
        ArrayNode instanceGroup = fields.putArray(ModelProfileSpec.FIELD_INSTANCE_GROUP);
        instanceGroup.addObject()
            .put("count", knobs.instanceCount())
            .put("kind", model.instanceKind());
        applyBatchingMode(model, fields);

        fields.put(ModelProfileSpec.FIELD_NAME, nameRegistry.nameFor(model.getModelName(), fields, false));
        return new ModelConfig(fields, model.isCpuOnly());
    }

    /**
     * Sequence batching is kept as declared; otherwise a batch-capable model gets dynamic
     * batching with default parameters.
     */
    private static void applyBatchingMode(ModelProfileSpec model, ObjectNode fields) {
        if (model.supportsSequenceBatching()) {
            fields.remove(ModelProfileSpec.FIELD_DYNAMIC_BATCHING);
        } else if (model.supportsBatching()) {
            fields.putObject(ModelProfileSpec.FIELD_DYNAMIC_BATCHING);
        }
    }

    private ModelRunConfig ensembleRunConfig(ModelProfileSpec ensemble, List<ModelConfig> stageConfigs,
                                             List<Integer> stageConcurrencies, boolean isDefault) {
        List<String> stageNames = stageConfigs.stream().map(ModelConfig::getName).toList();
        ObjectNode fields = ensemble.getBaseConfig();
        fields.put(ModelProfileSpec.FIELD_NAME,
            nameRegistry.nameForEnsemble(ensemble.getModelName(), stageNames, isDefault));
        ModelConfig ensembleConfig = new ModelConfig(fields, ensemble.isCpuOnly());

        int concurrency = bounds.hasConcurrencyOverride()
            ? bounds.concurrencyOverride()
            : Collections.min(stageConcurrencies);
        PerfConfig perfConfig = new PerfConfig(ensembleConfig.getName(), concurrency,
            ensemble.getPerfAnalyzerFlags());
        return new ModelRunConfig(ensemble.getModelName(), ensembleConfig, perfConfig, stageConfigs);
    }

    private List<ModelProfileSpec> stagesOf(ModelProfileSpec ensemble) {
        List<ModelProfileSpec> stages = ensembleSubmodels.get(ensemble.getModelName());
        if (stages == null || stages.isEmpty()) {
            throw new ConfigurationException(ensemble.getModelName(), "no stage configurations for ensemble");
        }
        return stages;
    }
}
