package io.runconfig.search.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.runconfig.search.ModelMeasurement;
import io.runconfig.search.ModelProfileSpec;
import io.runconfig.search.QuickSearchEngine;
import io.runconfig.search.RunConfig;
import io.runconfig.search.RunMeasurement;
import io.runconfig.search.SearchBounds;
import io.runconfig.search.SearchConfig;
import io.runconfig.search.VariantNameRegistry;
import io.runconfig.search.constraint.ConstraintEvaluator;
import io.runconfig.search.constraint.ConstraintSource;
import io.runconfig.search.constraint.ModelConstraints;
import io.runconfig.search.record.Record;
import io.runconfig.search.record.RecordType;
import io.runconfig.search.space.Coordinate;
import io.runconfig.search.space.Dimension;
import io.runconfig.search.space.DimensionSet;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Command-line interface for runconfig-search.
 */
@Command(
    name = "runconfig-search",
    mixinStandardHelpOptions = true,
    version = "runconfig-search 1.0.0",
    description = "Generate quick-search run configurations and check measurements against constraints",
    subcommands = {
        SearchCli.GenerateCommand.class,
        SearchCli.CheckCommand.class
    }
)
public class SearchCli implements Callable<Integer> {

    static final ObjectMapper MAPPER = new ObjectMapper();

    @Spec
    CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Builds the command line; failures print their message and exit with 1.
     */
    static CommandLine commandLine() {
        return new CommandLine(new SearchCli())
            .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
                cmd.getErr().println("Error: " + ex.getMessage());
                return 1;
            });
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    /**
     * Generate configurations for a set of models.
     */
    @Command(
        name = "generate",
        description = "Print the default configuration followed by quick-search steps"
    )
    static class GenerateCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Models file (JSON)")
        private Path modelsPath;

        @Option(names = {"-n", "--count"}, description = "Number of stepped configurations", defaultValue = "5")
        private int count;

        @Option(names = {"-c", "--coordinate"}, split = ",",
            description = "Resolve one explicit coordinate instead of walking the neighborhood")
        private List<Integer> coordinate;

        @Option(names = {"-r", "--radius"}, description = "Neighborhood radius", defaultValue = "1")
        private int radius;

        @Option(names = "--min-initialized", description = "Neighbors measured per step", defaultValue = "3")
        private int minInitialized;

        @Option(names = "--min-model-batch-size", description = "Lower bound on max batch size")
        private Integer minModelBatchSize;

        @Option(names = "--max-model-batch-size", description = "Upper bound on max batch size")
        private Integer maxModelBatchSize;

        @Option(names = "--min-instance-count", description = "Lower bound on instance count")
        private Integer minInstanceCount;

        @Option(names = "--max-instance-count", description = "Upper bound on instance count")
        private Integer maxInstanceCount;

        @Option(names = "--min-concurrency", description = "Lower bound on concurrency")
        private Integer minConcurrency;

        @Option(names = "--max-concurrency", description = "Upper bound on concurrency")
        private Integer maxConcurrency;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = spec.commandLine().getOut();

            ModelsFile modelsFile = ModelsFile.load(modelsPath);
            List<ModelProfileSpec> models = modelsFile.createSpecs();
            Map<String, List<ModelProfileSpec>> submodels = modelsFile.createSubmodels(models);

            DimensionSet dimensions = defaultDimensions(models, submodels);
            SearchBounds bounds = SearchBounds.defaults()
                .withModelBatchSize(minModelBatchSize, maxModelBatchSize)
                .withInstanceCount(minInstanceCount, maxInstanceCount)
                .withConcurrency(minConcurrency, maxConcurrency);

            QuickSearchEngine engine = new QuickSearchEngine(SearchConfig.of(dimensions, radius, minInitialized),
                bounds, models, submodels, new VariantNameRegistry());

            ArrayNode output = MAPPER.createArrayNode();
            output.add(RunConfigJson.toJson(null, engine.next()));

            if (coordinate != null) {
                Coordinate explicit = Coordinate.of(coordinate);
                engine.setCoordinateToMeasure(explicit);
                output.add(RunConfigJson.toJson(explicit, engine.next()));
            } else {
                Set<List<String>> seen = new HashSet<>();
                Coordinate start = engine.getStartingCoordinate();
                emitIfNew(engine, start, seen, output);
                for (Coordinate neighbor : start.neighborsWithinRadius(radius)) {
                    if (seen.size() >= count) break;
                    if (dimensions.isWithinBounds(neighbor)) {
                        emitIfNew(engine, neighbor, seen, output);
                    }
                }
            }

            out.println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(output));
            out.flush();
            return 0;
        }

        private static void emitIfNew(QuickSearchEngine engine, Coordinate coordinate, Set<List<String>> seen,
                                      ArrayNode output) {
            engine.setCoordinateToMeasure(coordinate);
            RunConfig runConfig = engine.next();
            if (seen.add(runConfig.variantNames())) {
                output.add(RunConfigJson.toJson(coordinate, runConfig));
            }
        }

        /**
         * Exponential max batch size and linear instance count for every search entity.
         */
        private static DimensionSet defaultDimensions(List<ModelProfileSpec> models,
                                                      Map<String, List<ModelProfileSpec>> submodels) {
            DimensionSet dimensions = new DimensionSet();
            int entity = 0;
            for (ModelProfileSpec model : models) {
                int stages = model.isEnsemble() ? submodels.get(model.getModelName()).size() : 1;
                for (int i = 0; i < stages; i++) {
                    dimensions.addDimensions(entity++, List.of(
                        Dimension.exponential(Dimension.MAX_BATCH_SIZE),
                        Dimension.linear(Dimension.INSTANCE_COUNT)));
                }
            }
            return dimensions;
        }
    }

    /**
     * Check a measurement against constraints.
     */
    @Command(
        name = "check",
        description = "Evaluate a run measurement against declared constraints"
    )
    static class CheckCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Constraints file (JSON)")
        private Path constraintsPath;

        @Parameters(index = "1", description = "Measurement file (JSON)")
        private Path measurementPath;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = spec.commandLine().getOut();

            ConstraintSource source = ConstraintSource.fromJson(MAPPER.readTree(constraintsPath.toFile()));
            RunMeasurement measurement = readMeasurement(MAPPER.readTree(measurementPath.toFile()));

            List<String> modelNames = measurement.getModels().stream()
                .map(ModelMeasurement::getModelName)
                .toList();
            List<ModelConstraints> constraints = source.forModels(modelNames);

            boolean satisfied = ConstraintEvaluator.satisfies(constraints, measurement);
            double score = ConstraintEvaluator.infeasibilityScore(constraints, measurement);

            out.println(satisfied ? "PASS" : "FAIL");
            out.printf(Locale.ROOT, "Infeasibility score: %.2f%%%n", score);
            for (int i = 0; i < modelNames.size(); i++) {
                out.println("  " + modelNames.get(i) + ": " + constraints.get(i));
            }
            out.flush();
            return satisfied ? 0 : 2;
        }

        /**
         * Reads {@code {"models": [{"name": "...", "metrics": {"perf_throughput": 100}}]}}.
         */
        static RunMeasurement readMeasurement(JsonNode root) {
            JsonNode modelsNode = root.path("models");
            if (!modelsNode.isArray() || modelsNode.isEmpty()) {
                throw new IllegalArgumentException("Measurement file needs a non-empty 'models' array");
            }
            List<ModelMeasurement> models = new ArrayList<>();
            for (JsonNode model : modelsNode) {
                List<Record> records = new ArrayList<>();
                model.path("metrics").fields().forEachRemaining(metric ->
                    records.add(RecordType.forTag(metric.getKey()).create(metric.getValue().asDouble())));
                models.add(new ModelMeasurement(model.path("name").asText(), records));
            }

            Map<String, Integer> objectives = new LinkedHashMap<>();
            root.path("objectives").fields().forEachRemaining(o -> objectives.put(o.getKey(), o.getValue().asInt()));
            return objectives.isEmpty() ? new RunMeasurement(models) : new RunMeasurement(models, objectives);
        }
    }
}
