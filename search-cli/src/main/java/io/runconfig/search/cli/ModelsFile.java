package io.runconfig.search.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.runconfig.search.BaselineConfigProvider;
import io.runconfig.search.ModelProfileSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON file describing the models to search and their baseline configurations.
 *
 * <pre>{@code
 * {
 *   "models": [ { "name": "resnet50", "perf_analyzer_flags": { "percentile": 96 }, "cpu_only": false } ],
 *   "configs": { "resnet50": { "name": "resnet50", "input": [ ... ], "max_batch_size": 8 } }
 * }
 * }</pre>
 *
 * <p>Ensemble stages are looked up in {@code configs} by their step names.</p>
 */
final class ModelsFile implements BaselineConfigProvider {

    private static final Logger log = LoggerFactory.getLogger(ModelsFile.class);

    private final JsonNode root;

    private ModelsFile(JsonNode root) {
        this.root = root;
    }

    static ModelsFile load(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Models file not found: " + path);
        }
        JsonNode root = SearchCli.MAPPER.readTree(path.toFile());
        if (!root.path("models").isArray() || root.path("models").isEmpty()) {
            throw new IOException("Models file needs a non-empty 'models' array: " + path);
        }
        log.debug("Loaded models file {}", path);
        return new ModelsFile(root);
    }

    @Override
    public ObjectNode baselineFor(String modelName) {
        JsonNode config = root.path("configs").get(modelName);
        return config instanceof ObjectNode object ? object : null;
    }

    List<ModelProfileSpec> createSpecs() {
        List<ModelProfileSpec> specs = new ArrayList<>();
        for (JsonNode model : root.path("models")) {
            String name = model.path("name").asText();
            Map<String, Object> flags = new LinkedHashMap<>();
            model.path("perf_analyzer_flags").fields().forEachRemaining(flag ->
                flags.put(flag.getKey(), flagValue(flag.getValue())));
            specs.add(ModelProfileSpec.create(name, this, flags, model.path("cpu_only").asBoolean(false)));
        }
        return specs;
    }

    Map<String, List<ModelProfileSpec>> createSubmodels(List<ModelProfileSpec> models) {
        Map<String, List<ModelProfileSpec>> submodels = new LinkedHashMap<>();
        for (ModelProfileSpec model : models) {
            if (model.isEnsemble()) {
                submodels.put(model.getModelName(), model.createSubmodels(this));
            }
        }
        return submodels;
    }

    private static Object flagValue(JsonNode value) {
        if (value.isBoolean()) return value.asBoolean();
        if (value.isInt()) return value.asInt();
        if (value.isNumber()) return value.asDouble();
        return value.asText();
    }
}
