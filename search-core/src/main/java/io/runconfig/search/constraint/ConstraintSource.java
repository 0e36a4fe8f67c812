package io.runconfig.search.constraint;

import com.fasterxml.jackson.databind.JsonNode;
import io.runconfig.search.record.RecordType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declared constraints keyed by model name, with an optional {@code default} entry
 * applied to models that declare none of their own.
 *
 * <p>JSON shape:</p>
 * <pre>{@code
 * {
 *   "resnet50": { "perf_latency_p99": { "max": 100 } },
 *   "default":  { "perf_throughput": { "min": 50 } }
 * }
 * }</pre>
 */
public final class ConstraintSource {

    public static final String DEFAULT_KEY = "default";

    private static final Logger log = LoggerFactory.getLogger(ConstraintSource.class);

    private final Map<String, ModelConstraints> byModel;

    public ConstraintSource(Map<String, ModelConstraints> byModel) {
        this.byModel = Collections.unmodifiableMap(new LinkedHashMap<>(byModel));
    }

    public static ConstraintSource empty() {
        return new ConstraintSource(Map.of());
    }

    /**
     * Parses a constraint mapping.
     *
     * @throws IllegalArgumentException on an unknown metric tag or a malformed entry
     */
    public static ConstraintSource fromJson(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return empty();
        }
        if (!root.isObject()) {
            throw new IllegalArgumentException("Constraints must be a JSON object");
        }

        Map<String, ModelConstraints> byModel = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> models = root.fields();
        while (models.hasNext()) {
            Map.Entry<String, JsonNode> model = models.next();
            List<Constraint> constraints = new ArrayList<>();
            Iterator<Map.Entry<String, JsonNode>> metrics = model.getValue().fields();
            while (metrics.hasNext()) {
                Map.Entry<String, JsonNode> metric = metrics.next();
                String tag = metric.getKey();
                if (!RecordType.isKnown(tag)) {
                    throw new IllegalArgumentException(String.format(
                        "Unknown metric '%s' in constraints for %s", tag, model.getKey()));
                }
                JsonNode bounds = metric.getValue();
                Double min = bounds.hasNonNull("min") ? bounds.get("min").asDouble() : null;
                Double max = bounds.hasNonNull("max") ? bounds.get("max").asDouble() : null;
                constraints.add(new Constraint(tag, min, max));
            }
            byModel.put(model.getKey(), ModelConstraints.of(constraints));
        }
        log.debug("Loaded constraints for {}", byModel.keySet());
        return new ConstraintSource(byModel);
    }

    /**
     * Returns the constraints for a model, falling back to the default entry.
     */
    public ModelConstraints forModel(String modelName) {
        ModelConstraints own = byModel.get(modelName);
        if (own != null) {
            return own;
        }
        return byModel.getOrDefault(DEFAULT_KEY, ModelConstraints.none());
    }

    /**
     * Returns the constraints for each model, aligned with the given order.
     */
    public List<ModelConstraints> forModels(List<String> modelNames) {
        return modelNames.stream().map(this::forModel).toList();
    }
}
