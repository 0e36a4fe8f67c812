package io.runconfig.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * A named, fully resolved model configuration variant.
 *
 * <p>Same shape as the baseline it came from, with search-determined fields overwritten.</p>
 */
public final class ModelConfig {

    private final ObjectNode fields;
    private final boolean cpuOnly;

    ModelConfig(ObjectNode fields, boolean cpuOnly) {
        Objects.requireNonNull(fields.get(ModelProfileSpec.FIELD_NAME), "model config must be named");
        this.fields = fields;
        this.cpuOnly = cpuOnly;
    }

    public String getName() {
        return fields.get(ModelProfileSpec.FIELD_NAME).asText();
    }

    /**
     * Returns a field value, or null if absent.
     */
    public JsonNode getField(String name) {
        JsonNode value = fields.get(name);
        return value == null ? null : value.deepCopy();
    }

    public boolean isCpuOnly() {
        return cpuOnly;
    }

    /**
     * Returns a copy of the configuration fields.
     */
    public ObjectNode toJson() {
        return fields.deepCopy();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModelConfig other)) return false;
        return cpuOnly == other.cpuOnly && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields, cpuOnly);
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
