package io.runconfig.search;

/**
 * Exception thrown when a model's baseline configuration is missing or invalid.
 *
 * <p>Only the search of the affected model is aborted; other models may continue.</p>
 */
public class ConfigurationException extends RuntimeException {

    private final String modelName;

    public ConfigurationException(String modelName, String problem) {
        super(String.format("Invalid configuration for model '%s': %s", modelName, problem));
        this.modelName = modelName;
    }

    public String getModelName() {
        return modelName;
    }
}
