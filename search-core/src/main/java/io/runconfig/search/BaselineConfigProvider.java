package io.runconfig.search;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Source of a model's baseline configuration, as served by its serving platform.
 */
@FunctionalInterface
public interface BaselineConfigProvider {

    /**
     * Returns the baseline configuration fields of a model.
     *
     * @param modelName Model name
     * @return Field mapping, or null if the model is unknown
     */
    ObjectNode baselineFor(String modelName);
}
