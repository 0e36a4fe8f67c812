package io.runconfig.search.cli;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.runconfig.search.ModelConfig;
import io.runconfig.search.ModelRunConfig;
import io.runconfig.search.RunConfig;
import io.runconfig.search.space.Coordinate;

/**
 * Renders run configurations for the command line.
 */
final class RunConfigJson {

    private RunConfigJson() {
    }

    static ObjectNode toJson(Coordinate coordinate, RunConfig runConfig) {
        ObjectNode node = SearchCli.MAPPER.createObjectNode();
        if (coordinate == null) {
            node.put("default", true);
        } else {
            ArrayNode slots = node.putArray("coordinate");
            for (int slot : coordinate.toArray()) {
                slots.add(slot);
            }
        }

        ArrayNode models = node.putArray("models");
        for (ModelRunConfig modelRunConfig : runConfig.modelRunConfigs()) {
            ObjectNode model = models.addObject();
            model.put("model", modelRunConfig.modelName());
            model.set("config", modelRunConfig.modelConfig().toJson());
            model.set("perf", SearchCli.MAPPER.valueToTree(modelRunConfig.perfConfig().toMap()));
            if (modelRunConfig.isEnsemble()) {
                ArrayNode stages = model.putArray("stages");
                for (ModelConfig stage : modelRunConfig.ensembleSubconfigs()) {
                    stages.add(stage.toJson());
                }
            }
        }
        node.put("representation", runConfig.representation());
        return node;
    }
}
