package io.runconfig.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Assigns stable, sequential variant names to configuration payloads.
 *
 * <p>Payloads are compared without their {@code name} field, so two coordinates that
 * produce value-equal configurations share one variant and are measured once. Names have
 * the form {@code <entity>_config_<N>}, with N counting from 0 per entity; the default
 * configuration is always {@code <entity>_config_default}.</p>
 *
 * <p>Thread-safe. Lookup-or-assign is atomic per entity, and entities never share
 * indices or names.</p>
 */
public class VariantNameRegistry {

    private static final Logger log = LoggerFactory.getLogger(VariantNameRegistry.class);

    public static final String NAME_FIELD = "name";
    public static final String DEFAULT_SUFFIX = "_config_default";
    static final String ENSEMBLE_KEY_FIELD = "ensemble_key";

    private final Map<String, EntityVariants> entities = new ConcurrentHashMap<>();

    /**
     * Returns the variant name for a payload of the given entity.
     *
     * @param entityName Model or stage name
     * @param payload Configuration payload; its name field is ignored
     * @param isDefault If true the reserved default name is returned and nothing is recorded
     * @return Variant name
     */
    public String nameFor(String entityName, ObjectNode payload, boolean isDefault) {
        Objects.requireNonNull(entityName, "entityName cannot be null");
        if (isDefault) {
            return defaultName(entityName);
        }
        Objects.requireNonNull(payload, "payload cannot be null");

        ObjectNode canonical = payload.deepCopy();
        canonical.remove(NAME_FIELD);
        return entities.computeIfAbsent(entityName, EntityVariants::new).nameFor(canonical);
    }

    /**
     * Names a composite variant from the ordered variant names of its stages.
     */
    public String nameForEnsemble(String ensembleName, List<String> stageVariantNames, boolean isDefault) {
        ObjectNode key = JsonNodeFactory.instance.objectNode();
        key.put(ENSEMBLE_KEY_FIELD, String.join(",", stageVariantNames));
        return nameFor(ensembleName, key, isDefault);
    }

    public static String defaultName(String entityName) {
        return entityName + DEFAULT_SUFFIX;
    }

    /**
     * Returns how many distinct non-default variants have been named for an entity.
     */
    public int variantCount(String entityName) {
        EntityVariants variants = entities.get(entityName);
        return variants == null ? 0 : variants.size();
    }

    /**
     * Forgets every assigned name.
     */
    public void reset() {
        entities.clear();
    }

    /**
     * Names assigned for one entity. All access goes through the instance monitor.
     */
    private static final class EntityVariants {

        private final String entityName;
        private final Map<JsonNode, String> nameByPayload = new HashMap<>();
        private final Map<String, JsonNode> payloadByName = new HashMap<>();
        private int nextIndex;

        EntityVariants(String entityName) {
            this.entityName = entityName;
        }

        synchronized String nameFor(ObjectNode canonical) {
            String existing = nameByPayload.get(canonical);
            if (existing != null) {
                return existing;
            }

            String name = entityName + "_config_" + nextIndex;
            JsonNode previous = payloadByName.putIfAbsent(name, canonical);
            if (previous != null && !previous.equals(canonical)) {
                throw new NamingCollisionException(name);
            }
            nextIndex++;
            nameByPayload.put(canonical, name);
            log.debug("Assigned variant {}", name);
            return name;
        }

        synchronized int size() {
            return nameByPayload.size();
        }
    }
}
