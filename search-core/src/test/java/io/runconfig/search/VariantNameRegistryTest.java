package io.runconfig.search;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for VariantNameRegistry.
 */
class VariantNameRegistryTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    // ==================== Naming ====================

    @Test
    void testSamePayloadGetsSameName() {
        VariantNameRegistry registry = new VariantNameRegistry();

        String first = registry.nameFor("resnet", payload(8, 2), false);
        String second = registry.nameFor("resnet", payload(8, 2), false);

        assertEquals("resnet_config_0", first);
        assertEquals(first, second);
        assertEquals(1, registry.variantCount("resnet"));
    }

    @Test
    void testDistinctPayloadsGetSequentialNames() {
        VariantNameRegistry registry = new VariantNameRegistry();

        assertEquals("resnet_config_0", registry.nameFor("resnet", payload(1, 1), false));
        assertEquals("resnet_config_1", registry.nameFor("resnet", payload(2, 1), false));
        assertEquals("resnet_config_2", registry.nameFor("resnet", payload(2, 2), false));
        assertEquals("resnet_config_1", registry.nameFor("resnet", payload(2, 1), false));
    }

    @Test
    void testNameFieldIsIgnored() {
        VariantNameRegistry registry = new VariantNameRegistry();
        ObjectNode a = payload(4, 1).put("name", "resnet_config_7");
        ObjectNode b = payload(4, 1).put("name", "something_else");

        assertEquals(registry.nameFor("resnet", a, false), registry.nameFor("resnet", b, false));
        assertEquals("resnet_config_7", a.get("name").asText(), "caller payload must not be modified");
    }

    @Test
    void testFieldOrderDoesNotMatter() throws Exception {
        VariantNameRegistry registry = new VariantNameRegistry();
        ObjectNode a = (ObjectNode) MAPPER.readTree("{\"max_batch_size\": 8, \"backend\": \"onnx\"}");
        ObjectNode b = (ObjectNode) MAPPER.readTree("{\"backend\": \"onnx\", \"max_batch_size\": 8}");

        assertEquals(registry.nameFor("m", a, false), registry.nameFor("m", b, false));
    }

    @Test
    void testDefaultNameIsReservedAndNotCounted() {
        VariantNameRegistry registry = new VariantNameRegistry();

        assertEquals("resnet_config_default", registry.nameFor("resnet", payload(1, 1), true));
        assertEquals("resnet_config_default", VariantNameRegistry.defaultName("resnet"));
        assertEquals(0, registry.variantCount("resnet"));
        assertEquals("resnet_config_0", registry.nameFor("resnet", payload(1, 1), false));
    }

    @Test
    void testEntitiesAreIndependent() {
        VariantNameRegistry registry = new VariantNameRegistry();

        assertEquals("a_config_0", registry.nameFor("a", payload(1, 1), false));
        assertEquals("b_config_0", registry.nameFor("b", payload(1, 1), false));
        assertEquals("a_config_1", registry.nameFor("a", payload(2, 1), false));
        assertEquals(2, registry.variantCount("a"));
        assertEquals(1, registry.variantCount("b"));
    }

    @Test
    void testEnsembleNamesFollowStageNames() {
        VariantNameRegistry registry = new VariantNameRegistry();

        String first = registry.nameForEnsemble("pipeline", List.of("pre_config_0", "net_config_0"), false);
        String same = registry.nameForEnsemble("pipeline", List.of("pre_config_0", "net_config_0"), false);
        String other = registry.nameForEnsemble("pipeline", List.of("pre_config_0", "net_config_1"), false);

        assertEquals("pipeline_config_0", first);
        assertEquals(first, same);
        assertEquals("pipeline_config_1", other);
        assertEquals("pipeline_config_default",
            registry.nameForEnsemble("pipeline", List.of("pre_config_default"), true));
    }

    @Test
    void testDistinctPayloadsNeverShareAName() {
        VariantNameRegistry registry = new VariantNameRegistry();
        Set<String> names = new HashSet<>();

        for (int batch = 1; batch <= 20; batch++) {
            for (int instances = 1; instances <= 10; instances++) {
                assertTrue(names.add(registry.nameFor("m", payload(batch, instances), false)));
            }
        }

        assertEquals(200, registry.variantCount("m"));
        assertEquals("m_config_0", registry.nameFor("m", payload(1, 1), false));
        assertEquals("m_config_199", registry.nameFor("m", payload(20, 10), false));
    }

    @Test
    void testReset() {
        VariantNameRegistry registry = new VariantNameRegistry();
        registry.nameFor("m", payload(1, 1), false);
        registry.nameFor("m", payload(2, 1), false);

        registry.reset();

        assertEquals(0, registry.variantCount("m"));
        assertEquals("m_config_0", registry.nameFor("m", payload(2, 1), false));
    }

    // ==================== Concurrency ====================

    @Test
    void testConcurrentCallersAgreeOnNames() throws Exception {
        VariantNameRegistry registry = new VariantNameRegistry();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<List<String>>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                futures.add(pool.submit(() -> {
                    List<String> names = new ArrayList<>();
                    for (int batch = 1; batch <= 50; batch++) {
                        names.add(registry.nameFor("m", payload(batch, 1), false));
                    }
                    return names;
                }));
            }

            List<String> reference = futures.get(0).get(10, TimeUnit.SECONDS);
            for (Future<List<String>> future : futures) {
                assertEquals(reference, future.get(10, TimeUnit.SECONDS));
            }
            Set<String> distinct = new HashSet<>(reference);
            assertEquals(50, distinct.size());
            assertEquals(50, registry.variantCount("m"));
        } finally {
            pool.shutdownNow();
        }
    }

    // ==================== Helpers ====================

    private static ObjectNode payload(int maxBatchSize, int instances) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("max_batch_size", maxBatchSize);
        node.putArray("instance_group").addObject().put("count", instances).put("kind", "KIND_GPU");
        return node;
    }
}
