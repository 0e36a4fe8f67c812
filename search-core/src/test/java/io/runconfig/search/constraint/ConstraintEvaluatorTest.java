package io.runconfig.search.constraint;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.runconfig.search.ModelMeasurement;
import io.runconfig.search.RunMeasurement;
import io.runconfig.search.record.GpuUsedMemory;
import io.runconfig.search.record.PerfLatencyP99;
import io.runconfig.search.record.PerfThroughput;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for constraint evaluation and the constraint file format.
 */
class ConstraintEvaluatorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    // ==================== Feasibility ====================

    @Test
    void testMaxViolation() {
        List<ModelConstraints> constraints = List.of(ModelConstraints.of(Constraint.max(PerfLatencyP99.TAG, 100)));
        RunMeasurement measurement = run(model("m", 500, 150));

        assertFalse(ConstraintEvaluator.satisfies(constraints, measurement));
        assertEquals(50.0, ConstraintEvaluator.infeasibilityScore(constraints, measurement), 1e-9);
    }

    @Test
    void testMinViolation() {
        List<ModelConstraints> constraints = List.of(ModelConstraints.of(Constraint.min(PerfThroughput.TAG, 400)));
        RunMeasurement measurement = run(model("m", 300, 10));

        assertFalse(ConstraintEvaluator.satisfies(constraints, measurement));
        assertEquals(25.0, ConstraintEvaluator.infeasibilityScore(constraints, measurement), 1e-9);
    }

    @Test
    void testBoundsAreInclusive() {
        List<ModelConstraints> constraints = List.of(ModelConstraints.of(
            Constraint.min(PerfThroughput.TAG, 300), Constraint.max(PerfLatencyP99.TAG, 10)));
        RunMeasurement measurement = run(model("m", 300, 10));

        assertTrue(ConstraintEvaluator.satisfies(constraints, measurement));
        assertEquals(0.0, ConstraintEvaluator.infeasibilityScore(constraints, measurement));
    }

    @Test
    void testViolationsAcrossModelsAccumulate() {
        List<ModelConstraints> constraints = List.of(
            ModelConstraints.of(Constraint.max(PerfLatencyP99.TAG, 100)),
            ModelConstraints.of(Constraint.min(PerfThroughput.TAG, 200)));
        RunMeasurement measurement = run(model("a", 1000, 120), model("b", 150, 1));

        assertEquals(20.0 + 25.0, ConstraintEvaluator.infeasibilityScore(constraints, measurement), 1e-9);
    }

    @Test
    void testUnconstrainedMetricsAndModelsAreIgnored() {
        List<ModelConstraints> constraints = Arrays.asList(
            ModelConstraints.of(Constraint.max(GpuUsedMemory.TAG, 1)), null);
        RunMeasurement measurement = run(model("a", 1, 1000), model("b", 1, 1000));

        assertTrue(ConstraintEvaluator.satisfies(constraints, measurement));
        assertTrue(ConstraintEvaluator.satisfies(null, measurement));
        assertEquals(0.0, ConstraintEvaluator.infeasibilityScore(List.of(), measurement));
    }

    @Test
    void testScoreIsZeroExactlyWhenSatisfied() {
        List<ModelConstraints> constraints = List.of(ModelConstraints.of(
            Constraint.between(PerfLatencyP99.TAG, 5, 50), Constraint.min(PerfThroughput.TAG, 100)));

        for (double latency = 0; latency <= 80; latency += 2.5) {
            for (double throughput = 0; throughput <= 200; throughput += 25) {
                RunMeasurement measurement = run(model("m", throughput, latency));
                boolean satisfied = ConstraintEvaluator.satisfies(constraints, measurement);
                double score = ConstraintEvaluator.infeasibilityScore(constraints, measurement);
                assertEquals(satisfied, score == 0.0, "latency=" + latency + " throughput=" + throughput);
            }
        }
    }

    @Test
    void testWideningBoundsNeverRaisesScore() {
        RunMeasurement measurement = run(model("m", 100, 90));
        double previous = Double.MAX_VALUE;
        for (double max = 10; max <= 120; max += 10) {
            List<ModelConstraints> constraints = List.of(ModelConstraints.of(Constraint.max(PerfLatencyP99.TAG, max)));
            double score = ConstraintEvaluator.infeasibilityScore(constraints, measurement);
            assertTrue(score <= previous);
            previous = score;
        }
        assertEquals(0.0, previous);
    }

    @Test
    void testZeroBoundUsesAbsoluteMiss() {
        Constraint constraint = Constraint.max(GpuUsedMemory.TAG, 0);

        assertEquals(3.0, constraint.failureFraction(3.0), 1e-9);
        assertEquals(0.0, constraint.failureFraction(0.0));
    }

    @Test
    void testConstraintNeedsABound() {
        assertThrows(IllegalArgumentException.class, () -> new Constraint(PerfThroughput.TAG, null, null));
        assertThrows(IllegalArgumentException.class, () -> ModelConstraints.of(
            Constraint.min(PerfThroughput.TAG, 1), Constraint.max(PerfThroughput.TAG, 5)));
    }

    // ==================== Constraint Source ====================

    @Test
    void testFromJsonWithDefaultFallback() throws Exception {
        ConstraintSource source = ConstraintSource.fromJson(MAPPER.readTree(
            "{\"resnet\": {\"perf_latency_p99\": {\"max\": 100}},"
                + " \"default\": {\"perf_throughput\": {\"min\": 50, \"max\": null}}}"));

        ModelConstraints resnet = source.forModel("resnet");
        assertEquals(100.0, resnet.get(PerfLatencyP99.TAG).max());
        assertNull(resnet.get(PerfThroughput.TAG));

        ModelConstraints other = source.forModel("bert");
        assertEquals(50.0, other.get(PerfThroughput.TAG).min());
        assertNull(other.get(PerfThroughput.TAG).max());

        assertEquals(List.of(resnet, other), source.forModels(List.of("resnet", "bert")));
    }

    @Test
    void testMissingModelWithoutDefaultIsUnconstrained() throws Exception {
        ConstraintSource source = ConstraintSource.fromJson(MAPPER.readTree(
            "{\"resnet\": {\"perf_latency_p99\": {\"max\": 100}}}"));

        assertTrue(source.forModel("bert").isEmpty());
        assertTrue(ConstraintSource.fromJson(null).forModel("resnet").isEmpty());
    }

    @Test
    void testUnknownMetricRejected() throws Exception {
        assertThrows(IllegalArgumentException.class, () -> ConstraintSource.fromJson(MAPPER.readTree(
            "{\"resnet\": {\"perf_speed\": {\"max\": 100}}}")));
        assertThrows(IllegalArgumentException.class, () -> ConstraintSource.fromJson(MAPPER.readTree("[1, 2]")));
    }

    // ==================== Helpers ====================

    private static RunMeasurement run(ModelMeasurement... models) {
        return new RunMeasurement(List.of(models));
    }

    private static ModelMeasurement model(String name, double throughput, double latencyP99) {
        return new ModelMeasurement(name, List.of(new PerfThroughput(throughput), new PerfLatencyP99(latencyP99)));
    }
}
