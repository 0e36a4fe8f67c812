package io.runconfig.search.record;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for polarity-aware record comparison and arithmetic.
 */
class RecordTest {

    // ==================== Higher Is Better ====================

    @Test
    void testThroughputOrdering() {
        Record low = new PerfThroughput(100);
        Record high = new PerfThroughput(150);

        assertTrue(high.compareTo(low) > 0);
        assertTrue(low.compareTo(high) < 0);
        assertEquals(0, low.compareTo(new PerfThroughput(100)));
        assertEquals(Polarity.HIGHER_IS_BETTER, low.polarity());
    }

    @Test
    void testThroughputArithmetic() {
        Record a = new PerfThroughput(150);
        Record b = new PerfThroughput(100);

        assertEquals(new PerfThroughput(250), a.add(b));
        assertEquals(new PerfThroughput(50), a.subtract(b));
        assertInstanceOf(PerfThroughput.class, a.add(b));
    }

    @Test
    void testThroughputPercentageGain() {
        Record baseline = new PerfThroughput(100);

        assertEquals(50.0, new PerfThroughput(150).percentageGainOver(baseline), 1e-9);
        assertEquals(-25.0, new PerfThroughput(75).percentageGainOver(baseline), 1e-9);
    }

    // ==================== Lower Is Better ====================

    @Test
    void testLatencyOrderingIsInverted() {
        Record fast = new PerfLatencyAvg(10);
        Record slow = new PerfLatencyAvg(20);

        assertTrue(fast.compareTo(slow) > 0);
        assertTrue(slow.compareTo(fast) < 0);
        assertEquals(Polarity.LOWER_IS_BETTER, fast.polarity());
    }

    @Test
    void testLatencySortPutsBestLast() {
        List<Record> records = new ArrayList<>(List.of(
            new PerfLatencyP99(30), new PerfLatencyP99(10), new PerfLatencyP99(20)));
        Collections.sort(records);

        assertEquals(List.of(new PerfLatencyP99(30), new PerfLatencyP99(20), new PerfLatencyP99(10)), records);
        assertEquals(new PerfLatencyP99(10), Collections.max(records));
    }

    @Test
    void testLatencySubtractionIsReversed() {
        Record fast = new PerfLatencyAvg(10);
        Record slow = new PerfLatencyAvg(25);

        assertEquals(new PerfLatencyAvg(15), fast.subtract(slow));
        assertEquals(new PerfLatencyAvg(35), fast.add(slow));
    }

    @Test
    void testLatencyPercentageGainIsPositiveWhenFaster() {
        Record baseline = new PerfLatencyAvg(20);

        assertEquals(50.0, new PerfLatencyAvg(10).percentageGainOver(baseline), 1e-9);
        assertEquals(-50.0, new PerfLatencyAvg(30).percentageGainOver(baseline), 1e-9);
    }

    @Test
    void testZeroBaselineGivesZeroGain() {
        assertEquals(0.0, new PerfThroughput(10).percentageGainOver(new PerfThroughput(0)));
        assertEquals(0.0, new GpuUsedMemory(10).percentageGainOver(new GpuUsedMemory(0)));
    }

    // ==================== Type Safety ====================

    @Test
    void testDifferentMetricsCannotBeCombined() {
        Record throughput = new PerfThroughput(10);
        Record latency = new PerfLatencyAvg(10);

        assertThrows(IllegalArgumentException.class, () -> throughput.add(latency));
        assertThrows(IllegalArgumentException.class, () -> throughput.compareTo(latency));
        assertThrows(IllegalArgumentException.class, () -> latency.percentageGainOver(throughput));
    }

    @Test
    void testEqualityIgnoresTimestamp() {
        assertEquals(new PerfThroughput(5, 1.0), new PerfThroughput(5, 2.0));
        assertNotEquals(new PerfThroughput(5), new GpuUtilization(5));
    }

    @Test
    void testNaNRejected() {
        assertThrows(IllegalArgumentException.class, () -> new PerfThroughput(Double.NaN));
    }

    // ==================== Headers & Registry ====================

    @Test
    void testHeaders() {
        assertEquals("Avg Latency (ms)", new PerfLatencyAvg(1).header());
        assertEquals("Throughput (infer/sec)", new PerfThroughput(1).header(true));
        assertEquals("Max GPU Memory Usage (MB)", new GpuUsedMemory(1).header(true));
        assertEquals("GPU Memory Usage (MB)", new GpuUsedMemory(1).header(false));
    }

    @Test
    void testRecordTypeLookup() {
        Record record = RecordType.forTag("perf_latency_p99").create(12.5);

        assertInstanceOf(PerfLatencyP99.class, record);
        assertEquals(12.5, record.value());
        assertTrue(RecordType.isKnown("cpu_used_ram"));
        assertFalse(RecordType.isKnown("made_up"));
        assertThrows(IllegalArgumentException.class, () -> RecordType.forTag("made_up"));
    }

    @Test
    void testEveryRegisteredTypeRoundTripsItsTag() {
        for (RecordType type : RecordType.values()) {
            assertEquals(type.tag(), type.create(1).tag());
        }
    }
}
