package io.runconfig.search.record;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleFunction;
import java.util.stream.Collectors;

/**
 * Registry of the known metric records, keyed by tag.
 */
public enum RecordType {
    PERF_THROUGHPUT(PerfThroughput.TAG, PerfThroughput::new),
    PERF_LATENCY_AVG(PerfLatencyAvg.TAG, PerfLatencyAvg::new),
    PERF_LATENCY_P90(PerfLatencyP90.TAG, PerfLatencyP90::new),
    PERF_LATENCY_P99(PerfLatencyP99.TAG, PerfLatencyP99::new),
    GPU_UTILIZATION(GpuUtilization.TAG, GpuUtilization::new),
    GPU_USED_MEMORY(GpuUsedMemory.TAG, GpuUsedMemory::new),
    CPU_USED_RAM(CpuUsedRam.TAG, CpuUsedRam::new);

    private static final Map<String, RecordType> BY_TAG = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(RecordType::tag, t -> t));

    private final String tag;
    private final DoubleFunction<Record> factory;

    RecordType(String tag, DoubleFunction<Record> factory) {
        this.tag = tag;
        this.factory = factory;
    }

    public String tag() {
        return tag;
    }

    public Record create(double value) {
        return factory.apply(value);
    }

    /**
     * Looks up a record type by tag.
     *
     * @throws IllegalArgumentException if the tag is unknown
     */
    public static RecordType forTag(String tag) {
        RecordType type = BY_TAG.get(tag);
        if (type == null) {
            throw new IllegalArgumentException("Unknown metric tag: " + tag + ". Known: " + knownTags());
        }
        return type;
    }

    public static boolean isKnown(String tag) {
        return BY_TAG.containsKey(tag);
    }

    public static List<String> knownTags() {
        return Arrays.stream(values()).map(RecordType::tag).toList();
    }
}
