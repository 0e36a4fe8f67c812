package io.runconfig.search.record;

/**
 * Inference throughput reported by the benchmarking tool.
 */
public class PerfThroughput extends IncreasingRecord {

    public static final String TAG = "perf_throughput";

    public PerfThroughput(double value) {
        this(value, 0);
    }

    public PerfThroughput(double value, double timestamp) {
        super(value, timestamp);
    }

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public String header() {
        return "Throughput (infer/sec)";
    }

    @Override
    protected Record withValue(double value) {
        return new PerfThroughput(value, timestamp());
    }
}
