package io.runconfig.search.record;

/**
 * 99th percentile request latency.
 */
public class PerfLatencyP99 extends DecreasingRecord {

    public static final String TAG = "perf_latency_p99";

    public PerfLatencyP99(double value) {
        this(value, 0);
    }

    public PerfLatencyP99(double value, double timestamp) {
        super(value, timestamp);
    }

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public String header() {
        return "p99 Latency (ms)";
    }

    @Override
    protected Record withValue(double value) {
        return new PerfLatencyP99(value, timestamp());
    }
}
