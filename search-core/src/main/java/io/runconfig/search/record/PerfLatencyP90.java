package io.runconfig.search.record;

/**
 * 90th percentile request latency.
 */
public class PerfLatencyP90 extends DecreasingRecord {

    public static final String TAG = "perf_latency_p90";

    public PerfLatencyP90(double value) {
        this(value, 0);
    }

    public PerfLatencyP90(double value, double timestamp) {
        super(value, timestamp);
    }

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public String header() {
        return "p90 Latency (ms)";
    }

    @Override
    protected Record withValue(double value) {
        return new PerfLatencyP90(value, timestamp());
    }
}
