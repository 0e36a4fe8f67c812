package io.runconfig.search.record;

/**
 * Average end-to-end request latency.
 */
public class PerfLatencyAvg extends DecreasingRecord {

    public static final String TAG = "perf_latency_avg";

    public PerfLatencyAvg(double value) {
        this(value, 0);
    }

    public PerfLatencyAvg(double value, double timestamp) {
        super(value, timestamp);
    }

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public String header() {
        return "Avg Latency (ms)";
    }

    @Override
    protected Record withValue(double value) {
        return new PerfLatencyAvg(value, timestamp());
    }
}
