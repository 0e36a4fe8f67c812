package io.runconfig.search.record;

/**
 * GPU compute utilization while the configuration was under load.
 */
public class GpuUtilization extends IncreasingRecord {

    public static final String TAG = "gpu_utilization";

    public GpuUtilization(double value) {
        this(value, 0);
    }

    public GpuUtilization(double value, double timestamp) {
        super(value, timestamp);
    }

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public String header() {
        return "GPU Utilization (%)";
    }

    @Override
    public String header(boolean aggregationTag) {
        return aggregationTag ? "Max " + header() : header();
    }

    @Override
    protected Record withValue(double value) {
        return new GpuUtilization(value, timestamp());
    }
}
