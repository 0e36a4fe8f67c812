package io.runconfig.search.record;

/**
 * GPU memory held by the configuration.
 */
public class GpuUsedMemory extends DecreasingRecord {

    public static final String TAG = "gpu_used_memory";

    public GpuUsedMemory(double value) {
        this(value, 0);
    }

    public GpuUsedMemory(double value, double timestamp) {
        super(value, timestamp);
    }

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public String header() {
        return "GPU Memory Usage (MB)";
    }

    @Override
    public String header(boolean aggregationTag) {
        return aggregationTag ? "Max " + header() : header();
    }

    @Override
    protected Record withValue(double value) {
        return new GpuUsedMemory(value, timestamp());
    }
}
