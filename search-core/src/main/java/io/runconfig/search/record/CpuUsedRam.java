package io.runconfig.search.record;

/**
 * Host memory held by the configuration.
 */
public class CpuUsedRam extends DecreasingRecord {

    public static final String TAG = "cpu_used_ram";

    public CpuUsedRam(double value) {
        this(value, 0);
    }

    public CpuUsedRam(double value, double timestamp) {
        super(value, timestamp);
    }

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public String header() {
        return "RAM Usage (MB)";
    }

    @Override
    public String header(boolean aggregationTag) {
        return aggregationTag ? "Max " + header() : header();
    }

    @Override
    protected Record withValue(double value) {
        return new CpuUsedRam(value, timestamp());
    }
}
