package io.runconfig.search.record;

/**
 * Base for metrics where a greater value is better.
 */
public abstract class IncreasingRecord extends Record {

    protected IncreasingRecord(double value, double timestamp) {
        super(value, timestamp);
    }

    @Override
    public final Polarity polarity() {
        return Polarity.HIGHER_IS_BETTER;
    }

    @Override
    public int compareTo(Record other) {
        checkSameMetric(other);
        return Double.compare(value(), other.value());
    }

    @Override
    public Record add(Record other) {
        checkSameMetric(other);
        return withValue(value() + other.value());
    }

    @Override
    public Record subtract(Record other) {
        checkSameMetric(other);
        return withValue(value() - other.value());
    }

    @Override
    public double percentageGainOver(Record baseline) {
        checkSameMetric(baseline);
        if (baseline.value() == 0) {
            return 0;
        }
        return (value() - baseline.value()) / baseline.value() * 100;
    }
}
