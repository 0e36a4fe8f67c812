package io.runconfig.search.record;

/**
 * Base for metrics where a lesser value is better.
 *
 * <p>Comparison, subtraction and percentage gain are inverted relative to
 * {@link IncreasingRecord} so that "greater" and "positive" still mean "better".</p>
 */
public abstract class DecreasingRecord extends Record {

    protected DecreasingRecord(double value, double timestamp) {
        super(value, timestamp);
    }

    @Override
    public final Polarity polarity() {
        return Polarity.LOWER_IS_BETTER;
    }

    @Override
    public int compareTo(Record other) {
        checkSameMetric(other);
        return Double.compare(other.value(), value());
    }

    @Override
    public Record add(Record other) {
        checkSameMetric(other);
        return withValue(value() + other.value());
    }

    @Override
    public Record subtract(Record other) {
        checkSameMetric(other);
        return withValue(other.value() - value());
    }

    @Override
    public double percentageGainOver(Record baseline) {
        checkSameMetric(baseline);
        if (baseline.value() == 0) {
            return 0;
        }
        return (baseline.value() - value()) / baseline.value() * 100;
    }
}
