package io.runconfig.search.record;

import java.util.Objects;

/**
 * A single measured value of one metric.
 *
 * <p>Ordering follows the metric's {@link Polarity}: {@code a.compareTo(b) > 0} always
 * means {@code a} is the better measurement, whatever the raw values are. Records of
 * different metrics are never comparable or combinable.</p>
 *
 * <p>Subclasses supply the tag, header and the polarity-specific arithmetic; see
 * {@link IncreasingRecord} and {@link DecreasingRecord}.</p>
 */
public abstract class Record implements Comparable<Record> {

    private final double value;
    private final double timestamp;

    protected Record(double value, double timestamp) {
        if (Double.isNaN(value)) throw new IllegalArgumentException("value cannot be NaN");
        this.value = value;
        this.timestamp = timestamp;
    }

    /**
     * Metric identifier used in constraints and objectives, e.g. "perf_throughput".
     */
    public abstract String tag();

    /**
     * Display header for the metric.
     */
    public abstract String header();

    /**
     * Display header, optionally marked as an aggregate (max, min, average).
     */
    public String header(boolean aggregationTag) {
        return header();
    }

    public abstract Polarity polarity();

    /**
     * Combines two records of the same metric into a new one.
     */
    public abstract Record add(Record other);

    /**
     * Inverse of {@link #add}. For lower-is-better metrics the operands are swapped so
     * that a positive result still means "this is better than other".
     */
    public abstract Record subtract(Record other);

    /**
     * Percentage gain of this record over a baseline; positive exactly when this record
     * is an improvement. A zero baseline yields 0.
     */
    public abstract double percentageGainOver(Record baseline);

    /**
     * Creates a record of the same metric with a new value.
     */
    protected abstract Record withValue(double value);

    public double value() {
        return value;
    }

    public double timestamp() {
        return timestamp;
    }

    protected void checkSameMetric(Record other) {
        Objects.requireNonNull(other, "other record cannot be null");
        if (!tag().equals(other.tag())) {
            throw new IllegalArgumentException(String.format(
                "Cannot combine '%s' with '%s'", tag(), other.tag()));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Double.compare(value, ((Record) o).value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), value);
    }

    @Override
    public String toString() {
        return String.format("%s=%.3f", tag(), value);
    }
}
