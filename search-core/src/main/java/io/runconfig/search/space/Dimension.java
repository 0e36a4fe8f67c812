package io.runconfig.search.space;

import java.util.Objects;

/**
 * One tunable axis of the search space.
 *
 * <p>A coordinate slot never resolves below {@code minBound}: exponential axes
 * yield {@code 2^slot} and linear axes yield {@code slot + 1}, so slot 0 on a
 * linear axis means a value of 1.</p>
 */
public record Dimension(
    /** Axis name, e.g. "max_batch_size" */
    String name,

    /** Growth law */
    Law law,

    /** Smallest slot value ever used for this axis */
    int minBound
) {
    public static final String MAX_BATCH_SIZE = "max_batch_size";
    public static final String INSTANCE_COUNT = "instance_count";
    public static final String CONCURRENCY = "concurrency";

    /** Offset added to a linear slot when resolving its value. */
    public static final int LINEAR_OFFSET = 1;

    /**
     * How a slot value grows into a concrete value.
     */
    public enum Law {
        LINEAR,
        EXPONENTIAL
    }

    public Dimension {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(law, "law cannot be null");
        if (minBound < 0) throw new IllegalArgumentException("minBound must be >= 0");
        // 2^30 is the largest power of two an int holds
        if (law == Law.EXPONENTIAL && minBound > 30) {
            throw new IllegalArgumentException("minBound too large for an exponential dimension: " + minBound);
        }
    }

    public static Dimension linear(String name) {
        return new Dimension(name, Law.LINEAR, 0);
    }

    public static Dimension linear(String name, int minBound) {
        return new Dimension(name, Law.LINEAR, minBound);
    }

    public static Dimension exponential(String name) {
        return new Dimension(name, Law.EXPONENTIAL, 0);
    }

    public static Dimension exponential(String name, int minBound) {
        return new Dimension(name, Law.EXPONENTIAL, minBound);
    }

    /**
     * Resolves a coordinate slot into the concrete value for this axis.
     *
     * @param slot coordinate slot, floored at {@link #minBound()}
     * @return resolved value
     */
    public int valueAt(int slot) {
        int effective = Math.max(slot, minBound);
        return switch (law) {
            case LINEAR -> effective + LINEAR_OFFSET;
            case EXPONENTIAL -> {
                if (effective > 30) {
                    throw new DimensionException(String.format(
                        "Slot %d of dimension '%s' overflows an exponential value", effective, name));
                }
                yield 1 << effective;
            }
        };
    }
}
