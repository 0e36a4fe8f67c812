package io.runconfig.search.space;

/**
 * Exception thrown when a coordinate does not fit the dimension layout it is resolved against.
 */
public class DimensionException extends RuntimeException {

    private final int expectedSlots;
    private final int actualSlots;

    public DimensionException(int expectedSlots, int actualSlots) {
        super(String.format(
            "Coordinate arity mismatch. Expected %d slots but found %d",
            expectedSlots, actualSlots
        ));
        this.expectedSlots = expectedSlots;
        this.actualSlots = actualSlots;
    }

    public DimensionException(String message) {
        super(message);
        this.expectedSlots = -1;
        this.actualSlots = -1;
    }

    public int getExpectedSlots() {
        return expectedSlots;
    }

    public int getActualSlots() {
        return actualSlots;
    }
}
