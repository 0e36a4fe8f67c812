package io.runconfig.search;

/**
 * Exception thrown when a global search bound is below 1 or a minimum exceeds its maximum.
 *
 * <p>Raised while the bounds are built, before anything is measured.</p>
 */
public class BoundsException extends RuntimeException {

    private final String knob;
    private final int min;
    private final int max;

    public BoundsException(String knob, int min, int max) {
        super(String.format(
            "Contradictory bounds for %s: min %d is greater than max %d", knob, min, max));
        this.knob = knob;
        this.min = min;
        this.max = max;
    }

    public BoundsException(String message) {
        super(message);
        this.knob = null;
        this.min = 0;
        this.max = 0;
    }

    public String getKnob() {
        return knob;
    }

    public int getMin() {
        return min;
    }

    public int getMax() {
        return max;
    }
}
