package io.runconfig.search.space;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * An immutable point in the discrete search space, one integer per dimension slot.
 *
 * <p>Every transition produces a new instance; the backing array never escapes.</p>
 */
public final class Coordinate {

    private final int[] slots;

    public Coordinate(int... slots) {
        for (int slot : slots) {
            if (slot < 0) {
                throw new IllegalArgumentException("Coordinate slots must be >= 0: " + Arrays.toString(slots));
            }
        }
        this.slots = slots.clone();
    }

    public static Coordinate of(List<Integer> slots) {
        return new Coordinate(slots.stream().mapToInt(Integer::intValue).toArray());
    }

    /**
     * Creates a coordinate with every slot set to zero.
     */
    public static Coordinate zero(int size) {
        return new Coordinate(new int[size]);
    }

    public int get(int slot) {
        return slots[slot];
    }

    public int size() {
        return slots.length;
    }

    public int[] toArray() {
        return slots.clone();
    }

    /**
     * Returns a copy with one slot replaced.
     */
    public Coordinate withSlot(int slot, int value) {
        int[] copy = slots.clone();
        copy[slot] = value;
        return new Coordinate(copy);
    }

    /**
     * Returns a copy with {@code slot} raised to at least {@code lowerBound}.
     */
    public Coordinate clampToBound(int slot, int lowerBound) {
        if (slots[slot] >= lowerBound) {
            return this;
        }
        return withSlot(slot, lowerBound);
    }

    /**
     * Adds a per-slot delta, returning a new coordinate.
     *
     * @throws DimensionException if the delta has a different arity
     * @throws IllegalArgumentException if any resulting slot is negative
     */
    public Coordinate plus(int[] delta) {
        if (delta.length != slots.length) {
            throw new DimensionException(slots.length, delta.length);
        }
        int[] sum = new int[slots.length];
        for (int i = 0; i < slots.length; i++) {
            sum[i] = slots[i] + delta[i];
        }
        return new Coordinate(sum);
    }

    /**
     * Chebyshev distance (largest absolute slot delta) to another coordinate.
     */
    public int distanceTo(Coordinate other) {
        if (other.slots.length != slots.length) {
            throw new DimensionException(slots.length, other.slots.length);
        }
        int max = 0;
        for (int i = 0; i < slots.length; i++) {
            max = Math.max(max, Math.abs(slots[i] - other.slots[i]));
        }
        return max;
    }

    /**
     * Enumerates every coordinate within Chebyshev distance {@code radius} of this one.
     *
     * <p>The origin and coordinates with a negative slot are excluded. Offsets are walked
     * like an odometer: slot 0 is the most significant digit and every digit runs from
     * {@code -radius} to {@code +radius}. Each call to {@code iterator()} starts over, and
     * nothing is materialized up front.</p>
     *
     * @param radius Neighborhood radius, must be >= 0
     * @return lazy, finite, restartable sequence of neighbors
     */
    public Iterable<Coordinate> neighborsWithinRadius(int radius) {
        if (radius < 0) {
            throw new IllegalArgumentException("radius must be >= 0");
        }
        return () -> new NeighborIterator(slots, radius);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Coordinate other)) return false;
        return Arrays.equals(slots, other.slots);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(slots);
    }

    @Override
    public String toString() {
        return Arrays.toString(slots);
    }

    private static final class NeighborIterator implements Iterator<Coordinate> {

        private final int[] origin;
        private final int radius;
        private final int[] offset;
        private boolean exhausted;
        private Coordinate next;

        NeighborIterator(int[] origin, int radius) {
            this.origin = origin;
            this.radius = radius;
            this.offset = new int[origin.length];
            Arrays.fill(offset, -radius);
            this.exhausted = origin.length == 0 || radius == 0;
            if (!exhausted) {
                advanceToValid(false);
            }
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public Coordinate next() {
            if (next == null) {
                throw new NoSuchElementException();
            }
            Coordinate current = next;
            advanceToValid(true);
            return current;
        }

        /**
         * Moves to the next offset that is not the origin and has no negative slot.
         */
        private void advanceToValid(boolean stepFirst) {
            next = null;
            if (stepFirst && !increment()) {
                return;
            }
            while (!exhausted) {
                Coordinate candidate = candidate();
                if (candidate != null) {
                    next = candidate;
                    return;
                }
                if (!increment()) {
                    return;
                }
            }
        }

        private Coordinate candidate() {
            boolean isOrigin = true;
            int[] values = new int[origin.length];
            for (int i = 0; i < origin.length; i++) {
                if (offset[i] != 0) isOrigin = false;
                values[i] = origin[i] + offset[i];
                if (values[i] < 0) return null;
            }
            return isOrigin ? null : new Coordinate(values);
        }

        private boolean increment() {
            for (int i = offset.length - 1; i >= 0; i--) {
                if (offset[i] < radius) {
                    offset[i]++;
                    return true;
                }
                offset[i] = -radius;
            }
            exhausted = true;
            return false;
        }
    }
}
