package io.runconfig.search;

/**
 * Global overrides applied on top of the values a coordinate resolves to.
 *
 * <p>Every bound is optional (null). A max clamps down and a min clamps up; a min above
 * its paired max is rejected at construction with {@link BoundsException}.</p>
 */
public record SearchBounds(
    Integer minModelBatchSize,
    Integer maxModelBatchSize,
    Integer minInstanceCount,
    Integer maxInstanceCount,
    Integer minConcurrency,
    Integer maxConcurrency,

    /** Factor in {@code concurrency = batch size x instance count x multiplier} */
    int concurrencyMultiplier
) {
    public static final int DEFAULT_CONCURRENCY_MULTIPLIER = 2;

    public SearchBounds {
        check("model batch size", minModelBatchSize, maxModelBatchSize);
        check("instance count", minInstanceCount, maxInstanceCount);
        check("concurrency", minConcurrency, maxConcurrency);
        if (concurrencyMultiplier < 1) {
            throw new BoundsException("concurrency multiplier must be >= 1, was " + concurrencyMultiplier);
        }
    }

    public static SearchBounds defaults() {
        return new SearchBounds(null, null, null, null, null, null, DEFAULT_CONCURRENCY_MULTIPLIER);
    }

    public SearchBounds withModelBatchSize(Integer min, Integer max) {
        return new SearchBounds(min, max, minInstanceCount, maxInstanceCount, minConcurrency, maxConcurrency,
            concurrencyMultiplier);
    }

    public SearchBounds withInstanceCount(Integer min, Integer max) {
        return new SearchBounds(minModelBatchSize, maxModelBatchSize, min, max, minConcurrency, maxConcurrency,
            concurrencyMultiplier);
    }

    public SearchBounds withConcurrency(Integer min, Integer max) {
        return new SearchBounds(minModelBatchSize, maxModelBatchSize, minInstanceCount, maxInstanceCount, min, max,
            concurrencyMultiplier);
    }

    public SearchBounds withConcurrencyMultiplier(int multiplier) {
        return new SearchBounds(minModelBatchSize, maxModelBatchSize, minInstanceCount, maxInstanceCount,
            minConcurrency, maxConcurrency, multiplier);
    }

    public int clampModelBatchSize(int value) {
        return clamp(value, minModelBatchSize, maxModelBatchSize);
    }

    public int clampInstanceCount(int value) {
        return clamp(value, minInstanceCount, maxInstanceCount);
    }

    public int clampConcurrency(int value) {
        return clamp(value, minConcurrency, maxConcurrency);
    }

    /**
     * Concurrency derived from the (already clamped) batch size and instance count,
     * then clamped itself. A product beyond {@code Integer.MAX_VALUE} saturates before clamping.
     */
    public int concurrencyFor(int modelBatchSize, int instanceCount) {
        long raw = (long) modelBatchSize * instanceCount * concurrencyMultiplier;
        return clampConcurrency((int) Math.min(raw, Integer.MAX_VALUE));
    }

    public boolean hasConcurrencyOverride() {
        return maxConcurrency != null || minConcurrency != null;
    }

    /**
     * The concurrency used verbatim for composite models: the max bound if set, else the min bound.
     *
     * @throws IllegalStateException if neither is set
     */
    public int concurrencyOverride() {
        if (maxConcurrency != null) return maxConcurrency;
        if (minConcurrency != null) return minConcurrency;
        throw new IllegalStateException("no concurrency override configured");
    }

    private static int clamp(int value, Integer min, Integer max) {
        int clamped = value;
        if (max != null) clamped = Math.min(clamped, max);
        if (min != null) clamped = Math.max(clamped, min);
        return clamped;
    }

    private static void check(String knob, Integer min, Integer max) {
        if (min != null && min < 1) {
            throw new BoundsException(String.format("min %s must be >= 1, was %d", knob, min));
        }
        if (max != null && max < 1) {
            throw new BoundsException(String.format("max %s must be >= 1, was %d", knob, max));
        }
        if (min != null && max != null && min > max) {
            throw new BoundsException(knob, min, max);
        }
    }
}
