package io.runconfig.search;

/**
 * Where a variant's concurrency comes from.
 */
public enum ConcurrencyMode {
    /** {@code batch size x instance count x multiplier} */
    FORMULA,

    /** The entity's own {@code concurrency} dimension */
    COORDINATE
}
