package io.runconfig.search;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SearchBounds clamping and validation.
 */
class SearchBoundsTest {

    @Test
    void testDefaultsLeaveValuesUntouched() {
        SearchBounds bounds = SearchBounds.defaults();

        assertEquals(128, bounds.clampModelBatchSize(128));
        assertEquals(7, bounds.clampInstanceCount(7));
        assertEquals(32, bounds.concurrencyFor(8, 2));
        assertFalse(bounds.hasConcurrencyOverride());
        assertThrows(IllegalStateException.class, bounds::concurrencyOverride);
    }

    @Test
    void testClampBothDirections() {
        SearchBounds bounds = SearchBounds.defaults().withModelBatchSize(4, 16);

        assertEquals(4, bounds.clampModelBatchSize(1));
        assertEquals(8, bounds.clampModelBatchSize(8));
        assertEquals(16, bounds.clampModelBatchSize(64));
    }

    @Test
    void testClampIsIdempotent() {
        SearchBounds bounds = SearchBounds.defaults().withInstanceCount(2, 5).withConcurrency(3, 40);

        for (int value = 1; value <= 100; value++) {
            int once = bounds.clampConcurrency(value);
            assertEquals(once, bounds.clampConcurrency(once));
            int instances = bounds.clampInstanceCount(value);
            assertEquals(instances, bounds.clampInstanceCount(instances));
        }
    }

    @Test
    void testConcurrencyIsClampedAfterDerivation() {
        SearchBounds bounds = SearchBounds.defaults().withConcurrency(null, 100);

        assertEquals(100, bounds.concurrencyFor(64, 4));
        assertEquals(100, bounds.concurrencyOverride());
    }

    @Test
    void testMultiplier() {
        assertEquals(24, SearchBounds.defaults().withConcurrencyMultiplier(3).concurrencyFor(4, 2));
        assertThrows(BoundsException.class, () -> SearchBounds.defaults().withConcurrencyMultiplier(0));
    }

    @Test
    void testOverridePrefersMax() {
        assertEquals(16, SearchBounds.defaults().withConcurrency(16, null).concurrencyOverride());
        assertEquals(32, SearchBounds.defaults().withConcurrency(16, 32).concurrencyOverride());
    }

    @Test
    void testInvalidBoundsRejected() {
        assertThrows(BoundsException.class, () -> SearchBounds.defaults().withModelBatchSize(32, 16));
        assertThrows(BoundsException.class, () -> SearchBounds.defaults().withInstanceCount(0, null));
        assertThrows(BoundsException.class, () -> SearchBounds.defaults().withConcurrency(null, -1));
    }

    @Test
    void testOverflowingProductIsClampedToBound() {
        SearchBounds bounds = SearchBounds.defaults().withConcurrency(null, 1024);

        assertEquals(1024, bounds.concurrencyFor(1 << 30, 1 << 10));
        assertEquals(1024, bounds.concurrencyFor(1 << 30, 1));
    }

    @Test
    void testOverflowingProductSaturatesWithoutBound() {
        assertEquals(Integer.MAX_VALUE, SearchBounds.defaults().concurrencyFor(1 << 30, 1 << 10));
    }
}
