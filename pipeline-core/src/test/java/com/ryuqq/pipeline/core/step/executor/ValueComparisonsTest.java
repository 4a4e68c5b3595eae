package com.ryuqq.pipeline.core.step.executor;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ValueComparisons 정렬 비교 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ValueComparisonsTest {

    @Test
    void compareForSort_MixedNumbers_ComparesByValue() {
        // When & Then
        assertTrue(ValueComparisons.compareForSort(2, 10.5) < 0);
        assertEquals(0, ValueComparisons.compareForSort(3L, 3));
    }

    @Test
    void compareForSort_SameComparableType_UsesNaturalOrder() {
        // When & Then
        assertTrue(ValueComparisons.compareForSort(LocalDate.of(2026, 1, 2), LocalDate.of(2025, 12, 31)) > 0);
        assertTrue(ValueComparisons.compareForSort("apple", "banana") < 0);
    }

    @Test
    void compareForSort_DifferentTypes_ComparesText() {
        // When & Then
        assertTrue(ValueComparisons.compareForSort("10", true) < 0);
    }

    @Test
    void compareForSort_NullsSortLast() {
        // When & Then
        assertTrue(ValueComparisons.compareForSort(null, 1) > 0);
        assertTrue(ValueComparisons.compareForSort(1, null) < 0);
        assertEquals(0, ValueComparisons.compareForSort(null, null));
    }
}
