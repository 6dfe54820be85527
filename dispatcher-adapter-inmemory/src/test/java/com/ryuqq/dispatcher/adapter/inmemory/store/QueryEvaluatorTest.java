package com.ryuqq.dispatcher.adapter.inmemory.store;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * QueryEvaluator 값 비교 규칙 테스트.
 */
class QueryEvaluatorTest {

    @Test
    void orderValues_DifferentTypes_RanksByType() {
        assertTrue(QueryEvaluator.orderValues(null, false) < 0);
        assertTrue(QueryEvaluator.orderValues(true, 0) < 0);
        assertTrue(QueryEvaluator.orderValues(10, "9") < 0);
        assertTrue(QueryEvaluator.orderValues("9", 9.5) > 0);
        assertTrue(QueryEvaluator.orderValues("z", List.of()) < 0);
    }

    @Test
    void orderValues_SameRank_ComparesValues() {
        assertTrue(QueryEvaluator.orderValues(9.5, 10L) < 0);
        assertTrue(QueryEvaluator.orderValues("10", "9") < 0);
        assertTrue(QueryEvaluator.orderValues(false, true) < 0);
        assertEquals(0, QueryEvaluator.orderValues(null, null));
    }

    @Test
    void compareNumbers_LargeLongAndDouble_NoPrecisionLoss() {
        // Given
        long exact = 1L << 53;
        double asDouble = 0x1p53;

        // When & Then
        assertEquals(0, QueryEvaluator.compareNumbers(exact, asDouble));
        assertTrue(QueryEvaluator.compareNumbers(exact + 1, asDouble) > 0);
        assertTrue(QueryEvaluator.compareNumbers(asDouble, exact + 1) < 0);
        assertTrue(QueryEvaluator.compareNumbers(Long.MAX_VALUE, 0x1p63) < 0);
        assertTrue(QueryEvaluator.compareNumbers(-1, -1.5) > 0);
        assertTrue(QueryEvaluator.compareNumbers(1, Double.NaN) < 0);
    }

    @Test
    void compare_DifferentTypesOrNull_ReturnsNull() {
        assertNull(QueryEvaluator.compare(1, "1"));
        assertNull(QueryEvaluator.compare(null, null));
        assertNull(QueryEvaluator.compare(true, 1));
        assertEquals(Integer.valueOf(0), QueryEvaluator.compare(5, 5.0));
    }
}
