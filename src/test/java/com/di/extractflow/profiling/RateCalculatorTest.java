package com.di.extractflow.profiling;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RateCalculator Tests")
class RateCalculatorTest {

    @Test
    @DisplayName("Rate is the delta over elapsed seconds")
    void testRate() {
        assertEquals(5.0, RateCalculator.rate(10.0, 100.0, 20.0, 102.0), 1e-9);
        assertEquals(-1.0, RateCalculator.rate(3.0, 0.0, 2.0, 1.0), 1e-9);
    }

    @Test
    @DisplayName("A non-positive time delta gives zero")
    void testZeroDelta() {
        assertEquals(0.0, RateCalculator.rate(1.0, 5.0, 9.0, 5.0));
        assertEquals(0.0, RateCalculator.rate(1.0, 6.0, 9.0, 5.0));
    }
}
