package com.sensemaking.common.estimate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DistributionsTest {

    @Test
    @DisplayName("mean of an empty sample is 0")
    void emptyMean() {
        assertEquals(0.0, Distributions.mean(List.of()));
        assertEquals(2.5, Distributions.mean(List.of(1.0, 2.0, 3.0, 4.0)), 1e-12);
    }

    @Test
    @DisplayName("sample standard deviation uses n − 1")
    void sampleStandardDeviation() {
        List<Double> values = List.of(2.0, 4.0, 4.0, 4.0, 5.0, 5.0, 7.0, 9.0);
        assertEquals(Math.sqrt(32.0 / 7.0), Distributions.sampleStandardDeviation(values), 1e-12);
    }

    @Test
    @DisplayName("standard deviation of one value is 0")
    void singleValue() {
        assertEquals(0.0, Distributions.sampleStandardDeviation(List.of(0.7)));
        assertEquals(0.0, Distributions.sampleStandardDeviation(List.of()));
    }

    @Test
    @DisplayName("percentile interpolates between ranks")
    void percentile() {
        assertEquals(4.0, Distributions.percentile(List.of(5.0, 1.0, 4.0, 2.0, 3.0), 0.75), 1e-12);
        assertEquals(3.25, Distributions.percentile(List.of(4.0, 3.0, 2.0, 1.0), 0.75), 1e-12);
        assertEquals(1.0, Distributions.percentile(List.of(1.0), 0.75), 1e-12);
        assertTrue(Double.isNaN(Distributions.percentile(List.of(), 0.75)));
    }

    @Test
    @DisplayName("quantile outside [0, 1] is rejected")
    void invalidQuantile() {
        assertThrows(IllegalArgumentException.class, () -> Distributions.percentile(List.of(1.0), 1.5));
    }

    @Test
    @DisplayName("spread is max − min")
    void spread() {
        assertEquals(0.5, Distributions.spread(List.of(0.25, 0.75, 0.5)), 1e-12);
        assertEquals(0.0, Distributions.spread(List.of()));
    }
}
