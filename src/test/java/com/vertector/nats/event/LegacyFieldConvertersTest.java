package com.vertector.nats.event;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LegacyFieldConvertersTest {

    @ParameterizedTest
    @CsvSource({"1, High", "2, High", "3, Medium", "4, Low", "5, Low"})
    void mapsPriority(int legacy, String expected) {
        assertEquals(expected, LegacyFieldConverters.priorityLabel(legacy));
    }

    @ParameterizedTest
    @CsvSource({"1, Minor", "3, Minor", "4, Moderate", "7, Moderate", "8, Critical", "10, Critical"})
    void mapsDifficultyToSeverity(int legacy, String expected) {
        assertEquals(expected, LegacyFieldConverters.severityLabel(legacy));
    }

    @Test
    void convertsPercentageWeights() {
        assertEquals(0.25, LegacyFieldConverters.weightFraction(25.0), 1e-9);
        assertEquals(1.0, LegacyFieldConverters.weightFraction(100.0), 1e-9);
        assertEquals(0.0, LegacyFieldConverters.weightFraction(null), 1e-9);
    }
}
