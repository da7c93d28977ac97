package com.vertector.nats.event;

/**
 * Converters from the numeric scales of the previous event schema to the string
 * scales used by the current catalog.
 */
public final class LegacyFieldConverters {

    private LegacyFieldConverters() {
    }

    /** Priority 1-5: 1-2 is {@code High}, 3 is {@code Medium}, 4-5 is {@code Low}. */
    public static String priorityLabel(int legacyPriority) {
        if (legacyPriority <= 2) {
            return "High";
        }
        if (legacyPriority == 3) {
            return "Medium";
        }
        return "Low";
    }

    /** Difficulty 1-10: 8+ is {@code Critical}, 4-7 is {@code Moderate}, below is {@code Minor}. */
    public static String severityLabel(int legacyDifficulty) {
        if (legacyDifficulty >= 8) {
            return "Critical";
        }
        if (legacyDifficulty >= 4) {
            return "Moderate";
        }
        return "Minor";
    }

    /** Percentage 0-100 to a 0-1 weight; {@code null} becomes 0. */
    public static double weightFraction(Double weightPercentage) {
        return weightPercentage == null ? 0.0 : weightPercentage / 100.0;
    }
}
