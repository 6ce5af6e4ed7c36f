package com.edgegate.backend.service.risk;

import java.time.LocalDateTime;

/**
 * Discretises continuous trade conditions into the labels used for failure grouping.
 */
public final class ConditionBuckets {

    private ConditionBuckets() {
    }

    public static String volatilityLevel(double volatility) {
        if (volatility < 0.01) {
            return "LOW";
        }
        if (volatility < 0.03) {
            return "MEDIUM";
        }
        return "HIGH";
    }

    public static String volumeLevel(double volumeRatio) {
        if (volumeRatio < 0.8) {
            return "LOW";
        }
        if (volumeRatio < 1.2) {
            return "MEDIUM";
        }
        return "HIGH";
    }

    /** Times are taken as UTC. */
    public static String timePeriod(LocalDateTime time) {
        int hour = time.getHour();
        if (hour < 6) {
            return "NIGHT";
        }
        if (hour < 12) {
            return "MORNING";
        }
        if (hour < 18) {
            return "AFTERNOON";
        }
        return "EVENING";
    }
}
