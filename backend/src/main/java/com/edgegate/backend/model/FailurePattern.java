package com.edgegate.backend.model;

import lombok.Builder;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * A (strategy, condition tuple) combination whose historical trades lose systematically.
 */
@Builder
public record FailurePattern(
        String strategyId,
        Map<ConditionDimension, String> conditions,
        double winRate,
        double expectedValue,
        double profitFactor,
        int sampleSize,
        double severity
) {
    public String describe() {
        String conditionText = conditions.entrySet().stream()
                .map(e -> e.getKey().name().toLowerCase() + "=" + e.getValue())
                .collect(Collectors.joining(", "));
        return String.format("%s [%s] wr=%.1f%% ev=%.2f pf=%.2f n=%d severity=%.2f",
                strategyId, conditionText, winRate * 100, expectedValue, profitFactor, sampleSize, severity);
    }
}
