package com.edgegate.backend.service.risk;

public record QualityScore(
        double score,
        boolean allowed,
        double signalStrength,
        double marketStateMatch,
        double historicalPerformance,
        double riskReward
) {
    static QualityScore disabled() {
        return new QualityScore(100.0, true, 0.0, 0.0, 0.0, 0.0);
    }
}
