package com.edgegate.backend.dto;

public record PercentileAnalysis(
        int count,
        int belowFloor,
        int probeSmall,
        int probeMedium,
        int full,
        double p10,
        double p25,
        double p50,
        double p75,
        double p90
) {
    public static PercentileAnalysis empty() {
        return new PercentileAnalysis(0, 0, 0, 0, 0, 0.0, 0.0, 0.0, 0.0, 0.0);
    }
}
