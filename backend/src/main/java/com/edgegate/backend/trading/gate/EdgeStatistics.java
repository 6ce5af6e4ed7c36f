package com.edgegate.backend.trading.gate;

public record EdgeStatistics(
        EdgeStatsKey key,
        int count,
        boolean sufficient,
        double min,
        double max,
        double mean,
        double p25,
        double p50,
        double p75,
        double p90
) {
    static EdgeStatistics empty(EdgeStatsKey key) {
        return new EdgeStatistics(key, 0, false, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0);
    }
}
