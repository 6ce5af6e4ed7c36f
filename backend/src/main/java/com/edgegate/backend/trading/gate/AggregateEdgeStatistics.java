package com.edgegate.backend.trading.gate;

import java.util.List;

public record AggregateEdgeStatistics(
        int totalKeys,
        long totalSamples,
        int keysWithSufficientData,
        List<EdgeStatistics> keys
) {}
