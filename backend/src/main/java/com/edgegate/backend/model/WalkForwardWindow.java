package com.edgegate.backend.model;

import lombok.Builder;

@Builder
public record WalkForwardWindow(
        int index,
        int trainStart,
        int trainEnd,
        int testStart,
        int testEnd,
        double trainPnl,
        double testPnl,
        int trainTrades,
        int testTrades,
        double trainWinRate,
        double testWinRate,
        int testWins,
        double degradation,
        boolean passed
) {}
