package com.edgegate.backend.model;

public enum StrategyType {
    TREND_FOLLOWING,
    MEAN_REVERSION,
    BREAKOUT,
    VOLATILITY,
    GENERIC
}
