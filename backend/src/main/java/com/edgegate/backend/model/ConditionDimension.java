package com.edgegate.backend.model;

public enum ConditionDimension {
    MARKET_REGIME,
    VOLATILITY_LEVEL,
    TIME_PERIOD,
    VOLUME_LEVEL
}
