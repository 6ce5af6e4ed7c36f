package com.edgegate.backend.model;

public enum MarketRegime {
    TRENDING_UP,
    TRENDING_DOWN,
    RANGING,
    VOLATILE,
    QUIET,
    UNKNOWN
}
