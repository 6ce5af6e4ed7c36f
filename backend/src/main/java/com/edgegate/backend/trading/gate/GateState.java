package com.edgegate.backend.trading.gate;

public enum GateState {
    BLOCK,
    PROBE_SMALL,
    PROBE_MEDIUM,
    FULL
}
