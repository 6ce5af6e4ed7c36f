package com.edgegate.backend.model;

public enum ExitReason {
    STOP_LOSS,
    TAKE_PROFIT,
    TRAILING_STOP,
    SIGNAL,
    END_OF_DATA
}
