package com.edgegate.backend.model;

@FunctionalInterface
public interface Strategy {
    /**
     * Called once per bar, after any exit triggered by that bar has been applied.
     */
    StrategySignal onBar(Candle bar, int index);
}
