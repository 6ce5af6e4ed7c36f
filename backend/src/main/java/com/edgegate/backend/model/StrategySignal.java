package com.edgegate.backend.model;

/**
 * What a strategy wants to do at a bar. Price levels are absolute; {@code trailingStopPct} is a fraction
 * of the best price reached since entry. Null optionals fall back to engine defaults.
 */
public record StrategySignal(
        Action action,
        Double sizeNotional,
        Double stopLoss,
        Double takeProfit,
        Double trailingStopPct
) {
    public enum Action {
        LONG,
        SHORT,
        CLOSE,
        HOLD
    }

    private static final StrategySignal HOLD_SIGNAL = new StrategySignal(Action.HOLD, null, null, null, null);
    private static final StrategySignal CLOSE_SIGNAL = new StrategySignal(Action.CLOSE, null, null, null, null);

    public static StrategySignal hold() {
        return HOLD_SIGNAL;
    }

    public static StrategySignal close() {
        return CLOSE_SIGNAL;
    }

    public static StrategySignal enterLong(Double stopLoss, Double takeProfit) {
        return new StrategySignal(Action.LONG, null, stopLoss, takeProfit, null);
    }

    public static StrategySignal enterShort(Double stopLoss, Double takeProfit) {
        return new StrategySignal(Action.SHORT, null, stopLoss, takeProfit, null);
    }

    public StrategySignal withSize(double notional) {
        return new StrategySignal(action, notional, stopLoss, takeProfit, trailingStopPct);
    }

    public StrategySignal withTrailingStop(double pct) {
        return new StrategySignal(action, sizeNotional, stopLoss, takeProfit, pct);
    }

    public boolean isEntry() {
        return action == Action.LONG || action == Action.SHORT;
    }

    public Direction direction() {
        return switch (action) {
            case LONG -> Direction.LONG;
            case SHORT -> Direction.SHORT;
            default -> null;
        };
    }
}
