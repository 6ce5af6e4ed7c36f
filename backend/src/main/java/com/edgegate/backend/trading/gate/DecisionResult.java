package com.edgegate.backend.trading.gate;

/**
 * Outcome of one gate evaluation. {@code reason} is a stable category used for counting,
 * {@code detail} carries the values and thresholds that produced it.
 */
public record DecisionResult(
        GateState state,
        double positionMultiplier,
        String reason,
        String detail,
        double stopDistanceMultiplier,
        boolean pyramidingAllowed
) {

    public static DecisionResult block(String reason, String detail) {
        return new DecisionResult(GateState.BLOCK, 0.0, reason, detail, 0.0, false);
    }

    public static DecisionResult probe(GateState state, double multiplier, String reason, String detail,
                                       double stopDistanceMultiplier) {
        return new DecisionResult(state, multiplier, reason, detail, stopDistanceMultiplier, false);
    }

    public static DecisionResult full(double multiplier, String reason, String detail) {
        return new DecisionResult(GateState.FULL, multiplier, reason, detail, 1.0, true);
    }

    public boolean isBlocked() {
        return state == GateState.BLOCK;
    }
}
