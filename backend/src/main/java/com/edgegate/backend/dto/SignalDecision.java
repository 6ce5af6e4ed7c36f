package com.edgegate.backend.dto;

import com.edgegate.backend.trading.gate.DecisionResult;
import com.edgegate.backend.trading.gate.GateState;

public record SignalDecision(
        String symbol,
        String direction,
        String timeframe,
        GateState state,
        double positionMultiplier,
        String reason,
        String detail,
        double stopDistanceMultiplier,
        boolean pyramidingAllowed,
        double percentile,
        boolean percentileSubstituted,
        Double qualityScore,
        String blacklistReason
) {
    public static SignalDecision of(String symbol, String direction, String timeframe, DecisionResult result,
                                    double percentile, boolean substituted, Double qualityScore,
                                    String blacklistReason) {
        return new SignalDecision(symbol, direction, timeframe, result.state(), result.positionMultiplier(),
                result.reason(), result.detail(), result.stopDistanceMultiplier(), result.pyramidingAllowed(),
                percentile, substituted, qualityScore, blacklistReason);
    }
}
