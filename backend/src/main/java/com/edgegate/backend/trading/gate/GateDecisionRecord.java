package com.edgegate.backend.trading.gate;

import com.edgegate.backend.model.Direction;

import java.time.LocalDateTime;

/**
 * One evaluated signal as seen by diagnostics. {@code percentile} is the value the gate was given;
 * {@code percentileSubstituted} marks keys that were still below the minimum sample count.
 */
public record GateDecisionRecord(
        LocalDateTime timestamp,
        String symbol,
        Direction direction,
        String timeframe,
        GateState state,
        String reason,
        double netEdge,
        double confidence,
        double percentile,
        boolean percentileSubstituted,
        double positionMultiplier
) {}
