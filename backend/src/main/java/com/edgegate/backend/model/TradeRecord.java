package com.edgegate.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeRecord {
    private String strategyId;
    private String strategyVersion;
    private Direction side;
    private LocalDateTime entryTime;
    private LocalDateTime exitTime;
    private double entryPrice;
    private double exitPrice;
    private double quantity;
    private double pnl;
    private double pnlPct;
    private boolean win;
    private ExitReason exitReason;
    private MarketRegime regimeAtEntry;
    // Null while the volatility lookback is not yet filled.
    private Double volatilityAtEntry;
    @Builder.Default
    private double volumeRatioAtEntry = 1.0;
    private int holdBars;

    public Duration getHoldDuration() {
        if (entryTime == null || exitTime == null) {
            return Duration.ZERO;
        }
        return Duration.between(entryTime, exitTime);
    }
}
