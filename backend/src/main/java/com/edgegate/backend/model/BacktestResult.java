package com.edgegate.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BacktestResult {

    public static final String REASON_INSUFFICIENT_TRADES = "insufficient trades";
    public static final String REASON_LOW_WIN_RATE = "win rate below minimum";
    public static final String REASON_NON_POSITIVE_PNL = "non-positive total pnl";
    public static final String REASON_LOW_PROFIT_FACTOR = "profit factor below minimum";
    public static final String REASON_EXCESSIVE_DRAWDOWN = "max drawdown above limit";
    public static final String REASON_INVALID_DATA = "invalid data";

    private String strategyId;
    private String version;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private int totalBars;

    private double initialCapital;
    private double finalCapital;

    private int totalTrades;
    private int winningTrades;
    private int losingTrades;
    private double totalPnl;
    private double winRate;
    private double profitFactor;
    private double sharpeRatio;
    private double maxDrawdown;
    private double maxDrawdownPct;

    @Builder.Default
    private List<TradeRecord> trades = new ArrayList<>();
    @Builder.Default
    private List<Double> equityCurve = new ArrayList<>();

    private boolean passed;
    @Builder.Default
    private List<String> failureReasons = new ArrayList<>();

    public String getPrimaryFailureReason() {
        return failureReasons.isEmpty() ? null : failureReasons.get(0);
    }
}
