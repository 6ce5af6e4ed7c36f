package com.edgegate.backend.service;

import java.util.List;

/**
 * Trade statistics shared by the backtest engine, the registry and the failure miner.
 */
public final class PerformanceMath {

    /** Reported profit factor when there are winning trades and no losing ones. */
    public static final double PROFIT_FACTOR_CAP = 999.0;

    private PerformanceMath() {
    }

    public static double winRate(int wins, int total) {
        return total > 0 ? (double) wins / total : 0.0;
    }

    /**
     * Gross win over gross loss (loss given as a positive amount), capped at {@link #PROFIT_FACTOR_CAP}.
     */
    public static double profitFactor(double grossWin, double grossLoss) {
        if (grossLoss <= 0.0) {
            return grossWin > 0.0 ? PROFIT_FACTOR_CAP : 0.0;
        }
        return Math.min(PROFIT_FACTOR_CAP, grossWin / grossLoss);
    }

    /**
     * Annualised Sharpe of per-trade returns. Zero with fewer than two returns or no dispersion.
     */
    public static double sharpe(List<Double> returns, int annualization) {
        if (returns == null || returns.size() < 2) {
            return 0.0;
        }
        double mean = returns.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = returns.stream().mapToDouble(r -> Math.pow(r - mean, 2)).sum() / returns.size();
        double std = Math.sqrt(variance);
        if (std == 0.0 || Double.isNaN(std)) {
            return 0.0;
        }
        return mean / std * Math.sqrt(annualization);
    }

    /**
     * Max drawdown of the cumulative pnl path of a trade sequence, starting from zero.
     */
    public static double maxDrawdownOfPnl(List<Double> pnls) {
        double cumulative = 0.0;
        double peak = 0.0;
        double maxDd = 0.0;
        for (double pnl : pnls) {
            cumulative += pnl;
            peak = Math.max(peak, cumulative);
            maxDd = Math.max(maxDd, peak - cumulative);
        }
        return maxDd;
    }
}
