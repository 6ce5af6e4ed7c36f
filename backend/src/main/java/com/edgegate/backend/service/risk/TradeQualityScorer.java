package com.edgegate.backend.service.risk;

import com.edgegate.backend.config.EdgeGateProperties;
import com.edgegate.backend.model.MarketRegime;
import com.edgegate.backend.model.StrategyType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Weighted 0-100 score of signal strength, strategy/regime fit, historical win rate and reward/risk.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeQualityScorer {

    private static final int SCORE_HISTORY = 100;

    private final EdgeGateProperties properties;

    private final AtomicLong totalScored = new AtomicLong();
    private final AtomicLong passed = new AtomicLong();
    private final AtomicLong blocked = new AtomicLong();
    private final Deque<Double> recentScores = new ArrayDeque<>();

    public QualityScore score(double confidence, MarketRegime regime, StrategyType strategyType,
                              Double historicalWinRate, Double rewardRiskRatio) {
        EdgeGateProperties.Quality quality = properties.getQuality();
        if (!quality.isEnabled()) {
            return QualityScore.disabled();
        }
        double signal = confidence * 100.0;
        double match = compatibility(strategyType != null ? strategyType : StrategyType.GENERIC,
                regime != null ? regime : MarketRegime.UNKNOWN);
        double history = historicalScore(historicalWinRate);
        double rr = riskRewardScore(rewardRiskRatio);

        double total = signal * quality.getSignalStrengthWeight()
                + match * quality.getMarketStateMatchWeight()
                + history * quality.getHistoricalPerformanceWeight()
                + rr * quality.getRiskRewardWeight();
        boolean allowed = total >= quality.getMinQualityScore();

        totalScored.incrementAndGet();
        (allowed ? passed : blocked).incrementAndGet();
        synchronized (recentScores) {
            recentScores.addLast(total);
            if (recentScores.size() > SCORE_HISTORY) {
                recentScores.removeFirst();
            }
        }
        log.debug("Quality {} {}: {} (signal={} match={} hist={} rr={})",
                strategyType, regime, total, signal, match, history, rr);
        return new QualityScore(total, allowed, signal, match, history, rr);
    }

    public QualityStats getStats() {
        double average;
        synchronized (recentScores) {
            average = recentScores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        }
        return new QualityStats(totalScored.get(), passed.get(), blocked.get(), average);
    }

    static double compatibility(StrategyType strategyType, MarketRegime regime) {
        return switch (strategyType) {
            case TREND_FOLLOWING -> switch (regime) {
                case TRENDING_UP, TRENDING_DOWN -> 90;
                case RANGING -> 30;
                case VOLATILE -> 50;
                case QUIET -> 40;
                case UNKNOWN -> 50;
            };
            case MEAN_REVERSION -> switch (regime) {
                case TRENDING_UP, TRENDING_DOWN -> 40;
                case RANGING -> 90;
                case VOLATILE -> 30;
                case QUIET -> 70;
                case UNKNOWN -> 50;
            };
            case BREAKOUT -> switch (regime) {
                case TRENDING_UP, TRENDING_DOWN -> 70;
                case RANGING -> 50;
                case VOLATILE -> 40;
                case QUIET -> 80;
                case UNKNOWN -> 50;
            };
            case VOLATILITY -> switch (regime) {
                case TRENDING_UP, TRENDING_DOWN -> 50;
                case RANGING -> 40;
                case VOLATILE -> 95;
                case QUIET -> 20;
                case UNKNOWN -> 50;
            };
            case GENERIC -> switch (regime) {
                case TRENDING_UP, TRENDING_DOWN, RANGING -> 70;
                case VOLATILE, QUIET -> 60;
                case UNKNOWN -> 50;
            };
        };
    }

    static double historicalScore(Double winRate) {
        if (winRate == null) {
            return 50.0;
        }
        if (winRate < 0.40) {
            return 20.0;
        }
        if (winRate < 0.50) {
            return 40.0 + (winRate - 0.40) * 200.0;
        }
        if (winRate < 0.60) {
            return 60.0 + (winRate - 0.50) * 250.0;
        }
        return Math.min(100.0, 85.0 + (winRate - 0.60) * 150.0);
    }

    static double riskRewardScore(Double ratio) {
        if (ratio == null) {
            return 60.0;
        }
        if (ratio < 0.8) {
            return 20.0;
        }
        if (ratio < 1.2) {
            return 50.0;
        }
        if (ratio < 1.8) {
            return 70.0;
        }
        if (ratio < 2.5) {
            return 85.0;
        }
        return 95.0;
    }

    public record QualityStats(long totalScored, long passed, long blocked, double averageScore) {}
}
