package com.edgegate.backend.service.risk;

import com.edgegate.backend.config.EdgeGateProperties;
import com.edgegate.backend.model.ConditionDimension;
import com.edgegate.backend.model.FailurePattern;
import com.edgegate.backend.model.TradeRecord;
import com.edgegate.backend.service.PerformanceMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Finds condition groups in which a strategy loses systematically. Trades are grouped per strategy
 * across several condition tuples; groups that fail the win rate / EV / profit factor tests are scored
 * by severity and ranked worst first.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FailurePatternMiner {

    static final List<List<ConditionDimension>> GROUPINGS = List.of(
            List.of(ConditionDimension.MARKET_REGIME),
            List.of(ConditionDimension.VOLATILITY_LEVEL),
            List.of(ConditionDimension.TIME_PERIOD),
            List.of(ConditionDimension.VOLUME_LEVEL),
            List.of(ConditionDimension.MARKET_REGIME, ConditionDimension.TIME_PERIOD),
            List.of(ConditionDimension.VOLATILITY_LEVEL, ConditionDimension.VOLUME_LEVEL)
    );

    private final EdgeGateProperties properties;

    public List<FailurePattern> mine(List<TradeRecord> trades) {
        EdgeGateProperties.Miner config = properties.getMiner();
        Map<String, List<TradeRecord>> byStrategy = trades.stream()
                .filter(trade -> trade.getStrategyId() != null)
                .collect(Collectors.groupingBy(TradeRecord::getStrategyId, LinkedHashMap::new, Collectors.toList()));

        List<FailurePattern> patterns = new ArrayList<>();
        for (Map.Entry<String, List<TradeRecord>> strategy : byStrategy.entrySet()) {
            for (List<ConditionDimension> grouping : GROUPINGS) {
                for (Map.Entry<Map<ConditionDimension, String>, List<TradeRecord>> group
                        : group(strategy.getValue(), grouping).entrySet()) {
                    if (group.getValue().size() < config.getMinSampleSize()) {
                        continue;
                    }
                    GroupStats stats = GroupStats.of(group.getValue());
                    if (!isFailure(stats)) {
                        continue;
                    }
                    double severity = severity(stats);
                    if (severity < config.getMinSeverity()) {
                        continue;
                    }
                    patterns.add(FailurePattern.builder()
                            .strategyId(strategy.getKey())
                            .conditions(group.getKey())
                            .winRate(stats.winRate())
                            .expectedValue(stats.expectedValue())
                            .profitFactor(stats.profitFactor())
                            .sampleSize(stats.sampleSize())
                            .severity(severity)
                            .build());
                }
            }
        }
        patterns.sort(Comparator.comparingDouble(FailurePattern::severity).reversed());
        log.info("Mined {} failure patterns from {} trades across {} strategies",
                patterns.size(), trades.size(), byStrategy.size());
        return patterns;
    }

    public String generateReport(List<FailurePattern> patterns) {
        StringBuilder sb = new StringBuilder();
        String rule = "=".repeat(60);
        sb.append(rule).append('\n').append("FAILURE PATTERN REPORT").append('\n').append(rule).append('\n');
        if (patterns.isEmpty()) {
            sb.append("No failure patterns found\n");
            return sb.toString();
        }
        int rank = 1;
        for (FailurePattern pattern : patterns) {
            sb.append(rank++).append(". ").append(pattern.describe()).append('\n');
        }
        return sb.toString();
    }

    boolean isFailure(GroupStats stats) {
        EdgeGateProperties.Miner config = properties.getMiner();
        return stats.winRate() < config.getWinRateThreshold()
                || stats.expectedValue() < config.getExpectedValueThreshold()
                || stats.profitFactor() < config.getProfitFactorThreshold()
                || (stats.winRate() < config.getCombinedWinRateThreshold()
                    && stats.expectedValue() < config.getCombinedExpectedValueThreshold());
    }

    double severity(GroupStats stats) {
        EdgeGateProperties.Miner config = properties.getMiner();
        double wrScore = Math.max(0.0, (0.5 - stats.winRate()) / 0.5);
        double evScore = Math.min(1.0, Math.max(0.0, -stats.expectedValue() / 100.0));
        double pfScore = Math.max(0.0, 1.0 - stats.profitFactor());
        double raw = config.getWinRateWeight() * wrScore
                + config.getExpectedValueWeight() * evScore
                + config.getProfitFactorWeight() * pfScore;
        double confidence = Math.min(1.0, stats.sampleSize() / (config.getMinSampleSize() * 3.0));
        return raw * confidence;
    }

    private Map<Map<ConditionDimension, String>, List<TradeRecord>> group(List<TradeRecord> trades,
                                                                         List<ConditionDimension> grouping) {
        Map<Map<ConditionDimension, String>, List<TradeRecord>> groups = new LinkedHashMap<>();
        for (TradeRecord trade : trades) {
            Map<ConditionDimension, String> labels = ConditionContext.fromTrade(trade).labels();
            Map<ConditionDimension, String> key = new EnumMap<>(ConditionDimension.class);
            for (ConditionDimension dimension : grouping) {
                String label = labels.get(dimension);
                if (label == null) {
                    break;
                }
                key.put(dimension, label);
            }
            if (key.size() == grouping.size()) {
                groups.computeIfAbsent(key, k -> new ArrayList<>()).add(trade);
            }
        }
        return groups;
    }

    record GroupStats(int sampleSize, double winRate, double expectedValue, double profitFactor) {

        static GroupStats of(List<TradeRecord> trades) {
            int wins = 0;
            double grossWin = 0.0;
            double grossLoss = 0.0;
            for (TradeRecord trade : trades) {
                if (trade.isWin()) {
                    wins++;
                    grossWin += trade.getPnl();
                } else {
                    grossLoss += Math.abs(trade.getPnl());
                }
            }
            int losses = trades.size() - wins;
            double winRate = PerformanceMath.winRate(wins, trades.size());
            double avgWin = wins > 0 ? grossWin / wins : 0.0;
            double avgLoss = losses > 0 ? grossLoss / losses : 0.0;
            double ev = winRate * avgWin - (1.0 - winRate) * avgLoss;
            return new GroupStats(trades.size(), winRate, ev, PerformanceMath.profitFactor(grossWin, grossLoss));
        }
    }
}
