package com.edgegate.backend.service.risk;

import com.edgegate.backend.config.EdgeGateProperties;
import com.edgegate.backend.model.ConditionDimension;
import com.edgegate.backend.model.FailurePattern;
import com.edgegate.backend.model.MarketRegime;
import com.edgegate.backend.model.TradeRecord;
import com.edgegate.backend.service.PerformanceMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Blocks (strategy, condition) combinations that have lost consistently. Outcomes are tallied per
 * regime and per regime and volatility level; a combination stays blacklisted until removed by hand.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FailureModeBlacklist {

    private final EdgeGateProperties properties;

    private final ConcurrentHashMap<CombinationKey, OutcomeTally> tallies = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<CombinationKey, BlacklistEntry> blacklisted = new ConcurrentHashMap<>();

    public BlacklistCheck check(String strategyId, ConditionContext context) {
        if (!properties.getBlacklist().isEnabled()) {
            return BlacklistCheck.allow("blacklist disabled");
        }
        if (strategyId == null) {
            return BlacklistCheck.allow("no strategy");
        }
        Map<ConditionDimension, String> labels = context.labels();
        Optional<BlacklistEntry> match = blacklisted.values().stream()
                .filter(entry -> entry.key().matches(strategyId, labels))
                .max(Comparator.comparingInt(entry -> entry.key().conditions().size()));
        return match.map(BlacklistCheck::deny).orElseGet(() -> BlacklistCheck.allow("not blacklisted"));
    }

    public void recordTrade(TradeRecord trade) {
        recordTradeResult(trade.getStrategyId(), trade.getRegimeAtEntry(), trade.getVolatilityAtEntry(), trade.getPnl());
    }

    public void recordTradeResult(String strategyId, MarketRegime regime, Double volatility, double pnl) {
        MarketRegime effectiveRegime = regime != null ? regime : MarketRegime.UNKNOWN;
        Map<ConditionDimension, String> general = new EnumMap<>(ConditionDimension.class);
        general.put(ConditionDimension.MARKET_REGIME, effectiveRegime.name());
        update(new CombinationKey(strategyId, general), pnl);
        if (volatility != null) {
            Map<ConditionDimension, String> specific = new EnumMap<>(general);
            specific.put(ConditionDimension.VOLATILITY_LEVEL, ConditionBuckets.volatilityLevel(volatility));
            update(new CombinationKey(strategyId, specific), pnl);
        }
    }

    /**
     * Adds mined patterns to the blacklist. Returns the number of combinations newly blocked.
     */
    public int importPatterns(List<FailurePattern> patterns) {
        int added = 0;
        for (FailurePattern pattern : patterns) {
            CombinationKey key = new CombinationKey(pattern.strategyId(), pattern.conditions());
            BlacklistEntry entry = new BlacklistEntry(key, pattern.sampleSize(), pattern.winRate(),
                    pattern.expectedValue(), pattern.profitFactor(), "mined pattern " + pattern.describe(),
                    LocalDateTime.now(), BlacklistEntry.Source.MINED);
            if (blacklisted.putIfAbsent(key, entry) == null) {
                added++;
                log.warn("Blacklisted mined pattern {}", key);
            }
        }
        return added;
    }

    public boolean remove(CombinationKey key) {
        boolean removed = blacklisted.remove(key) != null;
        if (removed) {
            log.info("Removed {} from blacklist", key);
        }
        return removed;
    }

    public List<BlacklistEntry> getBlacklisted() {
        return blacklisted.values().stream()
                .sorted(Comparator.comparing(entry -> entry.key().toString()))
                .toList();
    }

    public boolean isBlacklisted(CombinationKey key) {
        return blacklisted.containsKey(key);
    }

    public String generateReport() {
        EdgeGateProperties.Blacklist config = properties.getBlacklist();
        StringBuilder sb = new StringBuilder();
        String rule = "=".repeat(60);
        sb.append(rule).append('\n').append("FAILURE MODE BLACKLIST REPORT").append('\n').append(rule).append('\n');
        sb.append("Status: ").append(config.isEnabled() ? "ENABLED" : "DISABLED").append('\n');
        sb.append("Blacklisted combinations: ").append(blacklisted.size()).append('\n');
        sb.append("Tracked combinations: ").append(tallies.size()).append("\n\n");

        for (BlacklistEntry entry : getBlacklisted()) {
            sb.append("  BLOCKED ").append(entry.key()).append('\n');
            sb.append(String.format("    win rate %.1f%% (threshold %.1f%%), EV %.2f (threshold %.2f), trades %d%n",
                    entry.winRate() * 100, config.getWinRateThreshold() * 100,
                    entry.expectedValue(), config.getExpectedValueThreshold(), entry.sampleSize()));
        }
        sb.append('\n').append("ALL COMBINATIONS:").append('\n');
        List<Map.Entry<CombinationKey, OutcomeTally>> sorted = new ArrayList<>(tallies.entrySet());
        sorted.sort(Comparator.comparingDouble((Map.Entry<CombinationKey, OutcomeTally> e) -> e.getValue().expectedValue()).reversed());
        for (Map.Entry<CombinationKey, OutcomeTally> e : sorted) {
            OutcomeTally tally = e.getValue();
            sb.append(String.format("  %s %s trades=%d win rate=%.1f%% EV=%.2f%n",
                    blacklisted.containsKey(e.getKey()) ? "x" : "-", e.getKey(),
                    tally.trades(), tally.winRate() * 100, tally.expectedValue()));
        }
        return sb.toString();
    }

    private void update(CombinationKey key, double pnl) {
        OutcomeTally tally = tallies.computeIfAbsent(key, k -> new OutcomeTally());
        tally.add(pnl);
        EdgeGateProperties.Blacklist config = properties.getBlacklist();
        if (tally.trades() < config.getMinTradesForAnalysis() || blacklisted.containsKey(key)) {
            return;
        }
        double winRate = tally.winRate();
        double ev = tally.expectedValue();
        double pf = tally.profitFactor();
        boolean failing = winRate < config.getWinRateThreshold()
                || ev < config.getExpectedValueThreshold()
                || pf < config.getProfitFactorThreshold();
        if (!failing) {
            return;
        }
        String reason = String.format("%s win rate %.1f%%, EV %.2f, PF %.2f over %d trades",
                key, winRate * 100, ev, pf, tally.trades());
        BlacklistEntry entry = new BlacklistEntry(key, tally.trades(), winRate, ev, pf, reason,
                LocalDateTime.now(), BlacklistEntry.Source.OBSERVED);
        if (blacklisted.putIfAbsent(key, entry) == null) {
            log.warn("⛔ Blacklisted {}", reason);
        }
    }

    static final class OutcomeTally {
        private int trades;
        private int wins;
        private double totalPnl;
        private double grossWin;
        private double grossLoss;

        synchronized void add(double pnl) {
            trades++;
            totalPnl += pnl;
            if (pnl > 0) {
                wins++;
                grossWin += pnl;
            } else {
                grossLoss += -pnl;
            }
        }

        synchronized int trades() {
            return trades;
        }

        synchronized double winRate() {
            return PerformanceMath.winRate(wins, trades);
        }

        synchronized double expectedValue() {
            return trades > 0 ? totalPnl / trades : 0.0;
        }

        synchronized double profitFactor() {
            return PerformanceMath.profitFactor(grossWin, grossLoss);
        }
    }
}
