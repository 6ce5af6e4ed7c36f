package com.edgegate.backend.service;

import com.edgegate.backend.config.BacktestProperties;
import com.edgegate.backend.exception.NotFoundException;
import com.edgegate.backend.model.StrategyMetrics;
import com.edgegate.backend.model.StrategyType;
import com.edgegate.backend.model.TradeRecord;
import com.edgegate.backend.repository.StrategyMetricsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Durable per-(strategy, version) performance record and live-approval state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StrategyRegistryService {

    private final StrategyMetricsRepository strategyMetricsRepository;
    private final BacktestProperties backtestProperties;

    @Transactional
    public StrategyMetrics register(String strategyId, String version, StrategyType strategyType) {
        StrategyMetrics metrics = strategyMetricsRepository.findByStrategyIdAndVersion(strategyId, version)
                .orElseGet(() -> {
                    log.info("Registered strategy {} v{}", strategyId, version);
                    return StrategyMetrics.builder()
                            .strategyId(strategyId)
                            .version(version)
                            .createdAt(LocalDateTime.now())
                            .build();
                });
        if (strategyType != null) {
            metrics.setStrategyType(strategyType);
        }
        metrics.setUpdatedAt(LocalDateTime.now());
        return strategyMetricsRepository.save(metrics);
    }

    /**
     * Replaces the whole metric set with one computed from {@code trades}. An empty list leaves the record as is.
     */
    @Transactional
    public StrategyMetrics updateMetrics(String strategyId, String version, List<TradeRecord> trades) {
        StrategyMetrics metrics = strategyMetricsRepository.findByStrategyIdAndVersion(strategyId, version)
                .orElseGet(() -> StrategyMetrics.builder()
                        .strategyId(strategyId)
                        .version(version)
                        .createdAt(LocalDateTime.now())
                        .build());
        if (trades == null || trades.isEmpty()) {
            return strategyMetricsRepository.save(metrics);
        }
        List<Double> pnls = trades.stream().map(TradeRecord::getPnl).toList();
        List<Double> wins = pnls.stream().filter(p -> p > 0).toList();
        List<Double> losses = pnls.stream().filter(p -> p < 0).map(Math::abs).toList();
        double grossWin = wins.stream().mapToDouble(Double::doubleValue).sum();
        double grossLoss = losses.stream().mapToDouble(Double::doubleValue).sum();
        double totalPnl = pnls.stream().mapToDouble(Double::doubleValue).sum();

        metrics.setTotalTrades(trades.size());
        metrics.setWinningTrades(wins.size());
        metrics.setLosingTrades(losses.size());
        metrics.setTotalPnl(totalPnl);
        metrics.setWinRate(PerformanceMath.winRate(wins.size(), trades.size()));
        metrics.setProfitFactor(PerformanceMath.profitFactor(grossWin, grossLoss));
        metrics.setSharpeRatio(PerformanceMath.sharpe(pnls, backtestProperties.getSharpeAnnualization()));
        metrics.setMaxDrawdown(PerformanceMath.maxDrawdownOfPnl(pnls));
        metrics.setAvgTradePnl(totalPnl / trades.size());
        metrics.setAvgWin(wins.isEmpty() ? 0.0 : grossWin / wins.size());
        metrics.setAvgLoss(losses.isEmpty() ? 0.0 : grossLoss / losses.size());
        metrics.setLargestWin(wins.stream().mapToDouble(Double::doubleValue).max().orElse(0.0));
        metrics.setLargestLoss(losses.stream().mapToDouble(Double::doubleValue).max().orElse(0.0));
        metrics.setAvgHoldSeconds(trades.stream()
                .mapToDouble(t -> t.getHoldDuration().toSeconds())
                .average()
                .orElse(0.0));
        metrics.setUpdatedAt(LocalDateTime.now());
        StrategyMetrics saved = strategyMetricsRepository.save(metrics);
        log.info("Updated metrics for {} v{}: {} trades, win rate {}, pnl {}", strategyId, version,
                saved.getTotalTrades(), String.format("%.2f%%", saved.getWinRate() * 100),
                String.format("%+.2f", saved.getTotalPnl()));
        return saved;
    }

    /**
     * Stores a validation outcome. A rejection clears live approval and live trading together.
     */
    @Transactional
    public StrategyMetrics recordAdmission(String strategyId, String version, boolean backtestPassed,
                                           boolean walkforwardPassed, boolean approved) {
        StrategyMetrics metrics = requireMetrics(strategyId, version);
        metrics.setBacktestPassed(backtestPassed);
        metrics.setWalkforwardPassed(walkforwardPassed);
        if (approved) {
            metrics.setApprovedLive(true);
            metrics.setApprovedAt(LocalDateTime.now());
        } else {
            metrics.setApprovedLive(false);
            metrics.setLiveEnabled(false);
        }
        metrics.setUpdatedAt(LocalDateTime.now());
        return strategyMetricsRepository.save(metrics);
    }

    /**
     * Live requirements the stored metrics do not meet; empty when all are met.
     */
    public List<String> unmetRequirements(StrategyMetrics metrics) {
        BacktestProperties.Admission req = backtestProperties.getAdmission();
        List<String> failures = new ArrayList<>();
        if (metrics.getTotalTrades() < req.getMinTrades()) {
            failures.add(String.format("trades %d < %d", metrics.getTotalTrades(), req.getMinTrades()));
        }
        if (metrics.getWinRate() < req.getMinWinRate()) {
            failures.add(String.format("win rate %.3f < %.3f", metrics.getWinRate(), req.getMinWinRate()));
        }
        if (metrics.getProfitFactor() < req.getMinProfitFactor()) {
            failures.add(String.format("profit factor %.2f < %.2f", metrics.getProfitFactor(), req.getMinProfitFactor()));
        }
        if (metrics.getSharpeRatio() < req.getMinSharpe()) {
            failures.add(String.format("sharpe %.2f < %.2f", metrics.getSharpeRatio(), req.getMinSharpe()));
        }
        if (metrics.getTotalPnl() < req.getMinTotalPnl()) {
            failures.add(String.format("total pnl %.2f < %.2f", metrics.getTotalPnl(), req.getMinTotalPnl()));
        }
        if (req.getMaxDrawdown() != null && metrics.getMaxDrawdown() > req.getMaxDrawdown()) {
            failures.add(String.format("max drawdown %.2f > %.2f", metrics.getMaxDrawdown(), req.getMaxDrawdown()));
        }
        return failures;
    }

    @Transactional
    public StrategyMetrics enableLive(String strategyId, String version) {
        StrategyMetrics metrics = requireMetrics(strategyId, version);
        if (!metrics.isApprovedLive()) {
            throw new IllegalStateException("Strategy " + strategyId + " v" + version + " is not approved for live");
        }
        metrics.setLiveEnabled(true);
        metrics.setUpdatedAt(LocalDateTime.now());
        return strategyMetricsRepository.save(metrics);
    }

    @Transactional
    public StrategyMetrics disableLive(String strategyId, String version) {
        StrategyMetrics metrics = requireMetrics(strategyId, version);
        metrics.setLiveEnabled(false);
        metrics.setUpdatedAt(LocalDateTime.now());
        return strategyMetricsRepository.save(metrics);
    }

    public Optional<StrategyMetrics> getMetrics(String strategyId, String version) {
        return strategyMetricsRepository.findByStrategyIdAndVersion(strategyId, version);
    }

    public StrategyMetrics requireMetrics(String strategyId, String version) {
        return getMetrics(strategyId, version)
                .orElseThrow(() -> new NotFoundException("Strategy " + strategyId + " v" + version + " is not registered"));
    }

    public List<StrategyMetrics> list(boolean liveOnly) {
        return liveOnly
                ? strategyMetricsRepository.findByApprovedLiveTrueOrderByStrategyIdAscVersionAsc()
                : strategyMetricsRepository.findAllByOrderByStrategyIdAscVersionAsc();
    }

    public String generateReport() {
        List<StrategyMetrics> all = list(false);
        StringBuilder sb = new StringBuilder();
        String rule = "=".repeat(60);
        sb.append(rule).append('\n').append("STRATEGY REGISTRY REPORT").append('\n').append(rule).append('\n');
        sb.append("Strategies: ").append(all.size())
                .append(", approved for live: ").append(all.stream().filter(StrategyMetrics::isApprovedLive).count())
                .append('\n');
        for (StrategyMetrics m : all) {
            sb.append(String.format("%n%s v%s [%s%s]%n", m.getStrategyId(), m.getVersion(),
                    m.isApprovedLive() ? "APPROVED" : "PAPER", m.isLiveEnabled() ? ", LIVE" : ""));
            sb.append(String.format("  trades=%d win rate=%.1f%% pnl=%+.2f pf=%.2f sharpe=%.2f max dd=%.2f%n",
                    m.getTotalTrades(), m.getWinRate() * 100, m.getTotalPnl(), m.getProfitFactor(),
                    m.getSharpeRatio(), m.getMaxDrawdown()));
            sb.append(String.format("  backtest=%s walk-forward=%s%n",
                    m.isBacktestPassed() ? "pass" : "fail", m.isWalkforwardPassed() ? "pass" : "fail"));
        }
        return sb.toString();
    }
}
