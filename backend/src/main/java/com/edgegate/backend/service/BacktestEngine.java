package com.edgegate.backend.service;

import com.edgegate.backend.config.BacktestProperties;
import com.edgegate.backend.exception.SimulationException;
import com.edgegate.backend.model.BacktestResult;
import com.edgegate.backend.model.Candle;
import com.edgegate.backend.model.Direction;
import com.edgegate.backend.model.ExitReason;
import com.edgegate.backend.model.MarketRegime;
import com.edgegate.backend.model.MarketState;
import com.edgegate.backend.model.Strategy;
import com.edgegate.backend.model.StrategySignal;
import com.edgegate.backend.model.TradeRecord;
import com.edgegate.backend.service.indicator.MarketStateClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Bar-by-bar replay of a strategy over historical candles. One position at a time; exits triggered by a
 * bar are applied before the strategy sees that bar.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BacktestEngine {

    private final BacktestProperties properties;
    private final MarketStateClassifier marketStateClassifier;

    public BacktestResult run(String strategyId, String version, List<Candle> candles, Strategy strategy) {
        return run(strategyId, version, candles, strategy, properties.getInitialCapital());
    }

    public BacktestResult run(String strategyId, String version, List<Candle> candles, Strategy strategy,
                              double initialCapital) {
        try {
            validate(candles);
        } catch (SimulationException e) {
            log.warn("Backtest {} v{} rejected: {}", strategyId, version, e.getMessage());
            return BacktestResult.builder()
                    .strategyId(strategyId)
                    .version(version)
                    .totalBars(candles == null ? 0 : candles.size())
                    .initialCapital(initialCapital)
                    .finalCapital(initialCapital)
                    .passed(false)
                    .failureReasons(new ArrayList<>(List.of(BacktestResult.REASON_INVALID_DATA + ": " + e.getMessage())))
                    .build();
        }

        List<TradeRecord> trades = new ArrayList<>();
        List<Double> equityCurve = new ArrayList<>(candles.size());
        double capital = initialCapital;
        double peakEquity = initialCapital;
        double maxDrawdown = 0.0;
        OpenPosition position = null;
        boolean capitalExhausted = false;

        for (int i = 0; i < candles.size(); i++) {
            Candle bar = candles.get(i);

            if (position != null) {
                position.track(bar);
                TradeRecord exit = checkExit(position, bar, i, strategyId, version);
                if (exit != null) {
                    trades.add(exit);
                    capital += exit.getPnl();
                    position = null;
                }
            }

            StrategySignal signal = nextSignal(strategy, bar, i);

            if (position != null && (signal.action() == StrategySignal.Action.CLOSE
                    || (signal.isEntry() && signal.direction() != position.side))) {
                TradeRecord closed = position.close(bar.getClose(), bar, i, ExitReason.SIGNAL, strategyId, version);
                trades.add(closed);
                capital += closed.getPnl();
                position = null;
            }

            if (position == null && signal.isEntry()) {
                if (capital > 0) {
                    position = open(signal, candles, i, capital);
                } else if (!capitalExhausted) {
                    capitalExhausted = true;
                    log.warn("{} v{}: capital exhausted ({}) at bar {}, no further entries", strategyId, version,
                            String.format("%.2f", capital), i);
                }
            }

            double equity = capital + (position != null ? position.unrealized(bar.getClose()) : 0.0);
            equityCurve.add(equity);
            peakEquity = Math.max(peakEquity, equity);
            maxDrawdown = Math.max(maxDrawdown, peakEquity - equity);
        }

        if (position != null) {
            int last = candles.size() - 1;
            Candle lastBar = candles.get(last);
            TradeRecord closed = position.close(lastBar.getClose(), lastBar, last, ExitReason.END_OF_DATA, strategyId, version);
            trades.add(closed);
            capital += closed.getPnl();
        }

        BacktestResult result = summarize(strategyId, version, candles, trades, equityCurve, initialCapital, capital, maxDrawdown);
        log.info("Backtest {} v{}: {} trades, pnl {}, win rate {}, {}", strategyId, version, result.getTotalTrades(),
                String.format("%+.2f", result.getTotalPnl()), String.format("%.2f%%", result.getWinRate() * 100),
                result.isPassed() ? "PASSED" : "FAILED " + result.getFailureReasons());
        return result;
    }

    private void validate(List<Candle> candles) {
        if (candles == null || candles.isEmpty()) {
            throw new SimulationException("empty price series");
        }
        for (int i = 0; i < candles.size(); i++) {
            Candle bar = candles.get(i);
            if (bar == null) {
                throw new SimulationException("missing bar at index " + i);
            }
            double[] prices = {bar.getOpen(), bar.getHigh(), bar.getLow(), bar.getClose()};
            for (double price : prices) {
                if (!Double.isFinite(price) || price <= 0) {
                    throw new SimulationException("non-positive or non-finite price at index " + i);
                }
            }
            if (bar.getHigh() < bar.getLow()) {
                throw new SimulationException("high below low at index " + i);
            }
            if (i > 0 && bar.getTimestamp() != null && candles.get(i - 1).getTimestamp() != null
                    && bar.getTimestamp().isBefore(candles.get(i - 1).getTimestamp())) {
                throw new SimulationException("timestamps decrease at index " + i);
            }
        }
    }

    private StrategySignal nextSignal(Strategy strategy, Candle bar, int index) {
        try {
            StrategySignal signal = strategy.onBar(bar, index);
            return signal != null ? signal : StrategySignal.hold();
        } catch (RuntimeException e) {
            log.warn("Strategy error at bar {}: {}", index, e.getMessage());
            return StrategySignal.hold();
        }
    }

    private OpenPosition open(StrategySignal signal, List<Candle> candles, int index, double capital) {
        Candle bar = candles.get(index);
        double notional = signal.sizeNotional() != null && signal.sizeNotional() > 0
                ? signal.sizeNotional()
                : capital * properties.getDefaultPositionFraction();
        MarketState state = marketStateClassifier.classifyAt(candles, index);
        boolean volatilityKnown = state.regime() != MarketRegime.UNKNOWN
                && index + 1 >= properties.getMarketState().getLongLookback();
        return new OpenPosition(signal.direction(), bar.getClose(), notional / bar.getClose(), notional,
                signal.stopLoss(), signal.takeProfit(), signal.trailingStopPct(), bar, index, state,
                volatilityKnown ? state.longVolatility() : null);
    }

    /**
     * Stop-loss first, then take-profit, then trailing stop. A bar reaching both stop and target counts as stopped.
     */
    private TradeRecord checkExit(OpenPosition position, Candle bar, int index, String strategyId, String version) {
        boolean isLong = position.side == Direction.LONG;
        if (position.stopLoss != null) {
            boolean hit = isLong ? bar.getLow() <= position.stopLoss : bar.getHigh() >= position.stopLoss;
            if (hit) {
                return position.close(position.stopLoss, bar, index, ExitReason.STOP_LOSS, strategyId, version);
            }
        }
        if (position.takeProfit != null) {
            boolean hit = isLong ? bar.getHigh() >= position.takeProfit : bar.getLow() <= position.takeProfit;
            if (hit) {
                return position.close(position.takeProfit, bar, index, ExitReason.TAKE_PROFIT, strategyId, version);
            }
        }
        if (position.trailingStopPct != null && position.trailingStopPct > 0) {
            boolean hit = isLong
                    ? bar.getClose() <= position.extreme * (1 - position.trailingStopPct)
                    : bar.getClose() >= position.extreme * (1 + position.trailingStopPct);
            if (hit) {
                return position.close(bar.getClose(), bar, index, ExitReason.TRAILING_STOP, strategyId, version);
            }
        }
        return null;
    }

    private BacktestResult summarize(String strategyId, String version, List<Candle> candles, List<TradeRecord> trades,
                                     List<Double> equityCurve, double initialCapital, double finalCapital,
                                     double maxDrawdown) {
        int wins = (int) trades.stream().filter(TradeRecord::isWin).count();
        int losses = (int) trades.stream().filter(t -> t.getPnl() < 0).count();
        double totalPnl = trades.stream().mapToDouble(TradeRecord::getPnl).sum();
        double grossWin = trades.stream().filter(t -> t.getPnl() > 0).mapToDouble(TradeRecord::getPnl).sum();
        double grossLoss = trades.stream().filter(t -> t.getPnl() < 0).mapToDouble(t -> -t.getPnl()).sum();
        List<Double> returns = trades.stream().map(t -> t.getPnl() / initialCapital).toList();

        BacktestResult result = BacktestResult.builder()
                .strategyId(strategyId)
                .version(version)
                .startTime(candles.get(0).getTimestamp())
                .endTime(candles.get(candles.size() - 1).getTimestamp())
                .totalBars(candles.size())
                .initialCapital(initialCapital)
                .finalCapital(finalCapital)
                .trades(trades)
                .equityCurve(equityCurve)
                .totalTrades(trades.size())
                .winningTrades(wins)
                .losingTrades(losses)
                .totalPnl(totalPnl)
                .winRate(PerformanceMath.winRate(wins, trades.size()))
                .profitFactor(trades.isEmpty() ? 0.0 : PerformanceMath.profitFactor(grossWin, grossLoss))
                .sharpeRatio(PerformanceMath.sharpe(returns, properties.getSharpeAnnualization()))
                .maxDrawdown(maxDrawdown)
                .maxDrawdownPct(maxDrawdown / initialCapital)
                .build();
        result.setFailureReasons(evaluate(result));
        result.setPassed(result.getFailureReasons().isEmpty());
        return result;
    }

    private List<String> evaluate(BacktestResult result) {
        BacktestProperties.PassCriteria pass = properties.getPass();
        List<String> reasons = new ArrayList<>();
        if (result.getTotalTrades() < pass.getMinTrades()) {
            reasons.add(BacktestResult.REASON_INSUFFICIENT_TRADES);
        }
        if (result.getWinRate() < pass.getMinWinRate()) {
            reasons.add(BacktestResult.REASON_LOW_WIN_RATE);
        }
        if (result.getTotalPnl() <= pass.getMinTotalPnl()) {
            reasons.add(BacktestResult.REASON_NON_POSITIVE_PNL);
        }
        if (result.getProfitFactor() < pass.getMinProfitFactor()) {
            reasons.add(BacktestResult.REASON_LOW_PROFIT_FACTOR);
        }
        if (result.getMaxDrawdown() >= result.getInitialCapital() * pass.getMaxDrawdownPct()) {
            reasons.add(BacktestResult.REASON_EXCESSIVE_DRAWDOWN);
        }
        return reasons;
    }

    private static final class OpenPosition {
        private final Direction side;
        private final double entryPrice;
        private final double quantity;
        private final double notional;
        private final Double stopLoss;
        private final Double takeProfit;
        private final Double trailingStopPct;
        private final Candle entryBar;
        private final int entryIndex;
        private final MarketState entryState;
        private final Double entryVolatility;
        // Highest high for longs, lowest low for shorts.
        private double extreme;

        private OpenPosition(Direction side, double entryPrice, double quantity, double notional, Double stopLoss,
                             Double takeProfit, Double trailingStopPct, Candle entryBar, int entryIndex,
                             MarketState entryState, Double entryVolatility) {
            this.side = side;
            this.entryPrice = entryPrice;
            this.quantity = quantity;
            this.notional = notional;
            this.stopLoss = stopLoss;
            this.takeProfit = takeProfit;
            this.trailingStopPct = trailingStopPct;
            this.entryBar = entryBar;
            this.entryIndex = entryIndex;
            this.entryState = entryState;
            this.entryVolatility = entryVolatility;
            this.extreme = entryPrice;
        }

        private void track(Candle bar) {
            extreme = side == Direction.LONG ? Math.max(extreme, bar.getHigh()) : Math.min(extreme, bar.getLow());
        }

        private double unrealized(double price) {
            return (price - entryPrice) * quantity * side.sign();
        }

        private TradeRecord close(double exitPrice, Candle bar, int index, ExitReason reason, String strategyId,
                                  String version) {
            double pnl = unrealized(exitPrice);
            return TradeRecord.builder()
                    .strategyId(strategyId)
                    .strategyVersion(version)
                    .side(side)
                    .entryTime(entryBar.getTimestamp())
                    .exitTime(bar.getTimestamp())
                    .entryPrice(entryPrice)
                    .exitPrice(exitPrice)
                    .quantity(quantity)
                    .pnl(pnl)
                    .pnlPct(pnl / notional)
                    .win(pnl > 0)
                    .exitReason(reason)
                    .regimeAtEntry(entryState.regime())
                    .volatilityAtEntry(entryVolatility)
                    .volumeRatioAtEntry(entryState.volumeRatio())
                    .holdBars(index - entryIndex)
                    .build();
        }
    }
}
