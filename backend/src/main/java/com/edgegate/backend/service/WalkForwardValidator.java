package com.edgegate.backend.service;

import com.edgegate.backend.config.BacktestProperties;
import com.edgegate.backend.exception.InsufficientDataException;
import com.edgegate.backend.model.BacktestResult;
import com.edgegate.backend.model.Candle;
import com.edgegate.backend.model.Strategy;
import com.edgegate.backend.model.WalkForwardResult;
import com.edgegate.backend.model.WalkForwardWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Rolling train/test cross-validation. Each window's train and test slices are replayed in separate
 * engine runs; windows run concurrently and are aggregated once all have finished.
 */
@Slf4j
@Service
public class WalkForwardValidator {

    private final BacktestEngine backtestEngine;
    private final BacktestProperties properties;
    private final Executor executor;

    public WalkForwardValidator(BacktestEngine backtestEngine, BacktestProperties properties,
                                @Qualifier("backtestExecutor") Executor executor) {
        this.backtestEngine = backtestEngine;
        this.properties = properties;
        this.executor = executor;
    }

    public WalkForwardResult validate(String strategyId, String version, List<Candle> candles,
                                      Supplier<Strategy> strategyFactory) {
        List<int[]> ranges;
        try {
            ranges = windowRanges(candles == null ? 0 : candles.size());
        } catch (InsufficientDataException e) {
            log.warn("Walk-forward {} v{} skipped: {}", strategyId, version, e.getMessage());
            return WalkForwardResult.builder()
                    .strategyId(strategyId)
                    .version(version)
                    .passed(false)
                    .failureReasons(new ArrayList<>(List.of(WalkForwardResult.REASON_INSUFFICIENT_DATA)))
                    .build();
        }

        List<CompletableFuture<WalkForwardWindow>> futures = new ArrayList<>();
        for (int k = 0; k < ranges.size(); k++) {
            int index = k;
            int[] range = ranges.get(k);
            futures.add(submitWindow(() -> runWindow(strategyId, version, candles, strategyFactory, index, range)));
        }
        List<WalkForwardWindow> windows;
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            windows = futures.stream().map(CompletableFuture::join).toList();
        } catch (CompletionException e) {
            log.warn("Walk-forward {} v{} aborted: window simulation failed: {}", strategyId, version,
                    e.getCause() == null ? e.getMessage() : e.getCause().toString());
            futures.forEach(future -> future.cancel(true));
            return WalkForwardResult.builder()
                    .strategyId(strategyId)
                    .version(version)
                    .totalWindows(ranges.size())
                    .passed(false)
                    .failureReasons(new ArrayList<>(List.of(WalkForwardResult.REASON_WINDOW_FAILED)))
                    .build();
        }

        WalkForwardResult result = aggregate(strategyId, version, windows);
        log.info("Walk-forward {} v{}: {}/{} windows passed, consistency {}, avg degradation {}, {}", strategyId, version,
                result.getPassedWindows(), result.getTotalWindows(), String.format("%.2f", result.getConsistencyScore()),
                String.format("%.2f", result.getAvgDegradation()), result.isPassed() ? "PASSED" : "FAILED " + result.getFailureReasons());
        return result;
    }

    /**
     * Window k trains on [k*step, k*step+train) and tests on the following {@code testWindow} bars,
     * for every k whose test slice fits.
     */
    List<int[]> windowRanges(int totalBars) {
        BacktestProperties.WalkForward config = properties.getWalkForward();
        int train = config.getTrainWindow();
        int test = config.getTestWindow();
        int step = config.getStep();
        if (totalBars < train + test) {
            throw new InsufficientDataException("Not enough bars for one walk-forward window", totalBars, train + test);
        }
        List<int[]> ranges = new ArrayList<>();
        for (int start = 0; start + train + test <= totalBars; start += step) {
            ranges.add(new int[]{start, start + train, start + train + test});
        }
        return ranges;
    }

    public String generateReport(WalkForwardResult result) {
        StringBuilder sb = new StringBuilder();
        String rule = "=".repeat(60);
        sb.append(rule).append('\n')
                .append("WALK-FORWARD REPORT ").append(result.getStrategyId()).append(" v").append(result.getVersion())
                .append('\n').append(rule).append('\n');
        sb.append(String.format("Windows: %d passed of %d (consistency %.1f%%)%n",
                result.getPassedWindows(), result.getTotalWindows(), result.getConsistencyScore() * 100));
        sb.append(String.format("Avg train pnl: %.2f  Avg test pnl: %.2f  Total test pnl: %.2f%n",
                result.getAvgTrainPnl(), result.getAvgTestPnl(), result.getTotalTestPnl()));
        sb.append(String.format("Avg degradation: %.1f%%  Test win rate: %.1f%%%n%n",
                result.getAvgDegradation() * 100, result.getTestWinRate() * 100));
        for (WalkForwardWindow window : result.getWindows()) {
            sb.append(String.format("  #%d train[%d,%d) test[%d,%d) train=%.2f test=%.2f degr=%.1f%% wr=%.1f%% %s%n",
                    window.index(), window.trainStart(), window.trainEnd(), window.testStart(), window.testEnd(),
                    window.trainPnl(), window.testPnl(), window.degradation() * 100, window.testWinRate() * 100,
                    window.passed() ? "PASS" : "FAIL"));
        }
        sb.append('\n').append("Result: ").append(result.isPassed() ? "PASSED" : "FAILED " + result.getFailureReasons()).append('\n');
        return sb.toString();
    }

    /**
     * Queues a window on the backtest pool. A saturated pool runs the window on the calling thread instead,
     * so every window is still collected.
     */
    private CompletableFuture<WalkForwardWindow> submitWindow(Supplier<WalkForwardWindow> window) {
        try {
            return CompletableFuture.supplyAsync(window, executor);
        } catch (RejectedExecutionException e) {
            log.debug("Backtest pool saturated, running window inline: {}", e.getMessage());
            try {
                return CompletableFuture.completedFuture(window.get());
            } catch (RuntimeException failure) {
                return CompletableFuture.failedFuture(failure);
            }
        }
    }

    private WalkForwardWindow runWindow(String strategyId, String version, List<Candle> candles,
                                        Supplier<Strategy> strategyFactory, int index, int[] range) {
        List<Candle> trainSlice = new ArrayList<>(candles.subList(range[0], range[1]));
        List<Candle> testSlice = new ArrayList<>(candles.subList(range[1], range[2]));
        BacktestResult train = backtestEngine.run(strategyId, version, trainSlice, strategyFactory.get());
        BacktestResult test = backtestEngine.run(strategyId, version, testSlice, strategyFactory.get());

        BacktestProperties.WalkForward config = properties.getWalkForward();
        double degradation = train.getTotalPnl() != 0.0
                ? (train.getTotalPnl() - test.getTotalPnl()) / Math.abs(train.getTotalPnl())
                : 0.0;
        boolean passed = test.getTotalPnl() > config.getMinTestPnl()
                && degradation < config.getMaxDegradation()
                && test.getWinRate() >= config.getMinTestWinRate();
        return WalkForwardWindow.builder()
                .index(index)
                .trainStart(range[0])
                .trainEnd(range[1])
                .testStart(range[1])
                .testEnd(range[2])
                .trainPnl(train.getTotalPnl())
                .testPnl(test.getTotalPnl())
                .trainTrades(train.getTotalTrades())
                .testTrades(test.getTotalTrades())
                .trainWinRate(train.getWinRate())
                .testWinRate(test.getWinRate())
                .testWins(test.getWinningTrades())
                .degradation(degradation)
                .passed(passed)
                .build();
    }

    private WalkForwardResult aggregate(String strategyId, String version, List<WalkForwardWindow> windows) {
        BacktestProperties.WalkForward config = properties.getWalkForward();
        int total = windows.size();
        int passedWindows = (int) windows.stream().filter(WalkForwardWindow::passed).count();
        int testTrades = windows.stream().mapToInt(WalkForwardWindow::testTrades).sum();
        int testWins = windows.stream().mapToInt(WalkForwardWindow::testWins).sum();
        double totalTestPnl = windows.stream().mapToDouble(WalkForwardWindow::testPnl).sum();

        WalkForwardResult result = WalkForwardResult.builder()
                .strategyId(strategyId)
                .version(version)
                .windows(windows)
                .totalWindows(total)
                .passedWindows(passedWindows)
                .consistencyScore((double) passedWindows / total)
                .avgTrainPnl(windows.stream().mapToDouble(WalkForwardWindow::trainPnl).average().orElse(0.0))
                .avgTestPnl(windows.stream().mapToDouble(WalkForwardWindow::testPnl).average().orElse(0.0))
                .avgDegradation(windows.stream().mapToDouble(WalkForwardWindow::degradation).average().orElse(0.0))
                .testWinRate(PerformanceMath.winRate(testWins, testTrades))
                .totalTestPnl(totalTestPnl)
                .build();

        List<String> reasons = new ArrayList<>();
        if (result.getConsistencyScore() < config.getMinConsistency()) {
            reasons.add(WalkForwardResult.REASON_LOW_CONSISTENCY);
        }
        if (result.getAvgDegradation() >= config.getMaxDegradation()) {
            reasons.add(WalkForwardResult.REASON_DEGRADATION);
        }
        if (result.getTestWinRate() < config.getMinTestWinRate()) {
            reasons.add(WalkForwardResult.REASON_LOW_TEST_WIN_RATE);
        }
        if (totalTestPnl <= config.getMinTestPnl()) {
            reasons.add(WalkForwardResult.REASON_NON_POSITIVE_TEST_PNL);
        }
        result.setFailureReasons(reasons);
        result.setPassed(reasons.isEmpty());
        return result;
    }
}
