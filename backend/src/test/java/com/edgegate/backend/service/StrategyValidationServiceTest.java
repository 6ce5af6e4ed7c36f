package com.edgegate.backend.service;

import com.edgegate.backend.config.BacktestProperties;
import com.edgegate.backend.config.EdgeGateProperties;
import com.edgegate.backend.dto.AdmissionDecision;
import com.edgegate.backend.dto.ValidationReport;
import com.edgegate.backend.model.Candle;
import com.edgegate.backend.model.Strategy;
import com.edgegate.backend.model.StrategySignal;
import com.edgegate.backend.model.StrategyType;
import com.edgegate.backend.service.indicator.MarketStateClassifier;
import com.edgegate.backend.service.risk.BlacklistEntry;
import com.edgegate.backend.service.risk.CombinationKey;
import com.edgegate.backend.service.risk.FailureModeBlacklist;
import com.edgegate.backend.service.risk.FailurePatternMiner;
import com.edgegate.backend.util.TestCandleFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StrategyValidationServiceTest {

    private StrategyRegistryService registry;
    private AdmissionGateService admissionGate;
    private FailureModeBlacklist blacklist;
    private StrategyValidationService validationService;

    @BeforeEach
    void setUp() {
        BacktestProperties backtestProperties = new BacktestProperties();
        backtestProperties.getWalkForward().setTrainWindow(30);
        backtestProperties.getWalkForward().setTestWindow(20);
        backtestProperties.getWalkForward().setStep(20);
        EdgeGateProperties edgeGateProperties = new EdgeGateProperties();
        BacktestEngine engine = new BacktestEngine(backtestProperties, new MarketStateClassifier(backtestProperties));
        registry = mock(StrategyRegistryService.class);
        admissionGate = mock(AdmissionGateService.class);
        blacklist = new FailureModeBlacklist(edgeGateProperties);
        validationService = new StrategyValidationService(engine,
                new WalkForwardValidator(engine, backtestProperties, Runnable::run),
                registry, admissionGate, new FailurePatternMiner(edgeGateProperties), blacklist);
    }

    @Test
    void runsBacktestThenWalkForwardThenAdmission() {
        List<Candle> candles = TestCandleFactory.trendingCandles(130, 100, 0.5);
        when(admissionGate.requestApproval("trend", "1", true, true))
                .thenReturn(new AdmissionDecision("trend", "1", true, List.of()));

        ValidationReport report = validationService.validate("trend", "1", StrategyType.TREND_FOLLOWING,
                candles, () -> swing(null));

        assertThat(report.backtest().isPassed()).isTrue();
        assertThat(report.walkForward().getTotalWindows()).isEqualTo(5);
        assertThat(report.walkForward().isPassed()).isTrue();
        assertThat(report.admission().approved()).isTrue();
        assertThat(report.failurePatterns()).isEmpty();

        InOrder order = inOrder(registry, admissionGate);
        order.verify(registry).register("trend", "1", StrategyType.TREND_FOLLOWING);
        order.verify(registry).updateMetrics(eq("trend"), eq("1"), anyList());
        order.verify(admissionGate).requestApproval("trend", "1", true, true);
    }

    @Test
    void losingStrategyFeedsBlacklist() {
        List<Candle> candles = TestCandleFactory.trendingCandles(400, 200, -0.25);
        when(admissionGate.requestApproval("trend", "1", false, false))
                .thenReturn(new AdmissionDecision("trend", "1", false, List.of("backtest not passed")));

        ValidationReport report = validationService.validate("trend", "1", StrategyType.TREND_FOLLOWING,
                candles, () -> swing(10_000.0));

        assertThat(report.backtest().isPassed()).isFalse();
        assertThat(report.walkForward().isPassed()).isFalse();
        assertThat(report.admission().approved()).isFalse();
        assertThat(report.failurePatterns()).isNotEmpty();
        assertThat(blacklist.getBlacklisted()).extracting(BlacklistEntry::key)
                .containsAll(report.failurePatterns().stream()
                        .map(pattern -> new CombinationKey(pattern.strategyId(), pattern.conditions()))
                        .toList());
        assertThat(blacklist.generateReport())
                .contains("Tracked combinations: ")
                .doesNotContain("Tracked combinations: 0\n");
    }

    private static Strategy swing(Double size) {
        return (bar, index) -> {
            if (index % 6 == 0) {
                StrategySignal entry = StrategySignal.enterLong(null, null);
                return size != null ? entry.withSize(size) : entry;
            }
            return index % 6 == 3 ? StrategySignal.close() : StrategySignal.hold();
        };
    }
}
