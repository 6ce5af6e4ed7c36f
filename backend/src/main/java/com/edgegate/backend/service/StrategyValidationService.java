package com.edgegate.backend.service;

import com.edgegate.backend.dto.AdmissionDecision;
import com.edgegate.backend.dto.ValidationReport;
import com.edgegate.backend.model.BacktestResult;
import com.edgegate.backend.model.Candle;
import com.edgegate.backend.model.FailurePattern;
import com.edgegate.backend.model.Strategy;
import com.edgegate.backend.model.StrategyType;
import com.edgegate.backend.model.WalkForwardResult;
import com.edgegate.backend.service.risk.FailureModeBlacklist;
import com.edgegate.backend.service.risk.FailurePatternMiner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Supplier;

/**
 * Offline promotion run for one strategy version: backtest, walk-forward, registry update, admission.
 * Losing condition groups found in the backtest trades are handed to the blacklist, and every backtest
 * trade is tallied in its outcome counts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StrategyValidationService {

    private final BacktestEngine backtestEngine;
    private final WalkForwardValidator walkForwardValidator;
    private final StrategyRegistryService strategyRegistryService;
    private final AdmissionGateService admissionGateService;
    private final FailurePatternMiner failurePatternMiner;
    private final FailureModeBlacklist failureModeBlacklist;

    public ValidationReport validate(String strategyId, String version, StrategyType strategyType,
                                     List<Candle> candles, Supplier<Strategy> strategyFactory) {
        log.info("Validating {} v{} over {} bars", strategyId, version, candles == null ? 0 : candles.size());
        strategyRegistryService.register(strategyId, version, strategyType);

        BacktestResult backtest = backtestEngine.run(strategyId, version, candles, strategyFactory.get());
        strategyRegistryService.updateMetrics(strategyId, version, backtest.getTrades());

        WalkForwardResult walkForward = walkForwardValidator.validate(strategyId, version, candles, strategyFactory);

        List<FailurePattern> patterns = failurePatternMiner.mine(backtest.getTrades());
        int blocked = failureModeBlacklist.importPatterns(patterns);
        if (blocked > 0) {
            log.warn("{} v{}: {} failure patterns added to blacklist", strategyId, version, blocked);
        }
        backtest.getTrades().forEach(failureModeBlacklist::recordTrade);

        AdmissionDecision admission = admissionGateService.requestApproval(strategyId, version,
                backtest.isPassed(), walkForward.isPassed());
        return new ValidationReport(backtest, walkForward, admission, patterns);
    }
}
