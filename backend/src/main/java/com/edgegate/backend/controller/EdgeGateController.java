package com.edgegate.backend.controller;

import com.edgegate.backend.dto.BlacklistRemovalRequest;
import com.edgegate.backend.dto.DiagnosticsSummary;
import com.edgegate.backend.dto.PercentileAnalysis;
import com.edgegate.backend.dto.SignalDecision;
import com.edgegate.backend.dto.SignalEvaluationRequest;
import com.edgegate.backend.dto.TradeOutcomeRequest;
import com.edgegate.backend.exception.NotFoundException;
import com.edgegate.backend.service.risk.BlacklistCheck;
import com.edgegate.backend.service.risk.BlacklistEntry;
import com.edgegate.backend.service.risk.CombinationKey;
import com.edgegate.backend.service.risk.ConditionContext;
import com.edgegate.backend.service.risk.FailureModeBlacklist;
import com.edgegate.backend.service.risk.TradeQualityScorer;
import com.edgegate.backend.trading.gate.AggregateEdgeStatistics;
import com.edgegate.backend.trading.gate.EdgeGateDiagnostics;
import com.edgegate.backend.trading.gate.EdgeStatistics;
import com.edgegate.backend.trading.gate.EdgeStatsKey;
import com.edgegate.backend.trading.gate.EdgeStatsTracker;
import com.edgegate.backend.trading.gate.GateDecisionRecord;
import com.edgegate.backend.trading.gate.SignalAdmissionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/edge-gate")
@RequiredArgsConstructor
@Tag(name = "Edge Gate")
public class EdgeGateController {

    private final SignalAdmissionService signalAdmissionService;
    private final EdgeGateDiagnostics diagnostics;
    private final EdgeStatsTracker edgeStatsTracker;
    private final FailureModeBlacklist failureModeBlacklist;
    private final TradeQualityScorer tradeQualityScorer;

    @PostMapping("/evaluate")
    @Operation(summary = "Evaluate a signal and return the sizing decision")
    public ResponseEntity<SignalDecision> evaluate(@Valid @RequestBody SignalEvaluationRequest request) {
        return ResponseEntity.ok(signalAdmissionService.evaluate(request));
    }

    @GetMapping("/diagnostics/summary")
    @Operation(summary = "Decision counts per state and per block reason")
    public ResponseEntity<DiagnosticsSummary> summary() {
        return ResponseEntity.ok(diagnostics.getSummary());
    }

    @GetMapping("/diagnostics/percentiles")
    @Operation(summary = "Histogram of recent edge percentiles against the gate bands")
    public ResponseEntity<PercentileAnalysis> percentiles() {
        return ResponseEntity.ok(diagnostics.analyzePercentiles());
    }

    @GetMapping("/diagnostics/blocks")
    @Operation(summary = "Most recent blocked signals")
    public ResponseEntity<List<GateDecisionRecord>> recentBlocks(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(diagnostics.getRecentBlocks(Math.max(0, limit)));
    }

    @GetMapping(value = "/diagnostics/report", produces = MediaType.TEXT_PLAIN_VALUE)
    @Operation(summary = "Plain-text diagnostic report")
    public ResponseEntity<String> report() {
        return ResponseEntity.ok(diagnostics.generateReport());
    }

    @GetMapping("/stats")
    @Operation(summary = "Edge history statistics across all keys")
    public ResponseEntity<AggregateEdgeStatistics> aggregateStats() {
        return ResponseEntity.ok(edgeStatsTracker.getAggregateStatistics());
    }

    @GetMapping("/stats/{symbol}/{direction}/{timeframe}")
    @Operation(summary = "Edge history statistics for one key")
    public ResponseEntity<EdgeStatistics> stats(@PathVariable String symbol, @PathVariable String direction,
                                                @PathVariable String timeframe) {
        return ResponseEntity.ok(edgeStatsTracker.getStatistics(EdgeStatsKey.of(symbol, direction, timeframe)));
    }

    @PostMapping("/trade-outcomes")
    @Operation(summary = "Record a realised trade result against its entry conditions")
    public ResponseEntity<BlacklistCheck> recordTradeOutcome(@Valid @RequestBody TradeOutcomeRequest request) {
        failureModeBlacklist.recordTradeResult(request.getStrategyId(), request.getRegime(), request.getVolatility(),
                request.getPnl());
        return ResponseEntity.ok(failureModeBlacklist.check(request.getStrategyId(),
                ConditionContext.of(request.getRegime(), request.getVolatility())));
    }

    @GetMapping("/blacklist")
    @Operation(summary = "Blacklisted strategy and condition combinations")
    public ResponseEntity<List<BlacklistEntry>> blacklist() {
        return ResponseEntity.ok(failureModeBlacklist.getBlacklisted());
    }

    @GetMapping(value = "/blacklist/report", produces = MediaType.TEXT_PLAIN_VALUE)
    @Operation(summary = "Plain-text blacklist report")
    public ResponseEntity<String> blacklistReport() {
        return ResponseEntity.ok(failureModeBlacklist.generateReport());
    }

    @PostMapping("/blacklist/remove")
    @Operation(summary = "Lift a blacklisted combination")
    public ResponseEntity<Void> removeFromBlacklist(@Valid @RequestBody BlacklistRemovalRequest request) {
        CombinationKey key = new CombinationKey(request.getStrategyId(), request.getConditions());
        if (!failureModeBlacklist.remove(key)) {
            throw new NotFoundException("Combination " + key + " is not blacklisted");
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/quality/stats")
    @Operation(summary = "Quality scorer pass and block counts")
    public ResponseEntity<TradeQualityScorer.QualityStats> qualityStats() {
        return ResponseEntity.ok(tradeQualityScorer.getStats());
    }
}
