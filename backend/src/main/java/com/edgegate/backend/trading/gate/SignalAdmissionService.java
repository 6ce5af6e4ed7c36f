package com.edgegate.backend.trading.gate;

import com.edgegate.backend.config.EdgeGateProperties;
import com.edgegate.backend.dto.SignalDecision;
import com.edgegate.backend.dto.SignalEvaluationRequest;
import com.edgegate.backend.service.risk.BlacklistCheck;
import com.edgegate.backend.service.risk.ConditionContext;
import com.edgegate.backend.service.risk.FailureModeBlacklist;
import com.edgegate.backend.service.risk.QualityScore;
import com.edgegate.backend.service.risk.TradeQualityScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Online path for one signal: percentile lookup, gate, secondary filters, then the edge is recorded
 * and the decision logged. The edge is recorded here, before any trade outcome exists.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignalAdmissionService {

    public static final String REASON_LOW_QUALITY = "quality below threshold";
    public static final String REASON_BLACKLISTED = "blacklisted combination";

    private final EdgeStatsTracker edgeStatsTracker;
    private final EdgeGate edgeGate;
    private final TradeQualityScorer tradeQualityScorer;
    private final FailureModeBlacklist failureModeBlacklist;
    private final EdgeGateDiagnostics diagnostics;
    private final EdgeGateProperties properties;

    public SignalDecision evaluate(SignalEvaluationRequest request) {
        EdgeStatsKey key = EdgeStatsKey.of(request.getSymbol(), request.getDirection(), request.getTimeframe());
        double netEdge = request.getNetEdge();
        double confidence = request.getConfidence();

        OptionalDouble measured = edgeStatsTracker.getPercentile(netEdge, key);
        boolean substituted = measured.isEmpty();
        double percentile = measured.orElse(properties.getGate().getInsufficientSamplePercentile());

        DecisionResult decision = edgeGate.evaluate(netEdge, confidence, percentile);
        Double qualityScore = null;
        String blacklistReason = null;

        if (!decision.isBlocked() && request.getStrategyType() != null) {
            QualityScore quality = tradeQualityScorer.score(confidence, request.getRegime(), request.getStrategyType(),
                    request.getHistoricalWinRate(), request.getRewardRiskRatio());
            qualityScore = quality.score();
            if (!quality.allowed()) {
                decision = DecisionResult.block(REASON_LOW_QUALITY, String.format("quality=%.1f < %.1f",
                        quality.score(), properties.getQuality().getMinQualityScore()));
            }
        }
        if (!decision.isBlocked() && request.getStrategyId() != null) {
            BlacklistCheck check = failureModeBlacklist.check(request.getStrategyId(), conditions(request));
            if (!check.allowed()) {
                blacklistReason = check.reason();
                decision = DecisionResult.block(REASON_BLACKLISTED, check.reason());
            }
        }

        if (Double.isFinite(netEdge)) {
            edgeStatsTracker.recordEdge(netEdge, key, request.getSignalType(), sampleMetadata(request, decision));
        }
        recordDiagnostics(key, request, decision, percentile, substituted);

        if (decision.isBlocked()) {
            log.info("EDGE GATE BLOCK {} reason={} edge={} conf={} pct={}{}", key, decision.reason(), netEdge,
                    confidence, percentile, substituted ? " (insufficient history)" : "");
        } else {
            log.info("EDGE GATE {} {} multiplier={} pct={}{}", decision.state(), key, decision.positionMultiplier(),
                    percentile, substituted ? " (insufficient history)" : "");
        }
        return SignalDecision.of(key.symbol(), key.direction().name(), key.timeframe(), decision, percentile,
                substituted, qualityScore, blacklistReason);
    }

    private ConditionContext conditions(SignalEvaluationRequest request) {
        LocalDateTime signalTime = request.getSignalTime() != null
                ? request.getSignalTime()
                : LocalDateTime.now(ZoneOffset.UTC);
        return new ConditionContext(request.getRegime(), request.getVolatility(), signalTime, request.getVolumeRatio());
    }

    private Map<String, Object> sampleMetadata(SignalEvaluationRequest request, DecisionResult decision) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (request.getMetadata() != null) {
            metadata.putAll(request.getMetadata());
        }
        metadata.put("confidence", request.getConfidence());
        metadata.put("state", decision.state().name());
        metadata.put("positionMultiplier", decision.positionMultiplier());
        return metadata;
    }

    private void recordDiagnostics(EdgeStatsKey key, SignalEvaluationRequest request, DecisionResult decision,
                                   double percentile, boolean substituted) {
        try {
            diagnostics.record(new GateDecisionRecord(
                    LocalDateTime.now(),
                    key.symbol(),
                    key.direction(),
                    key.timeframe(),
                    decision.state(),
                    decision.reason(),
                    request.getNetEdge(),
                    request.getConfidence(),
                    percentile,
                    substituted,
                    decision.positionMultiplier()
            ));
        } catch (RuntimeException e) {
            log.warn("Diagnostics failed for {}, decision unaffected", key, e);
        }
    }
}
