package com.edgegate.backend.trading.gate;

import com.edgegate.backend.config.EdgeGateProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Graduated admission: turns net edge, confidence and the edge's historical percentile into a
 * block / probe / full decision. Rules are applied in order and the first match wins.
 */
@Service
@RequiredArgsConstructor
public class EdgeGate {

    public static final String REASON_NON_POSITIVE_EDGE = "non-positive edge";
    public static final String REASON_LOW_CONFIDENCE = "confidence below threshold";
    public static final String REASON_BELOW_FLOOR = "edge below historical floor";
    public static final String REASON_PROBE_SMALL = "probe small band";
    public static final String REASON_PROBE_MEDIUM = "probe medium band";
    public static final String REASON_FULL = "full band";

    private final EdgeGateProperties properties;

    public DecisionResult evaluate(double netEdge, double confidence, double percentile) {
        EdgeGateProperties.Gate gate = properties.getGate();

        if (!Double.isFinite(netEdge) || netEdge <= 0.0) {
            return DecisionResult.block(REASON_NON_POSITIVE_EDGE, String.format("netEdge=%.6f", netEdge));
        }
        if (!Double.isFinite(confidence) || confidence < gate.getMinConfidence()) {
            return DecisionResult.block(REASON_LOW_CONFIDENCE,
                    String.format("confidence=%.3f < %.3f", confidence, gate.getMinConfidence()));
        }
        if (Double.isNaN(percentile) || percentile < 0.0 || percentile > 1.0) {
            throw new IllegalArgumentException("percentile must be within [0,1]: " + percentile);
        }
        if (percentile < gate.getPercentileProbeSmall()) {
            return DecisionResult.block(REASON_BELOW_FLOOR,
                    String.format("percentile=%.3f < %.3f", percentile, gate.getPercentileProbeSmall()));
        }
        if (percentile < gate.getPercentileProbeMedium()) {
            return DecisionResult.probe(GateState.PROBE_SMALL, gate.getProbeSmallMultiplier(), REASON_PROBE_SMALL,
                    String.format("percentile=%.3f in [%.2f, %.2f)", percentile,
                            gate.getPercentileProbeSmall(), gate.getPercentileProbeMedium()),
                    gate.getProbeStopMultiplier());
        }
        if (percentile < gate.getPercentileFull()) {
            return DecisionResult.probe(GateState.PROBE_MEDIUM, gate.getProbeMediumMultiplier(), REASON_PROBE_MEDIUM,
                    String.format("percentile=%.3f in [%.2f, %.2f)", percentile,
                            gate.getPercentileProbeMedium(), gate.getPercentileFull()),
                    gate.getProbeStopMultiplier());
        }
        return DecisionResult.full(gate.getFullMultiplier(), REASON_FULL,
                String.format("percentile=%.3f >= %.2f", percentile, gate.getPercentileFull()));
    }
}
