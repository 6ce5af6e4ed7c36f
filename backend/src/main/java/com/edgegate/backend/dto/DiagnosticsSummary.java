package com.edgegate.backend.dto;

import com.edgegate.backend.trading.gate.GateState;

import java.util.Map;

public record DiagnosticsSummary(
        long totalDecisions,
        Map<GateState, Long> countsByState,
        Map<String, Long> blockReasons,
        double blockRate,
        double probeRate,
        double fullRate
) {}
