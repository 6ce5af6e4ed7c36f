package com.edgegate.backend.trading.gate;

import java.time.LocalDateTime;
import java.util.Map;

public record EdgeSample(
        double netEdge,
        LocalDateTime timestamp,
        String signalType,
        Map<String, Object> metadata
) {}
