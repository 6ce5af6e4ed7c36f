package com.edgegate.backend.dto;

import java.util.List;

public record AdmissionDecision(
        String strategyId,
        String version,
        boolean approved,
        List<String> reasons
) {}
