package com.edgegate.backend.service.risk;

import java.time.LocalDateTime;

public record BlacklistEntry(
        CombinationKey key,
        int sampleSize,
        double winRate,
        double expectedValue,
        double profitFactor,
        String reason,
        LocalDateTime blacklistedAt,
        Source source
) {
    public enum Source {
        OBSERVED,
        MINED
    }
}
