package com.edgegate.backend.model;

import lombok.Builder;

/**
 * Snapshot of recent price behaviour. Changes are fractional (0.02 = +2%), volatility is the standard
 * deviation of bar-to-bar returns and volume ratio compares the last bar to the window average.
 */
@Builder
public record MarketState(
        MarketRegime regime,
        double regimeConfidence,
        double price,
        double shortChange,
        double mediumChange,
        double longChange,
        double shortVolatility,
        double longVolatility,
        double volumeRatio
) {
    public static MarketState unknown(double price) {
        return MarketState.builder()
                .regime(MarketRegime.UNKNOWN)
                .regimeConfidence(0.0)
                .price(price)
                .volumeRatio(1.0)
                .build();
    }
}
