package com.edgegate.backend.service.risk;

import com.edgegate.backend.model.ConditionDimension;
import com.edgegate.backend.model.MarketRegime;
import com.edgegate.backend.model.TradeRecord;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;

/**
 * Conditions in force for a trade or a candidate signal. Null fields are unknown and match nothing.
 */
public record ConditionContext(
        MarketRegime regime,
        Double volatility,
        LocalDateTime time,
        Double volumeRatio
) {

    public static ConditionContext of(MarketRegime regime, Double volatility) {
        return new ConditionContext(regime, volatility, null, null);
    }

    public static ConditionContext fromTrade(TradeRecord trade) {
        MarketRegime regime = trade.getRegimeAtEntry() != null ? trade.getRegimeAtEntry() : MarketRegime.UNKNOWN;
        return new ConditionContext(regime, trade.getVolatilityAtEntry(), trade.getEntryTime(), trade.getVolumeRatioAtEntry());
    }

    public Map<ConditionDimension, String> labels() {
        Map<ConditionDimension, String> labels = new EnumMap<>(ConditionDimension.class);
        if (regime != null) {
            labels.put(ConditionDimension.MARKET_REGIME, regime.name());
        }
        if (volatility != null) {
            labels.put(ConditionDimension.VOLATILITY_LEVEL, ConditionBuckets.volatilityLevel(volatility));
        }
        if (time != null) {
            labels.put(ConditionDimension.TIME_PERIOD, ConditionBuckets.timePeriod(time));
        }
        if (volumeRatio != null) {
            labels.put(ConditionDimension.VOLUME_LEVEL, ConditionBuckets.volumeLevel(volumeRatio));
        }
        return labels;
    }
}
