package com.edgegate.backend.service.indicator;

import com.edgegate.backend.config.BacktestProperties;
import com.edgegate.backend.model.Candle;
import com.edgegate.backend.model.MarketRegime;
import com.edgegate.backend.model.MarketState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Labels the regime at the last bar of a window from price change and return volatility over three
 * lookbacks. Only bars up to and including the last one are read.
 */
@Service
@RequiredArgsConstructor
public class MarketStateClassifier {

    private final BacktestProperties backtestProperties;

    public MarketState classify(List<Candle> bars) {
        if (bars == null || bars.size() < 2) {
            double price = bars == null || bars.isEmpty() ? 0.0 : bars.get(bars.size() - 1).getClose();
            return MarketState.unknown(price);
        }
        BacktestProperties.MarketState config = backtestProperties.getMarketState();
        int n = bars.size();
        double price = bars.get(n - 1).getClose();

        double shortChange = priceChange(bars, config.getShortLookback());
        double mediumChange = priceChange(bars, config.getMediumLookback());
        double longChange = priceChange(bars, config.getLongLookback());
        double shortVol = n >= config.getShortLookback() ? volatility(bars, config.getShortLookback()) : 0.0;
        double longVol = n >= config.getLongLookback() ? volatility(bars, config.getLongLookback()) : 0.0;
        double volumeRatio = volumeRatio(bars, config.getLongLookback());

        MarketRegime regime;
        double confidence;
        if (longChange == 0.0 && longVol == 0.0) {
            regime = MarketRegime.UNKNOWN;
            confidence = 0.0;
        } else if (longVol > config.getVolatileThreshold()) {
            regime = MarketRegime.VOLATILE;
            confidence = Math.min(longVol / config.getVolatileConfidenceScale(), 1.0);
        } else if (longVol < config.getQuietThreshold()) {
            regime = MarketRegime.QUIET;
            confidence = 1.0 - longVol / config.getQuietThreshold();
        } else if (longChange > config.getTrendThreshold()) {
            regime = MarketRegime.TRENDING_UP;
            confidence = Math.min(longChange / config.getTrendConfidenceScale(), 1.0);
        } else if (longChange < -config.getTrendThreshold()) {
            regime = MarketRegime.TRENDING_DOWN;
            confidence = Math.min(-longChange / config.getTrendConfidenceScale(), 1.0);
        } else {
            regime = MarketRegime.RANGING;
            confidence = 1.0 - Math.abs(longChange) / config.getTrendThreshold();
        }

        return MarketState.builder()
                .regime(regime)
                .regimeConfidence(confidence)
                .price(price)
                .shortChange(shortChange)
                .mediumChange(mediumChange)
                .longChange(longChange)
                .shortVolatility(shortVol)
                .longVolatility(longVol)
                .volumeRatio(volumeRatio)
                .build();
    }

    /**
     * State as of bar {@code index}, ignoring everything after it.
     */
    public MarketState classifyAt(List<Candle> bars, int index) {
        return classify(bars.subList(0, index + 1));
    }

    private double priceChange(List<Candle> bars, int periods) {
        int n = bars.size();
        if (n < periods + 1) {
            return 0.0;
        }
        double oldPrice = bars.get(n - periods - 1).getClose();
        double newPrice = bars.get(n - 1).getClose();
        if (oldPrice == 0.0) {
            return 0.0;
        }
        return (newPrice - oldPrice) / oldPrice;
    }

    private double volatility(List<Candle> bars, int window) {
        int n = bars.size();
        int from = n - window;
        int count = 0;
        double sum = 0.0;
        double[] returns = new double[window];
        for (int i = from + 1; i < n; i++) {
            double prev = bars.get(i - 1).getClose();
            if (prev > 0) {
                returns[count] = (bars.get(i).getClose() - prev) / prev;
                sum += returns[count];
                count++;
            }
        }
        if (count == 0) {
            return 0.0;
        }
        double mean = sum / count;
        double variance = 0.0;
        for (int i = 0; i < count; i++) {
            variance += Math.pow(returns[i] - mean, 2);
        }
        return Math.sqrt(variance / count);
    }

    private double volumeRatio(List<Candle> bars, int window) {
        int n = bars.size();
        if (n < window) {
            return 1.0;
        }
        double total = 0.0;
        for (int i = n - window; i < n; i++) {
            total += bars.get(i).getVolume();
        }
        if (total <= 0) {
            return 1.0;
        }
        double average = total / window;
        return bars.get(n - 1).getVolume() / average;
    }
}
