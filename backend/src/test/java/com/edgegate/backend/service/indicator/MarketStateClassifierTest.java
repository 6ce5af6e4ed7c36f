package com.edgegate.backend.service.indicator;

import com.edgegate.backend.config.BacktestProperties;
import com.edgegate.backend.model.Candle;
import com.edgegate.backend.model.MarketRegime;
import com.edgegate.backend.model.MarketState;
import com.edgegate.backend.util.TestCandleFactory;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MarketStateClassifierTest {

    private final MarketStateClassifier classifier = new MarketStateClassifier(new BacktestProperties());

    @Test
    void tooFewBarsIsUnknown() {
        assertThat(classifier.classify(List.of()).regime()).isEqualTo(MarketRegime.UNKNOWN);
        assertThat(classifier.classify(TestCandleFactory.flatCandles(1, 100)).regime()).isEqualTo(MarketRegime.UNKNOWN);
    }

    @Test
    void flatSeriesIsUnknown() {
        MarketState state = classifier.classify(TestCandleFactory.flatCandles(100, 100));

        assertThat(state.regime()).isEqualTo(MarketRegime.UNKNOWN);
        assertThat(state.regimeConfidence()).isZero();
    }

    @Test
    void largeSwingsAreVolatile() {
        MarketState state = classifier.classify(alternating(100, 1.08, 1 / 1.08));

        assertThat(state.regime()).isEqualTo(MarketRegime.VOLATILE);
        assertThat(state.regimeConfidence()).isBetween(0.5, 1.0);
    }

    @Test
    void tinyMovesAreQuiet() {
        MarketState state = classifier.classify(TestCandleFactory.trendingCandles(100, 100, 0.01));

        assertThat(state.regime()).isEqualTo(MarketRegime.QUIET);
        assertThat(state.regimeConfidence()).isGreaterThan(0.9);
    }

    @Test
    void risingChoppySeriesTrendsUp() {
        MarketState state = classifier.classify(alternating(100, 1.03, 0.98));

        assertThat(state.regime()).isEqualTo(MarketRegime.TRENDING_UP);
        assertThat(state.regimeConfidence()).isEqualTo(1.0);
        assertThat(state.longChange()).isGreaterThan(0.02);
    }

    @Test
    void fallingChoppySeriesTrendsDown() {
        MarketState state = classifier.classify(alternating(100, 0.97, 1.02));

        assertThat(state.regime()).isEqualTo(MarketRegime.TRENDING_DOWN);
        assertThat(state.longChange()).isLessThan(-0.02);
    }

    @Test
    void balancedSwingsAreRanging() {
        MarketState state = classifier.classify(alternating(100, 1.02, 1 / 1.02));

        assertThat(state.regime()).isEqualTo(MarketRegime.RANGING);
        assertThat(state.longChange()).isCloseTo(0.0, within(1e-9));
        assertThat(state.regimeConfidence()).isCloseTo(1.0, within(1e-6));
    }

    @Test
    void shortSeriesSkipsLongLookback() {
        MarketState state = classifier.classify(alternating(10, 1.02, 1 / 1.02));

        assertThat(state.longChange()).isZero();
        assertThat(state.longVolatility()).isZero();
        assertThat(state.shortVolatility()).isGreaterThan(0.0);
        assertThat(state.volumeRatio()).isEqualTo(1.0);
    }

    @Test
    void classifyAtIgnoresLaterBars() {
        List<Candle> bars = alternating(150, 1.03, 0.98);
        MarketState before = classifier.classifyAt(bars, 99);

        bars.subList(100, 150).replaceAll(bar -> TestCandleFactory.bar(0, 1, 1, 1, 1));

        assertThat(classifier.classifyAt(bars, 99)).isEqualTo(before);
        assertThat(before).isEqualTo(classifier.classify(bars.subList(0, 100)));
    }

    @Test
    void volumeRatioComparesLastBarToAverage() {
        List<Candle> bars = alternating(100, 1.02, 1 / 1.02);
        bars.forEach(bar -> bar.setVolume(1000L));
        bars.get(99).setVolume(2000L);

        MarketState state = classifier.classify(bars);

        assertThat(state.volumeRatio()).isCloseTo(2000.0 / (97_000.0 / 96), within(1e-9));
    }

    private static List<Candle> alternating(int count, double upFactor, double downFactor) {
        List<Candle> bars = new ArrayList<>();
        double price = 100.0;
        for (int i = 0; i < count; i++) {
            double open = price;
            double close = i % 2 == 0 ? open * upFactor : open * downFactor;
            bars.add(TestCandleFactory.bar(i, open, Math.max(open, close), Math.min(open, close), close));
            price = close;
        }
        return bars;
    }
}
