package com.edgegate.backend.util;

import com.edgegate.backend.model.Candle;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

public final class TestCandleFactory {

    private static final LocalDateTime START = LocalDateTime.of(2024, 1, 2, 0, 0);

    private TestCandleFactory() {}

    public static List<Candle> trendingCandles(int count, double start, double step) {
        List<Candle> candles = new ArrayList<>();
        double price = start;
        for (int i = 0; i < count; i++) {
            double open = price;
            double close = price + step;
            double high = Math.max(open, close) + Math.abs(step) * 0.3;
            double low = Math.min(open, close) - Math.abs(step) * 0.2;
            candles.add(new Candle(open, high, low, close, 1000L + i * 10L, START.plusMinutes(i * 15L)));
            price = close;
        }
        return candles;
    }

    public static List<Candle> flatCandles(int count, double price) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            candles.add(new Candle(price, price, price, price, 1000L, START.plusMinutes(i * 15L)));
        }
        return candles;
    }

    /**
     * Segments of bars moving +1% (up) or -1% (down) per bar, each bar opening at the previous close.
     */
    public static List<Candle> segmentedCandles(double start, int segmentLength, boolean... upSegments) {
        List<Candle> candles = new ArrayList<>();
        double price = start;
        int index = 0;
        for (boolean up : upSegments) {
            for (int i = 0; i < segmentLength; i++) {
                double open = price;
                double close;
                double high;
                double low;
                if (up) {
                    close = open * 1.01;
                    high = close * 1.001;
                    low = open * 0.999;
                } else {
                    close = open * 0.99;
                    high = open * 1.001;
                    low = close * 0.999;
                }
                candles.add(new Candle(open, high, low, close, 1000L, START.plusMinutes(index * 15L)));
                price = close;
                index++;
            }
        }
        return candles;
    }

    public static Candle bar(int index, double open, double high, double low, double close) {
        return new Candle(open, high, low, close, 1000L, START.plusMinutes(index * 15L));
    }
}
