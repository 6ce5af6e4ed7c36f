package com.edgegate.backend.trading.gate;

import com.edgegate.backend.exception.InvalidKeyException;
import com.edgegate.backend.model.Direction;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Bucket for edge history. Symbols are upper-cased on construction so "btcusdt" and "BTCUSDT" share a bucket.
 */
public record EdgeStatsKey(String symbol, Direction direction, String timeframe) {

    private static final Pattern SYMBOL = Pattern.compile("[A-Z0-9._-]{1,32}");
    private static final Pattern TIMEFRAME = Pattern.compile("\\d{1,4}[mhdw]");

    public EdgeStatsKey {
        if (symbol == null) {
            throw new InvalidKeyException("symbol is required");
        }
        symbol = symbol.trim().toUpperCase(Locale.ROOT);
        if (!SYMBOL.matcher(symbol).matches()) {
            throw new InvalidKeyException("invalid symbol: " + symbol);
        }
        if (direction == null) {
            throw new InvalidKeyException("direction is required");
        }
        if (timeframe == null) {
            throw new InvalidKeyException("timeframe is required");
        }
        timeframe = timeframe.trim().toLowerCase(Locale.ROOT);
        if (!TIMEFRAME.matcher(timeframe).matches()) {
            throw new InvalidKeyException("invalid timeframe: " + timeframe);
        }
    }

    public static EdgeStatsKey of(String symbol, String direction, String timeframe) {
        return new EdgeStatsKey(symbol, parseDirection(direction), timeframe);
    }

    public static Direction parseDirection(String direction) {
        if (direction == null) {
            throw new InvalidKeyException("direction is required");
        }
        try {
            return Direction.valueOf(direction.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidKeyException("invalid direction: " + direction);
        }
    }

    @Override
    public String toString() {
        return symbol + ":" + direction + ":" + timeframe;
    }
}
