package com.quoteradar.domain;

/**
 * Normalized quote for one instrument. {@code symbol} is the caller's input string as given.
 * {@code change == lastTradePrice - previousClose} when previousClose is non-zero, else 0.
 */
public record Quote(
        String symbol,
        String name,
        double lastTradePrice,
        double change,
        double changePercent,
        double open,
        double high,
        double low,
        double previousClose,
        long volume,
        String currencyCode,
        String exchange,
        String marketState
) {
}
