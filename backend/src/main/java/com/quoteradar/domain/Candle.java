package com.quoteradar.domain;

/**
 * One OHLCV bar as returned by ISS. begin/end keep the wire format {@code yyyy-MM-dd HH:mm:ss}.
 */
public record Candle(double open, double high, double low, double close, long volume, String begin, String end) {
}
