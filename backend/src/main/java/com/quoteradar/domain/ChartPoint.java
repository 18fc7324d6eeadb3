package com.quoteradar.domain;

/**
 * Chart point keyed by candle begin time in epoch seconds.
 */
public record ChartPoint(long timestamp, double open, double high, double low, double close) {
}
