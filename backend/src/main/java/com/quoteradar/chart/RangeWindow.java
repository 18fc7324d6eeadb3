package com.quoteradar.chart;

import com.quoteradar.domain.CandleInterval;

import java.time.Duration;

/**
 * How far back to look and how coarse to sample for one chart range.
 */
public record RangeWindow(Duration lookback, CandleInterval interval) {
}
