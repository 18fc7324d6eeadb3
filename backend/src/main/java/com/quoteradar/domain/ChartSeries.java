package com.quoteradar.domain;

import java.util.List;

/**
 * Time-ordered chart points with the reference value (first open) and current value (last close).
 * Change figures are computed on each call and never stored.
 */
public record ChartSeries(String symbol, ChartRange range, List<ChartPoint> points,
                          double previousValue, double currentValue) {

    public ChartSeries {
        points = List.copyOf(points);
    }

    public double change() {
        return currentValue - previousValue;
    }

    public double changePercent() {
        if (previousValue == 0) {
            return 0;
        }
        return change() / previousValue * 100;
    }
}
