package com.quoteradar.api.dto;

import com.quoteradar.domain.ChartPoint;
import com.quoteradar.domain.ChartRange;
import com.quoteradar.domain.ChartSeries;
import com.quoteradar.domain.ChartStats;

import java.util.List;

public record ChartResponse(
        String symbol,
        ChartRange range,
        List<ChartPoint> points,
        double previousValue,
        double currentValue,
        ChartStats stats
) {

    public static ChartResponse of(ChartSeries series, ChartStats stats) {
        return new ChartResponse(series.symbol(), series.range(), series.points(),
                series.previousValue(), series.currentValue(), stats);
    }
}
