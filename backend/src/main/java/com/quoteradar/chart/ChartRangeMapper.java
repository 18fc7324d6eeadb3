package com.quoteradar.chart;

import com.quoteradar.domain.CandleInterval;
import com.quoteradar.domain.ChartPoint;
import com.quoteradar.domain.ChartRange;
import com.quoteradar.domain.ChartSeries;
import com.quoteradar.domain.ChartStats;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Range → (lookback, ISS interval). Short ranges sample finely, long ranges coarsely, which keeps
 * candle responses small.
 */
@Component
public class ChartRangeMapper {

    private static final Map<ChartRange, RangeWindow> WINDOWS;

    static {
        Map<ChartRange, RangeWindow> m = new EnumMap<>(ChartRange.class);
        m.put(ChartRange.ONE_DAY, new RangeWindow(Duration.ofDays(1), CandleInterval.TEN_MINUTES));
        m.put(ChartRange.TWO_WEEKS, new RangeWindow(Duration.ofDays(14), CandleInterval.ONE_HOUR));
        m.put(ChartRange.ONE_MONTH, new RangeWindow(Duration.ofDays(30), CandleInterval.ONE_DAY));
        m.put(ChartRange.THREE_MONTH, new RangeWindow(Duration.ofDays(90), CandleInterval.ONE_DAY));
        m.put(ChartRange.ONE_YEAR, new RangeWindow(Duration.ofDays(365), CandleInterval.ONE_WEEK));
        m.put(ChartRange.FIVE_YEARS, new RangeWindow(Duration.ofDays(5 * 365), CandleInterval.ONE_MONTH));
        m.put(ChartRange.MAX, new RangeWindow(Duration.ofDays(20 * 365), CandleInterval.ONE_MONTH));
        WINDOWS = Collections.unmodifiableMap(m);
    }

    public RangeWindow mapRange(ChartRange range) {
        if (range == null) {
            throw new IllegalArgumentException("range is required");
        }
        return WINDOWS.get(range);
    }

    /**
     * Change from the first point's open to the last point's close.
     *
     * @throws InsufficientDataException when the series has no points
     */
    public ChartStats deriveChartStats(ChartSeries series) {
        if (series == null || series.points().isEmpty()) {
            throw new InsufficientDataException("Cannot derive chart stats from an empty series");
        }
        List<ChartPoint> points = series.points();
        double firstOpen = points.get(0).open();
        double lastClose = points.get(points.size() - 1).close();
        double change = lastClose - firstOpen;
        double percentChange = firstOpen != 0 ? change / firstOpen * 100 : 0;
        return new ChartStats(change, percentChange, change > 0, change < 0);
    }
}
