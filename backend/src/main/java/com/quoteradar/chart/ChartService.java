package com.quoteradar.chart;

import com.fasterxml.jackson.databind.JsonNode;
import com.quoteradar.domain.Candle;
import com.quoteradar.domain.CandleInterval;
import com.quoteradar.domain.ChartPoint;
import com.quoteradar.domain.ChartRange;
import com.quoteradar.domain.ChartSeries;
import com.quoteradar.iss.IneligibleSymbolException;
import com.quoteradar.iss.InstrumentClassifier;
import com.quoteradar.iss.IssClient;
import com.quoteradar.iss.IssColumns;
import com.quoteradar.iss.config.IssProperties;
import com.quoteradar.iss.table.ColumnTableDecoder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalLong;

/**
 * Candle history and chart series for ISS instruments.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChartService {

    private static final DateTimeFormatter ISS_DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final IssClient issClient;
    private final ColumnTableDecoder tableDecoder;
    private final CandleResolver candleResolver;
    private final ChartRangeMapper chartRangeMapper;
    private final InstrumentClassifier instrumentClassifier;
    private final IssProperties issProperties;
    private final Clock clock;

    /**
     * Chart for {@code range} ending today. Points are keyed by candle begin in epoch seconds.
     *
     * @throws InsufficientDataException when ISS returns no usable candles
     */
    public ChartSeries fetchCandles(String symbol, ChartRange range) {
        RangeWindow window = chartRangeMapper.mapRange(range);
        LocalDate from = LocalDate.now(clock).minusDays(window.lookback().toDays());
        List<Candle> candles = fetchCandleHistory(symbol, from, null, window.interval());

        ZoneId zone = ZoneId.of(issProperties.getExchangeZone());
        List<ChartPoint> points = new ArrayList<>(candles.size());
        for (Candle c : candles) {
            OptionalLong ts = toEpochSecond(c.begin(), zone);
            if (ts.isPresent()) {
                points.add(new ChartPoint(ts.getAsLong(), c.open(), c.high(), c.low(), c.close()));
            }
        }
        points.sort(Comparator.comparingLong(ChartPoint::timestamp));
        if (points.isEmpty()) {
            throw new InsufficientDataException("No candle data for " + symbol + " over " + range);
        }
        return new ChartSeries(symbol, range, points,
                points.get(0).open(), points.get(points.size() - 1).close());
    }

    /**
     * Resolved candles for an explicit window on the primary board. An empty list means ISS has no data.
     *
     * @param till optional, inclusive upper date
     */
    public List<Candle> fetchCandleHistory(String symbol, LocalDate from, LocalDate till, CandleInterval interval) {
        if (!instrumentClassifier.isEligible(symbol)) {
            throw new IneligibleSymbolException(symbol);
        }
        if (from == null || interval == null) {
            throw new IllegalArgumentException("from and interval are required");
        }
        if (till != null && till.isBefore(from)) {
            throw new IllegalArgumentException("till " + till + " is before from " + from);
        }
        String secId = InstrumentClassifier.canonicalize(symbol);
        JsonNode root = tableDecoder.parse(issClient.getRawCandleTable(secId, from, interval, till));
        return candleResolver.resolve(tableDecoder.decode(root, IssColumns.CANDLES));
    }

    private static OptionalLong toEpochSecond(String begin, ZoneId zone) {
        try {
            return OptionalLong.of(LocalDateTime.parse(begin, ISS_DATE_TIME).atZone(zone).toEpochSecond());
        } catch (DateTimeParseException e) {
            log.debug("Skipping candle with unparseable begin '{}'", begin);
            return OptionalLong.empty();
        }
    }
}
