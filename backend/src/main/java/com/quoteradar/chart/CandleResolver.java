package com.quoteradar.chart;

import com.quoteradar.domain.Candle;
import com.quoteradar.iss.IssColumns;
import com.quoteradar.iss.table.ColumnTable;
import com.quoteradar.iss.table.TableRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Turns an ISS candles table into candles sorted by begin time. Rows without a full
 * open/high/low/close are dropped; there are no partial candles.
 */
@Component
@Slf4j
public class CandleResolver {

    public List<Candle> resolve(ColumnTable candles) {
        int openIdx = candles.columnIndex(IssColumns.CANDLE_OPEN);
        int highIdx = candles.columnIndex(IssColumns.CANDLE_HIGH);
        int lowIdx = candles.columnIndex(IssColumns.CANDLE_LOW);
        int closeIdx = candles.columnIndex(IssColumns.CANDLE_CLOSE);
        int volumeIdx = candles.columnIndex(IssColumns.CANDLE_VOLUME);
        int beginIdx = candles.columnIndex(IssColumns.CANDLE_BEGIN);
        int endIdx = candles.columnIndex(IssColumns.CANDLE_END);

        List<Candle> out = new ArrayList<>(candles.rowCount());
        for (TableRow row : candles.getRows()) {
            OptionalDouble open = row.asDouble(openIdx);
            OptionalDouble high = row.asDouble(highIdx);
            OptionalDouble low = row.asDouble(lowIdx);
            OptionalDouble close = row.asDouble(closeIdx);
            if (open.isEmpty() || high.isEmpty() || low.isEmpty() || close.isEmpty()) {
                continue;
            }
            out.add(new Candle(
                    open.getAsDouble(),
                    high.getAsDouble(),
                    low.getAsDouble(),
                    close.getAsDouble(),
                    row.asLong(volumeIdx).orElse(0L),
                    row.asString(beginIdx).orElse(""),
                    row.asString(endIdx).orElse("")));
        }
        // yyyy-MM-dd HH:mm:ss sorts lexicographically; List.sort is stable
        out.sort(Comparator.comparing(Candle::begin));
        log.debug("ISS candles: {} rows, {} kept", candles.rowCount(), out.size());
        return List.copyOf(out);
    }
}
