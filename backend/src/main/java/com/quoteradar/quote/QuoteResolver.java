package com.quoteradar.quote;

import com.quoteradar.domain.Quote;
import com.quoteradar.iss.InstrumentClassifier;
import com.quoteradar.iss.IssColumns;
import com.quoteradar.iss.config.IssProperties;
import com.quoteradar.iss.table.ColumnTable;
import com.quoteradar.iss.table.TableRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Builds a Quote from the securities (reference) and marketdata (live) tables.
 * Last price chain: LAST → LCLOSEPRICE → PREVPRICE; a zero counts as missing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QuoteResolver {

    private final IssProperties issProperties;

    public Quote resolve(String symbol, ColumnTable securities, ColumnTable marketdata) {
        String secId = InstrumentClassifier.canonicalize(symbol);
        TableRow secRow = selectBoardRow(securities, secId);
        TableRow mdRow = selectBoardRow(marketdata, secId);

        double previousClose = secRow.asDouble(securities.columnIndex(IssColumns.PREVPRICE)).orElse(0);

        OptionalDouble lastPrice = nonZero(mdRow.asDouble(marketdata.columnIndex(IssColumns.LAST)));
        if (lastPrice.isEmpty()) {
            lastPrice = nonZero(mdRow.asDouble(marketdata.columnIndex(IssColumns.LCLOSEPRICE)));
        }
        if (lastPrice.isEmpty()) {
            lastPrice = nonZero(OptionalDouble.of(previousClose));
        }
        if (lastPrice.isEmpty()) {
            throw new NoPriceAvailableException(symbol);
        }
        double last = lastPrice.getAsDouble();

        double open = nonZero(mdRow.asDouble(marketdata.columnIndex(IssColumns.OPEN))).orElse(last);
        double high = nonZero(mdRow.asDouble(marketdata.columnIndex(IssColumns.HIGH))).orElse(last);
        double low = nonZero(mdRow.asDouble(marketdata.columnIndex(IssColumns.LOW))).orElse(last);

        double change = previousClose != 0 ? last - previousClose : 0;
        OptionalDouble sourcePercent = mdRow.asDouble(marketdata.columnIndex(IssColumns.LASTTOPREVPRICE));
        double changePercent;
        if (sourcePercent.isPresent()) {
            changePercent = sourcePercent.getAsDouble();
        } else if (previousClose != 0) {
            changePercent = change / previousClose * 100;
        } else {
            changePercent = 0;
        }

        long volume = mdRow.asLong(marketdata.columnIndex(IssColumns.VOLTODAY)).orElse(0L);

        String name = nonBlank(secRow.asString(securities.columnIndex(IssColumns.SECNAME)))
                .or(() -> nonBlank(secRow.asString(securities.columnIndex(IssColumns.SHORTNAME))))
                .orElse(symbol);

        log.debug("ISS quote {}: last={} prev={} change={} ({}%) vol={}",
                secId, last, previousClose, change, changePercent, volume);

        return new Quote(
                symbol,
                name,
                last,
                change,
                changePercent,
                open,
                high,
                low,
                previousClose,
                volume,
                issProperties.getCurrencyCode(),
                issProperties.getExchange(),
                issProperties.getMarketState());
    }

    /**
     * Row on the primary board, else the first row. Callers guarantee the table is not empty.
     */
    TableRow selectBoardRow(ColumnTable table, String secId) {
        return table.findRowWhere(IssColumns.BOARDID, issProperties.getPrimaryBoard())
                .orElseGet(() -> {
                    log.debug("No {} row in {} for {}, using first of {} rows",
                            issProperties.getPrimaryBoard(), table.getName(), secId, table.rowCount());
                    return table.row(0);
                });
    }

    private static OptionalDouble nonZero(OptionalDouble value) {
        return value.isPresent() && value.getAsDouble() != 0 ? value : OptionalDouble.empty();
    }

    private static Optional<String> nonBlank(Optional<String> value) {
        return value.map(String::strip).filter(s -> !s.isEmpty());
    }
}
