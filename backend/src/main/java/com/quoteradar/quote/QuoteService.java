package com.quoteradar.quote;

import com.fasterxml.jackson.databind.JsonNode;
import com.quoteradar.domain.Quote;
import com.quoteradar.iss.IneligibleSymbolException;
import com.quoteradar.iss.InstrumentClassifier;
import com.quoteradar.iss.IssClient;
import com.quoteradar.iss.IssColumns;
import com.quoteradar.iss.table.ColumnTable;
import com.quoteradar.iss.table.ColumnTableDecoder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Single-symbol quote path: classify, fetch, decode, resolve. Every failure reaches the caller
 * as a {@link com.quoteradar.common.MarketDataException}.
 */
@Service
@RequiredArgsConstructor
public class QuoteService {

    private final IssClient issClient;
    private final ColumnTableDecoder tableDecoder;
    private final QuoteResolver quoteResolver;
    private final InstrumentClassifier instrumentClassifier;

    public Quote fetchQuote(String symbol) {
        if (!instrumentClassifier.isEligible(symbol)) {
            throw new IneligibleSymbolException(symbol);
        }
        String secId = InstrumentClassifier.canonicalize(symbol);
        JsonNode root = tableDecoder.parse(issClient.getRawTable(secId));
        ColumnTable securities = tableDecoder.decodeRequired(root, IssColumns.SECURITIES);
        ColumnTable marketdata = tableDecoder.decodeRequired(root, IssColumns.MARKETDATA);
        return quoteResolver.resolve(symbol, securities, marketdata);
    }

    public boolean isEligible(String symbol) {
        return instrumentClassifier.isEligible(symbol);
    }
}
