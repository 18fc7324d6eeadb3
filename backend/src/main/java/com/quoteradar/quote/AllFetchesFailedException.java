package com.quoteradar.quote;

import com.quoteradar.common.MarketDataException;
import lombok.Getter;

import java.util.List;

/**
 * Every symbol of a non-empty batch failed on its own, with no source outage behind it.
 */
@Getter
public class AllFetchesFailedException extends MarketDataException {

    public static final String CODE = "ALL_FETCHES_FAILED";

    private final List<String> symbols;

    public AllFetchesFailedException(List<String> symbols) {
        super(CODE, "All " + symbols.size() + " quote fetches failed");
        this.symbols = List.copyOf(symbols);
    }
}
