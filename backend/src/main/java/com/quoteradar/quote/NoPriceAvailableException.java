package com.quoteradar.quote;

import com.quoteradar.common.MarketDataException;
import lombok.Getter;

/**
 * LAST, LCLOSEPRICE and PREVPRICE were all absent or zero.
 */
@Getter
public class NoPriceAvailableException extends MarketDataException {

    public static final String CODE = "NO_PRICE_AVAILABLE";

    private final String symbol;

    public NoPriceAvailableException(String symbol) {
        super(CODE, "No price available for " + symbol);
        this.symbol = symbol;
    }
}
