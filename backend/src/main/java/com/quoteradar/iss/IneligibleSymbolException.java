package com.quoteradar.iss;

import com.quoteradar.common.MarketDataException;
import lombok.Getter;

/**
 * Symbol is not served by ISS (unknown ticker without an exchange suffix).
 */
@Getter
public class IneligibleSymbolException extends MarketDataException {

    public static final String CODE = "INELIGIBLE_SYMBOL";

    private final String symbol;

    public IneligibleSymbolException(String symbol) {
        super(CODE, "Symbol is not traded on MOEX: " + symbol);
        this.symbol = symbol;
    }
}
