package com.quoteradar.chart;

import com.quoteradar.common.MarketDataException;

/**
 * Candle data decoded fine but there is nothing to chart or summarize.
 */
public class InsufficientDataException extends MarketDataException {

    public static final String CODE = "INSUFFICIENT_DATA";

    public InsufficientDataException(String message) {
        super(CODE, message);
    }
}
