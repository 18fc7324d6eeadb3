package com.quoteradar.iss.table;

import com.quoteradar.common.MarketDataException;

/**
 * Thrown when an ISS response is not valid JSON or a table block does not have the columns/data shape.
 */
public class TableDecodeException extends MarketDataException {

    public static final String CODE = "DECODE_ERROR";

    public TableDecodeException(String message) {
        super(CODE, message);
    }

    public TableDecodeException(String message, Throwable cause) {
        super(CODE, message, cause);
    }

    protected TableDecodeException(String errorCode, String message) {
        super(errorCode, message);
    }
}
