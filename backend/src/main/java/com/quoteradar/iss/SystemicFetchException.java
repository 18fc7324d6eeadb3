package com.quoteradar.iss;

import com.quoteradar.common.MarketDataException;

/**
 * ISS as a whole is unreachable (connection refused, unknown host, connect/response timeout).
 * Batch fetches fail fast on it instead of dropping every item.
 */
public class SystemicFetchException extends MarketDataException {

    public static final String CODE = "SYSTEMIC_FETCH_ERROR";

    public SystemicFetchException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
