package com.quoteradar.common;

import lombok.Getter;

/**
 * Base of every quote/candle failure. API layer maps {@link #getErrorCode()} to an HTTP status.
 */
@Getter
public abstract class MarketDataException extends RuntimeException {

    /** Stable error code exposed in ErrorBody, e.g. NO_PRICE_AVAILABLE. */
    private final String errorCode;

    protected MarketDataException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected MarketDataException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
