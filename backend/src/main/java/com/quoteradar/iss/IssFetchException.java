package com.quoteradar.iss;

import com.quoteradar.common.MarketDataException;
import lombok.Getter;

/**
 * ISS answered for one security, but not usefully (HTTP error status, empty body).
 * Affects only that security; see {@link SystemicFetchException} for outages.
 */
@Getter
public class IssFetchException extends MarketDataException {

    public static final String CODE = "ITEM_FETCH_ERROR";

    private final String secId;

    public IssFetchException(String secId, String message) {
        super(CODE, message);
        this.secId = secId;
    }

    public IssFetchException(String secId, String message, Throwable cause) {
        super(CODE, message, cause);
        this.secId = secId;
    }
}
