package com.quoteradar.api.controller;

import com.quoteradar.api.dto.ErrorBody;
import com.quoteradar.chart.InsufficientDataException;
import com.quoteradar.common.MarketDataException;
import com.quoteradar.iss.IneligibleSymbolException;
import com.quoteradar.iss.IssFetchException;
import com.quoteradar.iss.SystemicFetchException;
import com.quoteradar.iss.table.EmptyTableException;
import com.quoteradar.iss.table.TableDecodeException;
import com.quoteradar.quote.AllFetchesFailedException;
import com.quoteradar.quote.NoPriceAvailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps MarketDataException codes to HTTP statuses with ErrorBody.
 */
@RestControllerAdvice
@Slf4j
public class MarketDataExceptionHandler {

    @ExceptionHandler(MarketDataException.class)
    public ResponseEntity<ErrorBody> handleMarketData(MarketDataException ex) {
        HttpStatus status = statusFor(ex.getErrorCode());
        if (status.is5xxServerError()) {
            log.warn("Market data request failed: [{}] {}", ex.getErrorCode(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorBody> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getMessage()));
    }

    static HttpStatus statusFor(String errorCode) {
        return switch (errorCode) {
            case IneligibleSymbolException.CODE -> HttpStatus.BAD_REQUEST;
            case EmptyTableException.CODE, NoPriceAvailableException.CODE, InsufficientDataException.CODE ->
                    HttpStatus.NOT_FOUND;
            case SystemicFetchException.CODE -> HttpStatus.SERVICE_UNAVAILABLE;
            case TableDecodeException.CODE, IssFetchException.CODE, AllFetchesFailedException.CODE ->
                    HttpStatus.BAD_GATEWAY;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
