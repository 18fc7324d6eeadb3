package com.quoteradar.domain;

/**
 * ISS candle sampling intervals. {@code issCode} is the value of the {@code interval} query parameter.
 */
public enum CandleInterval {
    ONE_MINUTE(1),
    TEN_MINUTES(10),
    ONE_HOUR(60),
    ONE_DAY(24),
    ONE_WEEK(7),
    ONE_MONTH(31);

    private final int issCode;

    CandleInterval(int issCode) {
        this.issCode = issCode;
    }

    public int getIssCode() {
        return issCode;
    }
}
