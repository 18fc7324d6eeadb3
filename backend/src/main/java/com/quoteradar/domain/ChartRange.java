package com.quoteradar.domain;

/**
 * Chart ranges a caller can ask for. Lookback and sampling live in ChartRangeMapper.
 */
public enum ChartRange {
    ONE_DAY,
    TWO_WEEKS,
    ONE_MONTH,
    THREE_MONTH,
    ONE_YEAR,
    FIVE_YEARS,
    MAX
}
