package com.quoteradar.iss;

import com.quoteradar.domain.CandleInterval;

import java.time.LocalDate;

/**
 * Raw access to MOEX ISS. Returns response bodies as JSON strings; decoding is the caller's job.
 * Implementations throw {@link SystemicFetchException} for source outages and
 * {@link IssFetchException} for failures scoped to one security.
 */
public interface IssClient {

    /**
     * {@code securities} and {@code marketdata} blocks for one security id.
     */
    String getRawTable(String secId);

    /**
     * {@code candles} block on the primary board.
     *
     * @param till optional upper bound, null for "up to now"
     */
    String getRawCandleTable(String secId, LocalDate from, CandleInterval interval, LocalDate till);
}
