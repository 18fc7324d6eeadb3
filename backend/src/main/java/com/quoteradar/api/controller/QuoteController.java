package com.quoteradar.api.controller;

import com.quoteradar.api.dto.ChartResponse;
import com.quoteradar.chart.ChartRangeMapper;
import com.quoteradar.chart.ChartService;
import com.quoteradar.domain.Candle;
import com.quoteradar.domain.CandleInterval;
import com.quoteradar.domain.ChartRange;
import com.quoteradar.domain.ChartSeries;
import com.quoteradar.domain.Quote;
import com.quoteradar.quote.BatchQuoteFetcher;
import com.quoteradar.quote.QuoteService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.LocalDate;
import java.util.List;

/**
 * Quotes, batch quotes, charts and candle history. ISS calls block, so each request runs on boundedElastic.
 */
@RestController
@RequestMapping("/api/v1/quotes")
@RequiredArgsConstructor
public class QuoteController {

    private final QuoteService quoteService;
    private final BatchQuoteFetcher batchQuoteFetcher;
    private final ChartService chartService;
    private final ChartRangeMapper chartRangeMapper;

    @GetMapping("/{symbol}")
    public Mono<Quote> quote(@PathVariable String symbol) {
        return Mono.fromCallable(() -> quoteService.fetchQuote(symbol))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * GET /api/v1/quotes?symbols=SBER,GAZP. Order follows the request; failed symbols are left out.
     */
    @GetMapping
    public Mono<List<Quote>> quotes(@RequestParam List<String> symbols) {
        List<String> requested = symbols.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(String::trim)
                .toList();
        if (requested.isEmpty()) {
            return Mono.error(new IllegalArgumentException("symbols is required"));
        }
        return Mono.fromCallable(() -> batchQuoteFetcher.fetchMany(requested))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{symbol}/chart")
    public Mono<ChartResponse> chart(@PathVariable String symbol,
                                     @RequestParam(defaultValue = "ONE_MONTH") ChartRange range) {
        return Mono.fromCallable(() -> {
                    ChartSeries series = chartService.fetchCandles(symbol, range);
                    return ChartResponse.of(series, chartRangeMapper.deriveChartStats(series));
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{symbol}/candles")
    public Mono<List<Candle>> candles(@PathVariable String symbol,
                                     @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                     @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate till,
                                     @RequestParam(defaultValue = "ONE_DAY") CandleInterval interval) {
        return Mono.fromCallable(() -> chartService.fetchCandleHistory(symbol, from, till, interval))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
