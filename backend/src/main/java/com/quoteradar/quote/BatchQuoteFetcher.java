package com.quoteradar.quote;

import com.quoteradar.common.MarketDataException;
import com.quoteradar.config.AsyncConfig;
import com.quoteradar.domain.Quote;
import com.quoteradar.iss.InstrumentClassifier;
import com.quoteradar.iss.SystemicFetchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Fetches quotes for many symbols concurrently, one task per requested symbol.
 * A symbol that fails on its own is dropped from the result; an ISS outage fails the whole batch.
 * Output follows input order, duplicates included. Each input gets its own quote; an input whose
 * task failed gets a successful quote for the same canonical symbol, if any.
 */
@Component
@Slf4j
public class BatchQuoteFetcher {

    private final QuoteService quoteService;
    private final Executor quoteFetchExecutor;

    public BatchQuoteFetcher(QuoteService quoteService,
                             @Qualifier(AsyncConfig.QUOTE_FETCH_EXECUTOR) Executor quoteFetchExecutor) {
        this.quoteService = quoteService;
        this.quoteFetchExecutor = quoteFetchExecutor;
    }

    /**
     * @return quotes in input order; may be shorter than {@code symbols}
     * @throws SystemicFetchException    when any task hit an ISS outage
     * @throws AllFetchesFailedException when the input was non-empty and nothing resolved
     */
    public List<Quote> fetchMany(List<String> symbols) {
        if (symbols == null || symbols.isEmpty()) {
            return List.of();
        }
        List<CompletableFuture<Optional<Quote>>> futures = new ArrayList<>(symbols.size());
        for (String symbol : symbols) {
            futures.add(CompletableFuture.supplyAsync(() -> fetchOne(symbol), quoteFetchExecutor));
        }
        // wait for every task, failed or not, before looking at any outcome
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .exceptionally(t -> null)
                .join();

        List<Optional<Quote>> results = new ArrayList<>(futures.size());
        Map<String, Quote> byCanonical = new HashMap<>();
        for (int i = 0; i < futures.size(); i++) {
            Optional<Quote> quote = settled(futures.get(i), symbols.size());
            String canonical = InstrumentClassifier.canonicalize(symbols.get(i));
            quote.ifPresent(q -> byCanonical.putIfAbsent(canonical, q));
            results.add(quote);
        }
        if (byCanonical.isEmpty()) {
            throw new AllFetchesFailedException(symbols);
        }

        // an input's own result wins; a failed input borrows the first success for its canonical symbol
        List<Quote> ordered = new ArrayList<>(symbols.size());
        for (int i = 0; i < symbols.size(); i++) {
            Quote q = results.get(i).orElse(null);
            if (q == null) {
                q = byCanonical.get(InstrumentClassifier.canonicalize(symbols.get(i)));
            }
            if (q != null) {
                ordered.add(q);
            }
        }
        log.info("Quote batch: {} requested, {} resolved, {} returned",
                symbols.size(), byCanonical.size(), ordered.size());
        return ordered;
    }

    private Optional<Quote> fetchOne(String symbol) {
        try {
            return Optional.of(quoteService.fetchQuote(symbol));
        } catch (SystemicFetchException e) {
            throw e;
        } catch (MarketDataException e) {
            log.warn("Dropping {} from quote batch: [{}] {}", symbol, e.getErrorCode(), e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Dropping {} from quote batch after unexpected error", symbol, e);
            return Optional.empty();
        }
    }

    private static Optional<Quote> settled(CompletableFuture<Optional<Quote>> future, int batchSize) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof SystemicFetchException systemic) {
                throw new SystemicFetchException("Quote batch of " + batchSize + " aborted: "
                        + systemic.getMessage(), systemic);
            }
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        }
    }
}
