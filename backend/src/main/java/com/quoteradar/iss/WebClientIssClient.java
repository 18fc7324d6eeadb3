package com.quoteradar.iss;

import com.quoteradar.domain.CandleInterval;
import com.quoteradar.iss.config.IssProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * ISS client over the shared WebClient. Request-level failures (no connection, timeouts) are
 * retried {@code connectRetries} times, then reported as systemic; HTTP error statuses and
 * empty bodies are item-local and never retried.
 */
@Slf4j
public class WebClientIssClient implements IssClient {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private static final String SECURITY_PATH =
            "/engines/stock/markets/shares/securities/{secId}.json?iss.meta=off&iss.only=securities,marketdata";
    private static final String CANDLES_PATH =
            "/engines/stock/markets/shares/boards/{board}/securities/{secId}/candles.json"
                    + "?from={from}&interval={interval}&iss.meta=off";

    private final WebClient webClient;
    private final IssProperties issProperties;

    public WebClientIssClient(WebClient webClient, IssProperties issProperties) {
        this.webClient = webClient;
        this.issProperties = issProperties;
    }

    @Override
    public String getRawTable(String secId) {
        return get(issProperties.getBaseUrl() + SECURITY_PATH, Map.of("secId", secId), secId);
    }

    @Override
    public String getRawCandleTable(String secId, LocalDate from, CandleInterval interval, LocalDate till) {
        Map<String, Object> vars = new HashMap<>();
        vars.put("board", issProperties.getPrimaryBoard());
        vars.put("secId", secId);
        vars.put("from", from.format(DATE_FORMAT));
        vars.put("interval", interval.getIssCode());
        String template = issProperties.getBaseUrl() + CANDLES_PATH;
        if (till != null) {
            template = template + "&till={till}";
            vars.put("till", till.format(DATE_FORMAT));
        }
        return get(template, vars, secId);
    }

    private String get(String uriTemplate, Map<String, ?> vars, String secId) {
        log.debug("ISS GET {} {}", uriTemplate, vars);
        String body;
        try {
            body = webClient.get()
                    .uri(uriTemplate, vars)
                    .retrieve()
                    .bodyToMono(String.class)
                    .retryWhen(Retry.max(issProperties.getConnectRetries())
                            .filter(WebClientIssClient::isConnectionFailure)
                            .doBeforeRetry(s -> log.debug("ISS connection failure for {}, retry {}: {}",
                                    secId, s.totalRetries() + 1, s.failure().toString()))
                            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                    .block();
        } catch (WebClientResponseException e) {
            throw new IssFetchException(secId, "ISS HTTP " + e.getStatusCode().value() + " for " + secId, e);
        } catch (WebClientRequestException e) {
            throw new SystemicFetchException("ISS unreachable while fetching " + secId + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (isConnectionFailure(cause)) {
                throw new SystemicFetchException("ISS unreachable while fetching " + secId + ": " + cause, cause);
            }
            throw e;
        }
        if (body == null || body.isBlank()) {
            throw new IssFetchException(secId, "Empty ISS response for " + secId);
        }
        return body;
    }

    /**
     * Request never got an HTTP answer: refused, reset, unknown host, timed out.
     */
    static boolean isConnectionFailure(Throwable t) {
        return t instanceof WebClientRequestException
                || t instanceof IOException
                || t instanceof TimeoutException;
    }
}
