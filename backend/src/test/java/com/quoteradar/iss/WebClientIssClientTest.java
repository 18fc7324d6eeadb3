package com.quoteradar.iss;

import com.quoteradar.domain.CandleInterval;
import com.quoteradar.iss.config.IssProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebClientIssClientTest {

    private final AtomicReference<URI> lastUri = new AtomicReference<>();
    private final AtomicInteger calls = new AtomicInteger();

    private WebClientIssClient client(ExchangeFunction exchange) {
        return client(exchange, new IssProperties());
    }

    private WebClientIssClient client(ExchangeFunction exchange, IssProperties props) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(req -> {
                    calls.incrementAndGet();
                    lastUri.set(req.url());
                    return exchange.exchange(req);
                })
                .build();
        return new WebClientIssClient(webClient, props);
    }

    /** What the reactor-netty exchange function emits when the connection cannot be made. */
    private static Mono<ClientResponse> connectRefused(ClientRequest req) {
        return Mono.error(new WebClientRequestException(new ConnectException("Connection refused"),
                HttpMethod.GET, req.url(), new HttpHeaders()));
    }

    private static ExchangeFunction respond(HttpStatus status, String body) {
        return req -> Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }

    @Test
    @DisplayName("security request asks for securities and marketdata blocks only")
    void rawTable() {
        String body = client(respond(HttpStatus.OK, "{\"securities\": {}}")).getRawTable("SBER");

        assertThat(body).isEqualTo("{\"securities\": {}}");
        assertThat(lastUri.get().toString())
                .startsWith("https://iss.moex.com/iss/engines/stock/markets/shares/securities/SBER.json")
                .contains("iss.meta=off")
                .contains("iss.only=securities,marketdata");
    }

    @Test
    @DisplayName("candle request targets the primary board with ISS interval code and optional till")
    void rawCandleTable() {
        WebClientIssClient client = client(respond(HttpStatus.OK, "{\"candles\": {}}"));

        client.getRawCandleTable("GAZP", LocalDate.of(2024, 4, 10), CandleInterval.ONE_DAY, null);
        assertThat(lastUri.get().toString())
                .contains("/boards/TQBR/securities/GAZP/candles.json")
                .contains("from=2024-04-10")
                .contains("interval=24")
                .doesNotContain("till=");

        client.getRawCandleTable("GAZP", LocalDate.of(2024, 4, 10), CandleInterval.ONE_HOUR, LocalDate.of(2024, 4, 12));
        assertThat(lastUri.get().toString())
                .contains("interval=60")
                .contains("till=2024-04-12");
    }

    @Test
    @DisplayName("HTTP error status is scoped to the security")
    void httpErrorIsItemLocal() {
        WebClientIssClient client = client(respond(HttpStatus.NOT_FOUND, ""));

        assertThatThrownBy(() -> client.getRawTable("XXXX"))
                .isInstanceOf(IssFetchException.class)
                .hasFieldOrPropertyWithValue("secId", "XXXX")
                .hasMessageContaining("404");
        assertThat(calls.get()).as("HTTP errors are not retried").isEqualTo(1);
    }

    @Test
    @DisplayName("empty body is scoped to the security")
    void emptyBodyIsItemLocal() {
        WebClientIssClient client = client(req -> Mono.just(ClientResponse.create(HttpStatus.OK).build()));

        assertThatThrownBy(() -> client.getRawTable("SBER"))
                .isInstanceOf(IssFetchException.class)
                .hasFieldOrPropertyWithValue("errorCode", "ITEM_FETCH_ERROR");
    }

    @Test
    @DisplayName("connection failure that persists past the retry is systemic")
    void connectFailureIsSystemic() {
        WebClientIssClient client = client(WebClientIssClientTest::connectRefused);

        assertThatThrownBy(() -> client.getRawTable("SBER"))
                .isInstanceOf(SystemicFetchException.class)
                .hasFieldOrPropertyWithValue("errorCode", "SYSTEMIC_FETCH_ERROR")
                .hasCauseInstanceOf(WebClientRequestException.class)
                .hasRootCauseInstanceOf(ConnectException.class);
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("one dropped connection is retried and the second answer is used")
    void transientConnectFailureIsRetried() {
        WebClientIssClient client = client(req -> calls.get() == 1
                ? connectRefused(req)
                : respond(HttpStatus.OK, "{\"securities\": {}}").exchange(req));

        assertThat(client.getRawTable("SBER")).isEqualTo("{\"securities\": {}}");
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("retry count comes from configuration; zero means a single attempt")
    void retriesConfigurable() {
        IssProperties props = new IssProperties();
        props.setConnectRetries(0);
        WebClientIssClient client = client(WebClientIssClientTest::connectRefused, props);

        assertThatThrownBy(() -> client.getRawTable("SBER")).isInstanceOf(SystemicFetchException.class);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("raw I/O error that was never wrapped is still systemic")
    void rawIoErrorIsSystemic() {
        WebClientIssClient client = client(req -> Mono.error(new IOException("Connection reset by peer")));

        assertThatThrownBy(() -> client.getRawTable("GAZP"))
                .isInstanceOf(SystemicFetchException.class)
                .hasRootCauseInstanceOf(IOException.class);
    }
}
