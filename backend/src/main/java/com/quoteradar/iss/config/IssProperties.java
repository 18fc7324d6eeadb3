package com.quoteradar.iss.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * MOEX ISS source configuration. Documented in application.yml under quoteradar.iss.
 */
@ConfigurationProperties(prefix = "quoteradar.iss")
@Validated
@Getter
@Setter
public class IssProperties {

    /**
     * ISS base URL, without trailing slash.
     */
    @NotBlank
    private String baseUrl = "https://iss.moex.com/iss";

    /**
     * Primary trading board. Quote rows for this board win over other venues; candles are read from it.
     */
    @NotBlank
    private String primaryBoard = "TQBR";

    private String exchange = "MOEX";

    private String currencyCode = "RUB";

    private String marketState = "REGULAR";

    /**
     * Zone in which candle begin/end timestamps are expressed.
     */
    private String exchangeZone = "Europe/Moscow";

    @Min(1)
    private int connectTimeoutSeconds = 8;

    @Min(1)
    private int readTimeoutSeconds = 10;

    /**
     * Extra attempts after a connection-level failure before ISS is reported unreachable.
     * HTTP error statuses are never retried.
     */
    @Min(0)
    private int connectRetries = 1;

    /**
     * Size of the shared connection pool.
     */
    @Min(1)
    private int maxConnections = 16;

    /**
     * Tickers accepted in addition to the built-in MOEX list (bare form, e.g. "SBERP").
     */
    private List<String> additionalTickers = new ArrayList<>();
}
