package com.quoteradar.iss.config;

import com.quoteradar.iss.IssClient;
import com.quoteradar.iss.WebClientIssClient;
import io.netty.channel.ChannelOption;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

/**
 * One pooled WebClient for all ISS calls, created at startup and disposed with the context.
 */
@Configuration
@EnableConfigurationProperties(IssProperties.class)
public class IssClientConfig {

    @Bean(destroyMethod = "dispose")
    public ConnectionProvider issConnectionProvider(IssProperties issProperties) {
        return ConnectionProvider.builder("iss")
                .maxConnections(issProperties.getMaxConnections())
                .maxIdleTime(Duration.ofMinutes(5))
                .build();
    }

    @Bean
    public WebClient issWebClient(WebClient.Builder webClientBuilder, ConnectionProvider issConnectionProvider,
                                  IssProperties issProperties) {
        HttpClient httpClient = HttpClient.create(issConnectionProvider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, issProperties.getConnectTimeoutSeconds() * 1000)
                .responseTimeout(Duration.ofSeconds(issProperties.getReadTimeoutSeconds()))
                .followRedirect(true);
        return webClientBuilder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .codecs(c -> c.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                .build();
    }

    @Bean
    public IssClient issClient(WebClient issWebClient, IssProperties issProperties) {
        return new WebClientIssClient(issWebClient, issProperties);
    }
}
