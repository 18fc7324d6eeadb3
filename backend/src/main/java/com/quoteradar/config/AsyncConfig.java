package com.quoteradar.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Executor for batch quote fetches: one task per requested symbol, handed straight to a thread
 * (no queue), so a batch never waits behind itself.
 */
@Configuration
@EnableConfigurationProperties(FetchProperties.class)
public class AsyncConfig {

    public static final String QUOTE_FETCH_EXECUTOR = "quote-fetch-executor";

    @Bean(name = QUOTE_FETCH_EXECUTOR)
    public Executor quoteFetchExecutor(FetchProperties fetchProperties) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(Math.max(1, fetchProperties.getCorePoolSize()));
        e.setMaxPoolSize(Integer.MAX_VALUE);
        e.setQueueCapacity(0);
        e.setKeepAliveSeconds(fetchProperties.getKeepAliveSeconds());
        e.setThreadNamePrefix("quote-fetch-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.initialize();
        return e;
    }
}
