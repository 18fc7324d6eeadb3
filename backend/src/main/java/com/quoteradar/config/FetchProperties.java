package com.quoteradar.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Batch quote fetch executor. Documented in application.yml under quoteradar.fetch.
 */
@ConfigurationProperties(prefix = "quoteradar.fetch")
@Getter
@Setter
public class FetchProperties {

    /**
     * Threads kept alive between batches. The pool grows past this on demand (one thread per in-flight symbol).
     */
    private int corePoolSize = 8;

    /**
     * Idle seconds before threads above the core size are released.
     */
    private int keepAliveSeconds = 60;
}
