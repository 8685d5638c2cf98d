package com.foodtrace.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Genealogy trace settings.
 */
@Data
@ConfigurationProperties(prefix = "trace.genealogy")
public class GenealogyCacheProperties {

    /**
     * Upper bound for the depth a trace may request.
     */
    private int maxDepth = 10;

    /**
     * Lifetime of a cached trace after it was written.
     */
    private long cacheTtlSeconds = 300;

    private long cacheMaximumSize = 10_000;
}
