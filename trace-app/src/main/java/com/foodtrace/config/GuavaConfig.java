package com.foodtrace.config;

import com.foodtrace.domain.lot.model.valobj.GenealogyTrace;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Guava cache configuration.
 * <p>
 * Deep genealogy traces are cached by direction, root lot and depth. Entries expire after
 * {@code trace.genealogy.cache-ttl-seconds} and are dropped on every genealogy write.
 * </p>
 */
@Configuration
@EnableConfigurationProperties(GenealogyCacheProperties.class)
public class GuavaConfig {

    @Bean(name = "genealogyTraceCache")
    public Cache<String, GenealogyTrace> genealogyTraceCache(GenealogyCacheProperties properties) {
        return CacheBuilder.newBuilder()
                .expireAfterWrite(properties.getCacheTtlSeconds(), TimeUnit.SECONDS)
                .maximumSize(properties.getCacheMaximumSize())
                .build();
    }

}
