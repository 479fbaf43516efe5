package com.voltquery.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.voltquery.service.cache.CacheEntry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Caffeine storage behind the response cache.
 * Only the size is bounded here; expiry is checked on read against the caller's TTL.
 */
@Configuration
public class CacheConfiguration {

    private final VoltQueryProperties properties;

    public CacheConfiguration(VoltQueryProperties properties) {
        this.properties = properties;
    }

    @Bean
    public Cache<String, CacheEntry> responseCacheStore() {
        return Caffeine.newBuilder()
                .maximumSize(properties.getCache().getMaxSize())
                .build();
    }
}
