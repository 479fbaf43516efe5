package com.voltquery.support;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.voltquery.config.VoltQueryProperties;
import com.voltquery.repository.InMemoryIndexedStore;
import com.voltquery.service.cache.ResponseCache;
import com.voltquery.service.freshness.FreshnessOracle;
import com.voltquery.service.resilience.CircuitBreakerRegistry;
import com.voltquery.service.resilience.RetryExecutor;
import com.voltquery.service.resilience.ServiceRegistry;

import java.time.Clock;
import java.time.Duration;

/**
 * Builds a real {@link ServiceRegistry} for unit tests, without Spring.
 */
public final class TestServices {

    private TestServices() {
    }

    /**
     * Properties with fast, jitter-free retries so tests stay deterministic.
     */
    public static VoltQueryProperties properties() {
        VoltQueryProperties properties = new VoltQueryProperties();
        VoltQueryProperties.RetryConfig retry = new VoltQueryProperties.RetryConfig();
        retry.setMaxAttempts(1);
        retry.setJitter(false);
        retry.setInitialDelay(Duration.ofMillis(10));
        properties.getRetry().put(VoltQueryProperties.DEFAULT_KEY, retry);
        return properties;
    }

    public static ServiceRegistry serviceRegistry(VoltQueryProperties properties, Clock clock) {
        ResponseCache cache = new ResponseCache(Caffeine.newBuilder().maximumSize(1000).build(), clock);
        FreshnessOracle oracle = new FreshnessOracle(new InMemoryIndexedStore(new VoltQueryProperties()), clock);
        return new ServiceRegistry(cache, new CircuitBreakerRegistry(properties, clock),
                new RetryExecutor(), oracle, properties);
    }
}
