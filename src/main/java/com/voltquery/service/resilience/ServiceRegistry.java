package com.voltquery.service.resilience;

import com.voltquery.config.VoltQueryProperties;
import com.voltquery.service.cache.ResponseCache;
import com.voltquery.service.freshness.FreshnessOracle;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Single holder of the process-wide resilience services.
 * Built once by Spring and injected wherever external calls are made.
 */
@Slf4j
@Getter
@Component
public class ServiceRegistry {

    private final ResponseCache cache;
    private final CircuitBreakerRegistry breakerRegistry;
    private final RetryExecutor retryExecutor;
    private final FreshnessOracle freshnessOracle;

    @Getter(AccessLevel.NONE)
    private final VoltQueryProperties properties;

    @Getter(AccessLevel.NONE)
    private final Map<String, RetryPolicy> retryPolicies = new ConcurrentHashMap<>();

    public ServiceRegistry(ResponseCache cache,
                           CircuitBreakerRegistry breakerRegistry,
                           RetryExecutor retryExecutor,
                           FreshnessOracle freshnessOracle,
                           VoltQueryProperties properties) {
        this.cache = cache;
        this.breakerRegistry = breakerRegistry;
        this.retryExecutor = retryExecutor;
        this.freshnessOracle = freshnessOracle;
        this.properties = properties;

        properties.getRetry().forEach((name, config) ->
                retryPolicies.put(name, RetryPolicy.fromConfig(name, config)));
        log.info("Initialized ServiceRegistry with retry policies: {}", retryPolicies.keySet());
    }

    /**
     * Named retry policy, falling back to the "default" settings.
     */
    public RetryPolicy retryPolicy(String name) {
        return retryPolicies.computeIfAbsent(name,
                key -> RetryPolicy.fromConfig(key, properties.retryFor(key)));
    }

    /**
     * Guard an external call: breaker outermost, retries inside it, and a timeout on every attempt.
     * The breaker sees one outcome per guarded call, after retries are exhausted.
     *
     * @param breakerName circuit breaker name
     * @param policyName  retry policy name
     * @param timeout     per-attempt timeout
     * @param call        supplier of the external call
     */
    public <T> Mono<T> protect(String breakerName, String policyName, Duration timeout, Supplier<Mono<T>> call) {
        CircuitBreaker breaker = breakerRegistry.getBreaker(breakerName);
        RetryPolicy policy = retryPolicy(policyName);
        return breaker.call(() -> retryExecutor.execute(() -> call.get().timeout(timeout), policy));
    }

    /**
     * {@link #protect} behind the response cache.
     */
    public <T> Mono<T> cachedProtect(String cacheKey, Duration ttl, String breakerName, String policyName,
                                     Duration timeout, Supplier<Mono<T>> call) {
        return cache.getOrFetch(cacheKey, () -> protect(breakerName, policyName, timeout, call), ttl);
    }
}
