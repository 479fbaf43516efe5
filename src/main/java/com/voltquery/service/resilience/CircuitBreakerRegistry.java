package com.voltquery.service.resilience;

import com.voltquery.config.VoltQueryProperties;
import com.voltquery.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates circuit breakers on first use and keeps them for the life of the process.
 */
@Slf4j
@Component
public class CircuitBreakerRegistry {

    private final VoltQueryProperties properties;
    private final Clock clock;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(VoltQueryProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        properties.getBreakers().forEach(CircuitBreakerRegistry::validate);
    }

    /**
     * Get the breaker for a dependency, creating it from the configured settings
     * (or the "default" settings) on first use.
     */
    public CircuitBreaker getBreaker(String name) {
        return breakers.computeIfAbsent(name, this::create);
    }

    private CircuitBreaker create(String name) {
        VoltQueryProperties.BreakerConfig config = properties.breakerFor(name);
        validate(name, config);
        log.info("Created circuit breaker: name={}, failureThreshold={}, openTimeout={}, successThreshold={}",
                name, config.getFailureThreshold(), config.getOpenTimeout(), config.getSuccessThreshold());
        return new CircuitBreaker(name, config.getFailureThreshold(), config.getOpenTimeout(),
                config.getSuccessThreshold(), clock);
    }

    public List<CircuitBreakerSnapshot> getAllStates() {
        return breakers.values().stream()
                .map(CircuitBreaker::snapshot)
                .sorted(Comparator.comparing(CircuitBreakerSnapshot::getName))
                .toList();
    }

    /**
     * Reset one breaker.
     *
     * @return false if no breaker with that name has been created
     */
    public boolean reset(String name) {
        CircuitBreaker breaker = breakers.get(name);
        if (breaker == null) {
            return false;
        }
        breaker.reset();
        return true;
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
    }

    private static void validate(String name, VoltQueryProperties.BreakerConfig config) {
        if (config.getFailureThreshold() < 1 || config.getSuccessThreshold() < 1) {
            throw new ConfigurationException("Breaker '" + name + "' needs thresholds of at least 1");
        }
        Duration openTimeout = config.getOpenTimeout();
        if (openTimeout == null || openTimeout.isNegative()) {
            throw new ConfigurationException("Breaker '" + name + "' needs a non-negative open-timeout");
        }
    }
}
