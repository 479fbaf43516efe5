package com.voltquery.service.resilience;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time view of a circuit breaker, exposed through the admin API.
 */
@Value
@Builder
public class CircuitBreakerSnapshot {
    String name;
    CircuitState state;
    int failureCount;
    int successCount;
    Instant lastFailureTime;
    Instant lastSuccessTime;
}
