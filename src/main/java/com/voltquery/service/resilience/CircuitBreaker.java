package com.voltquery.service.resilience;

import com.voltquery.exception.CircuitOpenException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Per-dependency circuit breaker.
 *
 * <pre>
 * CLOSED --(failureThreshold failures)--> OPEN --(openTimeout elapsed)--> HALF_OPEN
 * HALF_OPEN --(successThreshold successes)--> CLOSED
 * HALF_OPEN --(any failure)--> OPEN
 * </pre>
 *
 * The monitor guards state reads and writes only. The guarded call runs outside it,
 * so concurrent callers are never queued behind an in-flight request.
 * The breaker never retries; compose it with {@link RetryExecutor} for that.
 */
@Slf4j
public class CircuitBreaker {

    private final String name;
    private final int failureThreshold;
    private final Duration openTimeout;
    private final int successThreshold;
    private final Clock clock;

    private final Object lock = new Object();

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int successCount;
    private Instant lastFailureTime;
    private Instant lastSuccessTime;

    public CircuitBreaker(String name, int failureThreshold, Duration openTimeout,
                          int successThreshold, Clock clock) {
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.openTimeout = openTimeout;
        this.successThreshold = successThreshold;
        this.clock = clock;
    }

    /**
     * Invoke the supplied call under breaker protection.
     * An open breaker fails with {@link CircuitOpenException} without calling the supplier.
     * Errors of the call (timeouts included) are counted and re-emitted unchanged.
     * A cancelled call counts as neither success nor failure.
     *
     * @param call supplier of the guarded call, invoked once per subscription
     * @return result of the call
     */
    public <T> Mono<T> call(Supplier<Mono<T>> call) {
        return Mono.defer(() -> {
            CircuitOpenException rejection = admit();
            if (rejection != null) {
                return Mono.error(rejection);
            }

            Mono<T> invocation;
            try {
                invocation = call.get();
            } catch (RuntimeException e) {
                onFailure(e);
                return Mono.error(e);
            }

            return invocation
                    .doOnSuccess(result -> onSuccess())
                    .doOnError(this::onFailure);
        });
    }

    private CircuitOpenException admit() {
        synchronized (lock) {
            if (state != CircuitState.OPEN) {
                return null;
            }

            Instant now = clock.instant();
            Duration elapsed = lastFailureTime == null ? openTimeout.plusMillis(1)
                    : Duration.between(lastFailureTime, now);

            if (elapsed.compareTo(openTimeout) <= 0) {
                return new CircuitOpenException(name, elapsed, openTimeout.minus(elapsed));
            }

            state = CircuitState.HALF_OPEN;
            successCount = 0;
            logTransition("transitioned_to_half_open");
            return null;
        }
    }

    private void onSuccess() {
        synchronized (lock) {
            if (state == CircuitState.HALF_OPEN) {
                successCount++;
                if (successCount >= successThreshold) {
                    state = CircuitState.CLOSED;
                    failureCount = 0;
                    successCount = 0;
                    logTransition("recovered_to_closed");
                }
            }
            lastSuccessTime = clock.instant();
        }
    }

    private void onFailure(Throwable error) {
        synchronized (lock) {
            failureCount++;
            lastFailureTime = clock.instant();

            if (state == CircuitState.HALF_OPEN) {
                state = CircuitState.OPEN;
                successCount = 0;
                logTransition("failed_in_half_open");
            } else if (state == CircuitState.CLOSED && failureCount >= failureThreshold) {
                state = CircuitState.OPEN;
                logTransition("opened_after_threshold");
            }
        }
        log.debug("circuit_breaker name={} recorded_failure error={}", name, error.toString());
    }

    // Caller holds the lock
    private void logTransition(String action) {
        log.warn("circuit_breaker name={} state={} failure_count={} action={}",
                name, state, failureCount, action);
    }

    public CircuitBreakerSnapshot snapshot() {
        synchronized (lock) {
            return CircuitBreakerSnapshot.builder()
                    .name(name)
                    .state(state)
                    .failureCount(failureCount)
                    .successCount(successCount)
                    .lastFailureTime(lastFailureTime)
                    .lastSuccessTime(lastSuccessTime)
                    .build();
        }
    }

    public CircuitState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public String getName() {
        return name;
    }

    /**
     * Force the breaker back to CLOSED and clear its counters.
     */
    public void reset() {
        synchronized (lock) {
            state = CircuitState.CLOSED;
            failureCount = 0;
            successCount = 0;
            lastFailureTime = null;
            lastSuccessTime = null;
        }
        log.info("circuit_breaker name={} state=CLOSED action=manual_reset", name);
    }
}
