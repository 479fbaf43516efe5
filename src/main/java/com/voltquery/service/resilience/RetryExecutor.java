package com.voltquery.service.resilience;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * Runs a call with bounded exponential-backoff retries.
 * Built on {@link Mono#retryWhen}; waits are {@link Mono#delay} timers, so no thread is parked between attempts.
 */
@Slf4j
@Component
public class RetryExecutor {

    static final double JITTER_RANGE = 0.2;
    static final Duration MIN_JITTERED_DELAY = Duration.ofMillis(100);

    private final DoubleSupplier random;

    public RetryExecutor() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    RetryExecutor(DoubleSupplier random) {
        this.random = random;
    }

    /**
     * Execute the call, retrying retryable failures until the policy's attempts run out.
     *
     * @param call   supplier invoked once per attempt
     * @param policy retry settings
     * @return the first successful result, or the last failure
     */
    public <T> Mono<T> execute(Supplier<Mono<T>> call, RetryPolicy policy) {
        return Mono.defer(call)
                .retryWhen(Retry.from(signals -> signals.concatMap(signal -> backoff(signal, policy))));
    }

    /**
     * Wait before the next attempt, or the failure itself when it is not retryable or attempts ran out.
     */
    private Mono<Long> backoff(Retry.RetrySignal signal, RetryPolicy policy) {
        Throwable error = signal.failure();
        int attempt = (int) signal.totalRetries();

        if (!policy.isRetryable(error)) {
            return Mono.error(error);
        }
        if (attempt >= policy.getMaxAttempts() - 1) {
            log.warn("retry exhausted attempts={} error={}", policy.getMaxAttempts(), error.toString());
            return Mono.error(error);
        }

        Duration delay = computeDelay(policy, attempt);
        log.warn("retry attempt={}/{} delay_ms={} error={}",
                attempt + 1, policy.getMaxAttempts(), delay.toMillis(), error.toString());
        return Mono.delay(delay);
    }

    /**
     * Delay before the attempt following {@code attempt}: nominal backoff, then ±20% jitter
     * floored at 100 ms when jitter is enabled.
     */
    Duration computeDelay(RetryPolicy policy, int attempt) {
        Duration nominal = policy.nominalDelay(attempt);
        if (!policy.isJitterEnabled()) {
            return nominal;
        }
        double factor = 1.0 - JITTER_RANGE + (2 * JITTER_RANGE * random.getAsDouble());
        long millis = Math.round(nominal.toMillis() * factor);
        return Duration.ofMillis(Math.max(millis, MIN_JITTERED_DELAY.toMillis()));
    }
}
