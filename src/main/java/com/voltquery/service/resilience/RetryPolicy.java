package com.voltquery.service.resilience;

import com.voltquery.config.VoltQueryProperties;
import com.voltquery.exception.CircuitOpenException;
import com.voltquery.exception.ConfigurationException;
import com.voltquery.exception.TransientApiException;
import lombok.Builder;
import lombok.Value;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Immutable retry settings.
 */
@Value
@Builder(toBuilder = true)
public class RetryPolicy {

    @Builder.Default
    int maxAttempts = 3;

    @Builder.Default
    Duration initialDelay = Duration.ofSeconds(1);

    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(60);

    @Builder.Default
    double exponentialBase = 2.0;

    @Builder.Default
    boolean jitterEnabled = true;

    @Builder.Default
    Predicate<Throwable> retryablePredicate = RetryPolicy::isTransient;

    public boolean isRetryable(Throwable error) {
        return retryablePredicate.test(error);
    }

    /**
     * Un-jittered delay before the attempt following {@code attempt} (0-indexed).
     */
    public Duration nominalDelay(int attempt) {
        double millis = initialDelay.toMillis() * Math.pow(exponentialBase, attempt);
        return Duration.ofMillis((long) Math.min(millis, maxDelay.toMillis()));
    }

    /**
     * Network failures, timeouts, 429 and 5xx responses. Never an open circuit.
     */
    public static boolean isTransient(Throwable error) {
        if (error instanceof CircuitOpenException) {
            return false;
        }
        if (error instanceof TransientApiException
                || error instanceof TimeoutException
                || error instanceof WebClientRequestException) {
            return true;
        }
        if (error instanceof WebClientResponseException responseException) {
            int status = responseException.getStatusCode().value();
            return status == 429 || status >= 500;
        }
        return false;
    }

    public static RetryPolicy fromConfig(String name, VoltQueryProperties.RetryConfig config) {
        if (config.getMaxAttempts() < 1) {
            throw new ConfigurationException("Retry policy '" + name + "' needs max-attempts of at least 1");
        }
        if (config.getExponentialBase() < 1.0) {
            throw new ConfigurationException("Retry policy '" + name + "' needs exponential-base of at least 1");
        }
        return RetryPolicy.builder()
                .maxAttempts(config.getMaxAttempts())
                .initialDelay(config.getInitialDelay())
                .maxDelay(config.getMaxDelay())
                .exponentialBase(config.getExponentialBase())
                .jitterEnabled(config.isJitter())
                .build();
    }
}
