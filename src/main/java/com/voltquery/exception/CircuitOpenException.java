package com.voltquery.exception;

import java.time.Duration;
import java.util.Locale;

/**
 * Raised by an open circuit breaker without invoking the guarded call.
 */
public class CircuitOpenException extends VoltQueryException {

    private final String breakerName;
    private final Duration remaining;

    public CircuitOpenException(String breakerName, Duration elapsed, Duration remaining) {
        super(String.format(Locale.ROOT, "Circuit breaker '%s' is OPEN. Last failure: %.1fs ago. Retry after %.1fs",
                breakerName, elapsed.toMillis() / 1000.0, remaining.toMillis() / 1000.0));
        this.breakerName = breakerName;
        this.remaining = remaining;
    }

    public String getBreakerName() {
        return breakerName;
    }

    public Duration getRemaining() {
        return remaining;
    }
}
