package com.voltquery.service.resilience;

/**
 * Circuit breaker states.
 */
public enum CircuitState {
    /** Calls pass through. */
    CLOSED,
    /** Calls are rejected until the open timeout elapses. */
    OPEN,
    /** Probing recovery. */
    HALF_OPEN
}
