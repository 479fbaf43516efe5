package com.voltquery.service.freshness;

import lombok.Value;

import java.time.Instant;

/**
 * Outcome of a freshness check. {@code indexedAt} is null when no usable timestamp was found.
 */
@Value
public class FreshnessResult {

    private static final FreshnessResult ABSENT = new FreshnessResult(false, null);

    boolean fresh;
    Instant indexedAt;

    public static FreshnessResult absent() {
        return ABSENT;
    }
}
