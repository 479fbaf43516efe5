package com.voltquery.service.cache;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Cached value with the time it was stored. TTL is supplied by the reader.
 */
@Value
public class CacheEntry {
    String key;
    Object value;
    Instant storedAt;

    public boolean isExpired(Instant now, Duration ttl) {
        return Duration.between(storedAt, now).compareTo(ttl) >= 0;
    }
}
