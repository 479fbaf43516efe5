package com.voltquery.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.voltquery.model.dto.CacheStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * In-memory TTL cache for external API results.
 *
 * TTL is a read-time parameter: an entry is never returned once its age reaches the
 * TTL the caller passes, so one cache serves namespaces with different lifetimes.
 * There is no single-flight: concurrent misses on the same key each run the fetch.
 */
@Slf4j
@Component
public class ResponseCache {

    private static final int STATS_KEY_LIMIT = 10;

    private final Cache<String, CacheEntry> store;
    private final Clock clock;
    private final Object lock = new Object();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public ResponseCache(Cache<String, CacheEntry> responseCacheStore, Clock clock) {
        this.store = responseCacheStore;
        this.clock = clock;
    }

    /**
     * Return the cached value for the key if younger than the TTL, otherwise run the fetch
     * and store its result. An empty fetch result is passed through and not stored.
     *
     * @param key   cache key, see {@link CacheKeyGenerator}
     * @param fetch supplier of the fetch, invoked only on a miss
     * @param ttl   maximum age of a usable entry
     */
    public <T> Mono<T> getOrFetch(String key, Supplier<Mono<T>> fetch, Duration ttl) {
        return Mono.defer(() -> {
            Object cached = lookup(key, ttl);
            if (cached != null) {
                // callers use one value type per key
                @SuppressWarnings("unchecked")
                T value = (T) cached;
                return Mono.just(value);
            }

            return fetch.get()
                    .doOnNext(value -> put(key, value));
        });
    }

    private Object lookup(String key, Duration ttl) {
        synchronized (lock) {
            CacheEntry entry = store.getIfPresent(key);
            if (entry != null) {
                if (!entry.isExpired(clock.instant(), ttl)) {
                    hits.incrementAndGet();
                    log.debug("cache operation=get key={} hit=true ttl_seconds={}", key, ttl.toSeconds());
                    return entry.getValue();
                }
                store.invalidate(key);
                log.debug("cache operation=evict key={} reason=expired", key);
            }
            misses.incrementAndGet();
            log.debug("cache operation=get key={} hit=false ttl_seconds={}", key, ttl.toSeconds());
            return null;
        }
    }

    private void put(String key, Object value) {
        synchronized (lock) {
            store.put(key, new CacheEntry(key, value, clock.instant()));
        }
        log.debug("cache operation=set key={}", key);
    }

    /**
     * Remove all entries, or only those whose key starts with the prefix.
     *
     * @return number of entries removed
     */
    public int clear(String prefix) {
        synchronized (lock) {
            Map<String, CacheEntry> entries = store.asMap();
            if (prefix == null || prefix.isEmpty()) {
                int count = entries.size();
                store.invalidateAll();
                log.info("cache operation=clear removed={}", count);
                return count;
            }

            List<String> matching = entries.keySet().stream()
                    .filter(key -> key.startsWith(prefix))
                    .toList();
            store.invalidateAll(matching);
            log.info("cache operation=clear prefix={} removed={}", prefix, matching.size());
            return matching.size();
        }
    }

    public int clear() {
        return clear(null);
    }

    /**
     * Drop every entry at least as old as the TTL.
     *
     * @return number of entries removed
     */
    public int cleanupExpired(Duration ttl) {
        synchronized (lock) {
            Instant now = clock.instant();
            List<String> expired = store.asMap().values().stream()
                    .filter(entry -> entry.isExpired(now, ttl))
                    .map(CacheEntry::getKey)
                    .toList();
            store.invalidateAll(expired);
            return expired.size();
        }
    }

    public CacheStatistics getStats() {
        synchronized (lock) {
            long hitCount = hits.get();
            long missCount = misses.get();
            long total = hitCount + missCount;
            return CacheStatistics.builder()
                    .totalEntries(store.asMap().size())
                    .hits(hitCount)
                    .misses(missCount)
                    .hitRate(total == 0 ? 0.0 : (double) hitCount / total)
                    .keys(store.asMap().keySet().stream().limit(STATS_KEY_LIMIT).toList())
                    .build();
        }
    }
}
