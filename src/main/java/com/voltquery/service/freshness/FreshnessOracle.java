package com.voltquery.service.freshness;

import com.voltquery.exception.StaleDataException;
import com.voltquery.model.IndexedRecord;
import com.voltquery.repository.IndexedStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Decides whether previously indexed data for a domain/key is still usable.
 *
 * Missing records, missing or unparsable {@code indexed_at} values and store failures
 * all report stale. The oracle never emits an error.
 */
@Slf4j
@Service
public class FreshnessOracle {

    private final IndexedStore indexedStore;
    private final Clock clock;

    public FreshnessOracle(IndexedStore indexedStore, Clock clock) {
        this.indexedStore = indexedStore;
        this.clock = clock;
    }

    /**
     * Check the most recent record matching the domain and filter.
     *
     * @param domain      metadata domain
     * @param filterKey   metadata key, e.g. "zip" or "state"
     * @param filterValue value the key must equal
     * @param ttl         maximum usable age
     * @return fresh flag and the record's indexed time, if known
     */
    public Mono<FreshnessResult> checkFreshness(String domain, String filterKey, String filterValue, Duration ttl) {
        String key = domain + ":" + filterKey + ":" + filterValue;

        return Mono.defer(() -> indexedStore.query(domain, filterKey, filterValue, 1))
                .map(records -> evaluate(key, records, ttl))
                .defaultIfEmpty(FreshnessResult.absent())
                .onErrorResume(error -> {
                    log.warn("freshness_check key={} error={}", key, error.toString());
                    return Mono.just(FreshnessResult.absent());
                });
    }

    /**
     * Emit the indexed time when fresh, otherwise fail with {@link StaleDataException}.
     */
    public Mono<Instant> requireFresh(String domain, String filterKey, String filterValue, Duration ttl) {
        return checkFreshness(domain, filterKey, filterValue, ttl)
                .flatMap(result -> result.isFresh()
                        ? Mono.just(result.getIndexedAt())
                        : Mono.error(new StaleDataException(domain, filterValue)));
    }

    private FreshnessResult evaluate(String key, List<IndexedRecord> records, Duration ttl) {
        if (records == null || records.isEmpty()) {
            log.debug("freshness_check key={} found=false", key);
            return FreshnessResult.absent();
        }

        String indexedAtText = records.get(0).metadataString(IndexedRecord.INDEXED_AT);
        if (indexedAtText == null || indexedAtText.isBlank()) {
            // Records from before freshness tracking
            log.debug("freshness_check key={} found=true indexed_at=missing", key);
            return FreshnessResult.absent();
        }

        Instant indexedAt;
        try {
            indexedAt = parseTimestamp(indexedAtText);
        } catch (DateTimeParseException e) {
            log.warn("freshness_check key={} invalid_timestamp={}", key, indexedAtText);
            return FreshnessResult.absent();
        }

        Duration age = Duration.between(indexedAt, clock.instant());
        boolean fresh = age.compareTo(ttl) < 0;
        log.debug("freshness_check key={} age_seconds={} ttl_seconds={} fresh={}",
                key, age.toSeconds(), ttl.toSeconds(), fresh);
        return new FreshnessResult(fresh, indexedAt);
    }

    /**
     * Parse an ISO-8601 timestamp. Accepts a trailing Z, explicit offsets and a space in place
     * of the T separator. Timestamps without an offset are taken as UTC.
     */
    static Instant parseTimestamp(String text) {
        String normalized = text.trim().replaceFirst(" ", "T");
        try {
            return OffsetDateTime.parse(normalized).toInstant();
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(normalized).toInstant(ZoneOffset.UTC);
        }
    }
}
