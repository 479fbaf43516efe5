package com.voltquery.service.freshness;

import com.voltquery.exception.StaleDataException;
import com.voltquery.exception.TransientApiException;
import com.voltquery.model.IndexedRecord;
import com.voltquery.repository.IndexedStore;
import com.voltquery.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FreshnessOracleTest {

    private static final Duration TTL = Duration.ofHours(720);

    private IndexedStore store;
    private FreshnessOracle oracle;

    @BeforeEach
    void setUp() {
        store = mock(IndexedStore.class);
        oracle = new FreshnessOracle(store, new MutableClock(Instant.parse("2026-02-01T00:00:00Z")));
    }

    private void storeReturns(Map<String, Object> metadata) {
        IndexedRecord record = IndexedRecord.builder().id("1").text("station").metadata(metadata).build();
        when(store.query(anyString(), anyString(), anyString(), anyInt())).thenReturn(Mono.just(List.of(record)));
    }

    @Test
    void testRecentRecordIsFresh() {
        storeReturns(Map.of("indexed_at", "2026-01-20T00:00:00Z"));

        StepVerifier.create(oracle.checkFreshness("transportation", "zip", "80202", TTL))
                .assertNext(result -> {
                    assertTrue(result.isFresh());
                    assertEquals(Instant.parse("2026-01-20T00:00:00Z"), result.getIndexedAt());
                })
                .verifyComplete();
        verify(store).query(eq("transportation"), eq("zip"), eq("80202"), eq(1));
    }

    @Test
    void testOldRecordIsStaleButKeepsTimestamp() {
        storeReturns(Map.of("indexed_at", "2025-11-01T00:00:00+00:00"));

        StepVerifier.create(oracle.checkFreshness("transportation", "zip", "80202", TTL))
                .assertNext(result -> {
                    assertFalse(result.isFresh());
                    assertNotNull(result.getIndexedAt());
                })
                .verifyComplete();
    }

    @Test
    void testNoRecordsIsAbsent() {
        when(store.query(anyString(), anyString(), anyString(), anyInt())).thenReturn(Mono.just(List.of()));

        StepVerifier.create(oracle.checkFreshness("utility", "zip", "10001", TTL))
                .expectNext(FreshnessResult.absent())
                .verifyComplete();
    }

    @Test
    void testMissingIndexedAtIsAbsent() {
        storeReturns(Map.of("domain", "utility"));

        StepVerifier.create(oracle.checkFreshness("utility", "zip", "10001", TTL))
                .expectNext(FreshnessResult.absent())
                .verifyComplete();
    }

    @Test
    void testUnparsableTimestampIsAbsent() {
        storeReturns(Map.of("indexed_at", "last tuesday"));

        StepVerifier.create(oracle.checkFreshness("utility", "zip", "10001", TTL))
                .expectNext(FreshnessResult.absent())
                .verifyComplete();
    }

    @Test
    void testStoreFailureIsAbsent() {
        when(store.query(anyString(), anyString(), anyString(), anyInt()))
                .thenReturn(Mono.error(new TransientApiException("store down")));

        StepVerifier.create(oracle.checkFreshness("buildings", "topic", "efficiency", TTL))
                .expectNext(FreshnessResult.absent())
                .verifyComplete();
    }

    @Test
    void testStoreThrowingSynchronouslyIsAbsent() {
        when(store.query(anyString(), anyString(), anyString(), anyInt()))
                .thenThrow(new IllegalStateException("not connected"));

        StepVerifier.create(oracle.checkFreshness("buildings", "topic", "efficiency", TTL))
                .expectNext(FreshnessResult.absent())
                .verifyComplete();
    }

    @Test
    void testRequireFresh() {
        storeReturns(Map.of("indexed_at", "2025-01-01T00:00:00Z"));

        StepVerifier.create(oracle.requireFresh("transportation", "state", "CO", TTL))
                .expectError(StaleDataException.class)
                .verify();
    }

    @Test
    void testTimestampFormats() {
        Instant expected = Instant.parse("2026-01-20T10:15:30Z");

        assertEquals(expected, FreshnessOracle.parseTimestamp("2026-01-20T10:15:30Z"));
        assertEquals(expected, FreshnessOracle.parseTimestamp("2026-01-20T12:15:30+02:00"));
        assertEquals(expected, FreshnessOracle.parseTimestamp("2026-01-20T10:15:30"));
        assertEquals(expected, FreshnessOracle.parseTimestamp("2026-01-20 10:15:30"));
        assertEquals(expected.plusNanos(123_456_000), FreshnessOracle.parseTimestamp("2026-01-20T10:15:30.123456"));
    }
}
