package com.voltquery.repository;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.voltquery.config.VoltQueryProperties;
import com.voltquery.model.IndexedRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Process-local indexed store, used when no external store is configured and in tests.
 * Bounded by {@code voltquery.store.max-records}; the least recently used records go first.
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "voltquery.store", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryIndexedStore implements IndexedStore {

    private final Cache<String, IndexedRecord> records;

    public InMemoryIndexedStore(VoltQueryProperties properties) {
        this.records = Caffeine.newBuilder()
                .maximumSize(properties.getStore().getMaxRecords())
                .build();
    }

    @Override
    public Mono<List<IndexedRecord>> query(String domain, String filterKey, String filterValue, int topK) {
        return Mono.fromSupplier(() -> records.asMap().values().stream()
                .filter(record -> Objects.equals(domain, record.metadataString(IndexedRecord.DOMAIN)))
                .filter(record -> Objects.equals(filterValue, record.metadataString(filterKey)))
                .sorted(Comparator.comparing(
                        (IndexedRecord record) -> String.valueOf(record.metadataString(IndexedRecord.INDEXED_AT)))
                        .reversed())
                .limit(topK)
                .toList());
    }

    @Override
    public Mono<Integer> upsert(List<IndexedRecord> batch) {
        return Mono.fromSupplier(() -> {
            for (IndexedRecord record : batch) {
                String id = record.getId() != null ? record.getId() : UUID.randomUUID().toString();
                record.setId(id);
                records.put(id, record);
            }
            log.debug("Indexed {} records in memory (total={})", batch.size(), records.estimatedSize());
            return batch.size();
        });
    }

    @Override
    public String getName() {
        return "memory";
    }
}
