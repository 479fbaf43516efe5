package com.voltquery.repository;

import com.voltquery.model.IndexedRecord;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * External indexed knowledge store holding previously fetched API data.
 */
public interface IndexedStore {

    /**
     * Records of a domain whose metadata {@code filterKey} equals {@code filterValue},
     * most recently indexed first.
     *
     * @param domain      metadata domain, e.g. "transportation"
     * @param filterKey   metadata key, e.g. "zip"
     * @param filterValue required value of that key
     * @param topK        maximum number of records
     */
    Mono<List<IndexedRecord>> query(String domain, String filterKey, String filterValue, int topK);

    /**
     * Insert or replace records by id.
     *
     * @return number of records written
     */
    Mono<Integer> upsert(List<IndexedRecord> records);

    String getName();
}
