package com.voltquery.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response cache statistics for the admin API.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    private long totalEntries;

    private long hits;

    private long misses;

    /**
     * Hit rate (0.0-1.0).
     */
    private double hitRate;

    /**
     * First keys in the cache, for inspection.
     */
    private List<String> keys;
}
