package com.voltquery.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of fetching one location's records from upstream and writing them to the indexed store.
 */
@Value
@Builder
public class IndexingReport {

    String domain;

    @JsonProperty("filter_key")
    String filterKey;

    @JsonProperty("filter_value")
    String filterValue;

    int fetched;
    int indexed;

    @JsonProperty("indexed_at")
    String indexedAt;
}
