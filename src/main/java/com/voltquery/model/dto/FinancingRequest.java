package com.voltquery.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /v1/query/financing}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinancingRequest {

    /**
     * Zip code, "City, ST", state or free-text place.
     */
    private String location;

    @JsonProperty("property_type")
    @Builder.Default
    private String propertyType = "residential";

    @JsonProperty("lease_only")
    private boolean leaseOnly;
}
