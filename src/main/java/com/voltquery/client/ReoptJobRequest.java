package com.voltquery.client;

import lombok.Builder;
import lombok.Value;

/**
 * Inputs of a single REopt job.
 */
@Value
@Builder(toBuilder = true)
public class ReoptJobRequest {
    double latitude;
    double longitude;

    /**
     * "residential", "commercial" or "industrial".
     */
    String propertyType;

    String urdbLabel;
    double federalItcFraction;
    boolean thirdPartyOwnership;

    /**
     * Financial analysis period; the configured default when null.
     */
    Integer analysisYears;
}
