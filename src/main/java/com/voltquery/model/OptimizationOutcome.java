package com.voltquery.model;

import lombok.Builder;
import lombok.Data;

/**
 * Sizing and financial result of one REopt optimization run.
 */
@Data
@Builder
public class OptimizationOutcome {

    private String runUuid;

    /**
     * Net present value in dollars; {@code null} when REopt reported none.
     */
    private Double npv;

    private Double pvKw;
    private Double storageKw;
    private Double storageKwh;
    private Double recommendedSizeKw;
    private double federalItcFraction;
    private int analysisYears;
}
