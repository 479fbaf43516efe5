package com.voltquery.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.voltquery.service.scenario.ScenarioBranchReport;
import lombok.Builder;
import lombok.Data;

/**
 * Purchase vs lease (or commercial) financing comparison for one site.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FinancingComparison {

    public static final String PURCHASE = "purchase";
    public static final String LEASE = "lease";
    public static final String COMMERCIAL = "commercial";

    /**
     * "residential" or "commercial".
     */
    @JsonProperty("scenario_type")
    private String scenarioType;

    private String location;
    private Double latitude;
    private Double longitude;

    @JsonProperty("urdb_label")
    private String urdbLabel;

    private ScenarioBranchReport<OptimizationOutcome> report;

    /**
     * Lease NPV minus purchase NPV, when both branches produced an NPV.
     */
    @JsonProperty("npv_difference")
    private Double npvDifference;

    @JsonProperty("policy_notice")
    private String policyNotice;
}
