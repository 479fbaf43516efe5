package com.voltquery.service.scenario;

import com.voltquery.client.GeocodingClient;
import com.voltquery.client.ReoptClient;
import com.voltquery.client.ReoptJobRequest;
import com.voltquery.client.UrdbClient;
import com.voltquery.config.VoltQueryProperties;
import com.voltquery.exception.InvalidQuestionException;
import com.voltquery.model.DetectedLocation;
import com.voltquery.model.FinancingComparison;
import com.voltquery.model.OptimizationOutcome;
import com.voltquery.model.dto.FinancingRequest;
import com.voltquery.service.location.LocationExtractor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Runs REopt financing scenarios for a site as concurrent branches.
 * <p>
 * Residential sites compare an owner purchase (no federal ITC) with a third-party lease
 * (30% ITC claimed by the lessor). Commercial and industrial sites run one scenario with
 * the 30% ITC, which requires construction to start before the safe-harbor date.
 */
@Slf4j
@Service
public class FinancingScenarioService {

    static final String ITC_PARAM = "federal_itc_fraction";
    static final String THIRD_PARTY_PARAM = "third_party_ownership";
    static final String ANALYSIS_YEARS_PARAM = "analysis_years";

    private static final Set<String> COMMERCIAL_TYPES = Set.of("commercial", "industrial");

    private final ScenarioBranchExecutor branchExecutor;
    private final ReoptClient reoptClient;
    private final UrdbClient urdbClient;
    private final GeocodingClient geocodingClient;
    private final LocationExtractor locationExtractor;
    private final VoltQueryProperties.FinancingConfig financing;
    private final Clock clock;

    public FinancingScenarioService(ScenarioBranchExecutor branchExecutor,
                                    ReoptClient reoptClient,
                                    UrdbClient urdbClient,
                                    GeocodingClient geocodingClient,
                                    LocationExtractor locationExtractor,
                                    VoltQueryProperties properties,
                                    Clock clock) {
        this.branchExecutor = branchExecutor;
        this.reoptClient = reoptClient;
        this.urdbClient = urdbClient;
        this.geocodingClient = geocodingClient;
        this.locationExtractor = locationExtractor;
        this.financing = properties.getFinancing();
        this.clock = clock;
    }

    /**
     * Compare financing scenarios for a free-text location.
     */
    public Mono<FinancingComparison> compare(FinancingRequest request) {
        if (request.getLocation() == null || request.getLocation().isBlank()) {
            return Mono.error(new InvalidQuestionException("location is required"));
        }
        String location = request.getLocation().trim();
        Mono<DetectedLocation> resolved = locationExtractor.extract(location)
                .map(geocodingClient::resolve)
                .orElseGet(() -> geocodingClient.geocodeText(location)
                        .map(latLon -> DetectedLocation.builder()
                                .city(location)
                                .locationType(DetectedLocation.LocationType.CITY_STATE)
                                .latitude(latLon[0])
                                .longitude(latLon[1])
                                .build()));

        return resolved.flatMap(site -> compare(site, request.getPropertyType(), request.isLeaseOnly())
                .map(comparison -> {
                    comparison.setLocation(location);
                    return comparison;
                }));
    }

    /**
     * Compare financing scenarios for a location that already has coordinates.
     */
    public Mono<FinancingComparison> compare(DetectedLocation site, String propertyType, boolean leaseOnly) {
        return Mono.defer(() -> compareResolved(site, propertyType, leaseOnly));
    }

    private Mono<FinancingComparison> compareResolved(DetectedLocation site, String propertyType, boolean leaseOnly) {
        String normalizedType = normalizePropertyType(propertyType);
        boolean commercial = COMMERCIAL_TYPES.contains(normalizedType);
        List<ScenarioVariant> variants = variantsFor(normalizedType, leaseOnly);
        String sector = commercial ? "commercial" : "residential";

        return urdbClient.tariffLabel(site.getLatitude(), site.getLongitude(), sector)
                .flatMap(urdbLabel -> {
                    SiteContext context = new SiteContext(site.getLatitude(), site.getLongitude(),
                            normalizedType, urdbLabel);
                    return branchExecutor.runBranches(context, variants, this::runVariant,
                                    financing.getBranchTimeout())
                            .map(report -> FinancingComparison.builder()
                                    .scenarioType(commercial ? "commercial" : "residential")
                                    .location(site.describe())
                                    .latitude(site.getLatitude())
                                    .longitude(site.getLongitude())
                                    .urdbLabel(urdbLabel)
                                    .report(report)
                                    .npvDifference(npvDifference(report))
                                    .policyNotice(commercial ? policyNotice() : null)
                                    .build());
                });
    }

    List<ScenarioVariant> variantsFor(String propertyType, boolean leaseOnly) {
        if (COMMERCIAL_TYPES.contains(propertyType)) {
            return List.of(ScenarioVariant.of(FinancingComparison.COMMERCIAL, Map.of(
                    ITC_PARAM, financing.getCommercialItc(),
                    ANALYSIS_YEARS_PARAM, financing.getAnalysisYears(),
                    THIRD_PARTY_PARAM, false)));
        }
        ScenarioVariant lease = ScenarioVariant.of(FinancingComparison.LEASE, Map.of(
                ITC_PARAM, financing.getResidentialLeaseItc(),
                ANALYSIS_YEARS_PARAM, financing.getAnalysisYears(),
                THIRD_PARTY_PARAM, true));
        if (leaseOnly) {
            return List.of(lease);
        }
        ScenarioVariant purchase = ScenarioVariant.of(FinancingComparison.PURCHASE, Map.of(
                ITC_PARAM, financing.getResidentialPurchaseItc(),
                ANALYSIS_YEARS_PARAM, financing.getAnalysisYears(),
                THIRD_PARTY_PARAM, false));
        return List.of(purchase, lease);
    }

    private Mono<OptimizationOutcome> runVariant(SiteContext site, ScenarioVariant variant) {
        ReoptJobRequest job = ReoptJobRequest.builder()
                .latitude(site.getLatitude())
                .longitude(site.getLongitude())
                .propertyType(site.getPropertyType())
                .urdbLabel(site.getUrdbLabel())
                .federalItcFraction(variant.doubleParam(ITC_PARAM, 0.0))
                .thirdPartyOwnership(variant.booleanParam(THIRD_PARTY_PARAM))
                .analysisYears(variant.intParam(ANALYSIS_YEARS_PARAM, financing.getAnalysisYears()))
                .build();
        return reoptClient.optimize(job);
    }

    static Double npvDifference(ScenarioBranchReport<OptimizationOutcome> report) {
        Double leaseNpv = report.outcome(FinancingComparison.LEASE).map(OptimizationOutcome::getNpv).orElse(null);
        Double purchaseNpv = report.outcome(FinancingComparison.PURCHASE).map(OptimizationOutcome::getNpv).orElse(null);
        if (leaseNpv == null || purchaseNpv == null) {
            return null;
        }
        return leaseNpv - purchaseNpv;
    }

    /**
     * Construction-start reminder, shown only while the safe-harbor date is still ahead.
     */
    String policyNotice() {
        LocalDate today = LocalDate.now(clock);
        LocalDate safeHarbor = financing.getSafeHarborDate();
        if (!today.isBefore(safeHarbor)) {
            return null;
        }
        return "NOTE: You must commence construction by "
                + safeHarbor.format(DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.US))
                + ", to lock in this " + Math.round(financing.getCommercialItc() * 100) + "% credit.";
    }

    static String normalizePropertyType(String propertyType) {
        if (propertyType == null || propertyType.isBlank()) {
            return "residential";
        }
        String normalized = propertyType.trim().toLowerCase(Locale.ROOT);
        if (!normalized.equals("residential") && !COMMERCIAL_TYPES.contains(normalized)) {
            throw new InvalidQuestionException("Unsupported property type: " + propertyType);
        }
        return normalized;
    }

    @Value
    static class SiteContext {
        double latitude;
        double longitude;
        String propertyType;
        String urdbLabel;
    }
}
