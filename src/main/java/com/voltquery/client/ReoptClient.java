package com.voltquery.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.voltquery.config.VoltQueryProperties;
import com.voltquery.exception.VoltQueryException;
import com.voltquery.model.OptimizationOutcome;
import com.voltquery.service.canonicalization.CacheKeyGenerator;
import com.voltquery.service.resilience.ServiceRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Client for the REopt v3 job API.
 * A job is submitted once and then polled until it completes; both calls go through the
 * {@code reopt} circuit breaker.
 */
@Slf4j
@Component
public class ReoptClient extends AbstractApiClient {

    static final String BREAKER = "reopt";

    private static final Set<String> COMPLETE_STATUSES = Set.of("complete", "optimal");
    private static final Set<String> FAILED_STATUSES = Set.of("failed", "error");

    private static final Map<String, String> DOE_REFERENCE_NAMES = Map.of(
            "residential", "MidriseApartment",
            "commercial", "RetailStore",
            "industrial", "Warehouse");
    private static final Map<String, Double> PEAK_LOAD_KW = Map.of(
            "residential", 5.0,
            "commercial", 50.0,
            "industrial", 200.0);
    private static final Map<String, Double> ANNUAL_KWH = Map.of(
            "residential", 12000.0,
            "commercial", 60000.0,
            "industrial", 500000.0);

    private final ObjectMapper objectMapper;
    private final VoltQueryProperties.FinancingConfig financing;

    public ReoptClient(WebClient webClient, VoltQueryProperties properties, ObjectMapper objectMapper,
                       ServiceRegistry serviceRegistry, CacheKeyGenerator keyGenerator) {
        super(webClient, properties.getReopt(), serviceRegistry, keyGenerator);
        this.objectMapper = objectMapper;
        this.financing = properties.getFinancing();
    }

    @Override
    public String getName() {
        return "reopt";
    }

    /**
     * Submit a job, wait for it to finish and extract its outcome.
     */
    public Mono<OptimizationOutcome> optimize(ReoptJobRequest request) {
        return submit(request)
                .flatMap(runUuid -> pollResults(runUuid, 0)
                        .map(results -> extractOutcome(runUuid, results,
                                request.getFederalItcFraction(), analysisYears(request))));
    }

    private int analysisYears(ReoptJobRequest request) {
        return request.getAnalysisYears() != null ? request.getAnalysisYears() : financing.getAnalysisYears();
    }

    /**
     * Submit a job and return its run UUID.
     */
    public Mono<String> submit(ReoptJobRequest request) {
        return Mono.defer(() -> {
            String apiKey = requireApiKey();
            ObjectNode payload = buildPayload(request);
            return post(request, apiKey, payload);
        });
    }

    private Mono<String> post(ReoptJobRequest request, String apiKey, ObjectNode payload) {
        return guardedCall(BREAKER, () -> webClient.post()
                .uri(uri("/job/", Map.of("api_key", apiKey, "format", "json")))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .flatMap(body -> {
                    JsonNode runUuid = body.path("run_uuid");
                    if (!runUuid.isTextual()) {
                        return Mono.error(new VoltQueryException("REopt response did not contain a run_uuid"));
                    }
                    log.info("reopt operation=submit run_uuid={} property_type={} itc={}",
                            runUuid.asText(), request.getPropertyType(), request.getFederalItcFraction());
                    return Mono.just(runUuid.asText());
                }));
    }

    ObjectNode buildPayload(ReoptJobRequest request) {
        String propertyType = request.getPropertyType() == null
                ? "residential" : request.getPropertyType().toLowerCase(Locale.ROOT);
        if (request.getUrdbLabel() == null || request.getUrdbLabel().isBlank()) {
            throw new VoltQueryException("A URDB tariff label is required for REopt optimization");
        }

        ObjectNode payload = objectMapper.createObjectNode();
        payload.putObject("Scenario").put("timeout_seconds", 400);

        ObjectNode site = payload.putObject("Site");
        site.put("latitude", request.getLatitude());
        site.put("longitude", request.getLongitude());

        ObjectNode financial = payload.putObject("Financial");
        financial.put("analysis_years", analysisYears(request));
        financial.put("offtaker_discount_rate_fraction", financing.getDiscountRate());
        financial.put("owner_discount_rate_fraction", financing.getDiscountRate());
        financial.put("offtaker_tax_rate_fraction", financing.getTaxRate());
        financial.put("owner_tax_rate_fraction", financing.getTaxRate());
        financial.put("elec_cost_escalation_rate_fraction", financing.getElectricityEscalationRate());
        financial.put("om_cost_escalation_rate_fraction", financing.getOmCostEscalationRate());
        financial.put("third_party_ownership", request.isThirdPartyOwnership());
        financial.put("federal_itc_fraction", request.getFederalItcFraction());

        ObjectNode load = payload.putObject("ElectricLoad");
        load.put("load_profile_type", propertyType);
        load.put("doe_reference_name", DOE_REFERENCE_NAMES.getOrDefault(propertyType, "MidriseApartment"));
        load.put("load_profile_kw", PEAK_LOAD_KW.getOrDefault(propertyType, 5.0));
        load.put("annual_kwh", ANNUAL_KWH.getOrDefault(propertyType, 12000.0));

        payload.putObject("ElectricTariff").put("urdb_label", request.getUrdbLabel());
        payload.putObject("PV").put("max_kw", financing.getPvMaxKw()).put("existing_kw", 0.0);
        payload.putObject("ElectricStorage");
        return payload;
    }

    private Mono<JsonNode> pollResults(String runUuid, int attempt) {
        String apiKey = requireApiKey();
        return guardedCall(BREAKER, () -> webClient.get()
                .uri(uri("/job/" + runUuid + "/results", Map.of("api_key", apiKey)))
                .retrieve()
                .bodyToMono(JsonNode.class))
                .flatMap(results -> {
                    String status = jobStatus(results);
                    if (COMPLETE_STATUSES.contains(status)) {
                        log.info("reopt operation=poll run_uuid={} status={} attempts={}", runUuid, status, attempt + 1);
                        return Mono.just(results);
                    }
                    if (FAILED_STATUSES.contains(status)) {
                        return Mono.error(new VoltQueryException(
                                "REopt job " + runUuid + " failed with status '" + status + "'"));
                    }
                    if (attempt + 1 >= financing.getMaxPollAttempts()) {
                        return Mono.error(new VoltQueryException("REopt job " + runUuid + " did not finish after "
                                + financing.getMaxPollAttempts() + " polls (status '" + status + "')"));
                    }
                    Duration wait = pollInterval(attempt);
                    log.debug("reopt operation=poll run_uuid={} status={} wait={}", runUuid, status, wait);
                    return Mono.delay(wait).then(pollResults(runUuid, attempt + 1));
                });
    }

    /**
     * Poll wait: starts at the initial interval and doubles every third attempt, capped.
     */
    Duration pollInterval(int attempt) {
        long factor = 1L << Math.min(attempt / 3, 4);
        Duration wait = financing.getPollInitialInterval().multipliedBy(factor);
        return wait.compareTo(financing.getPollMaxInterval()) > 0 ? financing.getPollMaxInterval() : wait;
    }

    private static String jobStatus(JsonNode results) {
        JsonNode status = results.path("status");
        if (status.isMissingNode() || status.isNull()) {
            status = results.path("job_status");
        }
        return status.asText("").trim().toLowerCase(Locale.ROOT);
    }

    static OptimizationOutcome extractOutcome(String runUuid, JsonNode results,
                                              double itcFraction, int analysisYears) {
        JsonNode outputs = results.path("outputs");
        JsonNode financial = outputs.path("Financial");

        Double npv = firstNumber(financial, "npv", "offtaker_npv", "owner_npv");
        // v3 moved technology outputs to the top level; older results nest them under Scenario.Site
        JsonNode pv = firstObject(outputs.path("PV"), outputs.path("Scenario").path("Site").path("PV"));
        JsonNode storage = firstObject(outputs.path("ElectricStorage"),
                outputs.path("Scenario").path("Site").path("Storage"));

        Double pvKw = firstNumber(pv, "size_kw", "size_kW");
        return OptimizationOutcome.builder()
                .runUuid(runUuid)
                .npv(npv)
                .pvKw(pvKw)
                .recommendedSizeKw(pvKw)
                .storageKw(firstNumber(storage, "size_kw", "size_kW"))
                .storageKwh(firstNumber(storage, "size_kwh", "size_kWh"))
                .federalItcFraction(itcFraction)
                .analysisYears(analysisYears)
                .build();
    }

    private static JsonNode firstObject(JsonNode preferred, JsonNode fallback) {
        return preferred.isObject() ? preferred : fallback;
    }

    private static Double firstNumber(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.path(field);
            if (value.isNumber()) {
                return value.asDouble();
            }
            if (value.isTextual()) {
                try {
                    return Double.parseDouble(value.asText());
                } catch (NumberFormatException e) {
                    log.warn("reopt non-numeric {}={}", field, value.asText());
                }
            }
        }
        return null;
    }
}
