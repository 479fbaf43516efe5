package com.voltquery.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.voltquery.config.JacksonConfiguration;
import com.voltquery.config.VoltQueryProperties;
import com.voltquery.exception.ConfigurationException;
import com.voltquery.exception.VoltQueryException;
import com.voltquery.model.OptimizationOutcome;
import com.voltquery.service.canonicalization.CacheKeyGenerator;
import com.voltquery.support.MutableClock;
import com.voltquery.support.ScriptedExchange;
import com.voltquery.support.TestServices;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ReoptClientTest {

    private static final ReoptJobRequest LEASE = ReoptJobRequest.builder()
            .latitude(39.75)
            .longitude(-104.99)
            .propertyType("residential")
            .urdbLabel("5cd3f9fe5457a3f1d4b2a9e0")
            .federalItcFraction(0.30)
            .thirdPartyOwnership(true)
            .build();

    private static final String RESULTS = """
            {"status": "optimal",
             "outputs": {
               "Financial": {"npv": 11500.25},
               "PV": {"size_kw": 8.1},
               "ElectricStorage": {"size_kw": 2.5, "size_kwh": 10.0}}}""";

    private final ObjectMapper objectMapper = JacksonConfiguration.createObjectMapper();

    private VoltQueryProperties properties;
    private ScriptedExchange exchange;

    @BeforeEach
    void setUp() {
        properties = TestServices.properties();
        properties.getReopt().setBaseUrl("https://developer.nrel.gov/api/reopt/v3");
        properties.getReopt().setApiKey("test-key");
        exchange = new ScriptedExchange();
    }

    private ReoptClient client() {
        return new ReoptClient(exchange.webClient(), properties, objectMapper,
                TestServices.serviceRegistry(properties, new MutableClock(Instant.parse("2026-01-01T00:00:00Z"))),
                new CacheKeyGenerator(objectMapper));
    }

    @Test
    void testOptimizeSubmitsAndPollsUntilOptimal() {
        exchange.respond("{\"run_uuid\": \"run-42\"}")
                .respond("{\"status\": \"Optimizing...\"}")
                .respond(RESULTS);
        ReoptClient client = client();

        StepVerifier.withVirtualTime(() -> client.optimize(LEASE))
                .thenAwait(Duration.ofSeconds(3))
                .assertNext(outcome -> {
                    assertEquals("run-42", outcome.getRunUuid());
                    assertEquals(11500.25, outcome.getNpv());
                    assertEquals(8.1, outcome.getPvKw());
                    assertEquals(8.1, outcome.getRecommendedSizeKw());
                    assertEquals(10.0, outcome.getStorageKwh());
                    assertEquals(0.30, outcome.getFederalItcFraction());
                    assertEquals(25, outcome.getAnalysisYears());
                })
                .verifyComplete();

        assertEquals(3, exchange.getRequests().size());
        assertEquals(HttpMethod.POST, exchange.getRequests().get(0).method());
        String submitUrl = exchange.getRequests().get(0).url().toString();
        assertTrue(submitUrl.startsWith("https://developer.nrel.gov/api/reopt/v3/job/?"));
        assertTrue(submitUrl.contains("api_key=test-key"));
        assertEquals("https://developer.nrel.gov/api/reopt/v3/job/run-42/results?api_key=test-key",
                exchange.getRequests().get(2).url().toString());
    }

    @Test
    void testFailedJobStatus() {
        exchange.respond("{\"run_uuid\": \"run-7\"}")
                .respond("{\"status\": \"error\", \"messages\": {\"errors\": \"bad tariff\"}}");

        StepVerifier.create(client().optimize(LEASE))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(VoltQueryException.class, error);
                    assertEquals("REopt job run-7 failed with status 'error'", error.getMessage());
                })
                .verify();
    }

    @Test
    void testGivesUpAfterMaxPollAttempts() {
        properties.getFinancing().setMaxPollAttempts(2);
        exchange.respond("{\"run_uuid\": \"run-8\"}")
                .respond("{\"status\": \"Optimizing...\"}");
        ReoptClient client = client();

        StepVerifier.withVirtualTime(() -> client.optimize(LEASE))
                .thenAwait(Duration.ofSeconds(3))
                .expectErrorMessage("REopt job run-8 did not finish after 2 polls (status 'optimizing...')")
                .verify();
        assertEquals(3, exchange.getRequests().size());
    }

    @Test
    void testMissingRunUuid() {
        exchange.respond("{\"messages\": {\"error\": \"invalid inputs\"}}");

        StepVerifier.create(client().submit(LEASE))
                .expectError(VoltQueryException.class)
                .verify();
    }

    @Test
    void testMissingApiKeyFailsLazily() {
        properties.getReopt().setApiKey(" ");

        StepVerifier.create(client().submit(LEASE))
                .expectError(ConfigurationException.class)
                .verify();
        assertTrue(exchange.getRequests().isEmpty());
    }

    @Test
    void testPollIntervalDoublesEveryThirdAttempt() {
        ReoptClient client = client();

        assertEquals(Duration.ofSeconds(3), client.pollInterval(0));
        assertEquals(Duration.ofSeconds(3), client.pollInterval(2));
        assertEquals(Duration.ofSeconds(6), client.pollInterval(3));
        assertEquals(Duration.ofSeconds(12), client.pollInterval(6));
        assertEquals(Duration.ofSeconds(24), client.pollInterval(9));
        assertEquals(Duration.ofSeconds(30), client.pollInterval(12));
        assertEquals(Duration.ofSeconds(30), client.pollInterval(100));
    }

    @Test
    void testBuildPayload() {
        ObjectNode payload = client().buildPayload(LEASE.toBuilder().propertyType("Commercial").build());

        assertEquals(39.75, payload.path("Site").path("latitude").asDouble());
        assertEquals(0.30, payload.path("Financial").path("federal_itc_fraction").asDouble());
        assertTrue(payload.path("Financial").path("third_party_ownership").asBoolean());
        assertEquals(25, payload.path("Financial").path("analysis_years").asInt());
        assertEquals("RetailStore", payload.path("ElectricLoad").path("doe_reference_name").asText());
        assertEquals("5cd3f9fe5457a3f1d4b2a9e0", payload.path("ElectricTariff").path("urdb_label").asText());
        assertEquals(1000.0, payload.path("PV").path("max_kw").asDouble());
        assertTrue(payload.has("ElectricStorage"));
    }

    @Test
    void testBuildPayloadUsesRequestAnalysisYears() {
        ObjectNode payload = client().buildPayload(LEASE.toBuilder().analysisYears(20).build());

        assertEquals(20, payload.path("Financial").path("analysis_years").asInt());
    }

    @Test
    void testBuildPayloadRequiresTariff() {
        assertThrows(VoltQueryException.class,
                () -> client().buildPayload(LEASE.toBuilder().urdbLabel("").build()));
    }

    @Test
    void testExtractOutcomeFallsBackToLegacyLayout() throws Exception {
        JsonNode results = objectMapper.readTree("""
                {"status": "optimal",
                 "outputs": {
                   "Financial": {"offtaker_npv": "-250.5"},
                   "Scenario": {"Site": {"PV": {"size_kW": 6.0}, "Storage": {"size_kW": 0, "size_kWh": 0}}}}}""");

        OptimizationOutcome outcome = ReoptClient.extractOutcome("legacy", results, 0.0, 20);

        assertEquals(-250.5, outcome.getNpv());
        assertEquals(6.0, outcome.getPvKw());
        assertEquals(0.0, outcome.getStorageKw());
        assertEquals(20, outcome.getAnalysisYears());
    }

    @Test
    void testExtractOutcomeWithoutNpv() throws Exception {
        OptimizationOutcome outcome = ReoptClient.extractOutcome("empty",
                objectMapper.readTree("{\"status\": \"optimal\", \"outputs\": {}}"), 0.30, 25);

        assertNull(outcome.getNpv());
        assertNull(outcome.getPvKw());
    }
}
