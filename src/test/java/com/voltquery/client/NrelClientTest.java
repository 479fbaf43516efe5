package com.voltquery.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.voltquery.config.JacksonConfiguration;
import com.voltquery.config.VoltQueryProperties;
import com.voltquery.exception.CircuitOpenException;
import com.voltquery.exception.ConfigurationException;
import com.voltquery.exception.TransientApiException;
import com.voltquery.service.canonicalization.CacheKeyGenerator;
import com.voltquery.service.resilience.ServiceRegistry;
import com.voltquery.support.MutableClock;
import com.voltquery.support.ScriptedExchange;
import com.voltquery.support.TestServices;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class NrelClientTest {

    private final ObjectMapper objectMapper = JacksonConfiguration.createObjectMapper();

    private VoltQueryProperties properties;
    private ScriptedExchange exchange;
    private ServiceRegistry serviceRegistry;

    @BeforeEach
    void setUp() {
        properties = TestServices.properties();
        properties.getNrel().setBaseUrl("https://developer.nrel.gov/api");
        properties.getNrel().setApiKey("nrel-key");
        exchange = new ScriptedExchange();
        serviceRegistry = TestServices.serviceRegistry(properties, new MutableClock(Instant.parse("2026-01-01T00:00:00Z")));
    }

    private NrelClient client() {
        return new NrelClient(exchange.webClient(), properties, serviceRegistry, new CacheKeyGenerator(objectMapper));
    }

    @Test
    void testStationsNearbyIsCached() {
        exchange.respond("{\"total_results\": 1, \"fuel_stations\": [{\"id\": 1517, \"station_name\": \"Union Station\"}]}");
        NrelClient client = client();

        StepVerifier.create(client.stationsNearby(39.75, -104.99, 20))
                .assertNext(stations -> assertEquals("Union Station", stations.get(0).get("station_name").asText()))
                .verifyComplete();
        StepVerifier.create(client.stationsNearby(39.75, -104.99, 20))
                .expectNextCount(1)
                .verifyComplete();

        assertEquals(1, exchange.getRequests().size());
        String url = exchange.getRequests().get(0).url().toString();
        assertTrue(url.startsWith("https://developer.nrel.gov/api/alt-fuel-stations/v1/nearest.json?api_key=nrel-key"));
        assertTrue(url.contains("fuel_type=ELEC"));
        assertTrue(url.contains("limit=20"));
    }

    @Test
    void testUtilityRatesUnwrapsOutputs() {
        exchange.respond("{\"inputs\": {}, \"outputs\": {\"utility_name\": \"Xcel\", \"residential\": 0.142}}");

        StepVerifier.create(client().utilityRates(39.75, -104.99, null))
                .assertNext(outputs -> assertEquals("Xcel", outputs.get("utility_name").asText()))
                .verifyComplete();
        assertFalse(exchange.getRequests().get(0).url().toString().contains("sector="));
    }

    @Test
    void testServerErrorIsTransient() {
        exchange.respond(HttpStatus.SERVICE_UNAVAILABLE, "{}");

        StepVerifier.create(client().solarEstimate(39.75, -104.99, 5.0))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(TransientApiException.class, error);
                    assertEquals(503, ((TransientApiException) error).getStatusCode());
                })
                .verify();
    }

    @Test
    void testClientErrorPassesThrough() {
        exchange.respond(HttpStatus.FORBIDDEN, "{\"error\": {\"code\": \"API_KEY_INVALID\"}}");

        StepVerifier.create(client().stationsByState("CO", 50))
                .expectError(WebClientResponseException.Forbidden.class)
                .verify();
    }

    @Test
    void testBreakerOpensAfterRepeatedFailures() {
        VoltQueryProperties.BreakerConfig breaker = new VoltQueryProperties.BreakerConfig();
        breaker.setFailureThreshold(2);
        properties.getBreakers().put(NrelClient.PVWATTS_BREAKER, breaker);
        serviceRegistry = TestServices.serviceRegistry(properties, new MutableClock(Instant.parse("2026-01-01T00:00:00Z")));
        exchange.respond(HttpStatus.BAD_GATEWAY, "{}");
        NrelClient client = client();

        StepVerifier.create(client.solarEstimate(1.0, 1.0, 5.0)).expectError(TransientApiException.class).verify();
        StepVerifier.create(client.solarEstimate(2.0, 2.0, 5.0)).expectError(TransientApiException.class).verify();
        StepVerifier.create(client.solarEstimate(3.0, 3.0, 5.0)).expectError(CircuitOpenException.class).verify();

        assertEquals(2, exchange.getRequests().size());
    }

    @Test
    void testApiKeyRequired() {
        properties.getNrel().setApiKey("your_nrel_api_key_here");

        assertThrows(ConfigurationException.class, this::client);
    }
}
