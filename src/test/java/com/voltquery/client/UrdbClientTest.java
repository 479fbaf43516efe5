package com.voltquery.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.voltquery.config.JacksonConfiguration;
import com.voltquery.config.VoltQueryProperties;
import com.voltquery.exception.VoltQueryException;
import com.voltquery.service.canonicalization.CacheKeyGenerator;
import com.voltquery.support.MutableClock;
import com.voltquery.support.ScriptedExchange;
import com.voltquery.support.TestServices;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class UrdbClientTest {

    private final ObjectMapper objectMapper = JacksonConfiguration.createObjectMapper();

    private ScriptedExchange exchange;
    private UrdbClient client;

    @BeforeEach
    void setUp() {
        VoltQueryProperties properties = TestServices.properties();
        properties.getUrdb().setBaseUrl("https://api.openei.org/utility_rates");
        properties.getUrdb().setApiKey("urdb-key");
        exchange = new ScriptedExchange();
        client = new UrdbClient(exchange.webClient(), properties,
                TestServices.serviceRegistry(properties, new MutableClock(Instant.parse("2026-01-01T00:00:00Z"))),
                new CacheKeyGenerator(objectMapper));
    }

    @Test
    void testTariffLabel() {
        exchange.respond("{\"items\": [{\"label\": \"5cd3f9fe5457a3f1d4b2a9e0\", \"name\": \"Residential General\"}]}");

        StepVerifier.create(client.tariffLabel(39.75, -104.99, "commercial"))
                .expectNext("5cd3f9fe5457a3f1d4b2a9e0")
                .verifyComplete();

        String url = exchange.getRequests().get(0).url().toString();
        assertTrue(url.startsWith("https://api.openei.org/utility_rates?api_key=urdb-key&version=7"));
        assertTrue(url.contains("sector=Commercial"));
        assertTrue(url.contains("approved=true"));
    }

    @Test
    void testNoTariff() {
        exchange.respond("{\"items\": []}");

        StepVerifier.create(client.tariffLabel(0.0, 0.0, "residential"))
                .expectError(VoltQueryException.class)
                .verify();
    }
}
