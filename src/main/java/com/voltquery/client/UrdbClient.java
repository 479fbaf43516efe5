package com.voltquery.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.voltquery.config.VoltQueryProperties;
import com.voltquery.exception.VoltQueryException;
import com.voltquery.service.canonicalization.CacheKeyGenerator;
import com.voltquery.service.resilience.ServiceRegistry;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * OpenEI Utility Rate Database lookups. REopt needs a tariff label for every job.
 */
@Component
public class UrdbClient extends AbstractApiClient {

    static final String BREAKER = "urdb";

    private final VoltQueryProperties.CacheConfig cacheConfig;

    public UrdbClient(WebClient webClient, VoltQueryProperties properties,
                      ServiceRegistry serviceRegistry, CacheKeyGenerator keyGenerator) {
        super(webClient, properties.getUrdb(), serviceRegistry, keyGenerator);
        this.cacheConfig = properties.getCache();
    }

    @Override
    public String getName() {
        return "urdb";
    }

    /**
     * Label of the first approved tariff at a point for a sector ("residential", "commercial", ...).
     */
    public Mono<String> tariffLabel(double latitude, double longitude, String sector) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("api_key", config.getApiKey());
        params.put("version", "7");
        params.put("format", "json");
        params.put("lat", latitude);
        params.put("lon", longitude);
        params.put("sector", capitalize(sector));
        params.put("approved", "true");
        params.put("detail", "minimal");
        params.put("limit", 1);

        return cachedCall("urdb_label", cacheConfig.ttlFor("utility_rates"), BREAKER,
                List.of(latitude, longitude), Map.of("sector", sector),
                () -> webClient.get()
                        .uri(uri("", params))
                        .retrieve()
                        .bodyToMono(JsonNode.class)
                        .flatMap(body -> {
                            JsonNode label = body.path("items").path(0).path("label");
                            if (!label.isTextual() || label.asText().isBlank()) {
                                return Mono.error(new VoltQueryException(
                                        "No utility tariff found at " + latitude + "," + longitude));
                            }
                            return Mono.just(label.asText());
                        }));
    }

    private static String capitalize(String sector) {
        if (sector == null || sector.isEmpty()) {
            return "Residential";
        }
        return Character.toUpperCase(sector.charAt(0)) + sector.substring(1).toLowerCase(Locale.ROOT);
    }
}
