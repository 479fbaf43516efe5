package com.voltquery.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.voltquery.config.VoltQueryProperties;
import com.voltquery.service.canonicalization.CacheKeyGenerator;
import com.voltquery.service.resilience.ServiceRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Client for NREL developer APIs: alternative fuel stations, utility rates and PVWatts.
 * Each API has its own circuit breaker.
 */
@Slf4j
@Component
public class NrelClient extends AbstractApiClient {

    static final String STATIONS_BREAKER = "nrel_stations";
    static final String UTILITY_BREAKER = "nrel_utility";
    static final String PVWATTS_BREAKER = "nrel_pvwatts";

    private static final String FUEL_ELECTRIC = "ELEC";

    private final VoltQueryProperties.CacheConfig cacheConfig;

    public NrelClient(WebClient webClient, VoltQueryProperties properties,
                      ServiceRegistry serviceRegistry, CacheKeyGenerator keyGenerator) {
        super(webClient, properties.getNrel(), serviceRegistry, keyGenerator);
        this.cacheConfig = properties.getCache();
        requireApiKey();
    }

    @Override
    public String getName() {
        return "nrel";
    }

    /**
     * Electric charging stations nearest to a point.
     *
     * @return the {@code fuel_stations} array
     */
    public Mono<JsonNode> stationsNearby(double latitude, double longitude, int limit) {
        Map<String, Object> params = baseParams();
        params.put("latitude", latitude);
        params.put("longitude", longitude);
        params.put("fuel_type", FUEL_ELECTRIC);
        params.put("limit", limit);

        return cachedCall("stations_nearby", cacheConfig.ttlFor("stations"), STATIONS_BREAKER,
                List.of(latitude, longitude), Map.of("limit", limit),
                () -> get("/alt-fuel-stations/v1/nearest.json", params).map(body -> body.path("fuel_stations")));
    }

    /**
     * Electric charging stations in a state.
     *
     * @return the {@code fuel_stations} array
     */
    public Mono<JsonNode> stationsByState(String state, int limit) {
        Map<String, Object> params = baseParams();
        params.put("state", state);
        params.put("fuel_type", FUEL_ELECTRIC);
        params.put("limit", limit);

        return cachedCall("stations_state", cacheConfig.ttlFor("stations"), STATIONS_BREAKER,
                List.of(state), Map.of("limit", limit),
                () -> get("/alt-fuel-stations/v1.json", params).map(body -> body.path("fuel_stations")));
    }

    /**
     * Average utility rates and utility name at a point.
     *
     * @return the {@code outputs} object
     */
    public Mono<JsonNode> utilityRates(double latitude, double longitude, String sector) {
        Map<String, Object> params = baseParams();
        params.put("lat", latitude);
        params.put("lon", longitude);
        if (sector != null) {
            params.put("sector", sector.toLowerCase(Locale.ROOT));
        }

        return cachedCall("utility_rates", cacheConfig.ttlFor("utility_rates"), UTILITY_BREAKER,
                List.of(latitude, longitude), sector == null ? Map.of() : Map.of("sector", sector),
                () -> get("/utility_rates/v3.json", params).map(NrelClient::outputs));
    }

    /**
     * PVWatts annual production estimate for a fixed roof-mount system.
     *
     * @return the {@code outputs} object ({@code ac_annual}, {@code ac_monthly}, {@code solrad_annual}, ...)
     */
    public Mono<JsonNode> solarEstimate(double latitude, double longitude, double systemCapacityKw) {
        Map<String, Object> params = baseParams();
        params.put("lat", latitude);
        params.put("lon", longitude);
        params.put("system_capacity", systemCapacityKw);
        params.put("azimuth", 180);
        params.put("tilt", 20);
        params.put("array_type", 1);
        params.put("module_type", 0);
        params.put("losses", 14.0);

        return cachedCall("solar_estimate", cacheConfig.ttlFor("solar"), PVWATTS_BREAKER,
                List.of(latitude, longitude), Map.of("system_capacity", systemCapacityKw),
                () -> get("/pvwatts/v8.json", params).map(NrelClient::outputs));
    }

    private Mono<JsonNode> get(String path, Map<String, Object> params) {
        return webClient.get()
                .uri(uri(path, params))
                .retrieve()
                .bodyToMono(JsonNode.class);
    }

    private Map<String, Object> baseParams() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("api_key", config.getApiKey());
        params.put("format", "json");
        return params;
    }

    private static JsonNode outputs(JsonNode body) {
        JsonNode outputs = body.path("outputs");
        if (outputs.isArray() && !outputs.isEmpty()) {
            return outputs.get(0);
        }
        return outputs.isMissingNode() ? body : outputs;
    }
}
