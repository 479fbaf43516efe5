package com.voltquery.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.voltquery.config.VoltQueryProperties;
import com.voltquery.exception.VoltQueryException;
import com.voltquery.model.DetectedLocation;
import com.voltquery.service.canonicalization.CacheKeyGenerator;
import com.voltquery.service.resilience.ServiceRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Geocoding over the OpenStreetMap Nominatim search API.
 * Results are cached under the long "geocode" TTL.
 */
@Slf4j
@Component
public class GeocodingClient extends AbstractApiClient {

    static final String BREAKER = "geocoding";

    private final Duration ttl;

    public GeocodingClient(WebClient webClient, VoltQueryProperties properties,
                           ServiceRegistry serviceRegistry, CacheKeyGenerator keyGenerator) {
        super(webClient, properties.getGeocoding(), serviceRegistry, keyGenerator);
        this.ttl = properties.getCache().ttlFor("geocode");
    }

    @Override
    public String getName() {
        return "geocoding";
    }

    /**
     * Fill in coordinates for a detected location, geocoding it if needed.
     */
    public Mono<DetectedLocation> resolve(DetectedLocation location) {
        if (location.hasCoordinates()) {
            return Mono.just(location);
        }

        Mono<double[]> coordinates = switch (location.getLocationType()) {
            case ZIP_CODE -> geocodeZip(location.getZipCode());
            case CITY_STATE -> geocodeText(location.getCity() + ", " + location.getState() + ", USA");
            case STATE -> geocodeText(location.getState() + ", USA");
            case COORDINATES -> Mono.error(new VoltQueryException("Coordinates location without coordinates"));
        };

        return coordinates.map(latLon -> location.toBuilder()
                .latitude(latLon[0])
                .longitude(latLon[1])
                .build());
    }

    /**
     * Latitude and longitude of a US zip code.
     */
    public Mono<double[]> geocodeZip(String zipCode) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("postalcode", zipCode);
        params.put("country", "US");
        params.put("format", "json");
        params.put("limit", 1);

        return cachedCall("geocode_zip", ttl, BREAKER, List.of(zipCode), Map.of(),
                () -> search(params, "zip code " + zipCode));
    }

    /**
     * Latitude and longitude of a free-text place, e.g. "Denver, CO, USA".
     */
    public Mono<double[]> geocodeText(String place) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("q", place);
        params.put("countrycodes", "us");
        params.put("format", "json");
        params.put("limit", 1);

        return cachedCall("geocode_location", ttl, BREAKER, List.of(place), Map.of(),
                () -> search(params, place));
    }

    private Mono<double[]> search(Map<String, Object> params, String description) {
        return webClient.get()
                .uri(uri("/search", params))
                .header(HttpHeaders.USER_AGENT, config.getUserAgent())
                .retrieve()
                .bodyToMono(JsonNode.class)
                .flatMap(body -> {
                    if (!body.isArray() || body.isEmpty()
                            || !body.get(0).hasNonNull("lat") || !body.get(0).hasNonNull("lon")) {
                        return Mono.error(new VoltQueryException("Could not geocode " + description));
                    }
                    JsonNode first = body.get(0);
                    log.debug("Geocoded {} to {},{}", description, first.get("lat").asText(), first.get("lon").asText());
                    return Mono.just(new double[]{first.get("lat").asDouble(), first.get("lon").asDouble()});
                });
    }
}
