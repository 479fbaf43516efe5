package com.voltquery.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.voltquery.config.VoltQueryProperties;
import com.voltquery.service.canonicalization.CacheKeyGenerator;
import com.voltquery.service.resilience.ServiceRegistry;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client for the NREL Building Component Library (OpenStudio measures).
 */
@Component
public class BclClient extends AbstractApiClient {

    static final String BREAKER = "bcl";

    private static final List<String> BUILDING_CODE_TAGS = List.of("ModelMeasure", "Reporting.QAQC");

    private final VoltQueryProperties.CacheConfig cacheConfig;

    public BclClient(WebClient webClient, VoltQueryProperties properties,
                     ServiceRegistry serviceRegistry, CacheKeyGenerator keyGenerator) {
        super(webClient, properties.getBcl(), serviceRegistry, keyGenerator);
        this.cacheConfig = properties.getCache();
    }

    @Override
    public String getName() {
        return "bcl";
    }

    /**
     * Measures related to building and energy codes.
     */
    public Mono<List<JsonNode>> searchBuildingCodeMeasures(String query, int limit) {
        return searchMeasures(query, BUILDING_CODE_TAGS, limit);
    }

    /**
     * Energy efficiency measures matching the query.
     */
    public Mono<List<JsonNode>> searchEfficiencyMeasures(String query, int limit) {
        return searchMeasures(query, List.of(), limit);
    }

    private Mono<List<JsonNode>> searchMeasures(String query, List<String> tags, int limit) {
        List<String> filters = new ArrayList<>();
        filters.add("bundle:measure");
        tags.forEach(tag -> filters.add("tags:" + tag));

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("q", query);
        params.put("limit", limit);
        params.put("offset", 0);
        params.put("fq[]", filters);

        return cachedCall("bcl_measures", cacheConfig.ttlFor("bcl"), BREAKER,
                List.of(query == null ? "" : query), Map.of("tags", tags, "limit", limit),
                () -> webClient.get()
                        .uri(uri("/search", params))
                        .retrieve()
                        .bodyToMono(JsonNode.class)
                        .map(BclClient::measures));
    }

    // Results come as [{"measure": {...}}] or as bare measure objects
    private static List<JsonNode> measures(JsonNode body) {
        List<JsonNode> measures = new ArrayList<>();
        for (JsonNode item : body.path("result")) {
            if (item.has("measure")) {
                measures.add(item.get("measure"));
            } else if (item.isObject()) {
                measures.add(item);
            }
        }
        return measures;
    }
}
