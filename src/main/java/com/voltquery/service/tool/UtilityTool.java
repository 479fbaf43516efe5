package com.voltquery.service.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.voltquery.client.GeocodingClient;
import com.voltquery.client.NrelClient;
import com.voltquery.config.VoltQueryProperties;
import com.voltquery.model.IndexedRecord;
import com.voltquery.repository.IndexedStore;
import com.voltquery.service.freshness.FreshnessOracle;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Average electricity rates and serving utility from the NREL Utility Rates API.
 */
@Component
public class UtilityTool extends AbstractRetrievalTool {

    public static final String DOMAIN = "utility";

    private static final List<String> SECTORS = List.of("residential", "commercial", "industrial");

    private final NrelClient nrelClient;
    private final GeocodingClient geocodingClient;

    public UtilityTool(IndexedStore indexedStore, FreshnessOracle freshnessOracle,
                       VoltQueryProperties properties, Clock clock,
                       NrelClient nrelClient, GeocodingClient geocodingClient) {
        super(indexedStore, freshnessOracle, properties, clock);
        this.nrelClient = nrelClient;
        this.geocodingClient = geocodingClient;
    }

    @Override
    public String getName() {
        return ToolNames.UTILITY;
    }

    @Override
    public String getDescription() {
        return "Electricity rates, utility companies, cost per kWh, charging costs, "
                + "time-of-use pricing and bill comparisons for a location.";
    }

    @Override
    protected String getDomain() {
        return DOMAIN;
    }

    @Override
    protected Optional<RecordFilter> filterFor(ToolRequest request) {
        return RecordFilter.forLocation(request.getLocation());
    }

    @Override
    protected String missingFilterMessage() {
        return "Please include a zip code, city or state to look up electricity rates.";
    }

    @Override
    protected Mono<List<IndexedRecord>> fetchRecords(ToolRequest request, RecordFilter filter) {
        return geocodingClient.resolve(request.getLocation())
                .flatMap(site -> nrelClient.utilityRates(site.getLatitude(), site.getLongitude(), null))
                .map(outputs -> toRecords(filter, outputs));
    }

    static List<IndexedRecord> toRecords(RecordFilter filter, JsonNode outputs) {
        String utility = outputs.path("utility_name").asText("");
        if (utility.isBlank() && !outputs.has("residential")) {
            return List.of();
        }

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("utility_name", utility);
        StringBuilder text = new StringBuilder("Utility: ")
                .append(utility.isBlank() ? "unknown" : utility)
                .append(" serving ")
                .append(filter.getValue())
                .append('.');
        for (String sector : SECTORS) {
            JsonNode rate = outputs.path(sector);
            if (rate.isNumber()) {
                metadata.put(sector + "_rate", rate.asDouble());
                text.append(' ')
                        .append(Character.toUpperCase(sector.charAt(0)))
                        .append(sector.substring(1))
                        .append(String.format(Locale.ROOT, " rate: $%.4f/kWh.", rate.asDouble()));
            }
        }

        return List.of(IndexedRecord.builder()
                .id("utility_" + filter.getKey() + "_" + filter.getValue().replaceAll("[^A-Za-z0-9]", ""))
                .text(text.toString())
                .metadata(metadata)
                .build());
    }

    @Override
    protected String summarize(ToolRequest request, RecordFilter filter, List<IndexedRecord> records) {
        return records.get(0).getText();
    }
}
