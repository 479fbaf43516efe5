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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * EV charging station lookups from the NREL Alternative Fuel Stations API.
 */
@Component
public class TransportationTool extends AbstractRetrievalTool {

    public static final String DOMAIN = "transportation";

    private static final int NEARBY_LIMIT = 20;
    private static final int STATE_LIMIT = 50;

    private final NrelClient nrelClient;
    private final GeocodingClient geocodingClient;

    public TransportationTool(IndexedStore indexedStore, FreshnessOracle freshnessOracle,
                              VoltQueryProperties properties, Clock clock,
                              NrelClient nrelClient, GeocodingClient geocodingClient) {
        super(indexedStore, freshnessOracle, properties, clock);
        this.nrelClient = nrelClient;
        this.geocodingClient = geocodingClient;
    }

    @Override
    public String getName() {
        return ToolNames.TRANSPORTATION;
    }

    @Override
    public String getDescription() {
        return "Finds EV charging stations near a location: station names, addresses, "
                + "charger levels (Level 2, DC fast), connector types, networks and access hours.";
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
        return "Please include a zip code, city or state to search for charging stations.";
    }

    @Override
    protected Mono<List<IndexedRecord>> fetchRecords(ToolRequest request, RecordFilter filter) {
        Mono<JsonNode> stations = RecordFilter.STATE.equals(filter.getKey())
                ? nrelClient.stationsByState(filter.getValue(), request.limitOr(STATE_LIMIT))
                : geocodingClient.resolve(request.getLocation())
                .flatMap(site -> nrelClient.stationsNearby(site.getLatitude(), site.getLongitude(),
                        request.limitOr(NEARBY_LIMIT)));
        return stations.map(body -> toRecords(filter, body));
    }

    /**
     * One record per station. Ids are scoped to the filter so a station indexed for a zip code
     * and for its state keeps both entries.
     */
    static List<IndexedRecord> toRecords(RecordFilter filter, JsonNode stations) {
        String scope = filter.getKey() + "_" + filter.getValue().replaceAll("[^A-Za-z0-9]", "");
        List<IndexedRecord> records = new ArrayList<>();
        for (JsonNode station : stations) {
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("station_name", station.path("station_name").asText(""));
            metadata.put("station_zip", station.path("zip").asText(""));
            metadata.put("station_state", station.path("state").asText(""));
            metadata.put("network", station.path("ev_network").asText("Non-Networked"));
            metadata.put("level2_count", station.path("ev_level2_evse_num").asInt(0));
            metadata.put("dc_fast_count", station.path("ev_dc_fast_num").asInt(0));
            if (station.hasNonNull("distance")) {
                metadata.put("distance_miles", station.get("distance").asDouble());
            }

            records.add(IndexedRecord.builder()
                    .id("station_" + scope + "_" + station.path("id").asText())
                    .text(describe(station))
                    .metadata(metadata)
                    .build());
        }
        return records;
    }

    private static String describe(JsonNode station) {
        StringBuilder text = new StringBuilder()
                .append(station.path("station_name").asText("Unnamed station"))
                .append(" at ")
                .append(station.path("street_address").asText(""))
                .append(", ")
                .append(station.path("city").asText(""))
                .append(", ")
                .append(station.path("state").asText(""))
                .append(' ')
                .append(station.path("zip").asText(""))
                .append(". Network: ")
                .append(station.path("ev_network").asText("Non-Networked"))
                .append(". Level 2 ports: ")
                .append(station.path("ev_level2_evse_num").asInt(0))
                .append(", DC fast ports: ")
                .append(station.path("ev_dc_fast_num").asInt(0))
                .append('.');

        JsonNode connectors = station.path("ev_connector_types");
        if (connectors.isArray() && !connectors.isEmpty()) {
            List<String> types = new ArrayList<>();
            connectors.forEach(type -> types.add(type.asText()));
            text.append(" Connectors: ").append(String.join(", ", types)).append('.');
        }
        if (station.hasNonNull("access_days_time")) {
            text.append(" Access: ").append(station.get("access_days_time").asText()).append('.');
        }
        return text.toString();
    }

    @Override
    protected String summarize(ToolRequest request, RecordFilter filter, List<IndexedRecord> records) {
        StringBuilder answer = new StringBuilder("Found ")
                .append(records.size())
                .append(" charging stations for ")
                .append(filter.getValue())
                .append(":\n");
        for (IndexedRecord record : records) {
            answer.append("- ").append(record.getText()).append('\n');
        }
        return answer.toString().trim();
    }
}
