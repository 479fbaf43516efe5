package com.voltquery.service.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.voltquery.client.BclClient;
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
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Building codes and efficiency measures from the NREL Building Component Library.
 * Records are indexed per topic rather than per location.
 */
@Component
public class BuildingsTool extends AbstractRetrievalTool {

    static final String DOMAIN = "buildings";
    static final String BUILDING_CODES = "building_codes";
    static final String EFFICIENCY = "efficiency";

    private static final List<String> CODE_TERMS =
            List.of("code", "iecc", "ashrae", "standard", "compliance", "title 24", "regulation");
    private static final int MEASURE_LIMIT = 10;

    private final BclClient bclClient;

    public BuildingsTool(IndexedStore indexedStore, FreshnessOracle freshnessOracle,
                         VoltQueryProperties properties, Clock clock, BclClient bclClient) {
        super(indexedStore, freshnessOracle, properties, clock);
        this.bclClient = bclClient;
    }

    @Override
    public String getName() {
        return ToolNames.BUILDINGS;
    }

    @Override
    public String getDescription() {
        return "Building energy codes (IECC, ASHRAE 90.1), efficiency standards, "
                + "and energy efficiency measures for buildings.";
    }

    @Override
    protected String getDomain() {
        return DOMAIN;
    }

    @Override
    protected Optional<RecordFilter> filterFor(ToolRequest request) {
        String question = request.getQuestion() == null ? "" : request.getQuestion().toLowerCase(Locale.ROOT);
        boolean codes = CODE_TERMS.stream().anyMatch(question::contains);
        return Optional.of(new RecordFilter(RecordFilter.TOPIC, codes ? BUILDING_CODES : EFFICIENCY));
    }

    @Override
    protected String missingFilterMessage() {
        return "Could not determine a building topic.";
    }

    @Override
    protected Mono<List<IndexedRecord>> fetchRecords(ToolRequest request, RecordFilter filter) {
        Mono<List<JsonNode>> measures = BUILDING_CODES.equals(filter.getValue())
                ? bclClient.searchBuildingCodeMeasures("energy code", MEASURE_LIMIT)
                : bclClient.searchEfficiencyMeasures("energy efficiency", MEASURE_LIMIT);
        return measures.map(BuildingsTool::toRecords);
    }

    static List<IndexedRecord> toRecords(List<JsonNode> measures) {
        List<IndexedRecord> records = new ArrayList<>();
        for (JsonNode measure : measures) {
            String name = measure.path("display_name").asText(measure.path("name").asText(""));
            if (name.isBlank()) {
                continue;
            }
            String uuid = measure.path("uuid").asText(name);
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("measure_name", name);
            metadata.put("uuid", uuid);

            String description = measure.path("description").asText("").trim();
            records.add(IndexedRecord.builder()
                    .id("bcl_" + uuid)
                    .text(description.isEmpty() ? name : name + ": " + description)
                    .metadata(metadata)
                    .build());
        }
        return records;
    }

    @Override
    protected String summarize(ToolRequest request, RecordFilter filter, List<IndexedRecord> records) {
        StringBuilder answer = new StringBuilder(BUILDING_CODES.equals(filter.getValue())
                ? "Relevant building code measures:\n"
                : "Relevant energy efficiency measures:\n");
        records.forEach(record -> answer.append("- ").append(record.getText()).append('\n'));
        return answer.toString().trim();
    }
}
