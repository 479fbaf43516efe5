package com.voltquery.service.routing;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Disambiguates a bare "charging" mention: with a cost word nearby it is a rate question,
 * otherwise a station search.
 */
public class ChargingContextRule implements ClassificationRule {

    static final List<String> COST_WORDS = List.of(
            "cost", "savings", "rate", "price", "bill", "at 11", "at 12", "time");

    private final String costTool;
    private final String locationTool;

    public ChargingContextRule(String costTool, String locationTool) {
        this.costTool = costTool;
        this.locationTool = locationTool;
    }

    @Override
    public Optional<String> classify(String normalizedText) {
        if (!normalizedText.contains("charging")) {
            return Optional.empty();
        }
        boolean costContext = COST_WORDS.stream().anyMatch(normalizedText::contains);
        return Optional.of(costContext ? costTool : locationTool);
    }

    @Override
    public Set<String> targetTools() {
        return Set.of(costTool, locationTool);
    }

    @Override
    public String toString() {
        return "ChargingContextRule[" + costTool + "|" + locationTool + "]";
    }
}
