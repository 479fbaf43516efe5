package com.voltquery.service.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.voltquery.client.GeocodingClient;
import com.voltquery.client.NrelClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Solar production estimates from PVWatts v8.
 */
@Slf4j
@Component
public class SolarProductionTool implements ToolHandler {

    static final double DEFAULT_SYSTEM_KW = 5.0;

    private static final Pattern SYSTEM_SIZE = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*-?\\s*(kw|kilowatt)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final String[] MONTHS = {"Jan", "Feb", "Mar", "Apr", "May", "Jun",
            "Jul", "Aug", "Sep", "Oct", "Nov", "Dec"};

    private final NrelClient nrelClient;
    private final GeocodingClient geocodingClient;

    public SolarProductionTool(NrelClient nrelClient, GeocodingClient geocodingClient) {
        this.nrelClient = nrelClient;
        this.geocodingClient = geocodingClient;
    }

    @Override
    public String getName() {
        return ToolNames.SOLAR_PRODUCTION;
    }

    @Override
    public String getDescription() {
        return "Estimates solar panel energy production (kWh per year and month) "
                + "for a system size at a location.";
    }

    @Override
    public Mono<ToolResult> handle(ToolRequest request) {
        if (request.getLocation() == null) {
            return Mono.just(ToolResult.degraded(getName(), request.getQuestion(),
                    "Please include a location to estimate solar production."));
        }
        double systemKw = systemSizeKw(request.getQuestion());

        return geocodingClient.resolve(request.getLocation())
                .flatMap(site -> nrelClient.solarEstimate(site.getLatitude(), site.getLongitude(), systemKw)
                        .map(outputs -> toResult(request, site.describe(), systemKw, outputs)));
    }

    /**
     * System size in kW mentioned in the question, or {@value #DEFAULT_SYSTEM_KW}.
     */
    static double systemSizeKw(String question) {
        if (question != null) {
            Matcher matcher = SYSTEM_SIZE.matcher(question);
            if (matcher.find()) {
                double size = Double.parseDouble(matcher.group(1));
                if (size > 0 && size <= 500_000) {
                    return size;
                }
            }
        }
        return DEFAULT_SYSTEM_KW;
    }

    private ToolResult toResult(ToolRequest request, String place, double systemKw, JsonNode outputs) {
        JsonNode annual = outputs.path("ac_annual");
        if (!annual.isNumber()) {
            return ToolResult.degraded(getName(), request.getQuestion(),
                    "PVWatts returned no production estimate for " + place + ".");
        }

        StringBuilder text = new StringBuilder(String.format(Locale.ROOT,
                "A %.1f kW solar system at %s is estimated to produce %,.0f kWh per year",
                systemKw, place, annual.asDouble()));
        if (outputs.path("solrad_annual").isNumber()) {
            text.append(String.format(Locale.ROOT, " (average solar radiation %.2f kWh/m2/day)",
                    outputs.get("solrad_annual").asDouble()));
        }
        text.append('.');

        JsonNode monthly = outputs.path("ac_monthly");
        if (monthly.isArray() && monthly.size() == MONTHS.length) {
            text.append(" Monthly:");
            for (int i = 0; i < MONTHS.length; i++) {
                text.append(String.format(Locale.ROOT, " %s %,.0f", MONTHS[i], monthly.get(i).asDouble()));
                text.append(i < MONTHS.length - 1 ? ',' : '.');
            }
        }

        return ToolResult.builder()
                .toolName(getName())
                .subQuestion(request.getQuestion())
                .text(text.toString())
                .sources(List.of(new ToolSource("NREL PVWatts v8 estimate",
                        Map.of("system_capacity_kw", systemKw, "ac_annual_kwh", annual.asDouble()))))
                .build();
    }
}
