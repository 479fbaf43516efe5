package com.voltquery.service.tool;

import com.voltquery.client.GeocodingClient;
import com.voltquery.model.FinancingComparison;
import com.voltquery.model.OptimizationOutcome;
import com.voltquery.service.scenario.FinancingScenarioService;
import com.voltquery.service.scenario.ScenarioResult;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Solar and storage investment analysis through REopt financing scenarios.
 */
@Component
public class OptimizationTool implements ToolHandler {

    private static final Pattern INDUSTRIAL_TERMS =
            Pattern.compile("\\b(industrial|factory|manufacturing|plant)\\b");
    private static final Pattern COMMERCIAL_TERMS =
            Pattern.compile("\\b(commercial|business|office|retail|store|warehouse|company)\\b");
    private static final Pattern LEASE_TERMS = Pattern.compile("\\b(lease|leasing|ppa|power purchase agreement)\\b");
    private static final Pattern PURCHASE_TERMS = Pattern.compile("\\b(purchase|buy|buying|own|cash|loan)\\b");

    private final FinancingScenarioService financingService;
    private final GeocodingClient geocodingClient;

    public OptimizationTool(FinancingScenarioService financingService, GeocodingClient geocodingClient) {
        this.financingService = financingService;
        this.geocodingClient = geocodingClient;
    }

    @Override
    public String getName() {
        return ToolNames.OPTIMIZATION;
    }

    @Override
    public String getDescription() {
        return "Optimal solar and battery sizing, NPV, payback and ROI, including purchase vs lease "
                + "financing under 2026 federal tax credit rules.";
    }

    @Override
    public Mono<ToolResult> handle(ToolRequest request) {
        if (request.getLocation() == null) {
            return Mono.just(ToolResult.degraded(getName(), request.getQuestion(),
                    "Please include a location to run a solar investment analysis."));
        }
        String question = request.getQuestion() == null ? "" : request.getQuestion().toLowerCase(Locale.ROOT);
        String propertyType = propertyType(question);
        boolean leaseOnly = isLeaseOnly(question);

        return geocodingClient.resolve(request.getLocation())
                .flatMap(site -> financingService.compare(site, propertyType, leaseOnly))
                .map(comparison -> toResult(request, comparison));
    }

    static String propertyType(String question) {
        if (INDUSTRIAL_TERMS.matcher(question).find()) {
            return "industrial";
        }
        if (COMMERCIAL_TERMS.matcher(question).find()) {
            return "commercial";
        }
        return "residential";
    }

    static boolean isLeaseOnly(String question) {
        return LEASE_TERMS.matcher(question).find() && !PURCHASE_TERMS.matcher(question).find();
    }

    private ToolResult toResult(ToolRequest request, FinancingComparison comparison) {
        if (comparison.getReport().isAllFailed()) {
            List<String> errors = comparison.getReport().getFailures().stream()
                    .map(failure -> failure.getName() + ": " + failure.getErrorMessage())
                    .toList();
            return ToolResult.degraded(getName(), request.getQuestion(),
                    "REopt optimization failed for " + comparison.getLocation() + " (" + String.join("; ", errors) + ").");
        }

        StringBuilder text = new StringBuilder("REopt analysis for ")
                .append(comparison.getLocation())
                .append(" (")
                .append(comparison.getScenarioType())
                .append(", tariff ")
                .append(comparison.getUrdbLabel())
                .append("):");
        List<ToolSource> sources = new ArrayList<>();
        for (ScenarioResult<OptimizationOutcome> result : comparison.getReport().getResults()) {
            text.append("\n- ").append(result.getName()).append(": ");
            if (!result.isSuccess()) {
                text.append("unavailable (").append(result.getErrorMessage()).append(')');
                continue;
            }
            OptimizationOutcome outcome = result.getOutcome();
            text.append(describe(outcome));

            Map<String, Object> metadata = new HashMap<>(result.getParams());
            metadata.put("scenario", result.getName());
            metadata.put("run_uuid", outcome.getRunUuid());
            sources.add(new ToolSource("REopt run " + outcome.getRunUuid(), metadata));
        }
        if (comparison.getNpvDifference() != null) {
            text.append(String.format(Locale.ROOT, "\nLease NPV minus purchase NPV: $%,.0f.",
                    comparison.getNpvDifference()));
        }
        if (comparison.getPolicyNotice() != null) {
            text.append('\n').append(comparison.getPolicyNotice());
        }

        return ToolResult.builder()
                .toolName(getName())
                .subQuestion(request.getQuestion())
                .text(text.toString())
                .sources(sources)
                .build();
    }

    private static String describe(OptimizationOutcome outcome) {
        StringBuilder text = new StringBuilder();
        text.append(outcome.getNpv() == null
                ? "NPV not reported"
                : String.format(Locale.ROOT, "NPV $%,.0f", outcome.getNpv()));
        text.append(String.format(Locale.ROOT, " over %d years with %.0f%% federal ITC",
                outcome.getAnalysisYears(), outcome.getFederalItcFraction() * 100));
        if (outcome.getPvKw() != null) {
            text.append(String.format(Locale.ROOT, "; optimal PV %.1f kW", outcome.getPvKw()));
        }
        if (outcome.getStorageKw() != null && outcome.getStorageKw() > 0) {
            text.append(String.format(Locale.ROOT, ", storage %.1f kW", outcome.getStorageKw()));
            if (outcome.getStorageKwh() != null) {
                text.append(String.format(Locale.ROOT, " / %.1f kWh", outcome.getStorageKwh()));
            }
        }
        return text.toString();
    }
}
