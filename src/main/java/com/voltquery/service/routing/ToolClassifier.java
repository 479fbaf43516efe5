package com.voltquery.service.routing;

import com.voltquery.model.SubQuestion;
import com.voltquery.service.tool.ToolNames;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Keyword-precedence classifier that repairs tool names the LLM got wrong.
 * Rules are tried in order and the first match wins, so the order is the precedence.
 */
@Slf4j
@Component
public class ToolClassifier {

    public static final String DEFAULT_TOOL = ToolNames.TRANSPORTATION;

    private final List<ClassificationRule> rules;

    public ToolClassifier() {
        this(defaultRules());
    }

    public ToolClassifier(List<ClassificationRule> rules) {
        this.rules = List.copyOf(rules);
    }

    static List<ClassificationRule> defaultRules() {
        return List.of(
                new KeywordRule(ToolNames.UTILITY, List.of(
                        "electricity", "utility", "rate", "cost", "kwh", "price", "bill",
                        "time-of-use", "off-peak", "peak rate", "charging cost", "charging at",
                        "savings", "compare", "monthly", "annual")),
                new KeywordRule(ToolNames.OPTIMIZATION, List.of(
                        "investment", "sizing", "roi", "optimal size", "optimal system", "npv",
                        "net present value", "financial analysis", "economic analysis", "optimal design",
                        "payback", "optimize", "optimization", "optimal solar", "optimal storage",
                        "optimal energy system")),
                new KeywordRule(ToolNames.SOLAR_PRODUCTION, List.of(
                        "solar", "photovoltaic", "pv system", "production", "generation")),
                new KeywordRule(ToolNames.BUILDINGS, List.of(
                        "building code", "energy code", "iecc", "ashrae", "building standard",
                        "efficiency requirement", "code compliance", "building performance",
                        "energy efficiency standard", "building codes", "energy standards",
                        "building efficiency", "energy efficiency measure", "energy retrofit",
                        "improve efficiency", "reduce consumption")),
                new KeywordRule(ToolNames.TRANSPORTATION, List.of(
                        "charging station", "where to charge", "where can i charge", "charger location",
                        "charging location", "nearest charging", "find charging", "dc fast", "level 2",
                        "station near", "charger", "station")),
                new ChargingContextRule(ToolNames.UTILITY, ToolNames.TRANSPORTATION));
    }

    /**
     * Tool for a sub-question text; {@link #DEFAULT_TOOL} when no rule matches.
     */
    public String classify(String text) {
        String normalized = text == null ? "" : text.toLowerCase(Locale.ROOT);
        for (ClassificationRule rule : rules) {
            Optional<String> tool = rule.classify(normalized);
            if (tool.isPresent()) {
                return tool.get();
            }
        }
        return DEFAULT_TOOL;
    }

    /**
     * Reassign the sub-question's tool if it is not one of the registered tools.
     * Registered names are kept as the LLM gave them. A classification naming an unregistered
     * tool falls back to the default tool, or to the first registered tool if that is missing too.
     *
     * @return the same sub-question, corrected in place
     */
    public SubQuestion correct(SubQuestion subQuestion, Set<String> registeredTools) {
        String original = subQuestion.getToolName();
        if (original != null && registeredTools.contains(original)) {
            return subQuestion;
        }

        String corrected = classify(subQuestion.getSubQuestion());
        if (!registeredTools.contains(corrected)) {
            corrected = registeredTools.contains(DEFAULT_TOOL)
                    ? DEFAULT_TOOL
                    : new TreeSet<>(registeredTools).first();
        }

        log.info("Corrected tool name: from={} to={} sub_question=\"{}\"",
                original, corrected, subQuestion.getSubQuestion());
        subQuestion.setToolName(corrected);
        return subQuestion;
    }

    public List<ClassificationRule> getRules() {
        return rules;
    }

    /**
     * Rules able to assign the given tool, in precedence order.
     */
    public List<ClassificationRule> rulesFor(String toolName) {
        return rules.stream()
                .filter(rule -> rule.targetTools().contains(toolName))
                .toList();
    }
}
