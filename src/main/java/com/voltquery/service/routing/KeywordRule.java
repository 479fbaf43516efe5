package com.voltquery.service.routing;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Assigns a tool when the text contains any of its keywords (substring match).
 */
public class KeywordRule implements ClassificationRule {

    private final String toolName;
    private final List<String> keywords;

    public KeywordRule(String toolName, List<String> keywords) {
        this.toolName = toolName;
        this.keywords = keywords.stream().map(keyword -> keyword.toLowerCase(Locale.ROOT)).toList();
    }

    @Override
    public Optional<String> classify(String normalizedText) {
        for (String keyword : keywords) {
            if (normalizedText.contains(keyword)) {
                return Optional.of(toolName);
            }
        }
        return Optional.empty();
    }

    @Override
    public Set<String> targetTools() {
        return Set.of(toolName);
    }

    public List<String> getKeywords() {
        return keywords;
    }

    @Override
    public String toString() {
        return "KeywordRule[" + toolName + "]";
    }
}
