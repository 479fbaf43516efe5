package com.voltquery.service.routing;

import java.util.Optional;
import java.util.Set;

/**
 * One entry of the tool classifier's precedence list.
 */
public interface ClassificationRule {

    /**
     * @param normalizedText lower-cased sub-question text
     * @return tool name if this rule decides the text, empty to defer to the next rule
     */
    Optional<String> classify(String normalizedText);

    /**
     * Tools this rule can assign.
     */
    Set<String> targetTools();
}
