package com.voltquery.service.routing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.voltquery.exception.SubQuestionParseException;
import com.voltquery.model.SubQuestion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts sub-questions from noisy LLM decomposition output.
 *
 * Expected payload: {@code {"items": [{"sub_question": "...", "tool_name": "..."}]}}, possibly
 * surrounded by prose, markdown fences, repeated objects or echoed tool descriptions.
 *
 * <ol>
 *   <li>Parse the whole trimmed text as a JSON object.</li>
 *   <li>Otherwise scan backward for balanced {@code {...}} spans and keep every valid non-empty object,
 *       skipping past each accepted span.</li>
 *   <li>Otherwise parse the body of a {@code ```json} fence.</li>
 *   <li>Prefer objects with {@code items}, then single {@code {sub_question, tool_name}} objects, then
 *       objects whose values are not all strings. Among equals, the last one found by the backward scan
 *       (the leftmost in the text) wins.</li>
 * </ol>
 */
@Slf4j
@Component
public class SubQuestionParser {

    static final String ITEMS = "items";
    static final String SUB_QUESTION = "sub_question";
    static final String TOOL_NAME = "tool_name";

    private static final Pattern JSON_FENCE = Pattern.compile("```(?:json)?\\s*(.*?)```", Pattern.DOTALL);
    private static final int PREVIEW_LENGTH = 500;

    private final ObjectReader strictReader;

    public SubQuestionParser(ObjectMapper objectMapper) {
        // "{...} trailing text" must not parse as a whole document
        this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Parse decomposition output into sub-questions.
     *
     * @param output raw LLM text
     * @return at least one sub-question, in payload order
     * @throws SubQuestionParseException if no usable sub-question list is present
     */
    public List<SubQuestion> parse(String output) {
        if (output == null || output.isBlank()) {
            throw new SubQuestionParseException("Decomposition output is empty");
        }

        List<ObjectNode> candidates = findCandidates(output);
        if (candidates.isEmpty()) {
            throw new SubQuestionParseException("No valid JSON found in output: " + preview(output));
        }

        ObjectNode chosen = select(candidates);
        return extract(chosen);
    }

    List<ObjectNode> findCandidates(String output) {
        List<ObjectNode> candidates = new ArrayList<>();

        ObjectNode whole = tryParseObject(output.trim());
        if (whole != null) {
            candidates.add(whole);
            return candidates;
        }

        candidates.addAll(scanBackward(output));
        if (!candidates.isEmpty()) {
            return candidates;
        }

        Matcher fence = JSON_FENCE.matcher(output);
        if (fence.find()) {
            ObjectNode fenced = tryParseObject(fence.group(1).trim());
            if (fenced != null && !fenced.isEmpty()) {
                candidates.add(fenced);
            }
        }
        return candidates;
    }

    /**
     * Balanced-brace spans from the end of the text towards the start, in scan order.
     */
    private List<ObjectNode> scanBackward(String text) {
        List<ObjectNode> found = new ArrayList<>();
        int i = text.length() - 1;

        while (i >= 0) {
            if (text.charAt(i) == '}') {
                int start = matchingOpenBrace(text, i);
                if (start >= 0) {
                    ObjectNode node = tryParseObject(text.substring(start, i + 1));
                    if (node != null && !node.isEmpty()) {
                        found.add(node);
                        i = start - 1;
                        continue;
                    }
                }
            }
            i--;
        }

        return found;
    }

    /**
     * Index of the brace opening the span that closes at {@code closeIndex}, or -1.
     * Braces inside double-quoted strings are not counted.
     */
    private static int matchingOpenBrace(String text, int closeIndex) {
        int depth = 0;
        boolean inString = false;
        for (int j = closeIndex; j >= 0; j--) {
            char c = text.charAt(j);
            if (c == '"' && !isEscaped(text, j)) {
                inString = !inString;
            } else if (inString) {
                continue;
            } else if (c == '}') {
                depth++;
            } else if (c == '{') {
                depth--;
                if (depth == 0) {
                    return j;
                }
            }
        }
        return -1;
    }

    private static boolean isEscaped(String text, int index) {
        int backslashes = 0;
        for (int k = index - 1; k >= 0 && text.charAt(k) == '\\'; k--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    private ObjectNode select(List<ObjectNode> candidates) {
        ObjectNode itemsObject = null;
        ObjectNode singleShape = null;
        ObjectNode usable = null;

        for (ObjectNode candidate : candidates) {
            if (candidate.has(ITEMS)) {
                itemsObject = candidate;
            } else if (toSubQuestion(candidate) != null) {
                singleShape = candidate;
            } else if (!allValuesAreStrings(candidate)) {
                usable = candidate;
            }
        }

        if (itemsObject != null) {
            return itemsObject;
        }
        if (singleShape != null) {
            return singleShape;
        }
        if (usable != null) {
            return usable;
        }

        ObjectNode last = candidates.get(candidates.size() - 1);
        if (allValuesAreStrings(last)) {
            throw new SubQuestionParseException(
                    "LLM returned tool descriptions instead of sub-questions. Expected format: "
                            + "{\"items\": [{\"sub_question\": \"...\", \"tool_name\": \"...\"}]}. Got: "
                            + preview(last.toString()));
        }
        return last;
    }

    private List<SubQuestion> extract(ObjectNode chosen) {
        if (chosen.has(ITEMS)) {
            JsonNode items = chosen.get(ITEMS);
            if (!items.isArray()) {
                throw new SubQuestionParseException(
                        "'items' should contain a list, got: " + items.getNodeType());
            }

            List<SubQuestion> subQuestions = new ArrayList<>();
            for (JsonNode item : items) {
                SubQuestion subQuestion = toSubQuestion(item);
                if (subQuestion != null) {
                    subQuestions.add(subQuestion);
                } else {
                    log.debug("Dropping malformed decomposition item: {}", item);
                }
            }

            if (subQuestions.isEmpty()) {
                throw new SubQuestionParseException("No valid sub-questions found in items: " + preview(items.toString()));
            }
            return subQuestions;
        }

        SubQuestion single = toSubQuestion(chosen);
        if (single != null) {
            return List.of(single);
        }

        throw new SubQuestionParseException("Invalid JSON structure: " + preview(chosen.toString()));
    }

    private static SubQuestion toSubQuestion(JsonNode item) {
        if (!item.isObject()) {
            return null;
        }
        JsonNode text = item.get(SUB_QUESTION);
        JsonNode tool = item.get(TOOL_NAME);
        if (text == null || tool == null || !text.isTextual() || !tool.isTextual()) {
            return null;
        }
        return new SubQuestion(text.asText().trim(), tool.asText().trim());
    }

    private static boolean allValuesAreStrings(ObjectNode node) {
        Iterator<JsonNode> values = node.elements();
        while (values.hasNext()) {
            if (!values.next().isTextual()) {
                return false;
            }
        }
        return true;
    }

    private ObjectNode tryParseObject(String text) {
        try {
            JsonNode node = strictReader.readTree(text);
            return node instanceof ObjectNode objectNode ? objectNode : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static String preview(String text) {
        return text.length() <= PREVIEW_LENGTH ? text : text.substring(0, PREVIEW_LENGTH) + "...";
    }
}
