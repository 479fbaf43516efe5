package com.voltquery.service.query;

import com.voltquery.config.VoltQueryProperties;
import com.voltquery.exception.InvalidQuestionException;
import org.springframework.stereotype.Component;

@Component
public class QuestionValidator {

    private final VoltQueryProperties.QueryConfig config;

    public QuestionValidator(VoltQueryProperties properties) {
        this.config = properties.getQuery();
    }

    /**
     * Trimmed question, or {@link InvalidQuestionException} when empty, too short or too long.
     */
    public String validate(String question) {
        if (question == null || question.isBlank()) {
            throw new InvalidQuestionException("Question cannot be empty");
        }
        String trimmed = question.trim();
        if (trimmed.length() < config.getMinQuestionLength()) {
            throw new InvalidQuestionException(
                    "Question must be at least " + config.getMinQuestionLength() + " characters");
        }
        if (trimmed.length() > config.getMaxQuestionLength()) {
            throw new InvalidQuestionException(
                    "Question must be at most " + config.getMaxQuestionLength() + " characters");
        }
        return trimmed;
    }
}
