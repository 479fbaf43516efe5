package com.voltquery.exception;

/**
 * Rejected user question (empty, too short or too long).
 */
public class InvalidQuestionException extends IllegalArgumentException {

    public InvalidQuestionException(String message) {
        super(message);
    }
}
