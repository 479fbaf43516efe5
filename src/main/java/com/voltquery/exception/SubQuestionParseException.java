package com.voltquery.exception;

/**
 * LLM decomposition output did not contain a usable sub-question list.
 */
public class SubQuestionParseException extends VoltQueryException {

    public SubQuestionParseException(String message) {
        super(message);
    }
}
