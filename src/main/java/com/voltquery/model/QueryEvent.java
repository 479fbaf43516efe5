package com.voltquery.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * One server-sent event of a streamed answer.
 * <p>
 * A stream is a sequence of {@code status} and {@code tool} progress events, the answer text as
 * {@code chunk} events, and exactly one terminal {@code done} or {@code error} event.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryEvent {

    public static final String STATUS = "status";
    public static final String TOOL = "tool";
    public static final String CHUNK = "chunk";
    public static final String DONE = "done";
    public static final String ERROR = "error";

    String type;
    String stage;
    String message;

    @JsonProperty("tool_name")
    String toolName;

    @JsonProperty("sub_question")
    String subQuestion;

    String text;
    QueryAnswer answer;

    public static QueryEvent status(String stage, String message) {
        return QueryEvent.builder().type(STATUS).stage(stage).message(message).build();
    }

    public static QueryEvent tool(SubQuestion subQuestion) {
        return QueryEvent.builder()
                .type(TOOL)
                .toolName(subQuestion.getToolName())
                .subQuestion(subQuestion.getSubQuestion())
                .build();
    }

    public static QueryEvent chunk(String text) {
        return QueryEvent.builder().type(CHUNK).text(text).build();
    }

    public static QueryEvent done(QueryAnswer answer) {
        return QueryEvent.builder().type(DONE).answer(answer).build();
    }

    public static QueryEvent error(String message) {
        return QueryEvent.builder().type(ERROR).message(message).build();
    }
}
