package com.voltquery.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One independently answerable part of a user question, with the tool that should answer it.
 * {@code toolName} is corrected in place before dispatch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubQuestion {

    @JsonProperty("sub_question")
    private String subQuestion;

    @JsonProperty("tool_name")
    private String toolName;
}
