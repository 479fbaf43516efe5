package com.voltquery.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.voltquery.service.tool.ToolResult;
import com.voltquery.service.tool.ToolSource;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Composite answer to a question.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryAnswer {

    private String question;
    private String answer;

    @Builder.Default
    private List<ToolSource> sources = List.of();

    /**
     * Tools that contributed a non-degraded answer.
     */
    @JsonProperty("tools_used")
    @Builder.Default
    private List<String> toolsUsed = List.of();

    @JsonProperty("degraded_tools")
    @Builder.Default
    private List<String> degradedTools = List.of();

    @JsonProperty("sub_answers")
    @Builder.Default
    private List<ToolResult> subAnswers = List.of();

    @JsonProperty("detected_location")
    private DetectedLocation detectedLocation;

    @JsonProperty("response_time_ms")
    private long responseTimeMs;
}
