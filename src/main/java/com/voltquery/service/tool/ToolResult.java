package com.voltquery.service.tool;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Answer of one tool to one sub-question.
 * Degraded results carry a descriptive "no data" text instead of an answer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolResult {

    private String toolName;
    private String subQuestion;
    private String text;

    @Builder.Default
    private List<ToolSource> sources = List.of();

    private boolean degraded;

    public static ToolResult degraded(String toolName, String subQuestion, String reason) {
        return ToolResult.builder()
                .toolName(toolName)
                .subQuestion(subQuestion)
                .text(reason)
                .degraded(true)
                .build();
    }
}
