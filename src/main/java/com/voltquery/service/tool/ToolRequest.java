package com.voltquery.service.tool;

import com.voltquery.model.DetectedLocation;
import lombok.Builder;
import lombok.Value;

/**
 * Input to a tool handler: one sub-question plus the location detected in the original question.
 */
@Value
@Builder
public class ToolRequest {
    String question;
    DetectedLocation location;

    /**
     * Maximum upstream records to fetch; the tool's own default when null.
     */
    Integer limit;

    public int limitOr(int defaultLimit) {
        return limit != null && limit > 0 ? limit : defaultLimit;
    }
}
