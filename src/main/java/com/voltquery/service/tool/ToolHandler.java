package com.voltquery.service.tool;

import reactor.core.publisher.Mono;

/**
 * A domain tool that answers sub-questions.
 * Implementations guard their own external calls with cache, breaker and retry.
 */
public interface ToolHandler {

    /**
     * Registered tool name, e.g. "utility_tool".
     */
    String getName();

    /**
     * Description shown to the LLM when decomposing questions.
     */
    String getDescription();

    /**
     * Answer a sub-question. "No data" conditions produce a degraded result;
     * infrastructure failures may be emitted as errors.
     */
    Mono<ToolResult> handle(ToolRequest request);
}
