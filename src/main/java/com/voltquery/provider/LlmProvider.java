package com.voltquery.provider;

import com.voltquery.model.ChatCompletionRequest;
import com.voltquery.model.ChatCompletionResponse;
import reactor.core.publisher.Mono;

/**
 * Interface for chat completion providers used for decomposition and answer synthesis.
 */
public interface LlmProvider {

    /**
     * Get provider name (e.g., "openai").
     *
     * @return provider name
     */
    String getName();

    /**
     * Check if provider is enabled and configured.
     *
     * @return true if ready to use
     */
    boolean isEnabled();

    /**
     * Complete a chat request.
     *
     * @param request OpenAI-compatible request
     * @return provider response
     */
    Mono<ChatCompletionResponse> complete(ChatCompletionRequest request);

    /**
     * Send a system and a user prompt with the configured model and return the reply text.
     *
     * @param systemPrompt instructions, may be null
     * @param userPrompt   user content
     * @return reply text; errors if the reply is empty
     */
    Mono<String> prompt(String systemPrompt, String userPrompt);
}
