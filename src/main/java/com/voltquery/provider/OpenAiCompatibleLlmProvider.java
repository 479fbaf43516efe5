package com.voltquery.provider;

import com.voltquery.config.VoltQueryProperties;
import com.voltquery.exception.TransientApiException;
import com.voltquery.exception.VoltQueryException;
import com.voltquery.model.ChatCompletionRequest;
import com.voltquery.model.ChatCompletionResponse;
import com.voltquery.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Chat completion provider for OpenAI and API-compatible endpoints.
 * Retries and circuit breaking are applied by the caller through the service registry.
 */
@Slf4j
@Component
public class OpenAiCompatibleLlmProvider implements LlmProvider {

    private final WebClient webClient;
    private final VoltQueryProperties.LlmConfig config;

    public OpenAiCompatibleLlmProvider(WebClient webClient, VoltQueryProperties properties) {
        this.webClient = webClient;
        this.config = properties.getLlm();
    }

    @Override
    public String getName() {
        return "openai";
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled() && config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    @Override
    public Mono<ChatCompletionResponse> complete(ChatCompletionRequest request) {
        if (!isEnabled()) {
            return Mono.error(new VoltQueryException("LLM provider is not enabled"));
        }

        log.debug("Forwarding request to LLM: model={}, messages={}",
                request.getModel(), request.getMessages().size());

        String endpoint = config.getBaseUrl() + "/chat/completions";

        return webClient.post()
                .uri(endpoint)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(ChatCompletionResponse.class)
                .onErrorMap(OpenAiCompatibleLlmProvider::isTransient,
                        error -> new TransientApiException("LLM request failed: " + error.getMessage(), error));
    }

    @Override
    public Mono<String> prompt(String systemPrompt, String userPrompt) {
        List<Message> messages = new ArrayList<>();
        if (systemPrompt != null) {
            messages.add(Message.system(systemPrompt));
        }
        messages.add(Message.user(userPrompt));

        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .model(config.getModel())
                .messages(messages)
                .temperature(config.getTemperature())
                .build();

        return complete(request)
                .flatMap(response -> {
                    String content = response.firstContent();
                    if (content == null || content.isBlank()) {
                        return Mono.error(new TransientApiException("LLM returned an empty completion"));
                    }
                    return Mono.just(content);
                });
    }

    private static boolean isTransient(Throwable error) {
        if (error instanceof WebClientRequestException) {
            return true;
        }
        return error instanceof WebClientResponseException responseException
                && (responseException.getStatusCode().value() == 429
                || responseException.getStatusCode().is5xxServerError());
    }
}
