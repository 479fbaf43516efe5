package com.voltquery.client;

import com.voltquery.config.VoltQueryProperties;
import com.voltquery.exception.ConfigurationException;
import com.voltquery.exception.TransientApiException;
import com.voltquery.service.canonicalization.CacheKeyGenerator;
import com.voltquery.service.resilience.ServiceRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Base class for external HTTP API clients.
 * Maps transport failures onto the retry/breaker exception taxonomy and wires calls through
 * the response cache, circuit breaker and retry executor.
 */
@Slf4j
public abstract class AbstractApiClient {

    protected final WebClient webClient;
    protected final VoltQueryProperties.ApiConfig config;
    protected final ServiceRegistry serviceRegistry;
    protected final CacheKeyGenerator keyGenerator;

    /**
     * Client without cache or breaker support.
     */
    protected AbstractApiClient(WebClient webClient, VoltQueryProperties.ApiConfig config) {
        this(webClient, config, null, null);
    }

    protected AbstractApiClient(WebClient webClient,
                                VoltQueryProperties.ApiConfig config,
                                ServiceRegistry serviceRegistry,
                                CacheKeyGenerator keyGenerator) {
        this.webClient = webClient;
        this.config = config;
        this.serviceRegistry = serviceRegistry;
        this.keyGenerator = keyGenerator;
    }

    /**
     * Name used for logging and as the default circuit breaker and retry policy name.
     */
    public abstract String getName();

    /**
     * Run a call behind the response cache, the named breaker and this client's retry policy.
     *
     * @param prefix  cache key namespace
     * @param ttl     cache TTL
     * @param breaker circuit breaker name
     * @param args    logical call arguments for the cache key
     * @param call    the HTTP call
     */
    protected <T> Mono<T> cachedCall(String prefix, Duration ttl, String breaker,
                                     List<?> args, Map<String, ?> kwargs, Supplier<Mono<T>> call) {
        String key = keyGenerator.generateKey(prefix, args, kwargs);
        return serviceRegistry.cachedProtect(key, ttl, breaker, getName(), config.getTimeout(),
                () -> classifyErrors(call.get()));
    }

    /**
     * Run a call behind the named breaker and this client's retry policy, without caching.
     */
    protected <T> Mono<T> guardedCall(String breaker, Supplier<Mono<T>> call) {
        return serviceRegistry.protect(breaker, getName(), config.getTimeout(),
                () -> classifyErrors(call.get()));
    }

    /**
     * Translate network errors and 429/5xx responses into {@link TransientApiException}.
     * Other 4xx responses pass through unchanged and are not retried.
     */
    protected <T> Mono<T> classifyErrors(Mono<T> request) {
        return request.onErrorMap(this::isTransportFailure, this::toTransient)
                .doOnError(error -> log.warn("{} request failed: {}", getName(), error.toString()));
    }

    private boolean isTransportFailure(Throwable error) {
        if (error instanceof WebClientRequestException) {
            return true;
        }
        if (error instanceof WebClientResponseException responseException) {
            int status = responseException.getStatusCode().value();
            return status == 429 || status >= 500;
        }
        return false;
    }

    private Throwable toTransient(Throwable error) {
        if (error instanceof WebClientResponseException responseException) {
            int status = responseException.getStatusCode().value();
            return new TransientApiException(getName() + " returned HTTP " + status, status);
        }
        return new TransientApiException(getName() + " unreachable: " + error.getMessage(), error);
    }

    protected URI uri(String path, Map<String, ?> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(config.getBaseUrl() + path);
        params.forEach((name, value) -> {
            if (value instanceof List<?> values) {
                values.forEach(item -> builder.queryParam(name, item));
            } else if (value != null) {
                builder.queryParam(name, value);
            }
        });
        return builder.encode().build().toUri();
    }

    protected String requireApiKey() {
        String apiKey = config.getApiKey();
        if (apiKey == null || apiKey.isBlank() || "your_nrel_api_key_here".equals(apiKey)) {
            throw new ConfigurationException(getName() + " API key must be configured");
        }
        return apiKey;
    }
}
