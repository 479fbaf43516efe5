package com.voltquery.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * WebClient configuration for HTTP requests to the LLM, data APIs and the indexed store.
 */
@Configuration
public class WebClientConfiguration {

    // REopt result documents run to several megabytes
    private static final int MAX_IN_MEMORY_BYTES = 16 * 1024 * 1024;

    private final VoltQueryProperties properties;

    public WebClientConfiguration(VoltQueryProperties properties) {
        this.properties = properties;
    }

    @Bean
    public WebClient webClient() {
        Duration responseTimeout = properties.getLlm().getTimeout();
        HttpClient httpClient = HttpClient.create()
                .followRedirect(true)
                .responseTimeout(responseTimeout);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                        .build())
                .build();
    }
}
