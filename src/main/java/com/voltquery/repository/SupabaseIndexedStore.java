package com.voltquery.repository;

import com.voltquery.client.AbstractApiClient;
import com.voltquery.config.VoltQueryProperties;
import com.voltquery.exception.ConfigurationException;
import com.voltquery.model.IndexedRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Repository;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;

/**
 * Indexed store backed by a Supabase table through its PostgREST API.
 * Metadata filters are JSON path equality filters on the {@code metadata} column.
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "voltquery.store", name = "type", havingValue = "supabase")
public class SupabaseIndexedStore extends AbstractApiClient implements IndexedStore {

    private static final ParameterizedTypeReference<List<IndexedRecord>> RECORD_LIST =
            new ParameterizedTypeReference<>() {
            };

    private final VoltQueryProperties.StoreConfig store;

    public SupabaseIndexedStore(WebClient webClient, VoltQueryProperties properties) {
        super(webClient, toApiConfig(properties.getStore()));
        this.store = properties.getStore();
        if (store.getUrl() == null || store.getUrl().isBlank()) {
            throw new ConfigurationException("voltquery.store.url is required for the supabase store");
        }
    }

    private static VoltQueryProperties.ApiConfig toApiConfig(VoltQueryProperties.StoreConfig store) {
        VoltQueryProperties.ApiConfig api = new VoltQueryProperties.ApiConfig();
        api.setBaseUrl(store.getUrl());
        api.setApiKey(store.getApiKey());
        api.setTimeout(store.getTimeout());
        return api;
    }

    @Override
    public Mono<List<IndexedRecord>> query(String domain, String filterKey, String filterValue, int topK) {
        URI uri = UriComponentsBuilder.fromHttpUrl(store.getUrl())
                .path("/rest/v1/" + store.getTable())
                .queryParam("select", "id,text,metadata")
                .queryParam("metadata->>" + IndexedRecord.DOMAIN, "eq." + domain)
                .queryParam("metadata->>" + filterKey, "eq." + filterValue)
                .queryParam("order", "metadata->>" + IndexedRecord.INDEXED_AT + ".desc.nullslast")
                .queryParam("limit", topK)
                .encode()
                .build()
                .toUri();

        log.debug("Querying indexed store: domain={}, {}={}, topK={}", domain, filterKey, filterValue, topK);

        Mono<List<IndexedRecord>> request = webClient.get()
                .uri(uri)
                .header("apikey", store.getApiKey())
                .headers(headers -> headers.setBearerAuth(store.getApiKey()))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(RECORD_LIST)
                .timeout(store.getTimeout());

        return classifyErrors(request);
    }

    @Override
    public Mono<Integer> upsert(List<IndexedRecord> records) {
        if (records.isEmpty()) {
            return Mono.just(0);
        }

        Mono<Integer> request = webClient.post()
                .uri(store.getUrl() + "/rest/v1/" + store.getTable())
                .header("apikey", store.getApiKey())
                .header("Prefer", "resolution=merge-duplicates,return=minimal")
                .headers(headers -> headers.setBearerAuth(store.getApiKey()))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(records)
                .retrieve()
                .toBodilessEntity()
                .timeout(store.getTimeout())
                .thenReturn(records.size());

        return classifyErrors(request)
                .doOnSuccess(count -> log.info("Upserted {} records into {}", count, store.getTable()));
    }

    @Override
    public String getName() {
        return "supabase";
    }
}
