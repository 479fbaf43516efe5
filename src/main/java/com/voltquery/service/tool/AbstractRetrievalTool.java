package com.voltquery.service.tool;

import com.voltquery.config.VoltQueryProperties;
import com.voltquery.exception.InvalidQuestionException;
import com.voltquery.exception.StaleDataException;
import com.voltquery.model.IndexedRecord;
import com.voltquery.model.IndexingReport;
import com.voltquery.repository.IndexedStore;
import com.voltquery.service.freshness.FreshnessOracle;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Base class for tools that answer from the indexed store.
 * <p>
 * Records are served from the store while the freshness oracle reports them fresh. Stale or
 * absent data triggers a fetch from the upstream API; fetched records are stamped with
 * {@code domain}, the filter key and {@code indexed_at}, written back to the store and used
 * for the answer. {@link #index} runs the same fetch-and-write path ahead of any question.
 */
@Slf4j
public abstract class AbstractRetrievalTool implements ToolHandler {

    protected final IndexedStore indexedStore;
    protected final FreshnessOracle freshnessOracle;
    protected final VoltQueryProperties properties;
    protected final Clock clock;

    protected AbstractRetrievalTool(IndexedStore indexedStore,
                                    FreshnessOracle freshnessOracle,
                                    VoltQueryProperties properties,
                                    Clock clock) {
        this.indexedStore = indexedStore;
        this.freshnessOracle = freshnessOracle;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Metadata domain of this tool's records.
     */
    protected abstract String getDomain();

    /**
     * Filter selecting the records relevant to a request; empty when the request lacks what is needed.
     */
    protected abstract Optional<RecordFilter> filterFor(ToolRequest request);

    /**
     * Degraded answer text used when {@link #filterFor} is empty.
     */
    protected abstract String missingFilterMessage();

    /**
     * Fetch fresh records from the upstream API.
     */
    protected abstract Mono<List<IndexedRecord>> fetchRecords(ToolRequest request, RecordFilter filter);

    /**
     * Compose the answer from records, most recent first.
     */
    protected abstract String summarize(ToolRequest request, RecordFilter filter, List<IndexedRecord> records);

    @Override
    public Mono<ToolResult> handle(ToolRequest request) {
        Optional<RecordFilter> maybeFilter = filterFor(request);
        if (maybeFilter.isEmpty()) {
            return Mono.just(ToolResult.degraded(getName(), request.getQuestion(), missingFilterMessage()));
        }
        RecordFilter filter = maybeFilter.get();
        Duration ttl = properties.freshnessTtl(getDomain());
        int topK = properties.getStore().getTopK();

        return freshnessOracle.requireFresh(getDomain(), filter.getKey(), filter.getValue(), ttl)
                .flatMap(indexedAt -> {
                    log.debug("{} serving indexed records for {}={} indexed_at={}",
                            getName(), filter.getKey(), filter.getValue(), indexedAt);
                    return indexedStore.query(getDomain(), filter.getKey(), filter.getValue(), topK);
                })
                .onErrorResume(StaleDataException.class, stale -> refresh(request, filter, topK))
                .map(records -> toResult(request, filter, records));
    }

    /**
     * Fetch the records a request selects and write them to the store, whatever their freshness.
     *
     * @throws InvalidQuestionException (as an error signal) if the request selects no records
     */
    public Mono<IndexingReport> index(ToolRequest request) {
        return Mono.defer(() -> {
            Optional<RecordFilter> maybeFilter = filterFor(request);
            if (maybeFilter.isEmpty()) {
                return Mono.error(new InvalidQuestionException(missingFilterMessage()));
            }
            RecordFilter filter = maybeFilter.get();
            String indexedAt = clock.instant().toString();

            return fetchRecords(request, filter)
                    .map(records -> stamp(records, filter, indexedAt))
                    .flatMap(records -> upsertInBatches(records, filter)
                            .map(indexed -> IndexingReport.builder()
                                    .domain(getDomain())
                                    .filterKey(filter.getKey())
                                    .filterValue(filter.getValue())
                                    .fetched(records.size())
                                    .indexed(indexed)
                                    .indexedAt(indexedAt)
                                    .build()));
        });
    }

    private Mono<List<IndexedRecord>> refresh(ToolRequest request, RecordFilter filter, int topK) {
        log.info("{} refreshing {}={} from upstream", getName(), filter.getKey(), filter.getValue());
        String indexedAt = clock.instant().toString();

        return fetchRecords(request, filter)
                .map(records -> stamp(records, filter, indexedAt))
                .flatMap(records -> upsertInBatches(records, filter).thenReturn(records))
                .map(records -> records.size() > topK ? records.subList(0, topK) : records);
    }

    private Mono<Integer> upsertInBatches(List<IndexedRecord> records, RecordFilter filter) {
        if (records.isEmpty()) {
            return Mono.just(0);
        }
        return Flux.fromIterable(records)
                .buffer(Math.max(1, properties.getStore().getIndexBatchSize()))
                .concatMap(indexedStore::upsert)
                .reduce(0, Integer::sum)
                .doOnNext(count -> log.info("{} indexed {} records for {}={}",
                        getName(), count, filter.getKey(), filter.getValue()));
    }

    private List<IndexedRecord> stamp(List<IndexedRecord> records, RecordFilter filter, String indexedAt) {
        List<IndexedRecord> stamped = new ArrayList<>(records.size());
        for (IndexedRecord record : records) {
            Map<String, Object> metadata = new HashMap<>(record.getMetadata());
            metadata.put(IndexedRecord.DOMAIN, getDomain());
            metadata.put(filter.getKey(), filter.getValue());
            metadata.put(IndexedRecord.INDEXED_AT, indexedAt);
            stamped.add(record.toBuilder().metadata(metadata).build());
        }
        return stamped;
    }

    private ToolResult toResult(ToolRequest request, RecordFilter filter, List<IndexedRecord> records) {
        if (records.isEmpty()) {
            return ToolResult.degraded(getName(), request.getQuestion(),
                    "No " + getDomain() + " data found for " + filter.getValue() + ".");
        }
        List<ToolSource> sources = records.stream()
                .map(record -> new ToolSource(record.getText(), record.getMetadata()))
                .toList();
        return ToolResult.builder()
                .toolName(getName())
                .subQuestion(request.getQuestion())
                .text(summarize(request, filter, records))
                .sources(sources)
                .build();
    }
}
