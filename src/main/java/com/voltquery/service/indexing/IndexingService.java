package com.voltquery.service.indexing;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.voltquery.config.VoltQueryProperties;
import com.voltquery.model.DetectedLocation;
import com.voltquery.model.DetectedLocation.LocationType;
import com.voltquery.model.IndexingReport;
import com.voltquery.model.IndexingTask;
import com.voltquery.service.routing.SubQuestionRouter;
import com.voltquery.service.tool.AbstractRetrievalTool;
import com.voltquery.service.tool.ToolRequest;
import com.voltquery.service.tool.TransportationTool;
import com.voltquery.service.tool.UtilityTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Pre-populates the indexed store with charging stations and utility rates, by zip code or state.
 * <p>
 * Single locations are indexed inline. Lists of locations run as background tasks in batches,
 * with a pause between batches to stay under upstream rate limits; their progress is kept
 * for {@code voltquery.indexing.task-retention}.
 */
@Slf4j
@Service
public class IndexingService {

    private static final Pattern ZIP = Pattern.compile("\\d{5}");
    private static final Pattern STATE = Pattern.compile("[A-Za-z]{2}");

    private final TransportationTool transportationTool;
    private final UtilityTool utilityTool;
    private final VoltQueryProperties.IndexingConfig config;
    private final Clock clock;
    private final Cache<String, IndexingTask> tasks;

    public IndexingService(TransportationTool transportationTool,
                           UtilityTool utilityTool,
                           VoltQueryProperties properties,
                           Clock clock) {
        this.transportationTool = transportationTool;
        this.utilityTool = utilityTool;
        this.config = properties.getIndexing();
        this.clock = clock;
        this.tasks = Caffeine.newBuilder()
                .expireAfterWrite(config.getTaskRetention())
                .build();
    }

    /**
     * Fetch and index charging stations for a zip code (nearest stations) or a state.
     *
     * @param location five-digit zip code or two-letter state code
     * @param limit    maximum stations to fetch; the configured limit when null
     */
    public Mono<IndexingReport> indexStations(String location, Integer limit) {
        return Mono.defer(() -> {
            DetectedLocation target = parseLocation(location);
            int stationLimit = limit != null && limit > 0 ? limit : config.getStationLimit();
            return transportationTool.index(request(transportationTool, target, stationLimit));
        });
    }

    /**
     * Fetch and index utility rates for a zip code or a state.
     */
    public Mono<IndexingReport> indexTariffs(String location) {
        return Mono.defer(() -> utilityTool.index(request(utilityTool, parseLocation(location), null)));
    }

    /**
     * Start indexing utility rates for many locations in the background.
     *
     * @return the queued task; poll {@link #getTask} for progress
     */
    public IndexingTask startTariffIndexing(List<String> locations) {
        if (locations == null || locations.isEmpty()) {
            throw new IllegalArgumentException("At least one zip code or state is required");
        }
        if (locations.size() > config.getMaxLocationsPerTask()) {
            throw new IllegalArgumentException("At most " + config.getMaxLocationsPerTask()
                    + " locations can be indexed per task, got " + locations.size());
        }
        List<DetectedLocation> targets = locations.stream().map(IndexingService::parseLocation).toList();

        IndexingTask queued = queueTariffTask(targets);
        String taskId = queued.getTaskId();
        runTariffTask(taskId, targets).subscribe(
                task -> log.info("indexing operation=finish task_id={} status={} indexed={} failed={}",
                        taskId, task.getStatus(), task.getRecordsIndexed(), task.getLocationsFailed()),
                error -> log.error("Indexing task {} terminated unexpectedly", taskId, error));
        return queued;
    }

    public Optional<IndexingTask> getTask(String taskId) {
        return Optional.ofNullable(tasks.getIfPresent(taskId));
    }

    IndexingTask queueTariffTask(List<DetectedLocation> targets) {
        String taskId = UUID.randomUUID().toString();
        IndexingTask queued = IndexingTask.builder()
                .taskId(taskId)
                .domain(UtilityTool.DOMAIN)
                .status(IndexingTask.Status.QUEUED)
                .message("Task queued for " + targets.size() + " locations")
                .locationsTotal(targets.size())
                .createdAt(clock.instant())
                .updatedAt(clock.instant())
                .build();
        tasks.put(taskId, queued);
        log.info("indexing operation=start task_id={} locations={}", taskId, targets.size());
        return queued;
    }

    Mono<IndexingTask> runTariffTask(String taskId, List<DetectedLocation> targets) {
        int batchSize = Math.max(1, config.getFetchBatchSize());
        Duration pause = config.getDelayBetweenBatches();

        return Mono.fromSupplier(() -> update(taskId, task -> task.toBuilder()
                        .status(IndexingTask.Status.RUNNING)
                        .message("Indexing utility rates")
                        .build()))
                .thenMany(Flux.fromIterable(targets)
                        .buffer(batchSize)
                        .index()
                        .concatMap(batch -> {
                            Mono<Long> wait = batch.getT1() == 0 || pause.isZero() ? Mono.empty() : Mono.delay(pause);
                            return wait.thenMany(Flux.fromIterable(batch.getT2())
                                    .flatMap(target -> indexOne(taskId, target)));
                        }))
                .then(Mono.fromSupplier(() -> update(taskId, task -> task.toBuilder()
                        .status(IndexingTask.Status.COMPLETED)
                        .message("Indexed " + task.getRecordsIndexed() + " records for "
                                + (task.getLocationsDone() - task.getLocationsFailed()) + " of "
                                + task.getLocationsTotal() + " locations")
                        .build())))
                .onErrorResume(error -> Mono.fromSupplier(() -> update(taskId, task -> task.toBuilder()
                        .status(IndexingTask.Status.FAILED)
                        .message("Indexing failed: " + error.getMessage())
                        .build())));
    }

    private Mono<IndexingTask> indexOne(String taskId, DetectedLocation target) {
        return utilityTool.index(request(utilityTool, target, null))
                .map(report -> update(taskId, task -> task.toBuilder()
                        .locationsDone(task.getLocationsDone() + 1)
                        .recordsIndexed(task.getRecordsIndexed() + report.getIndexed())
                        .build()))
                .onErrorResume(error -> !SubQuestionRouter.isProgrammingError(error), error -> {
                    log.warn("indexing operation=location task_id={} location={} error={}",
                            taskId, target.describe(), error.toString());
                    return Mono.just(update(taskId, task -> task.toBuilder()
                            .locationsDone(task.getLocationsDone() + 1)
                            .locationsFailed(task.getLocationsFailed() + 1)
                            .build()));
                });
    }

    private IndexingTask update(String taskId, UnaryOperator<IndexingTask> change) {
        return tasks.asMap().compute(taskId, (id, task) -> {
            if (task == null) {
                throw new IllegalStateException("Indexing task " + id + " expired while running");
            }
            return change.apply(task).toBuilder().updatedAt(clock.instant()).build();
        });
    }

    private static ToolRequest request(AbstractRetrievalTool tool, DetectedLocation target, Integer limit) {
        return ToolRequest.builder()
                .question("Index " + tool.getName() + " data for " + target.describe())
                .location(target)
                .limit(limit)
                .build();
    }

    /**
     * A five-digit zip code or a two-letter state code.
     */
    static DetectedLocation parseLocation(String location) {
        String trimmed = location == null ? "" : location.trim();
        if (ZIP.matcher(trimmed).matches()) {
            return DetectedLocation.builder().zipCode(trimmed).locationType(LocationType.ZIP_CODE).build();
        }
        if (STATE.matcher(trimmed).matches()) {
            return DetectedLocation.builder()
                    .state(trimmed.toUpperCase(Locale.ROOT))
                    .locationType(LocationType.STATE)
                    .build();
        }
        throw new IllegalArgumentException(
                "Location must be a 5-digit zip code or a 2-letter state code, got '" + location + "'");
    }
}
