package com.voltquery.controller;

import com.voltquery.model.IndexingReport;
import com.voltquery.model.IndexingTask;
import com.voltquery.model.dto.BulkIndexRequest;
import com.voltquery.model.dto.IndexRequest;
import com.voltquery.service.indexing.IndexingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Store population endpoints: index stations and utility rates ahead of questions.
 */
@Slf4j
@RestController
@RequestMapping("/v1/index")
public class IndexingController {

    private final IndexingService indexingService;

    public IndexingController(IndexingService indexingService) {
        this.indexingService = indexingService;
    }

    @PostMapping(value = "/stations", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<IndexingReport> indexStations(@RequestBody IndexRequest request) {
        log.info("Received station indexing request for location={} limit={}",
                request.getLocation(), request.getLimit());
        return indexingService.indexStations(request.getLocation(), request.getLimit());
    }

    @PostMapping(value = "/tariffs", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<IndexingReport> indexTariffs(@RequestBody IndexRequest request) {
        log.info("Received tariff indexing request for location={}", request.getLocation());
        return indexingService.indexTariffs(request.getLocation());
    }

    /**
     * Start a background task indexing utility rates for many locations.
     */
    @PostMapping(value = "/tariffs/bulk", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Mono<Map<String, Object>> indexTariffsInBulk(@RequestBody BulkIndexRequest request) {
        return Mono.fromCallable(() -> {
            IndexingTask task = indexingService.startTariffIndexing(request.getLocations());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("task_id", task.getTaskId());
            body.put("status", task.getStatus());
            body.put("message", task.getMessage());
            body.put("check_status_url", "/v1/index/tasks/" + task.getTaskId());
            return body;
        });
    }

    @GetMapping("/tasks/{taskId}")
    public Mono<IndexingTask> getTask(@PathVariable String taskId) {
        return Mono.justOrEmpty(indexingService.getTask(taskId))
                .switchIfEmpty(Mono.error(new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Indexing task not found: " + taskId)));
    }
}
