package com.voltquery.controller;

import com.voltquery.model.FinancingComparison;
import com.voltquery.model.QueryAnswer;
import com.voltquery.model.QueryEvent;
import com.voltquery.model.dto.FinancingRequest;
import com.voltquery.model.dto.QueryRequest;
import com.voltquery.service.query.QueryOrchestrator;
import com.voltquery.service.scenario.FinancingScenarioService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Question answering endpoints.
 */
@Slf4j
@RestController
@RequestMapping("/v1/query")
public class QueryController {

    private final QueryOrchestrator orchestrator;
    private final FinancingScenarioService financingService;

    public QueryController(QueryOrchestrator orchestrator, FinancingScenarioService financingService) {
        this.orchestrator = orchestrator;
        this.financingService = financingService;
    }

    /**
     * Answer a natural-language energy question.
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<QueryAnswer> query(@RequestBody QueryRequest request) {
        log.info("Received query request");
        return orchestrator.answer(request.getQuestion());
    }

    /**
     * Answer a question as server-sent events, named by event type.
     */
    @PostMapping(value = "/stream", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<QueryEvent>> queryStream(@RequestBody QueryRequest request) {
        log.info("Received streaming query request");
        return orchestrator.answerStream(request.getQuestion())
                .map(event -> ServerSentEvent.<QueryEvent>builder()
                        .event(event.getType())
                        .data(event)
                        .build());
    }

    /**
     * Run purchase vs lease (or commercial) REopt scenarios for a location.
     */
    @PostMapping(value = "/financing", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<FinancingComparison> financing(@RequestBody FinancingRequest request) {
        log.info("Received financing request for location={} property_type={} lease_only={}",
                request.getLocation(), request.getPropertyType(), request.isLeaseOnly());
        return financingService.compare(request);
    }
}
