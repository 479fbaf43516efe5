package com.voltquery.service.query;

import com.voltquery.config.JacksonConfiguration;
import com.voltquery.config.VoltQueryProperties;
import com.voltquery.exception.InvalidQuestionException;
import com.voltquery.exception.TransientApiException;
import com.voltquery.model.DetectedLocation;
import com.voltquery.model.QueryEvent;
import com.voltquery.provider.LlmProvider;
import com.voltquery.service.location.LocationExtractor;
import com.voltquery.service.resilience.ServiceRegistry;
import com.voltquery.service.routing.SubQuestionParser;
import com.voltquery.service.routing.SubQuestionRouter;
import com.voltquery.service.routing.ToolClassifier;
import com.voltquery.service.tool.ToolNames;
import com.voltquery.service.tool.ToolResult;
import com.voltquery.service.tool.ToolSource;
import com.voltquery.support.MutableClock;
import com.voltquery.support.StubTool;
import com.voltquery.support.TestServices;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QueryOrchestratorTest {

    private static final String DECOMPOSITION = """
            Here you go:
            {"items": [
              {"sub_question": "What are electricity rates in 80202?", "tool_name": "utility_tool"},
              {"sub_question": "What is solar production in 80202?", "tool_name": "solar_production_tool"}
            ]}""";

    private LlmProvider llmProvider;
    private StubTool utility;
    private StubTool solar;
    private StubTool transportation;
    private QueryOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        VoltQueryProperties properties = TestServices.properties();
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        ServiceRegistry serviceRegistry = TestServices.serviceRegistry(properties, clock);

        llmProvider = mock(LlmProvider.class);
        when(llmProvider.isEnabled()).thenReturn(true);

        utility = new StubTool(ToolNames.UTILITY, request -> Mono.just(ToolResult.builder()
                .toolName(ToolNames.UTILITY)
                .text("Xcel Energy residential rate $0.1420/kWh")
                .sources(List.of(new ToolSource("Xcel Energy", Map.of("zip", "80202"))))
                .build()));
        solar = StubTool.failing(ToolNames.SOLAR_PRODUCTION, new TransientApiException("PVWatts returned HTTP 503"));
        transportation = StubTool.answering(ToolNames.TRANSPORTATION, "Found 12 stations");

        SubQuestionRouter router = new SubQuestionRouter(List.of(utility, solar, transportation),
                new SubQuestionParser(JacksonConfiguration.createObjectMapper()),
                new ToolClassifier(), llmProvider, serviceRegistry, properties);
        orchestrator = new QueryOrchestrator(new QuestionValidator(properties), new LocationExtractor(), router,
                new AnswerSynthesizer(llmProvider, serviceRegistry, properties), clock);
    }

    private void stubLlm(Mono<String> decomposition, Mono<String> synthesis) {
        when(llmProvider.prompt(anyString(), anyString())).thenAnswer(invocation ->
                AnswerSynthesizer.SYSTEM_PROMPT.equals(invocation.getArgument(0)) ? synthesis : decomposition);
    }

    @Test
    void testAnswerCombinesToolsAndMarksDegraded() {
        stubLlm(Mono.just(DECOMPOSITION), Mono.just("Power costs 14.2 cents per kWh."));

        StepVerifier.create(orchestrator.answer("  Electricity rates and solar output in 80202?  "))
                .assertNext(answer -> {
                    assertEquals("Electricity rates and solar output in 80202?", answer.getQuestion());
                    assertEquals("Power costs 14.2 cents per kWh.", answer.getAnswer());
                    assertEquals(List.of(ToolNames.UTILITY), answer.getToolsUsed());
                    assertEquals(List.of(ToolNames.SOLAR_PRODUCTION), answer.getDegradedTools());
                    assertEquals(2, answer.getSubAnswers().size());
                    assertEquals("Xcel Energy", answer.getSources().get(0).getText());
                    assertEquals("80202", answer.getDetectedLocation().getZipCode());
                    assertEquals(DetectedLocation.LocationType.ZIP_CODE, answer.getDetectedLocation().getLocationType());
                })
                .verifyComplete();

        assertEquals("80202", utility.getRequests().get(0).getLocation().getZipCode());
        assertTrue(transportation.getRequests().isEmpty());
    }

    @Test
    void testUnparseableDecompositionFallsBackToClassifiedQuestion() {
        stubLlm(Mono.just("{\"utility_tool\": \"Rates lookup\", \"transportation_tool\": \"Stations\"}"),
                Mono.just("About 14 cents."));

        StepVerifier.create(orchestrator.answer("What is the electricity price in Denver?"))
                .assertNext(answer -> {
                    assertEquals(List.of(ToolNames.UTILITY), answer.getToolsUsed());
                    assertEquals("What is the electricity price in Denver?",
                            answer.getSubAnswers().get(0).getSubQuestion());
                    assertEquals("Denver", answer.getDetectedLocation().getCity());
                })
                .verifyComplete();
    }

    @Test
    void testLlmOutageStillAnswersFromTools() {
        stubLlm(Mono.error(new TransientApiException("LLM returned HTTP 503")),
                Mono.error(new TransientApiException("LLM returned HTTP 503")));

        StepVerifier.create(orchestrator.answer("Where is the nearest charging station in 80202?"))
                .assertNext(answer -> {
                    assertEquals("Found 12 stations", answer.getAnswer());
                    assertEquals(List.of(ToolNames.TRANSPORTATION), answer.getToolsUsed());
                    assertTrue(answer.getDegradedTools().isEmpty());
                })
                .verifyComplete();
    }

    @Test
    void testInvalidQuestionFailsWithoutCallingLlm() {
        StepVerifier.create(orchestrator.answer(" "))
                .expectError(InvalidQuestionException.class)
                .verify();
        verify(llmProvider, never()).prompt(anyString(), anyString());
    }

    @Test
    void testAnswerStreamReportsStagesThenChunksThenDone() {
        stubLlm(Mono.just(DECOMPOSITION), Mono.just("Power costs 14.2 cents per kWh."));

        List<QueryEvent> events = orchestrator.answerStream("Electricity rates and solar output in 80202?")
                .collectList()
                .block();

        assertNotNull(events);
        assertEquals(QueryEvent.STATUS, events.get(0).getType());
        assertEquals("analyzing", events.get(0).getStage());
        assertEquals("searching", events.get(1).getStage());

        List<String> tools = events.stream()
                .filter(event -> QueryEvent.TOOL.equals(event.getType()))
                .map(QueryEvent::getToolName)
                .toList();
        assertEquals(List.of(ToolNames.UTILITY, ToolNames.SOLAR_PRODUCTION), tools);

        List<String> stages = events.stream()
                .filter(event -> QueryEvent.STATUS.equals(event.getType()))
                .map(QueryEvent::getStage)
                .toList();
        assertEquals(List.of("analyzing", "searching", "retrieving", "generating"), stages);

        String streamed = events.stream()
                .filter(event -> QueryEvent.CHUNK.equals(event.getType()))
                .map(QueryEvent::getText)
                .collect(Collectors.joining());
        assertEquals("Power costs 14.2 cents per kWh.", streamed);

        QueryEvent last = events.get(events.size() - 1);
        assertEquals(QueryEvent.DONE, last.getType());
        assertEquals("Power costs 14.2 cents per kWh.", last.getAnswer().getAnswer());
        assertEquals(List.of(ToolNames.SOLAR_PRODUCTION), last.getAnswer().getDegradedTools());
    }

    @Test
    void testAnswerStreamEndsWithErrorEventForInvalidQuestion() {
        StepVerifier.create(orchestrator.answerStream(" "))
                .assertNext(event -> {
                    assertEquals(QueryEvent.ERROR, event.getType());
                    assertNotNull(event.getMessage());
                })
                .verifyComplete();
        verify(llmProvider, never()).prompt(anyString(), anyString());
    }

    @Test
    void testAnswerStreamHidesProgrammingErrors() {
        stubLlm(Mono.just(DECOMPOSITION), Mono.error(new IllegalStateException("synthesizer misconfigured")));

        List<QueryEvent> events = orchestrator.answerStream("Electricity rates in 80202?")
                .collectList()
                .block();

        assertNotNull(events);
        QueryEvent last = events.get(events.size() - 1);
        assertEquals(QueryEvent.ERROR, last.getType());
        assertEquals("Internal server error", last.getMessage());
        assertTrue(events.stream().noneMatch(event -> QueryEvent.DONE.equals(event.getType())));
    }
}
