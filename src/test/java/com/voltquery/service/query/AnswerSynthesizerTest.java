package com.voltquery.service.query;

import com.voltquery.config.VoltQueryProperties;
import com.voltquery.exception.TransientApiException;
import com.voltquery.provider.LlmProvider;
import com.voltquery.service.tool.ToolNames;
import com.voltquery.service.tool.ToolResult;
import com.voltquery.support.MutableClock;
import com.voltquery.support.TestServices;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AnswerSynthesizerTest {

    private static final ToolResult RATES = ToolResult.builder()
            .toolName(ToolNames.UTILITY)
            .subQuestion("Rates in 80202?")
            .text("Residential rate: $0.1420/kWh")
            .build();
    private static final ToolResult STATIONS = ToolResult.builder()
            .toolName(ToolNames.TRANSPORTATION)
            .subQuestion("Stations in 80202?")
            .text("Found 12 stations")
            .build();
    private static final ToolResult NO_SOLAR = ToolResult.degraded(ToolNames.SOLAR_PRODUCTION,
            "Solar output in 80202?", "No data available from solar_production_tool: timeout");

    private LlmProvider llmProvider;
    private AnswerSynthesizer synthesizer;

    @BeforeEach
    void setUp() {
        VoltQueryProperties properties = TestServices.properties();
        llmProvider = mock(LlmProvider.class);
        when(llmProvider.isEnabled()).thenReturn(true);
        synthesizer = new AnswerSynthesizer(llmProvider,
                TestServices.serviceRegistry(properties, new MutableClock(Instant.parse("2026-01-01T00:00:00Z"))),
                properties);
    }

    @Test
    void testSynthesizesWithLlmFromAnsweredResultsOnly() {
        when(llmProvider.prompt(anyString(), anyString())).thenReturn(Mono.just("Rates are 14.2 cents and 12 stations exist."));

        StepVerifier.create(synthesizer.synthesize("Rates and stations in 80202?", List.of(RATES, NO_SOLAR, STATIONS)))
                .expectNext("Rates are 14.2 cents and 12 stations exist.")
                .verifyComplete();

        verify(llmProvider).prompt(eq(AnswerSynthesizer.SYSTEM_PROMPT),
                contains("Sub question: Rates in 80202?\nResponse: Residential rate: $0.1420/kWh"));
        verify(llmProvider, never()).prompt(anyString(), contains("timeout"));
    }

    @Test
    void testLlmFailureFallsBackToConcatenation() {
        when(llmProvider.prompt(anyString(), anyString())).thenReturn(Mono.error(new TransientApiException("429")));

        StepVerifier.create(synthesizer.synthesize("q", List.of(RATES, STATIONS)))
                .expectNext("Residential rate: $0.1420/kWh\n\nFound 12 stations")
                .verifyComplete();
    }

    @Test
    void testDisabledLlmConcatenates() {
        when(llmProvider.isEnabled()).thenReturn(false);

        StepVerifier.create(synthesizer.synthesize("q", List.of(STATIONS, NO_SOLAR)))
                .expectNext("Found 12 stations")
                .verifyComplete();
        verify(llmProvider, never()).prompt(anyString(), anyString());
    }

    @Test
    void testAllDegradedExplainsMissingData() {
        StepVerifier.create(synthesizer.synthesize("q", List.of(NO_SOLAR)))
                .assertNext(answer -> {
                    assertTrue(answer.startsWith("I could not find data to answer this question."));
                    assertTrue(answer.contains("solar_production_tool"));
                })
                .verifyComplete();
        verify(llmProvider, never()).prompt(anyString(), anyString());
    }

    @Test
    void testNoResults() {
        StepVerifier.create(synthesizer.synthesize("q", List.of()))
                .expectNext("I could not find any data to answer this question.")
                .verifyComplete();
    }
}
