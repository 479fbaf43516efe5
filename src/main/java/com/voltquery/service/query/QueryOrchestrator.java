package com.voltquery.service.query;

import com.voltquery.model.DetectedLocation;
import com.voltquery.model.QueryAnswer;
import com.voltquery.model.QueryEvent;
import com.voltquery.model.SubQuestion;
import com.voltquery.service.location.LocationExtractor;
import com.voltquery.service.routing.SubQuestionRouter;
import com.voltquery.service.tool.ToolResult;
import com.voltquery.service.tool.ToolSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;

/**
 * Entry point for answering a question end to end.
 * <p>
 * Flow: validate, detect a location, decompose into sub-questions (falling back to the whole
 * question as one classified sub-question), dispatch to tools, synthesize.
 * {@link #answerStream} runs the same flow and reports each stage as it happens.
 */
@Slf4j
@Service
public class QueryOrchestrator {

    private final QuestionValidator validator;
    private final LocationExtractor locationExtractor;
    private final SubQuestionRouter router;
    private final AnswerSynthesizer synthesizer;
    private final Clock clock;

    public QueryOrchestrator(QuestionValidator validator,
                             LocationExtractor locationExtractor,
                             SubQuestionRouter router,
                             AnswerSynthesizer synthesizer,
                             Clock clock) {
        this.validator = validator;
        this.locationExtractor = locationExtractor;
        this.router = router;
        this.synthesizer = synthesizer;
        this.clock = clock;
    }

    public Mono<QueryAnswer> answer(String rawQuestion) {
        return Mono.defer(() -> {
            long start = clock.millis();
            String question = validator.validate(rawQuestion);
            DetectedLocation location = locationExtractor.extract(question).orElse(null);
            log.info("Answering question: \"{}\" location={}", question,
                    location == null ? "none" : location.describe());

            return decompose(question)
                    .flatMap(subQuestions -> router.dispatch(subQuestions, location))
                    .flatMap(results -> synthesizer.synthesize(question, results)
                            .map(answer -> buildAnswer(question, answer, results, location, start)));
        });
    }

    /**
     * Answer a question as a stream of progress events, answer chunks and a final
     * {@code done} event carrying the full answer. Failures end the stream with an
     * {@code error} event instead of an error signal.
     */
    public Flux<QueryEvent> answerStream(String rawQuestion) {
        return Flux.defer(() -> {
            long start = clock.millis();
            String question = validator.validate(rawQuestion);
            DetectedLocation location = locationExtractor.extract(question).orElse(null);
            log.info("Streaming answer for question: \"{}\" location={}", question,
                    location == null ? "none" : location.describe());

            Flux<QueryEvent> answering = decompose(question).flatMapMany(subQuestions -> Flux.concat(
                    Flux.just(QueryEvent.status("searching",
                            "Searching " + subQuestions.size() + " data source(s)")),
                    Flux.fromIterable(subQuestions).map(QueryEvent::tool),
                    Flux.just(QueryEvent.status("retrieving", "Retrieving data")),
                    router.dispatch(subQuestions, location).flatMapMany(results -> Flux.concat(
                            Flux.just(QueryEvent.status("generating", "Generating answer")),
                            synthesizer.synthesize(question, results).flatMapMany(answer -> {
                                QueryAnswer full = buildAnswer(question, answer, results, location, start);
                                return Flux.fromIterable(AnswerChunker.split(answer))
                                        .map(QueryEvent::chunk)
                                        .concatWith(Mono.just(QueryEvent.done(full)));
                            })))));

            return Flux.just(QueryEvent.status("analyzing", "Analyzing question"))
                    .concatWith(answering);
        }).onErrorResume(error -> Mono.just(QueryEvent.error(streamErrorMessage(error))));
    }

    private static String streamErrorMessage(Throwable error) {
        if (SubQuestionRouter.isProgrammingError(error)) {
            log.error("Streaming answer failed", error);
            return "Internal server error";
        }
        log.warn("Streaming answer failed: {}", error.toString());
        return error.getMessage();
    }

    private Mono<List<SubQuestion>> decompose(String question) {
        return router.decompose(question)
                .onErrorResume(error -> !SubQuestionRouter.isProgrammingError(error), error -> {
                    SubQuestion fallback = router.fallbackSubQuestion(question);
                    log.warn("Decomposition failed ({}), routing whole question to {}",
                            error.toString(), fallback.getToolName());
                    return Mono.just(List.of(fallback));
                });
    }

    private QueryAnswer buildAnswer(String question, String answer, List<ToolResult> results,
                                    DetectedLocation location, long start) {
        List<ToolSource> sources = results.stream()
                .filter(result -> !result.isDegraded())
                .flatMap(result -> result.getSources().stream())
                .toList();
        List<String> toolsUsed = results.stream()
                .filter(result -> !result.isDegraded())
                .map(ToolResult::getToolName)
                .distinct()
                .toList();
        List<String> degradedTools = results.stream()
                .filter(ToolResult::isDegraded)
                .map(ToolResult::getToolName)
                .distinct()
                .toList();

        long elapsed = clock.millis() - start;
        log.info("Answered question in {} ms tools_used={} degraded_tools={}", elapsed, toolsUsed, degradedTools);

        return QueryAnswer.builder()
                .question(question)
                .answer(answer)
                .sources(sources)
                .toolsUsed(toolsUsed)
                .degradedTools(degradedTools)
                .subAnswers(results)
                .detectedLocation(location)
                .responseTimeMs(elapsed)
                .build();
    }
}
