package com.voltquery.service.query;

import com.voltquery.config.VoltQueryProperties;
import com.voltquery.provider.LlmProvider;
import com.voltquery.service.resilience.ServiceRegistry;
import com.voltquery.service.routing.SubQuestionRouter;
import com.voltquery.service.tool.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Merges tool answers into one response with the LLM, falling back to plain concatenation.
 */
@Slf4j
@Service
public class AnswerSynthesizer {

    static final String SYSTEM_PROMPT = """
            You answer energy questions using only the context provided.
            Be concise and specific, keep numbers and units from the context, and say so when data is missing.""";

    private static final String TEMPLATE = """
            Context information is below.
            ---------------------
            {{context}}
            ---------------------
            Given the context information and not prior knowledge, answer the query.
            If results for both purchase and lease scenarios are provided, compare them explicitly:
            1. State the NPV of the purchase scenario (0% federal ITC)
            2. State the NPV of the lease scenario (30% federal ITC)
            3. Explain that in 2026 homeowners who buy lose the federal credit, while lease and PPA
               providers can still claim 30% and pass savings on through lower rates.

            Query: {{question}}
            Answer:""";

    private final LlmProvider llmProvider;
    private final ServiceRegistry serviceRegistry;
    private final VoltQueryProperties properties;

    public AnswerSynthesizer(LlmProvider llmProvider, ServiceRegistry serviceRegistry,
                             VoltQueryProperties properties) {
        this.llmProvider = llmProvider;
        this.serviceRegistry = serviceRegistry;
        this.properties = properties;
    }

    /**
     * Composite answer text. Never fails: when the LLM is off or its call fails, the
     * successful tool answers are concatenated.
     */
    public Mono<String> synthesize(String question, List<ToolResult> results) {
        List<ToolResult> answered = results.stream().filter(result -> !result.isDegraded()).toList();
        if (answered.isEmpty()) {
            return Mono.just(noDataAnswer(results));
        }
        if (!llmProvider.isEnabled()) {
            return Mono.just(concatenate(answered));
        }

        String prompt = TEMPLATE
                .replace("{{context}}", context(answered))
                .replace("{{question}}", question);

        return serviceRegistry.protect(SubQuestionRouter.LLM_BREAKER, SubQuestionRouter.LLM_BREAKER,
                        properties.getQuery().getSynthesisTimeout(),
                        () -> llmProvider.prompt(SYSTEM_PROMPT, prompt))
                .onErrorResume(error -> !SubQuestionRouter.isProgrammingError(error), error -> {
                    log.warn("Answer synthesis failed, concatenating sub-answers: {}", error.toString());
                    return Mono.just(concatenate(answered));
                });
    }

    static String context(List<ToolResult> answered) {
        return answered.stream()
                .map(result -> "Sub question: " + result.getSubQuestion() + "\nResponse: " + result.getText())
                .collect(Collectors.joining("\n\n"));
    }

    static String concatenate(List<ToolResult> answered) {
        return answered.stream()
                .map(ToolResult::getText)
                .collect(Collectors.joining("\n\n"));
    }

    private static String noDataAnswer(List<ToolResult> results) {
        if (results.isEmpty()) {
            return "I could not find any data to answer this question.";
        }
        return "I could not find data to answer this question. "
                + results.stream().map(ToolResult::getText).collect(Collectors.joining(" "));
    }
}
