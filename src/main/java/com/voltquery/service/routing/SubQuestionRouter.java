package com.voltquery.service.routing;

import com.voltquery.config.VoltQueryProperties;
import com.voltquery.exception.ConfigurationException;
import com.voltquery.exception.VoltQueryException;
import com.voltquery.model.DetectedLocation;
import com.voltquery.model.SubQuestion;
import com.voltquery.provider.LlmProvider;
import com.voltquery.service.resilience.ServiceRegistry;
import com.voltquery.service.tool.ToolDescriptor;
import com.voltquery.service.tool.ToolHandler;
import com.voltquery.service.tool.ToolRequest;
import com.voltquery.service.tool.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decomposes questions into sub-questions, repairs their tool names and dispatches them.
 */
@Slf4j
@Service
public class SubQuestionRouter {

    public static final String LLM_BREAKER = "llm";

    private final Map<String, ToolDescriptor> tools = new LinkedHashMap<>();
    private final SubQuestionParser parser;
    private final ToolClassifier classifier;
    private final LlmProvider llmProvider;
    private final ServiceRegistry serviceRegistry;
    private final VoltQueryProperties properties;

    public SubQuestionRouter(List<ToolHandler> handlers,
                             SubQuestionParser parser,
                             ToolClassifier classifier,
                             LlmProvider llmProvider,
                             ServiceRegistry serviceRegistry,
                             VoltQueryProperties properties) {
        this.parser = parser;
        this.classifier = classifier;
        this.llmProvider = llmProvider;
        this.serviceRegistry = serviceRegistry;
        this.properties = properties;

        for (ToolHandler handler : handlers) {
            if (!properties.toolFor(handler.getName()).isEnabled()) {
                log.info("Tool disabled by configuration: {}", handler.getName());
                continue;
            }
            tools.put(handler.getName(), ToolDescriptor.builder()
                    .name(handler.getName())
                    .description(handler.getDescription())
                    .rules(classifier.rulesFor(handler.getName()))
                    .handler(handler)
                    .build());
        }

        if (tools.isEmpty()) {
            throw new ConfigurationException("At least one tool must be enabled");
        }
        log.info("Initialized SubQuestionRouter with {} tools: {}", tools.size(), tools.keySet());
    }

    /**
     * Ask the LLM for a decomposition and return the parsed, corrected sub-questions.
     * Fails with a parse error on unusable output, or with the LLM call's error.
     */
    public Mono<List<SubQuestion>> decompose(String question) {
        if (!llmProvider.isEnabled()) {
            return Mono.error(new VoltQueryException("LLM provider is not enabled"));
        }

        String prompt = DecompositionPrompt.render(List.copyOf(tools.values()), question);
        Duration timeout = properties.getLlm().getTimeout();

        return serviceRegistry.protect(LLM_BREAKER, LLM_BREAKER, timeout,
                        () -> llmProvider.prompt(DecompositionPrompt.SYSTEM, prompt))
                .map(this::parseAndCorrect)
                .doOnSuccess(subQuestions -> log.info("Decomposed question into {} sub-questions: {}",
                        subQuestions.size(), subQuestions));
    }

    /**
     * Parse raw decomposition output and correct every tool name against the registered tools.
     */
    public List<SubQuestion> parseAndCorrect(String llmOutput) {
        List<SubQuestion> subQuestions = parser.parse(llmOutput);
        Set<String> registered = tools.keySet();
        subQuestions.forEach(subQuestion -> classifier.correct(subQuestion, registered));
        return subQuestions;
    }

    /**
     * The whole question as one sub-question, routed by the classifier.
     */
    public SubQuestion fallbackSubQuestion(String question) {
        SubQuestion subQuestion = new SubQuestion(question, null);
        return classifier.correct(subQuestion, tools.keySet());
    }

    /**
     * Run every sub-question on its tool concurrently. Results keep sub-question order.
     * A failing tool yields a degraded result; programming and configuration errors propagate.
     */
    public Mono<List<ToolResult>> dispatch(List<SubQuestion> subQuestions, DetectedLocation location) {
        return Flux.fromIterable(subQuestions)
                .flatMapSequential(subQuestion -> invoke(subQuestion, location))
                .collectList();
    }

    private Mono<ToolResult> invoke(SubQuestion subQuestion, DetectedLocation location) {
        ToolDescriptor tool = tools.get(subQuestion.getToolName());
        if (tool == null) {
            return Mono.error(new IllegalStateException(
                    "Sub-question routed to unregistered tool: " + subQuestion.getToolName()));
        }

        ToolRequest request = ToolRequest.builder()
                .question(subQuestion.getSubQuestion())
                .location(location)
                .build();
        Duration timeout = properties.toolFor(tool.getName()).getTimeout();

        log.info("Dispatching sub-question to {}: \"{}\"", tool.getName(), subQuestion.getSubQuestion());

        return Mono.defer(() -> tool.getHandler().handle(request))
                .timeout(timeout)
                .map(result -> {
                    if (result.getSubQuestion() == null) {
                        result.setSubQuestion(subQuestion.getSubQuestion());
                    }
                    return result;
                })
                .onErrorResume(error -> !isProgrammingError(error), error -> {
                    log.warn("Tool {} failed for \"{}\": {}", tool.getName(),
                            subQuestion.getSubQuestion(), error.toString());
                    return Mono.just(ToolResult.degraded(tool.getName(), subQuestion.getSubQuestion(),
                            "No data available from " + tool.getName() + ": " + error.getMessage()));
                });
    }

    public static boolean isProgrammingError(Throwable error) {
        return error instanceof ConfigurationException
                || error instanceof NullPointerException
                || error instanceof IllegalStateException
                || error instanceof ClassCastException;
    }

    public Set<String> getToolNames() {
        return tools.keySet();
    }

    public ToolDescriptor getTool(String name) {
        return tools.get(name);
    }
}
