package com.voltquery.service.scenario;

import com.voltquery.exception.BranchException;
import com.voltquery.exception.VoltQueryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Runs independent parameterized invocations of one slow operation concurrently.
 * <p>
 * Every branch settles on its own. A failing or timed-out branch is recorded as a
 * {@link BranchException} in the report and never cancels its siblings; the returned
 * {@code Mono} itself does not fail because of a branch. Cancelling the subscription
 * cancels every branch still running.
 */
@Slf4j
@Component
public class ScenarioBranchExecutor {

    public <B, T> Mono<ScenarioBranchReport<T>> runBranches(B baseRequest,
                                                             List<ScenarioVariant> variants,
                                                             BiFunction<B, ScenarioVariant, Mono<T>> operation) {
        return runBranches(baseRequest, variants, operation, null);
    }

    /**
     * @param baseRequest   parameters shared by every branch
     * @param variants      one branch per variant
     * @param operation     invoked with the base request and a variant
     * @param branchTimeout optional limit applied to each branch separately
     */
    public <B, T> Mono<ScenarioBranchReport<T>> runBranches(B baseRequest,
                                                             List<ScenarioVariant> variants,
                                                             BiFunction<B, ScenarioVariant, Mono<T>> operation,
                                                             Duration branchTimeout) {
        if (variants.isEmpty()) {
            return Mono.just(new ScenarioBranchReport<>(List.of()));
        }
        log.info("scenario_branches count={} names={}", variants.size(),
                variants.stream().map(ScenarioVariant::getName).toList());

        return Flux.fromIterable(variants)
                .flatMapSequential(variant -> runBranch(baseRequest, variant, operation, branchTimeout),
                        variants.size())
                .collectList()
                .map(results -> new ScenarioBranchReport<T>(results))
                .doOnNext(report -> log.info("scenario_branches settled succeeded={} failed={}",
                        report.getSuccesses().size(), report.getFailures().size()));
    }

    private <B, T> Mono<ScenarioResult<T>> runBranch(B baseRequest,
                                                     ScenarioVariant variant,
                                                     BiFunction<B, ScenarioVariant, Mono<T>> operation,
                                                     Duration branchTimeout) {
        Mono<T> invocation = Mono.defer(() -> operation.apply(baseRequest, variant));
        if (branchTimeout != null) {
            invocation = invocation.timeout(branchTimeout);
        }
        return invocation
                .map(outcome -> ScenarioResult.<T>success(variant, outcome))
                .switchIfEmpty(Mono.error(() -> new VoltQueryException("branch produced no result")))
                .onErrorResume(error -> {
                    log.warn("scenario_branch name={} outcome=failed error={}", variant.getName(), error.toString());
                    return Mono.just(ScenarioResult.<T>failure(variant, new BranchException(variant.getName(), error)));
                });
    }
}
