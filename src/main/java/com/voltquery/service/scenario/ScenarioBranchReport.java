package com.voltquery.service.scenario;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * All branch results of one run, in the order the variants were given.
 */
@Value
public class ScenarioBranchReport<T> {
    List<ScenarioResult<T>> results;

    @JsonIgnore
    public List<ScenarioResult<T>> getSuccesses() {
        return results.stream().filter(ScenarioResult::isSuccess).toList();
    }

    @JsonIgnore
    public List<ScenarioResult<T>> getFailures() {
        return results.stream().filter(result -> !result.isSuccess()).toList();
    }

    public Optional<ScenarioResult<T>> find(String name) {
        return results.stream().filter(result -> result.getName().equals(name)).findFirst();
    }

    /**
     * Outcome of a named branch if that branch succeeded.
     */
    public Optional<T> outcome(String name) {
        return find(name).filter(ScenarioResult::isSuccess).map(ScenarioResult::getOutcome);
    }

    public boolean isAllFailed() {
        return !results.isEmpty() && getSuccesses().isEmpty();
    }
}
