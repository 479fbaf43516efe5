package com.voltquery.service.scenario;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.voltquery.exception.BranchException;
import lombok.Value;

import java.util.Map;

/**
 * Settled outcome of one branch: either {@code outcome} or {@code error} is set.
 */
@Value
public class ScenarioResult<T> {
    String name;
    Map<String, Object> params;
    T outcome;

    @JsonIgnore
    BranchException error;

    public static <T> ScenarioResult<T> success(ScenarioVariant variant, T outcome) {
        return new ScenarioResult<>(variant.getName(), variant.getParams(), outcome, null);
    }

    public static <T> ScenarioResult<T> failure(ScenarioVariant variant, BranchException error) {
        return new ScenarioResult<>(variant.getName(), variant.getParams(), null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Message of the underlying failure, for API responses.
     */
    public String getErrorMessage() {
        if (error == null) {
            return null;
        }
        Throwable cause = error.getCause() != null ? error.getCause() : error;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
