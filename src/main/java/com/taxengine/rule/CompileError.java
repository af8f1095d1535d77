package com.taxengine.rule;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.taxengine.contract.ErrorType;
import com.taxengine.contract.RuleEngineException;

/**
 * Why an aggregated rule failed to compile. Kept outside the content hash.
 */
public record CompileError(
    @JsonProperty("error_type") ErrorType errorType,
    @JsonProperty("failed_step") String failedStep,
    @JsonProperty("message") String message
) {

    public static CompileError of(RuleEngineException failure) {
        return new CompileError(failure.getErrorType(), failure.getFailedStep(), failure.getMessage());
    }

    public RuleEngineException toException(String ruleId) {
        return new RuleEngineException(errorType, failedStep, "rule " + ruleId + " did not compile: " + message);
    }
}
