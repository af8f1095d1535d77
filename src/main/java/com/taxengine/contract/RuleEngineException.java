package com.taxengine.contract;

/**
 * A typed failure from compilation or execution. Carries the taxonomy entry and
 * the step that was running when it happened, so callers can record it as-is.
 */
public class RuleEngineException extends RuntimeException {

    private final ErrorType errorType;
    private final String failedStep;

    public RuleEngineException(ErrorType errorType, String failedStep, String message) {
        super(message);
        this.errorType = errorType;
        this.failedStep = failedStep;
    }

    public RuleEngineException(ErrorType errorType, String failedStep, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.failedStep = failedStep;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getFailedStep() {
        return failedStep;
    }
}
