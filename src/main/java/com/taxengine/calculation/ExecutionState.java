package com.taxengine.calculation;

/**
 * Per-request state machine: pending -> resolving_variables -> evaluating -> completed | failed.
 * The state active when a failure occurs becomes the recorded {@code failed_step}.
 */
public enum ExecutionState {
    PENDING("pending"),
    RULE_LOOKUP("rule_lookup"),
    RESOLVING_VARIABLES("resolving_variables"),
    EVALUATING("evaluating"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    ExecutionState(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
