package com.taxengine.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Failure taxonomy shared by compilation, execution and audit.
 * Only infrastructure failures are retried; rule and numeric failures are terminal.
 */
public enum ErrorType {
    FORMULA_PARSE_ERROR("formula_parse_error"),
    VARIABLE_MISSING("variable_missing"),
    CALCULATION_OVERFLOW("calculation_overflow"),
    RULE_VALIDATION_FAILED("rule_validation_failed"),
    DATABASE_ERROR("database_error"),
    UNKNOWN_ERROR("unknown_error");

    private final String value;

    ErrorType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isRetryable() {
        return this == DATABASE_ERROR || this == UNKNOWN_ERROR;
    }

    @JsonCreator
    public static ErrorType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown error type: " + raw));
    }
}
