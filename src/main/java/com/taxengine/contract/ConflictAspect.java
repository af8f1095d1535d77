package com.taxengine.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Dimension of a rule that evidence can disagree on.
 */
public enum ConflictAspect {
    BRACKETS("brackets"),
    THRESHOLDS("thresholds"),
    DEFINITIONS("definitions"),
    FORMULAS("formulas"),
    UNITS("units"),
    INPUTS("inputs"),
    OTHER("other");

    private final String value;

    ConflictAspect(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ConflictAspect fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown conflict aspect: " + raw));
    }
}
