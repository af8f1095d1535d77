package com.taxengine.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum RuleCategory {
    BRACKET("bracket"),
    DEDUCTION("deduction"),
    EXEMPTION("exemption"),
    RATE("rate"),
    THRESHOLD("threshold"),
    ALLOWANCE("allowance");

    private final String value;

    RuleCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static RuleCategory fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown rule category: " + raw));
    }
}
