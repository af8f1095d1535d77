package com.taxengine.rule;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FormulaStatus {
    ACTIVE("active"),
    INACTIVE("inactive"),
    FAILED("failed");

    private final String value;

    FormulaStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
