package com.taxengine.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum VariableDataType {
    STRING("string"),
    NUMBER("number"),
    INTEGER("integer"),
    BOOLEAN("boolean"),
    DATE("date"),
    CURRENCY("currency"),
    PERCENT("percent");

    private final String value;

    VariableDataType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Whether values of this type can take part in formula arithmetic. */
    public boolean isNumeric() {
        return this == NUMBER || this == INTEGER || this == CURRENCY || this == PERCENT || this == BOOLEAN;
    }

    @JsonCreator
    public static VariableDataType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown variable data type: " + raw));
    }
}
