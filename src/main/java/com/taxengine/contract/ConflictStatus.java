package com.taxengine.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ConflictStatus {
    OPEN("open"),
    UNDER_REVIEW("under_review"),
    RESOLVED("resolved"),
    DISMISSED("dismissed");

    private final String value;

    ConflictStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Resolved and dismissed conflicts no longer block their aspect. */
    public boolean isTerminal() {
        return this == RESOLVED || this == DISMISSED;
    }

    @JsonCreator
    public static ConflictStatus fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown conflict status: " + raw));
    }
}
