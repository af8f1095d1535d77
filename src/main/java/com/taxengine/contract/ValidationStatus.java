package com.taxengine.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

public enum ValidationStatus {
    PENDING("pending"),
    VALIDATED("validated"),
    FAILED("failed"),
    DEPRECATED("deprecated");

    private final String value;

    ValidationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Statuses reachable from this one through an explicit transition request.
     */
    public Set<ValidationStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(VALIDATED, FAILED, DEPRECATED);
            case VALIDATED, FAILED -> EnumSet.of(DEPRECATED);
            case DEPRECATED -> EnumSet.noneOf(ValidationStatus.class);
        };
    }

    public boolean canTransitionTo(ValidationStatus target) {
        return allowedTargets().contains(target);
    }

    @JsonCreator
    public static ValidationStatus fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown validation status: " + raw));
    }
}
