package com.taxengine.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Tax types a rule or calculation applies to. GENERAL evidence applies to every type.
 */
public enum TaxType {
    INCOME_TAX("income_tax"),
    VAT("vat"),
    PAYE("paye"),
    WHT("wht"),
    NBT("nbt"),
    SSCL("sscl"),
    GENERAL("general");

    private final String value;

    TaxType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static TaxType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown tax type: " + raw));
    }
}
