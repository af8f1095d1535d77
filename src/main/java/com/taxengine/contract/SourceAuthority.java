package com.taxengine.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Legal weight of the document an evidence rule was extracted from.
 * Lower rank wins: an Act overrides a Gazette, which overrides a Regulation, and so on.
 */
public enum SourceAuthority {
    ACT("act", 1),
    GAZETTE("gazette", 2),
    REGULATION("regulation", 3),
    CIRCULAR("circular", 4),
    RULING("ruling", 5),
    GUIDELINE("guideline", 6),
    NOTICE("notice", 7),
    OTHER("other", 8);

    private final String value;
    private final int rank;

    SourceAuthority(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int rank() {
        return rank;
    }

    @JsonCreator
    public static SourceAuthority fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown source authority: " + raw));
    }
}
