package com.taxengine.aggregation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.taxengine.contract.PreflightStatus;
import com.taxengine.contract.TaxType;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Read-only readiness snapshot for a (tax type, target date).
 */
public record PreflightRun(
    @JsonProperty("id") String id,
    @JsonProperty("taxType") TaxType taxType,
    @JsonProperty("targetDate") LocalDate targetDate,
    @JsonProperty("status") PreflightStatus status,
    @JsonProperty("evidenceCount") int evidenceCount,
    @JsonProperty("aggregatedCount") int aggregatedCount,
    @JsonProperty("blockers") List<String> blockers,
    @JsonProperty("checkedAt") Instant checkedAt
) {

    public static final String NO_EVIDENCE = "NO_EVIDENCE";
    public static final String AGGREGATION_IN_PROGRESS = "AGGREGATION_IN_PROGRESS";
    public static final String INVALID_EVIDENCE_ONLY = "INVALID_EVIDENCE_ONLY";

    public PreflightRun {
        blockers = blockers != null ? List.copyOf(blockers) : List.of();
    }

    public boolean isBlocked() {
        return status == PreflightStatus.BLOCKED;
    }
}
