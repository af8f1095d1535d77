package com.taxengine.aggregation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.taxengine.contract.ConflictAspect;
import com.taxengine.contract.ConflictStatus;
import com.taxengine.contract.TaxType;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Top-tier evidence disagreeing on one slot of an aggregated rule.
 * Created only by aggregation; only an operator decision moves it out of {@code open}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RuleConflict(
    @JsonProperty("id") String id,
    @JsonProperty("tax_type") TaxType taxType,
    @JsonProperty("target_date") LocalDate targetDate,
    @JsonProperty("aspect") ConflictAspect aspect,
    @JsonProperty("slot") String slot,
    @JsonProperty("status") ConflictStatus status,
    @JsonProperty("details") List<ConflictCandidate> details,
    @JsonProperty("resolution") Map<String, Object> resolution,
    @JsonProperty("decided_by") String decidedBy,
    @JsonProperty("decided_at") Instant decidedAt,
    @JsonProperty("created_at") Instant createdAt
) {

    public static final String CHOSEN_EVIDENCE_ID = "chosen_evidence_id";

    public RuleConflict {
        details = details != null ? List.copyOf(details) : List.of();
        resolution = resolution != null ? Map.copyOf(resolution) : Map.of();
    }

    public boolean isBlocking() {
        return !status.isTerminal();
    }

    /** Evidence id picked by the operator, present only on resolved conflicts. */
    public String chosenEvidenceId() {
        Object chosen = resolution.get(CHOSEN_EVIDENCE_ID);
        return status == ConflictStatus.RESOLVED && chosen != null ? chosen.toString() : null;
    }

    public boolean matches(TaxType taxType, LocalDate targetDate, ConflictAspect aspect, String slot) {
        return this.taxType == taxType && this.targetDate.equals(targetDate)
            && this.aspect == aspect && this.slot.equals(slot);
    }

    RuleConflict withDetails(List<ConflictCandidate> newDetails) {
        return new RuleConflict(id, taxType, targetDate, aspect, slot, status, newDetails,
            resolution, decidedBy, decidedAt, createdAt);
    }

    RuleConflict decide(ConflictStatus newStatus, Map<String, Object> newResolution, String by, Instant at) {
        return new RuleConflict(id, taxType, targetDate, aspect, slot, newStatus, details,
            newResolution, by, at, createdAt);
    }
}
