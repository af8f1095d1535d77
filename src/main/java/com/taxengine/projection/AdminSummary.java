package com.taxengine.projection;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only operational counts across the engine.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AdminSummary(
    @JsonProperty("evidence_rules") long evidenceRules,
    @JsonProperty("aggregated_rules") long aggregatedRules,
    @JsonProperty("aggregated_rules_by_status") Map<String, Long> aggregatedRulesByStatus,
    @JsonProperty("blocking_conflicts") long blockingConflicts,
    @JsonProperty("pending_synonyms") long pendingSynonyms,
    @JsonProperty("active_variables") long activeVariables,
    @JsonProperty("active_form_schemas") long activeFormSchemas,
    @JsonProperty("calculations_audited") long calculationsAudited,
    @JsonProperty("unresolved_calculation_errors") long unresolvedCalculationErrors,
    @JsonProperty("generated_at") Instant generatedAt
) {
}
