package com.taxengine.aggregation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.taxengine.contract.SourceAuthority;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One of the disagreeing values recorded on a conflict, with where it came from.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConflictCandidate(
    @JsonProperty("evidence_rule_id") String evidenceRuleId,
    @JsonProperty("source_authority") SourceAuthority sourceAuthority,
    @JsonProperty("effective_date") LocalDate effectiveDate,
    @JsonProperty("chunk_confidence") BigDecimal chunkConfidence,
    @JsonProperty("value") Object value
) {
}
