package com.taxengine.audit;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.taxengine.contract.TaxType;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Record of one successful calculation. There is exactly one per execution id.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CalculationAudit(
    @JsonProperty("execution_id") String executionId,
    @JsonProperty("calculation_type") TaxType calculationType,
    @JsonProperty("rule_id") String ruleId,
    @JsonProperty("rule_version") int ruleVersion,
    @JsonProperty("schema_version") Integer schemaVersion,
    @JsonProperty("input") Map<String, Object> input,
    @JsonProperty("outputs") SortedMap<String, BigDecimal> outputs,
    @JsonProperty("breakdown") List<BreakdownLine> breakdown,
    @JsonProperty("final_amount") BigDecimal finalAmount,
    @JsonProperty("preview") boolean preview,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("duration_ms") long durationMs
) {

    public CalculationAudit {
        breakdown = List.copyOf(breakdown);
    }
}
