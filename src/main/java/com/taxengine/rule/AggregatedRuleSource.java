package com.taxengine.rule;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.taxengine.contract.ConflictAspect;

import java.math.BigDecimal;

/**
 * Provenance link from an aggregated value back to one evidence rule.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AggregatedRuleSource(
    @JsonProperty("evidence_rule_id") String evidenceRuleId,
    @JsonProperty("aspect") ConflictAspect aspect,
    @JsonProperty("slot") String slot,
    @JsonProperty("weight") BigDecimal weight,
    @JsonProperty("reason") String reason
) {

    public static final String PRIMARY = "primary";
    public static final String CORROBORATING = "corroborating";
    public static final String OVERRIDDEN = "overridden";
    public static final String OPERATOR_DECISION = "operator_decision";
}
