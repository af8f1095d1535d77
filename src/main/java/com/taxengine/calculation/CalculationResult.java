package com.taxengine.calculation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.taxengine.audit.BreakdownLine;
import com.taxengine.audit.CalculationAudit;

import java.math.BigDecimal;
import java.util.List;
import java.util.SortedMap;

public record CalculationResult(
    @JsonProperty("executionId") String executionId,
    @JsonProperty("result") SortedMap<String, BigDecimal> result,
    @JsonProperty("breakdown") List<BreakdownLine> breakdown,
    @JsonProperty("schemaVersion") Integer schemaVersion,
    @JsonProperty("finalAmount") BigDecimal finalAmount,
    @JsonProperty("preview") boolean preview,
    @JsonProperty("ruleId") String ruleId,
    @JsonProperty("ruleVersion") int ruleVersion
) {

    public static CalculationResult fromAudit(CalculationAudit audit) {
        return new CalculationResult(audit.executionId(), audit.outputs(), audit.breakdown(), audit.schemaVersion(),
            audit.finalAmount(), audit.preview(), audit.ruleId(), audit.ruleVersion());
    }
}
