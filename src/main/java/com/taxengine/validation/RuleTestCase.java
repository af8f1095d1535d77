package com.taxengine.validation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * A named regression fixture for one aggregated rule. {@code (ruleId, testName)} is unique.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RuleTestCase(
    @JsonProperty("rule_id") String ruleId,
    @JsonProperty("test_name") String testName,
    @JsonProperty("input") Map<String, Object> input,
    @JsonProperty("expected_final_amount") BigDecimal expectedFinalAmount,
    @JsonProperty("expected_outputs") Map<String, BigDecimal> expectedOutputs,
    @JsonProperty("tolerance") BigDecimal tolerance,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt
) {

    public static final BigDecimal DEFAULT_TOLERANCE = new BigDecimal("0.01");

    public RuleTestCase {
        input = input != null ? input : Map.of();
        expectedOutputs = expectedOutputs != null ? Map.copyOf(expectedOutputs) : Map.of();
        tolerance = tolerance != null ? tolerance : DEFAULT_TOLERANCE;
    }
}
