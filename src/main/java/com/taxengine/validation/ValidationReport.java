package com.taxengine.validation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.taxengine.contract.ValidationStatus;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of a validation-status transition request.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ValidationReport(
    @JsonProperty("rule_id") String ruleId,
    @JsonProperty("rule_version") int ruleVersion,
    @JsonProperty("from_status") ValidationStatus fromStatus,
    @JsonProperty("requested_status") ValidationStatus requestedStatus,
    @JsonProperty("applied") boolean applied,
    @JsonProperty("blockers") List<String> blockers,
    @JsonProperty("results") List<TestResult> results
) {

    public ValidationReport {
        blockers = List.copyOf(blockers);
        results = List.copyOf(results);
    }

    public List<String> failedTests() {
        return results.stream().filter(r -> !r.passed()).map(TestResult::testName).toList();
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record TestResult(
        @JsonProperty("test_name") String testName,
        @JsonProperty("passed") boolean passed,
        @JsonProperty("expected_final_amount") BigDecimal expectedFinalAmount,
        @JsonProperty("actual_final_amount") BigDecimal actualFinalAmount,
        @JsonProperty("mismatches") List<String> mismatches
    ) {
        public TestResult {
            mismatches = List.copyOf(mismatches);
        }
    }
}
