package com.taxengine.validation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Map;

public record TestCaseDraft(
    @JsonProperty("test_name") String testName,
    @JsonProperty("input") Map<String, Object> input,
    @JsonProperty("expected_final_amount") BigDecimal expectedFinalAmount,
    @JsonProperty("expected_outputs") Map<String, BigDecimal> expectedOutputs,
    @JsonProperty("tolerance") BigDecimal tolerance
) {
}
