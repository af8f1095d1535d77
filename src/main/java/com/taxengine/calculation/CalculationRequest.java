package com.taxengine.calculation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record CalculationRequest(
    @JsonProperty("calculationType") String calculationType,
    @JsonProperty("inputData") Map<String, Object> inputData,
    @JsonProperty("targetDate") String targetDate,
    @JsonProperty("executionId") String executionId
) {
}
