package com.taxengine.audit;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.taxengine.contract.ErrorType;

import java.time.Instant;

/**
 * Record of one failed calculation, kept unresolved until an operator follows up.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CalculationError(
    @JsonProperty("id") String id,
    @JsonProperty("execution_id") String executionId,
    @JsonProperty("calculation_type") String calculationType,
    @JsonProperty("error_type") ErrorType errorType,
    @JsonProperty("message") String message,
    @JsonProperty("failed_step") String failedStep,
    @JsonProperty("retry_count") int retryCount,
    @JsonProperty("resolved") boolean resolved,
    @JsonProperty("resolved_by") String resolvedBy,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("resolved_at") Instant resolvedAt
) {

    CalculationError resolve(String by, Instant at) {
        return new CalculationError(id, executionId, calculationType, errorType, message, failedStep, retryCount,
            true, by, createdAt, at);
    }
}
