package com.taxengine.aggregation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.taxengine.contract.ErrorType;
import com.taxengine.contract.RunStatus;
import com.taxengine.contract.TaxType;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * One aggregation attempt for a (tax type, target date): queued -> running -> completed | failed.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AggregationRun(
    @JsonProperty("id") String id,
    @JsonProperty("tax_type") TaxType taxType,
    @JsonProperty("target_date") LocalDate targetDate,
    @JsonProperty("status") RunStatus status,
    @JsonProperty("inputs_count") int inputsCount,
    @JsonProperty("outputs_count") int outputsCount,
    @JsonProperty("conflicts_count") int conflictsCount,
    @JsonProperty("rule_id") String ruleId,
    @JsonProperty("error_type") ErrorType errorType,
    @JsonProperty("message") String message,
    @JsonProperty("blockers") List<String> blockers,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("finished_at") Instant finishedAt
) {

    public AggregationRun {
        blockers = blockers != null ? List.copyOf(blockers) : List.of();
    }

    public static AggregationRun queued(String id, TaxType taxType, LocalDate targetDate, Instant at) {
        return new AggregationRun(id, taxType, targetDate, RunStatus.QUEUED, 0, 0, 0, null, null, null,
            List.of(), at, null, null);
    }

    public static String key(TaxType taxType, LocalDate targetDate) {
        return taxType.getValue() + ":" + targetDate;
    }

    public String key() {
        return key(taxType, targetDate);
    }

    public AggregationRun running(Instant at) {
        return new AggregationRun(id, taxType, targetDate, RunStatus.RUNNING, inputsCount, outputsCount,
            conflictsCount, ruleId, errorType, message, blockers, createdAt, at, finishedAt);
    }

    public AggregationRun completed(int inputs, int outputs, int conflicts, String resultRuleId, Instant at) {
        return new AggregationRun(id, taxType, targetDate, RunStatus.COMPLETED, inputs, outputs, conflicts,
            resultRuleId, null, null, blockers, createdAt, startedAt, at);
    }

    public AggregationRun failed(int inputs, int outputs, int conflicts, String resultRuleId,
                                 ErrorType error, String reason, List<String> runBlockers, Instant at) {
        return new AggregationRun(id, taxType, targetDate, RunStatus.FAILED, inputs, outputs, conflicts,
            resultRuleId, error, reason, runBlockers, createdAt, startedAt, at);
    }
}
