package com.taxengine.rule;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.taxengine.contract.TaxType;
import com.taxengine.contract.ValidationStatus;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * The canonical, cross-source reconciled rule for one (tax type, target date).
 *
 * Instances are immutable snapshots; the store replaces them atomically, so a
 * calculation that picked a snapshot never sees a concurrent aggregation.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AggregatedRule(
    @JsonProperty("rule_id") String ruleId,
    @JsonProperty("tax_type") TaxType taxType,
    @JsonProperty("target_date") LocalDate targetDate,
    @JsonProperty("version") int version,
    @JsonProperty("source_kind") String sourceKind,
    @JsonProperty("content") RuleContent content,
    @JsonProperty("sources") List<AggregatedRuleSource> sources,
    @JsonProperty("validation_status") ValidationStatus validationStatus,
    @JsonProperty("content_hash") String contentHash,
    @JsonProperty("compile_error") CompileError compileError,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt
) {

    public static final String SOURCE_KIND = "aggregated";

    public AggregatedRule {
        sources = sources != null ? List.copyOf(sources) : List.of();
    }

    public static String ruleId(TaxType taxType, LocalDate targetDate) {
        return taxType.getValue() + ":" + targetDate;
    }

    public AggregatedRule withValidationStatus(ValidationStatus status, Instant at) {
        return new AggregatedRule(ruleId, taxType, targetDate, version, sourceKind, content, sources,
            status, contentHash, compileError, createdAt, at);
    }
}
