package com.taxengine.evidence;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.taxengine.contract.RuleCategory;
import com.taxengine.contract.SourceAuthority;
import com.taxengine.contract.TaxType;
import com.taxengine.contract.ValidationStatus;
import com.taxengine.rule.FormulaDraft;
import com.taxengine.rule.RuleData;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * A tax rule extracted from one source document. Immutable once stored, apart
 * from {@code validationStatus}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EvidenceRule(
    @JsonProperty("id") String id,
    @JsonProperty("rule_type") TaxType ruleType,
    @JsonProperty("category") RuleCategory category,
    @JsonProperty("title") String title,
    @JsonProperty("rule_data") RuleData ruleData,
    @JsonProperty("formulas") List<FormulaDraft> formulas,
    @JsonProperty("definitions") Map<String, String> definitions,
    @JsonProperty("inputs") List<String> inputs,
    @JsonProperty("unit") String unit,
    @JsonProperty("document_id") String documentId,
    @JsonProperty("chunk_id") String chunkId,
    @JsonProperty("chunk_confidence") BigDecimal chunkConfidence,
    @JsonProperty("effective_date") LocalDate effectiveDate,
    @JsonProperty("expiry_date") LocalDate expiryDate,
    @JsonProperty("source_authority") SourceAuthority sourceAuthority,
    @JsonProperty("validation_status") ValidationStatus validationStatus,
    @JsonProperty("created_at") Instant createdAt
) {

    public EvidenceRule {
        formulas = formulas != null ? List.copyOf(formulas) : List.of();
        definitions = definitions != null ? Map.copyOf(definitions) : Map.of();
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
    }

    /**
     * Whether this evidence takes part in aggregating {@code taxType} on {@code date}:
     * same type (or general), in force on that date, and not failed or deprecated.
     */
    public boolean appliesTo(TaxType taxType, LocalDate date) {
        return (ruleType == taxType || ruleType == TaxType.GENERAL)
            && inForceOn(date)
            && isUsable();
    }

    public boolean inForceOn(LocalDate date) {
        return (effectiveDate == null || !effectiveDate.isAfter(date))
            && (expiryDate == null || !expiryDate.isBefore(date));
    }

    public boolean isUsable() {
        return validationStatus != ValidationStatus.FAILED && validationStatus != ValidationStatus.DEPRECATED;
    }

    public EvidenceRule withValidationStatus(ValidationStatus status) {
        return new EvidenceRule(id, ruleType, category, title, ruleData, formulas, definitions, inputs, unit,
            documentId, chunkId, chunkConfidence, effectiveDate, expiryDate, sourceAuthority, status, createdAt);
    }
}
