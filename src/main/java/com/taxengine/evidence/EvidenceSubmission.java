package com.taxengine.evidence;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.taxengine.rule.FormulaDraft;

import java.util.List;
import java.util.Map;

/**
 * Evidence rule as delivered by the extraction pipeline. {@code ruleData} is the raw
 * JSON payload; {@link EvidenceContractValidator} turns it into a typed {@code RuleData}.
 */
public record EvidenceSubmission(
    @JsonProperty("id") String id,
    @JsonProperty("rule_type") String ruleType,
    @JsonProperty("category") String category,
    @JsonProperty("title") String title,
    @JsonProperty("rule_data") Map<String, Object> ruleData,
    @JsonProperty("formulas") List<FormulaDraft> formulas,
    @JsonProperty("definitions") Map<String, String> definitions,
    @JsonProperty("inputs") List<String> inputs,
    @JsonProperty("unit") String unit,
    @JsonProperty("document_id") String documentId,
    @JsonProperty("chunk_id") String chunkId,
    @JsonProperty("chunk_confidence") Double chunkConfidence,
    @JsonProperty("effective_date") String effectiveDate,
    @JsonProperty("expiry_date") String expiryDate,
    @JsonProperty("source_authority") String sourceAuthority
) {
}
