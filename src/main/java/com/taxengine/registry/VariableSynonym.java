package com.taxengine.registry;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.taxengine.contract.SynonymStatus;
import com.taxengine.contract.TaxType;

import java.time.Instant;

/**
 * A raw extracted term waiting for, or bound by, a human mapping decision.
 * {@code normalizedTerm} is unique across the registry.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record VariableSynonym(
    @JsonProperty("id") String id,
    @JsonProperty("raw_term") String rawTerm,
    @JsonProperty("normalized_term") String normalizedTerm,
    @JsonProperty("variable_key") String variableKey,
    @JsonProperty("suggested_variable_key") String suggestedVariableKey,
    @JsonProperty("confidence") Double confidence,
    @JsonProperty("document_id") String documentId,
    @JsonProperty("tax_type") TaxType taxType,
    @JsonProperty("status") SynonymStatus status,
    @JsonProperty("decided_by") String decidedBy,
    @JsonProperty("decided_at") Instant decidedAt,
    @JsonProperty("proposal_count") int proposalCount,
    @JsonProperty("created_at") Instant createdAt
) {

    VariableSynonym mergeProposal(SynonymProposal proposal) {
        boolean better = proposal.confidence() != null
            && (confidence == null || proposal.confidence() > confidence);
        return new VariableSynonym(id, rawTerm, normalizedTerm, variableKey,
            better && proposal.suggestedVariableKey() != null ? proposal.suggestedVariableKey() : suggestedVariableKey,
            better ? proposal.confidence() : confidence,
            documentId != null ? documentId : proposal.documentId(),
            taxType != null ? taxType : proposal.taxType(),
            status, decidedBy, decidedAt, proposalCount + 1, createdAt);
    }

    VariableSynonym decide(SynonymStatus decision, String boundKey, String decider, Instant at) {
        return new VariableSynonym(id, rawTerm, normalizedTerm, boundKey, suggestedVariableKey,
            confidence, documentId, taxType, decision, decider, at, proposalCount, createdAt);
    }
}
