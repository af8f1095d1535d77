package com.taxengine.registry;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.taxengine.contract.TaxType;

/**
 * One entry of a synonym proposal batch produced by the extraction pipeline.
 */
public record SynonymProposal(
    @JsonProperty("term") String term,
    @JsonProperty("suggested_variable_key") String suggestedVariableKey,
    @JsonProperty("confidence") Double confidence,
    @JsonProperty("document_id") String documentId,
    @JsonProperty("tax_type") TaxType taxType
) {
}
