package com.taxengine.aggregation;

import com.taxengine.contract.ConflictAspect;
import com.taxengine.evidence.EvidenceRule;

/**
 * A value one evidence rule contributes to one slot of the aggregated rule.
 *
 * @param value      what the slot receives when this candidate wins
 * @param comparable form used to decide agreement (normalized text, rendered formula, numbers, brackets)
 */
public record SlotCandidate(EvidenceRule evidence, ConflictAspect aspect, String slot, Object value, Object comparable) {

    public String evidenceRuleId() {
        return evidence.id();
    }

    public int authorityRank() {
        return evidence.sourceAuthority().rank();
    }

    ConflictCandidate toConflictCandidate() {
        return new ConflictCandidate(evidence.id(), evidence.sourceAuthority(), evidence.effectiveDate(),
            evidence.chunkConfidence(), value);
    }
}
