package com.taxengine.evidence;

import com.taxengine.contract.TaxType;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface EvidenceRuleStore {

    EvidenceRule append(EvidenceRule rule);

    Optional<EvidenceRule> findById(String id);

    boolean existsById(String id);

    /** Evidence applicable to aggregating {@code taxType} on {@code date}, in insertion order. */
    List<EvidenceRule> findApplicable(TaxType taxType, LocalDate date);

    /** Like {@link #findApplicable} but regardless of validation status. */
    List<EvidenceRule> findInForce(TaxType taxType, LocalDate date);

    List<EvidenceRule> query(Optional<TaxType> ruleType, Optional<LocalDate> inForceOn, int limit);

    EvidenceRule replace(EvidenceRule rule);

    long count();
}
