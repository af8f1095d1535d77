package com.taxengine.rule;

import com.taxengine.contract.TaxType;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface RuleStore {

    AggregatedRule save(AggregatedRule rule);

    Optional<AggregatedRule> findById(String ruleId);

    /**
     * Replaces {@code expected} with {@code next} only if {@code expected} is still the stored snapshot.
     */
    boolean compareAndSet(AggregatedRule expected, AggregatedRule next);

    /**
     * The non-deprecated rule of the given type with the latest target date on or before {@code date}.
     */
    Optional<AggregatedRule> findApplicable(TaxType taxType, LocalDate date);

    List<AggregatedRule> list(Optional<TaxType> taxType);

    long count();
}
