package com.taxengine.aggregation;

import com.taxengine.contract.ConflictAspect;
import com.taxengine.contract.ConflictStatus;
import com.taxengine.contract.TaxType;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface ConflictStore {

    RuleConflict save(RuleConflict conflict);

    Optional<RuleConflict> findById(String id);

    /** The most recent conflict recorded for a slot. */
    Optional<RuleConflict> findBySlot(TaxType taxType, LocalDate targetDate, ConflictAspect aspect, String slot);

    List<RuleConflict> list(Optional<TaxType> taxType, Optional<LocalDate> targetDate, Optional<ConflictStatus> status);

    long countBlocking();
}
