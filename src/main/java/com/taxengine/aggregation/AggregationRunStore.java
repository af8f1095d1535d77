package com.taxengine.aggregation;

import com.taxengine.contract.TaxType;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

public interface AggregationRunStore {

    /**
     * Stores {@code queued} unless its key already has a non-terminal run. Check and
     * insert are atomic.
     *
     * @return the active run that blocked the start, or empty when {@code queued} was stored
     */
    Optional<AggregationRun> tryStart(AggregationRun queued);

    /**
     * Applies {@code change} to a run that is still queued or running. Terminal runs are
     * left untouched, so a supervisor's failure is never overwritten by a late finisher.
     *
     * @return the updated run, or empty when the run had already finished
     */
    Optional<AggregationRun> advance(String id, UnaryOperator<AggregationRun> change);

    Optional<AggregationRun> findById(String id);

    Optional<AggregationRun> findActive(TaxType taxType, LocalDate targetDate);

    List<AggregationRun> list(Optional<TaxType> taxType, Optional<LocalDate> targetDate);
}
