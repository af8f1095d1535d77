package com.taxengine.aggregation;

import com.taxengine.contract.ConflictAspect;

import java.util.Set;

/**
 * @param requiredAspects aspects whose unresolved conflicts fail the aggregation run
 */
public record AggregationSettings(Set<ConflictAspect> requiredAspects) {

    public AggregationSettings {
        requiredAspects = Set.copyOf(requiredAspects);
    }
}
