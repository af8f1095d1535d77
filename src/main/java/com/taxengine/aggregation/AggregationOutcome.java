package com.taxengine.aggregation;

import com.taxengine.rule.AggregatedRule;

import java.util.List;
import java.util.Optional;

/**
 * Result of one aggregation request: the finished run and, unless preflight blocked it,
 * the aggregated rule it produced.
 */
public record AggregationOutcome(AggregationRun run, Optional<AggregatedRule> rule, List<String> blockers,
                                 List<RuleConflict> conflicts) {

    public static final String BLOCKED = "blocked";

    public AggregationOutcome {
        blockers = List.copyOf(blockers);
        conflicts = List.copyOf(conflicts);
    }

    public boolean isBlocked() {
        return !blockers.isEmpty();
    }

    /** {@code blocked} when preflight stopped the run, otherwise the run status. */
    public String status() {
        return isBlocked() ? BLOCKED : run.status().getValue();
    }
}
