package com.taxengine.aggregation;

import com.taxengine.rule.AggregatedRuleSource;

import java.util.Comparator;
import java.util.List;

/**
 * Decides the value of one slot from the candidates competing for it.
 * Policies are deterministic: the same candidates always give the same outcome.
 */
public interface ReconciliationPolicy {

    /** Best candidate first. */
    Comparator<SlotCandidate> ranking();

    boolean agree(SlotCandidate a, SlotCandidate b);

    /**
     * @param ranked candidates sorted by {@link #ranking()}, never empty
     */
    Outcome reconcile(List<SlotCandidate> ranked);

    /**
     * Accepts {@code winner} without checking for disagreement, as after an operator decision.
     */
    Outcome.Accepted accept(List<SlotCandidate> ranked, SlotCandidate winner, String winnerReason);

    sealed interface Outcome {
        record Accepted(SlotCandidate winner, List<AggregatedRuleSource> sources) implements Outcome {
            public Accepted {
                sources = List.copyOf(sources);
            }
        }

        record Conflicted(List<SlotCandidate> disagreeing) implements Outcome {
            public Conflicted {
                disagreeing = List.copyOf(disagreeing);
            }
        }
    }
}
