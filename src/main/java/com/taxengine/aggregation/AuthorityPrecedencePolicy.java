package com.taxengine.aggregation;

import com.taxengine.rule.AggregatedRuleSource;
import com.taxengine.rule.Numbers;
import com.taxengine.rule.TaxBracket;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Ranks by source authority (Act first, Other last), then newest effective date,
 * then highest chunk confidence, then evidence id.
 *
 * Only the top authority tier can conflict. When it agrees, every agreeing candidate
 * becomes a source weighted {@code 1 / (position + 1)} and lower-tier dissenters are
 * recorded as overridden with weight 0.
 */
public class AuthorityPrecedencePolicy implements ReconciliationPolicy {

    private static final Comparator<SlotCandidate> RANKING = Comparator
        .comparingInt(SlotCandidate::authorityRank)
        .thenComparing((SlotCandidate c) -> c.evidence().effectiveDate(),
            Comparator.nullsLast(Comparator.<LocalDate>reverseOrder()))
        .thenComparing((SlotCandidate c) -> c.evidence().chunkConfidence(),
            Comparator.nullsLast(Comparator.<BigDecimal>reverseOrder()))
        .thenComparing(SlotCandidate::evidenceRuleId);

    private final BigDecimal tolerance;

    public AuthorityPrecedencePolicy(BigDecimal tolerance) {
        this.tolerance = tolerance;
    }

    @Override
    public Comparator<SlotCandidate> ranking() {
        return RANKING;
    }

    @Override
    public Outcome reconcile(List<SlotCandidate> ranked) {
        SlotCandidate best = ranked.get(0);
        List<SlotCandidate> topTier = ranked.stream()
            .filter(c -> c.authorityRank() == best.authorityRank())
            .toList();
        boolean unanimous = topTier.stream().allMatch(c -> agree(best, c));
        if (!unanimous) {
            return new Outcome.Conflicted(topTier);
        }
        return accept(ranked, best, AggregatedRuleSource.PRIMARY);
    }

    @Override
    public Outcome.Accepted accept(List<SlotCandidate> ranked, SlotCandidate winner, String winnerReason) {
        List<AggregatedRuleSource> sources = new ArrayList<>();
        sources.add(source(winner, BigDecimal.ONE, winnerReason));
        int position = 1;
        for (SlotCandidate candidate : ranked) {
            if (candidate == winner) {
                continue;
            }
            if (agree(winner, candidate)) {
                BigDecimal weight = BigDecimal.ONE.divide(BigDecimal.valueOf(position + 1L), Numbers.RATE_SCALE,
                    RoundingMode.HALF_UP);
                sources.add(source(candidate, weight, AggregatedRuleSource.CORROBORATING));
                position++;
            } else {
                sources.add(source(candidate, BigDecimal.ZERO.setScale(Numbers.RATE_SCALE),
                    AggregatedRuleSource.OVERRIDDEN));
            }
        }
        return new Outcome.Accepted(winner, sources);
    }

    @Override
    public boolean agree(SlotCandidate a, SlotCandidate b) {
        return same(a.comparable(), b.comparable());
    }

    private boolean same(Object a, Object b) {
        if (a instanceof BigDecimal x && b instanceof BigDecimal y) {
            return Numbers.withinTolerance(x, y, tolerance);
        }
        if (a instanceof List<?> x && b instanceof List<?> y) {
            if (x.size() != y.size()) {
                return false;
            }
            for (int i = 0; i < x.size(); i++) {
                if (!same(x.get(i), y.get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (a instanceof TaxBracket x && b instanceof TaxBracket y) {
            return x.bracketOrder() == y.bracketOrder()
                && Numbers.withinTolerance(x.minIncome(), y.minIncome(), tolerance)
                && Numbers.withinTolerance(x.maxIncome(), y.maxIncome(), tolerance)
                && Numbers.withinTolerance(x.rate(), y.rate(), tolerance)
                && Numbers.withinTolerance(x.fixedAmount(), y.fixedAmount(), tolerance);
        }
        return Objects.equals(a, b);
    }

    private static AggregatedRuleSource source(SlotCandidate candidate, BigDecimal weight, String reason) {
        return new AggregatedRuleSource(candidate.evidenceRuleId(), candidate.aspect(), candidate.slot(),
            Numbers.rate(weight), reason);
    }
}
