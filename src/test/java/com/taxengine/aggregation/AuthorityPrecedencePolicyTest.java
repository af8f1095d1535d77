package com.taxengine.aggregation;

import com.taxengine.contract.ConflictAspect;
import com.taxengine.contract.RuleCategory;
import com.taxengine.contract.SourceAuthority;
import com.taxengine.contract.TaxType;
import com.taxengine.contract.ValidationStatus;
import com.taxengine.evidence.EvidenceRule;
import com.taxengine.rule.AggregatedRuleSource;
import com.taxengine.rule.RuleData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AuthorityPrecedencePolicyTest {

    private AuthorityPrecedencePolicy policy;

    @BeforeEach
    void setUp() {
        policy = new AuthorityPrecedencePolicy(new BigDecimal("0.0001"));
    }

    @Test
    void ranking_prefersAuthorityThenNewestThenConfidence() {
        SlotCandidate circular = candidate("c", SourceAuthority.CIRCULAR, "2025-06-01", "0.99", "0.18");
        SlotCandidate olderAct = candidate("b", SourceAuthority.ACT, "2024-01-01", "0.99", "0.18");
        SlotCandidate newerAct = candidate("a", SourceAuthority.ACT, "2025-01-01", "0.50", "0.18");
        SlotCandidate confidentNewerAct = candidate("z", SourceAuthority.ACT, "2025-01-01", "0.90", "0.18");

        List<SlotCandidate> ranked = rank(circular, olderAct, newerAct, confidentNewerAct);

        assertEquals(List.of("z", "a", "b", "c"), ranked.stream().map(SlotCandidate::evidenceRuleId).toList());
    }

    @Test
    void ranking_breaksFullTiesByEvidenceId() {
        List<SlotCandidate> ranked = rank(
            candidate("e2", SourceAuthority.GAZETTE, "2025-01-01", "0.9", "0.18"),
            candidate("e1", SourceAuthority.GAZETTE, "2025-01-01", "0.9", "0.18"));
        assertEquals("e1", ranked.get(0).evidenceRuleId());
    }

    @Test
    void topTierDisagreement_isConflict() {
        ReconciliationPolicy.Outcome outcome = policy.reconcile(rank(
            candidate("a", SourceAuthority.ACT, "2025-01-01", "0.9", "0.06"),
            candidate("b", SourceAuthority.ACT, "2024-01-01", "0.9", "0.08"),
            candidate("c", SourceAuthority.NOTICE, "2024-01-01", "0.9", "0.07")));

        ReconciliationPolicy.Outcome.Conflicted conflicted =
            assertInstanceOf(ReconciliationPolicy.Outcome.Conflicted.class, outcome);
        assertEquals(List.of("a", "b"), conflicted.disagreeing().stream().map(SlotCandidate::evidenceRuleId).toList());
    }

    @Test
    void lowerTierDissent_isOverridden() {
        ReconciliationPolicy.Outcome outcome = policy.reconcile(rank(
            candidate("act", SourceAuthority.ACT, "2025-01-01", "0.9", "0.18"),
            candidate("gazette", SourceAuthority.GAZETTE, "2025-01-01", "0.9", "0.15"),
            candidate("circular", SourceAuthority.CIRCULAR, "2025-01-01", "0.9", "0.18")));

        ReconciliationPolicy.Outcome.Accepted accepted =
            assertInstanceOf(ReconciliationPolicy.Outcome.Accepted.class, outcome);
        assertEquals("act", accepted.winner().evidenceRuleId());
        List<AggregatedRuleSource> sources = accepted.sources();
        assertEquals(AggregatedRuleSource.PRIMARY, sources.get(0).reason());
        assertEquals(0, BigDecimal.ONE.compareTo(sources.get(0).weight()));
        AggregatedRuleSource overridden = sources.stream()
            .filter(s -> s.evidenceRuleId().equals("gazette")).findFirst().orElseThrow();
        assertEquals(AggregatedRuleSource.OVERRIDDEN, overridden.reason());
        assertEquals(0, BigDecimal.ZERO.compareTo(overridden.weight()));
        AggregatedRuleSource corroborating = sources.stream()
            .filter(s -> s.evidenceRuleId().equals("circular")).findFirst().orElseThrow();
        assertEquals(AggregatedRuleSource.CORROBORATING, corroborating.reason());
        assertEquals(0, new BigDecimal("0.5").compareTo(corroborating.weight()));
    }

    @Test
    void valuesWithinTolerance_agree() {
        assertTrue(policy.agree(
            candidate("a", SourceAuthority.ACT, null, null, "0.18"),
            candidate("b", SourceAuthority.ACT, null, null, "0.180001")));
        assertFalse(policy.agree(
            candidate("a", SourceAuthority.ACT, null, null, "0.18"),
            candidate("b", SourceAuthority.ACT, null, null, "0.19")));
    }

    private List<SlotCandidate> rank(SlotCandidate... candidates) {
        return Arrays.stream(candidates).sorted(policy.ranking()).toList();
    }

    private SlotCandidate candidate(String id, SourceAuthority authority, String effective, String confidence,
                                    String rate) {
        BigDecimal value = new BigDecimal(rate);
        EvidenceRule evidence = new EvidenceRule(id, TaxType.VAT, RuleCategory.RATE, "VAT rate",
            new RuleData.Rate("vat_rate", value, null), List.of(), null, null, null, "doc-" + id, null,
            confidence == null ? null : new BigDecimal(confidence),
            effective == null ? null : LocalDate.parse(effective), null, authority, ValidationStatus.PENDING,
            Instant.parse("2026-01-01T00:00:00Z"));
        return new SlotCandidate(evidence, ConflictAspect.OTHER, "vat_rate", value, value);
    }
}
