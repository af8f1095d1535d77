package com.taxengine.registry;

import com.taxengine.contract.ContractViolationException;
import com.taxengine.contract.SynonymStatus;
import com.taxengine.contract.TaxType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CanonicalVariableRegistryTest {

    private CanonicalVariableRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new CanonicalVariableRegistry(Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("Term normalization")
    class Normalization {

        @Test
        void collapsesPunctuationAndCase() {
            assertEquals("taxable_income", TermNormalizer.normalize("  Taxable-Income "));
            assertEquals("gross_income_2024", TermNormalizer.normalize("Gross income (2024)"));
        }

        @Test
        void stripsLeadingAndTrailingSeparators() {
            assertEquals("rate", TermNormalizer.normalize("__rate__"));
            assertEquals("", TermNormalizer.normalize("--"));
            assertEquals("", TermNormalizer.normalize(null));
        }
    }

    @Nested
    @DisplayName("Resolution")
    class Resolving {

        @Test
        void knownKey_resolvesToItself() {
            registry.upsertVariable("taxable_income", "Taxable income", null, "LKR", "income");
            Resolution resolution = registry.resolve("Taxable Income");
            assertTrue(resolution.isMapped());
            assertEquals("taxable_income", resolution.key());
        }

        @Test
        void unknownTerm_registersPendingSynonymOnce() {
            Resolution first = registry.resolve("Assessable Income");
            Resolution second = registry.resolve("assessable-income");

            assertFalse(first.isMapped());
            assertEquals("assessable_income", first.key());
            assertEquals(first, second);
            List<VariableSynonym> pending = registry.synonyms(Optional.of(SynonymStatus.PENDING),
                Optional.empty(), Optional.empty());
            assertEquals(1, pending.size());
        }

        @Test
        void peek_hasNoSideEffects() {
            assertTrue(registry.peek("never seen").isEmpty());
            assertTrue(registry.synonyms(Optional.empty(), Optional.empty(), Optional.empty()).isEmpty());
        }

        @Test
        void approvedSynonym_mapsToBoundVariable() {
            registry.upsertVariable("taxable_income", null, null, null, null);
            Resolution.Unmapped unmapped = (Resolution.Unmapped) registry.resolve("assessable income");

            registry.approveSynonym(unmapped.synonymId(), "taxable_income", "reviewer");

            Resolution resolution = registry.resolve("Assessable Income");
            assertTrue(resolution.isMapped());
            assertEquals("taxable_income", resolution.key());
        }

        @Test
        void deactivatedVariable_noLongerResolves() {
            registry.upsertVariable("old_income", null, null, null, null);
            registry.deactivate("old_income", "superseded", null);
            assertFalse(registry.resolve("old_income").isMapped());
        }
    }

    @Nested
    @DisplayName("Synonym review")
    class Review {

        @Test
        void proposalsForSameTerm_merge() {
            List<VariableSynonym> touched = registry.propose(List.of(
                new SynonymProposal("Net Pay", "net_income", 0.4, "doc-1", TaxType.PAYE),
                new SynonymProposal("net pay", "net_salary", 0.9, "doc-2", TaxType.PAYE)));

            assertEquals(2, touched.size());
            VariableSynonym merged = touched.get(1);
            assertEquals(touched.get(0).id(), merged.id());
            assertEquals(2, merged.proposalCount());
            assertEquals("net_salary", merged.suggestedVariableKey());
            assertEquals("doc-1", merged.documentId());
        }

        @Test
        void approve_requiresActiveVariable() {
            Resolution.Unmapped unmapped = (Resolution.Unmapped) registry.resolve("gross pay");
            assertThrows(ContractViolationException.class,
                () -> registry.approveSynonym(unmapped.synonymId(), "does_not_exist", "reviewer"));
        }

        @Test
        void decidedSynonym_cannotBeDecidedAgain() {
            Resolution.Unmapped unmapped = (Resolution.Unmapped) registry.resolve("gross pay");
            registry.rejectSynonym(unmapped.synonymId(), "reviewer");
            ContractViolationException ex = assertThrows(ContractViolationException.class,
                () -> registry.rejectSynonym(unmapped.synonymId(), "reviewer"));
            assertTrue(ex.getMessage().contains("rejected"));
        }

        @Test
        void decision_requiresDecider() {
            Resolution.Unmapped unmapped = (Resolution.Unmapped) registry.resolve("gross pay");
            assertThrows(ContractViolationException.class, () -> registry.rejectSynonym(unmapped.synonymId(), " "));
        }

        @Test
        void synonymsFilterByDocumentAndType() {
            registry.propose(List.of(
                new SynonymProposal("a", null, null, "doc-1", TaxType.VAT),
                new SynonymProposal("b", null, null, "doc-2", TaxType.PAYE)));
            assertEquals(1, registry.synonyms(Optional.empty(), Optional.of("doc-1"), Optional.empty()).size());
            assertEquals(1, registry.synonyms(Optional.empty(), Optional.empty(), Optional.of(TaxType.PAYE)).size());
        }
    }

    @Nested
    @DisplayName("Variable lifecycle")
    class Lifecycle {

        @Test
        void upsert_bumpsVersionOnlyOnChange() {
            CanonicalVariable created = registry.upsertVariable("vat_rate", "VAT rate", null, "%", "rate");
            CanonicalVariable same = registry.upsertVariable("vat_rate", null, null, "%", "rate");
            CanonicalVariable changed = registry.upsertVariable("vat_rate", "VAT rate", null, "fraction", "rate");

            assertEquals(1, created.version());
            assertEquals(1, same.version());
            assertEquals(2, changed.version());
        }

        @Test
        void deactivate_keepsHistoryAndReplacement() {
            registry.upsertVariable("income", null, null, null, null);
            registry.upsertVariable("taxable_income", null, null, null, null);

            CanonicalVariable deactivated = registry.deactivate("income", "renamed", "taxable_income");

            assertFalse(deactivated.active());
            assertEquals("taxable_income", deactivated.replacedBy());
            assertEquals(1, registry.variables(false).size());
            assertEquals(2, registry.variables(true).size());
        }

        @Test
        void deactivate_rejectsUnknownReplacement() {
            registry.upsertVariable("income", null, null, null, null);
            assertThrows(ContractViolationException.class, () -> registry.deactivate("income", null, "nope"));
        }
    }
}
