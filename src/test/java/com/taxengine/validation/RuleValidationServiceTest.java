package com.taxengine.validation;

import com.taxengine.TestEngine;
import com.taxengine.contract.ContractViolationException;
import com.taxengine.contract.TaxType;
import com.taxengine.contract.ValidationStatus;
import com.taxengine.rule.AggregatedRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class RuleValidationServiceTest {

    private static final LocalDate DATE = LocalDate.parse("2025-04-01");
    private static final String RULE_ID = "income_tax:2025-04-01";

    private TestEngine engine;

    @BeforeEach
    void setUp() {
        engine = new TestEngine();
        engine.evidence.ingest(TestEngine.brackets("b1", "income_tax", "act", "2025-04-01",
            TestEngine.incomeTaxBrackets(0.06)));
        engine.aggregation.aggregate(TaxType.INCOME_TAX, DATE);
    }

    @Nested
    @DisplayName("Validation gate")
    class Gate {

        @Test
        void passingFixtures_promoteRule() {
            engine.validation.upsertTestCase(RULE_ID, new TestCaseDraft("one million",
                Map.of("taxable_income", 1000000), new BigDecimal("45000"), null, null));
            engine.validation.upsertTestCase(RULE_ID, new TestCaseDraft("exempt band",
                Map.of("taxable_income", 400000), BigDecimal.ZERO, Map.of("bracket_tax", BigDecimal.ZERO), null));

            ValidationReport report = engine.validation.transition(RULE_ID, ValidationStatus.VALIDATED);

            assertTrue(report.applied());
            assertEquals(2, report.results().size());
            AggregatedRule rule = engine.ruleStore.findById(RULE_ID).orElseThrow();
            assertEquals(ValidationStatus.VALIDATED, rule.validationStatus());
        }

        @Test
        @DisplayName("A failing fixture is reported by name and blocks promotion")
        void failingFixture_blocks() {
            engine.validation.upsertTestCase(RULE_ID, new TestCaseDraft("one million",
                Map.of("taxable_income", 1000000), new BigDecimal("45000"), null, null));
            engine.validation.upsertTestCase(RULE_ID, new TestCaseDraft("wrong expectation",
                Map.of("taxable_income", 1000000), new BigDecimal("46000"), null, null));

            ValidationReport report = engine.validation.transition(RULE_ID, ValidationStatus.VALIDATED);

            assertFalse(report.applied());
            assertEquals(List.of("wrong expectation"), report.failedTests());
            assertTrue(report.blockers().contains("test case failed: wrong expectation"));
            assertEquals(ValidationStatus.PENDING,
                engine.ruleStore.findById(RULE_ID).orElseThrow().validationStatus());
        }

        @Test
        void fixtureWithinTolerance_passes() {
            engine.validation.upsertTestCase(RULE_ID, new TestCaseDraft("rounded",
                Map.of("taxable_income", 1000000), new BigDecimal("45000.5"), null, BigDecimal.ONE));
            assertTrue(engine.validation.transition(RULE_ID, ValidationStatus.VALIDATED).applied());
        }

        @Test
        void fixtureMissingInput_failsWithReason() {
            engine.validation.upsertTestCase(RULE_ID, new TestCaseDraft("no input",
                Map.of(), BigDecimal.ZERO, null, null));

            ValidationReport report = engine.validation.transition(RULE_ID, ValidationStatus.VALIDATED);

            assertFalse(report.applied());
            assertTrue(report.results().get(0).mismatches().get(0).startsWith("variable_missing"));
        }

        @Test
        void pendingAspects_blockPromotion() {
            engine.evidence.ingest(TestEngine.brackets("b2", "income_tax", "act", "2025-04-01",
                TestEngine.incomeTaxBrackets(0.08)));
            engine.aggregation.aggregate(TaxType.INCOME_TAX, DATE);

            ValidationReport report = engine.validation.transition(RULE_ID, ValidationStatus.VALIDATED);

            assertFalse(report.applied());
            assertTrue(report.blockers().get(0).contains("brackets"));
        }
    }

    @Nested
    @DisplayName("Transitions")
    class Transitions {

        @Test
        void deprecatedIsFinal() {
            assertTrue(engine.validation.transition(RULE_ID, ValidationStatus.DEPRECATED).applied());
            assertThrows(ContractViolationException.class,
                () -> engine.validation.transition(RULE_ID, ValidationStatus.VALIDATED));
        }

        @Test
        void unknownRule_isNotFound() {
            assertThrows(NoSuchElementException.class,
                () -> engine.validation.transition("vat:2020-01-01", ValidationStatus.DEPRECATED));
        }
    }

    @Nested
    @DisplayName("Fixtures")
    class Fixtures {

        @Test
        void upsert_replacesByName() {
            engine.validation.upsertTestCase(RULE_ID, new TestCaseDraft("case",
                Map.of("taxable_income", 1), BigDecimal.ONE, null, null));
            RuleTestCase updated = engine.validation.upsertTestCase(RULE_ID, new TestCaseDraft("case",
                Map.of("taxable_income", 2), BigDecimal.TEN, null, null));

            assertEquals(1, engine.validation.testCases(RULE_ID).size());
            assertEquals(BigDecimal.TEN, updated.expectedFinalAmount());
            assertEquals(RuleTestCase.DEFAULT_TOLERANCE, updated.tolerance());
        }

        @Test
        void fixtureWithoutExpectation_isRejected() {
            assertThrows(ContractViolationException.class, () -> engine.validation.upsertTestCase(RULE_ID,
                new TestCaseDraft("empty", Map.of(), null, null, null)));
        }

        @Test
        void delete_removesFixture() {
            engine.validation.upsertTestCase(RULE_ID, new TestCaseDraft("case",
                Map.of("taxable_income", 1), BigDecimal.ONE, null, null));
            engine.validation.deleteTestCase(RULE_ID, "case");
            assertTrue(engine.validation.testCases(RULE_ID).isEmpty());
            assertThrows(NoSuchElementException.class, () -> engine.validation.deleteTestCase(RULE_ID, "case"));
        }
    }
}
