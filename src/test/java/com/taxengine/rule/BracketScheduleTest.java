package com.taxengine.rule;

import com.taxengine.contract.ErrorType;
import com.taxengine.contract.RuleEngineException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BracketScheduleTest {

    static List<TaxBracket> incomeTaxBrackets() {
        return List.of(
            bracket("0", "500000", "0", "0", 1),
            bracket("500001", "750000", "0.06", "0", 2),
            bracket("750001", "1500000", "0.12", "15000", 3),
            bracket("1500001", null, "0.18", "105000", 4));
    }

    @Nested
    @DisplayName("Evaluation")
    class Evaluation {

        @Test
        @DisplayName("1,000,000 of income yields 45,000 from two contributing bands")
        void progressiveExample() {
            BracketSchedule.Evaluation result = BracketSchedule.of(incomeTaxBrackets())
                .evaluate(new BigDecimal("1000000"));

            assertEquals(0, new BigDecimal("45000").compareTo(result.total()));
            assertEquals(2, result.contributions().size());
            assertEquals(2, result.contributions().get(0).bracketOrder());
            assertEquals(0, new BigDecimal("15000").compareTo(result.contributions().get(0).amount()));
            assertEquals(3, result.contributions().get(1).bracketOrder());
            assertEquals(0, new BigDecimal("30000").compareTo(result.contributions().get(1).amount()));
        }

        @Test
        void zeroIncome_yieldsZero() {
            BracketSchedule.Evaluation result = BracketSchedule.of(incomeTaxBrackets()).evaluate(BigDecimal.ZERO);
            assertEquals(0, BigDecimal.ZERO.compareTo(result.total()));
            assertTrue(result.contributions().isEmpty());
        }

        @Test
        void continuousAtBoundaries() {
            BracketSchedule schedule = BracketSchedule.of(incomeTaxBrackets());
            assertEquals(0, new BigDecimal("15000").compareTo(schedule.evaluate(new BigDecimal("750000")).total()));
            assertEquals(0, new BigDecimal("105000").compareTo(schedule.evaluate(new BigDecimal("1500000")).total()));
            BigDecimal justAbove = schedule.evaluate(new BigDecimal("1500000.01")).total();
            assertTrue(justAbove.subtract(new BigDecimal("105000")).abs().compareTo(new BigDecimal("0.01")) < 0);
        }

        @Test
        void monotonicAcrossIncomes() {
            BracketSchedule schedule = BracketSchedule.of(incomeTaxBrackets());
            BigDecimal previous = BigDecimal.ZERO;
            for (int income = 0; income <= 3_000_000; income += 125_000) {
                BigDecimal tax = schedule.evaluate(BigDecimal.valueOf(income)).total();
                assertTrue(tax.compareTo(previous) >= 0, "tax decreased at " + income);
                previous = tax;
            }
        }

        @Test
        @DisplayName("A fixed amount a few cents off the accrual does not move the tax at its boundary")
        void fixedAmountWithinTolerance_keepsBoundaryContinuous() {
            BracketSchedule schedule = BracketSchedule.of(List.of(
                bracket("0", "500000", "0", "0", 1),
                bracket("500001", "750000", "0.06", "0", 2),
                bracket("750001", null, "0.12", "14999.94", 3)));

            BigDecimal atBoundary = schedule.evaluate(new BigDecimal("750000")).total();
            BigDecimal justAbove = schedule.evaluate(new BigDecimal("750000.10")).total();

            assertEquals(0, new BigDecimal("15000").compareTo(atBoundary));
            assertTrue(justAbove.compareTo(atBoundary) >= 0, "tax decreased across the boundary");
            assertEquals(0, new BigDecimal("15000.012").compareTo(justAbove));
        }

        @Test
        void fixedAmountAboveAccrual_addsNoStep() {
            BracketSchedule schedule = BracketSchedule.of(List.of(
                bracket("0", "500000", "0.10", "0", 1),
                bracket("500001", null, "0.20", "50000.80", 2)));

            BigDecimal justAbove = schedule.evaluate(new BigDecimal("500000.01")).total();

            assertEquals(0, new BigDecimal("50000.002").compareTo(justAbove));
        }

        @Test
        void topBand_isOpenEnded() {
            BigDecimal tax = BracketSchedule.of(incomeTaxBrackets()).evaluate(new BigDecimal("2000000")).total();
            assertEquals(0, new BigDecimal("195000").compareTo(tax));
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        void overlappingBands_areRejected() {
            RuleEngineException ex = assertThrows(RuleEngineException.class, () -> BracketSchedule.of(List.of(
                bracket("0", "500000", "0", "0", 1),
                bracket("400000", null, "0.06", "0", 2))));
            assertEquals(ErrorType.RULE_VALIDATION_FAILED, ex.getErrorType());
            assertEquals("bracket_validation", ex.getFailedStep());
        }

        @Test
        void gapBetweenBands_isRejected() {
            assertThrows(RuleEngineException.class, () -> BracketSchedule.of(List.of(
                bracket("0", "500000", "0", "0", 1),
                bracket("600000", null, "0.06", "0", 2))));
        }

        @Test
        void openEndedBandBeforeLast_isRejected() {
            assertThrows(RuleEngineException.class, () -> BracketSchedule.of(List.of(
                bracket("0", null, "0", "0", 1),
                bracket("500001", null, "0.06", "0", 2))));
        }

        @Test
        void fixedAmountNotMatchingAccrual_isRejected() {
            RuleEngineException ex = assertThrows(RuleEngineException.class, () -> BracketSchedule.of(List.of(
                bracket("0", "500000", "0.10", "0", 1),
                bracket("500001", null, "0.20", "10000", 2))));
            assertTrue(ex.getMessage().contains("fixed_amount"));
        }

        @Test
        void duplicateOrder_isRejected() {
            assertThrows(RuleEngineException.class, () -> BracketSchedule.of(List.of(
                bracket("0", "500000", "0", "0", 1),
                bracket("500001", null, "0.06", "0", 1))));
        }

        @Test
        void emptySet_isRejected() {
            assertThrows(RuleEngineException.class, () -> BracketSchedule.of(List.of()));
        }
    }

    static TaxBracket bracket(String min, String max, String rate, String fixed, int order) {
        return new TaxBracket(new BigDecimal(min), max == null ? null : new BigDecimal(max), new BigDecimal(rate),
            new BigDecimal(fixed), order).normalized();
    }
}
