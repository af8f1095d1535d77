package com.taxengine.validation;

import com.taxengine.calculation.CalculationResult;
import com.taxengine.calculation.CalculationService;
import com.taxengine.contract.ContractViolationException;
import com.taxengine.contract.RuleEngineException;
import com.taxengine.contract.ValidationStatus;
import com.taxengine.rule.AggregatedRule;
import com.taxengine.rule.Numbers;
import com.taxengine.rule.RuleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Regression fixtures per aggregated rule and the gate on validation-status transitions.
 *
 * Moving a rule to {@code validated} replays every fixture in dry-run mode against the
 * stored snapshot; one mismatch keeps the rule where it is.
 */
@Service
public class RuleValidationService {

    private static final Logger log = LoggerFactory.getLogger(RuleValidationService.class);

    private final RuleStore ruleStore;
    private final RuleTestCaseStore testCaseStore;
    private final CalculationService calculationService;
    private final Clock clock;

    public RuleValidationService(RuleStore ruleStore, RuleTestCaseStore testCaseStore,
                                 CalculationService calculationService, Clock clock) {
        this.ruleStore = ruleStore;
        this.testCaseStore = testCaseStore;
        this.calculationService = calculationService;
        this.clock = clock;
    }

    public RuleTestCase upsertTestCase(String ruleId, TestCaseDraft draft) {
        requireRule(ruleId);
        if (draft == null || draft.testName() == null || draft.testName().isBlank()) {
            throw new ContractViolationException("test_name is required");
        }
        if (draft.expectedFinalAmount() == null && (draft.expectedOutputs() == null || draft.expectedOutputs().isEmpty())) {
            throw new ContractViolationException("expected_final_amount or expected_outputs is required");
        }
        if (draft.tolerance() != null && draft.tolerance().signum() < 0) {
            throw new ContractViolationException("tolerance must not be negative");
        }
        Instant now = clock.instant();
        Instant createdAt = testCaseStore.find(ruleId, draft.testName()).map(RuleTestCase::createdAt).orElse(now);
        RuleTestCase testCase = testCaseStore.upsert(new RuleTestCase(ruleId, draft.testName(), draft.input(),
            draft.expectedFinalAmount(), draft.expectedOutputs(), draft.tolerance(), createdAt, now));
        log.info("Stored test case '{}' for rule {}", testCase.testName(), ruleId);
        return testCase;
    }

    public List<RuleTestCase> testCases(String ruleId) {
        requireRule(ruleId);
        return testCaseStore.findByRule(ruleId);
    }

    public void deleteTestCase(String ruleId, String testName) {
        if (!testCaseStore.delete(ruleId, testName)) {
            throw new NoSuchElementException("unknown test case '" + testName + "' for rule " + ruleId);
        }
    }

    /**
     * Requests a validation-status transition. Transitions other than to {@code validated}
     * apply directly when allowed; {@code validated} must also clear the gate.
     */
    public ValidationReport transition(String ruleId, ValidationStatus target) {
        AggregatedRule rule = requireRule(ruleId);
        if (target == null) {
            throw new ContractViolationException("validation_status is required");
        }
        if (!rule.validationStatus().canTransitionTo(target)) {
            throw new ContractViolationException("rule " + ruleId + " cannot move from "
                + rule.validationStatus().getValue() + " to " + target.getValue());
        }

        List<String> blockers = new ArrayList<>();
        List<ValidationReport.TestResult> results = new ArrayList<>();
        if (target == ValidationStatus.VALIDATED) {
            if (!rule.content().pendingAspects().isEmpty()) {
                blockers.add("pending aspects: " + String.join(", ", rule.content().pendingAspects()));
            }
            if (!rule.content().allFormulasActive()) {
                blockers.add("formulas are not active");
            }
            if (blockers.isEmpty()) {
                for (RuleTestCase testCase : testCaseStore.findByRule(ruleId)) {
                    ValidationReport.TestResult result = replay(rule, testCase);
                    results.add(result);
                    if (!result.passed()) {
                        blockers.add("test case failed: " + result.testName());
                    }
                }
            }
        }

        if (!blockers.isEmpty()) {
            log.warn("Rule {} v{} not moved to {}: {}", ruleId, rule.version(), target.getValue(), blockers);
            return new ValidationReport(ruleId, rule.version(), rule.validationStatus(), target, false, blockers,
                results);
        }
        if (!ruleStore.compareAndSet(rule, rule.withValidationStatus(target, clock.instant()))) {
            throw new ContractViolationException("rule " + ruleId + " changed while being validated; request again");
        }
        log.info("Rule {} v{} moved {} -> {} ({} test cases passed)", ruleId, rule.version(),
            rule.validationStatus().getValue(), target.getValue(), results.size());
        return new ValidationReport(ruleId, rule.version(), rule.validationStatus(), target, true, blockers, results);
    }

    private ValidationReport.TestResult replay(AggregatedRule rule, RuleTestCase testCase) {
        CalculationResult actual;
        try {
            actual = calculationService.dryRun(rule, testCase.input());
        } catch (RuleEngineException ex) {
            return new ValidationReport.TestResult(testCase.testName(), false, testCase.expectedFinalAmount(), null,
                List.of(ex.getErrorType().getValue() + " at " + ex.getFailedStep() + ": " + ex.getMessage()));
        }

        List<String> mismatches = new ArrayList<>();
        if (testCase.expectedFinalAmount() != null
            && !close(testCase.expectedFinalAmount(), actual.finalAmount(), testCase.tolerance())) {
            mismatches.add("final_amount expected " + testCase.expectedFinalAmount().toPlainString()
                + " but was " + actual.finalAmount().toPlainString());
        }
        for (Map.Entry<String, BigDecimal> expected : testCase.expectedOutputs().entrySet()) {
            BigDecimal value = actual.result().get(expected.getKey());
            if (value == null) {
                mismatches.add(expected.getKey() + " was not produced");
            } else if (!close(expected.getValue(), value, testCase.tolerance())) {
                mismatches.add(expected.getKey() + " expected " + expected.getValue().toPlainString()
                    + " but was " + value.toPlainString());
            }
        }
        return new ValidationReport.TestResult(testCase.testName(), mismatches.isEmpty(),
            testCase.expectedFinalAmount(), actual.finalAmount(), mismatches);
    }

    /** Absolute comparison: fixture tolerances are in currency units. */
    private static boolean close(BigDecimal expected, BigDecimal actual, BigDecimal tolerance) {
        return expected.subtract(actual, Numbers.MATH).abs().compareTo(tolerance) <= 0;
    }

    private AggregatedRule requireRule(String ruleId) {
        return ruleStore.findById(ruleId)
            .orElseThrow(() -> new NoSuchElementException("unknown aggregated rule: " + ruleId));
    }
}
