package com.taxengine.integration;

import com.taxengine.aggregation.AggregationOutcome;
import com.taxengine.aggregation.AggregationService;
import com.taxengine.aggregation.ConflictService;
import com.taxengine.aggregation.RuleConflict;
import com.taxengine.api.CalculationFailedException;
import com.taxengine.audit.AuditService;
import com.taxengine.audit.CalculationAudit;
import com.taxengine.calculation.CalculationRequest;
import com.taxengine.calculation.CalculationResult;
import com.taxengine.calculation.CalculationService;
import com.taxengine.contract.ConflictStatus;
import com.taxengine.contract.ErrorType;
import com.taxengine.contract.RunStatus;
import com.taxengine.contract.TaxType;
import com.taxengine.contract.ValidationStatus;
import com.taxengine.evidence.EvidenceService;
import com.taxengine.evidence.EvidenceSubmission;
import com.taxengine.registry.CanonicalVariableRegistry;
import com.taxengine.rule.FormulaDraft;
import com.taxengine.validation.RuleValidationService;
import com.taxengine.validation.TestCaseDraft;
import com.taxengine.validation.ValidationReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Evidence -> aggregation -> conflict decision -> re-aggregation -> fixtures
 * -> validated rule -> audited calculation, against the wired application.
 */
@SpringBootTest
class EvidenceToCalculationIntegrationTest {

    @Autowired CanonicalVariableRegistry registry;
    @Autowired EvidenceService evidence;
    @Autowired AggregationService aggregation;
    @Autowired ConflictService conflicts;
    @Autowired RuleValidationService validation;
    @Autowired CalculationService calculation;
    @Autowired AuditService audit;

    @Test
    @DisplayName("Withholding tax: conflicting rates are decided, validated and calculated")
    void withholdingTax_fromEvidenceToAuditedCalculation() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        LocalDate date = LocalDate.parse("2024-04-01");
        for (String key : List.of("payment", "wht_rate", "wht_due")) {
            registry.upsertVariable(key, null, null, null, null);
        }

        // 1. Two acts disagree on the rate; the formula itself is uncontested
        evidence.ingest(rate("wht-a-" + suffix, 0.05));
        evidence.ingest(rate("wht-b-" + suffix, 0.10));
        evidence.ingest(new EvidenceSubmission("wht-f-" + suffix, "wht", "rate", "Withholding on payments",
            Map.of("variable", "wht_rate", "rate", 0.05),
            List.of(new FormulaDraft("payment * wht_rate", "wht_due", 1)), null, List.of("payment"),
            "LKR", "doc-wht", "chunk-f", 0.95, "2024-04-01", null, "act"));

        AggregationOutcome first = aggregation.aggregate(TaxType.WHT, date);
        assertFalse(first.conflicts().isEmpty());
        RuleConflict conflict = first.conflicts().stream()
            .filter(c -> c.slot().equals("wht_rate"))
            .findFirst().orElseThrow();

        // 2. Operator picks the 5% act; the next run folds the decision in
        conflicts.resolve(conflict.id(), ConflictStatus.RESOLVED,
            Map.of("chosen_evidence_id", "wht-a-" + suffix), "reviewer");
        AggregationOutcome second = aggregation.aggregate(TaxType.WHT, date);
        assertEquals(RunStatus.COMPLETED, second.run().status());
        String ruleId = second.rule().orElseThrow().ruleId();
        assertEquals("wht:2024-04-01", ruleId);

        // 3. Preview calculation before validation
        CalculationResult preview = calculation.calculate(
            new CalculationRequest("wht", Map.of("payment", 200000), date.toString(), null));
        assertTrue(preview.preview());
        assertEquals(new BigDecimal("10000.00"), preview.finalAmount());

        // 4. Fixture gate
        validation.upsertTestCase(ruleId, new TestCaseDraft("two hundred thousand",
            Map.of("payment", 200000), new BigDecimal("10000"), Map.of("wht_due", new BigDecimal("10000")), null));
        ValidationReport report = validation.transition(ruleId, ValidationStatus.VALIDATED);
        assertTrue(report.applied(), () -> "blocked: " + report.blockers());

        // 5. Validated calculation is audited under its execution id
        String executionId = "exec-wht-" + suffix;
        CalculationResult result = calculation.calculate(
            new CalculationRequest("wht", Map.of("payment", 200000), date.toString(), executionId));
        assertFalse(result.preview());
        CalculationAudit stored = audit.audit(executionId).orElseThrow();
        assertEquals(ruleId, stored.ruleId());
        assertEquals(0, new BigDecimal("10000").compareTo(stored.finalAmount()));

        // 6. Missing input is recorded as a calculation error
        String failedId = "exec-wht-missing-" + suffix;
        CalculationFailedException ex = assertThrows(CalculationFailedException.class, () -> calculation.calculate(
            new CalculationRequest("wht", Map.of(), date.toString(), failedId)));
        assertEquals(ErrorType.VARIABLE_MISSING, ex.getError().errorType());
        assertEquals(1, audit.errors(Optional.of(false), Optional.of(failedId)).size());
    }

    private static EvidenceSubmission rate(String id, double rate) {
        return new EvidenceSubmission(id, "wht", "rate", "Withholding rate", Map.of("variable", "wht_rate", "rate", rate),
            null, null, null, null, "doc-wht", "chunk-" + id, 0.9, "2024-04-01", null, "act");
    }
}
