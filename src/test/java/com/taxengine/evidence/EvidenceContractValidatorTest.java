package com.taxengine.evidence;

import com.taxengine.contract.ContractViolationException;
import com.taxengine.contract.RuleCategory;
import com.taxengine.contract.SourceAuthority;
import com.taxengine.contract.TaxType;
import com.taxengine.contract.ValidationStatus;
import com.taxengine.rule.FormulaDraft;
import com.taxengine.rule.RuleData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EvidenceContractValidatorTest {

    private static final Instant RECEIVED = Instant.parse("2026-01-01T00:00:00Z");

    private EvidenceContractValidator validator;

    @BeforeEach
    void setUp() {
        validator = new EvidenceContractValidator();
    }

    @Nested
    @DisplayName("Required fields")
    class RequiredFields {

        @Test
        void missingRuleType_isRejected() {
            EvidenceSubmission submission = submission(null, "rate", Map.of("variable", "vat_rate", "rate", 0.18));
            ContractViolationException ex = assertThrows(ContractViolationException.class,
                () -> validator.validate(submission, RECEIVED));
            assertTrue(ex.getMessage().contains("rule_type"));
        }

        @Test
        void unknownCategory_isRejected() {
            EvidenceSubmission submission = submission("vat", "surcharge", Map.of());
            assertThrows(ContractViolationException.class, () -> validator.validate(submission, RECEIVED));
        }

        @Test
        void missingRuleData_isRejected() {
            EvidenceSubmission submission = submission("vat", "rate", null);
            assertThrows(ContractViolationException.class, () -> validator.validate(submission, RECEIVED));
        }

        @Test
        void confidenceOutOfRange_isRejected() {
            EvidenceSubmission base = submission("vat", "rate", Map.of("variable", "vat_rate", "rate", 0.18));
            EvidenceSubmission submission = new EvidenceSubmission(base.id(), base.ruleType(), base.category(),
                base.title(), base.ruleData(), null, null, null, null, base.documentId(), null, 1.5,
                null, null, null);
            assertThrows(ContractViolationException.class, () -> validator.validate(submission, RECEIVED));
        }

        @Test
        void expiryBeforeEffective_isRejected() {
            EvidenceSubmission base = submission("vat", "rate", Map.of("variable", "vat_rate", "rate", 0.18));
            EvidenceSubmission submission = new EvidenceSubmission(base.id(), base.ruleType(), base.category(),
                base.title(), base.ruleData(), null, null, null, null, base.documentId(), null, null,
                "2025-04-01", "2025-03-31", "act");
            assertThrows(ContractViolationException.class, () -> validator.validate(submission, RECEIVED));
        }
    }

    @Nested
    @DisplayName("Typed rule data")
    class TypedRuleData {

        @Test
        void bracketSet_isNormalizedAndDefaultsOrder() {
            Map<String, Object> first = new LinkedHashMap<>();
            first.put("min_income", 0);
            first.put("max_income", 500000);
            first.put("rate", 0);
            Map<String, Object> second = new LinkedHashMap<>();
            second.put("min_income", "500001");
            second.put("max_income", null);
            second.put("rate", 0.06);

            EvidenceRule rule = validator.validate(
                submission("income_tax", "bracket", Map.of("brackets", List.of(first, second))), RECEIVED);

            RuleData.BracketSet set = assertInstanceOf(RuleData.BracketSet.class, rule.ruleData());
            assertEquals(2, set.brackets().size());
            assertEquals(2, set.brackets().get(1).bracketOrder());
            assertEquals(new BigDecimal("0.0600"), set.brackets().get(1).rate());
            assertTrue(set.brackets().get(1).isOpenEnded());
        }

        @Test
        void emptyBracketList_isRejected() {
            assertThrows(ContractViolationException.class, () -> validator.validate(
                submission("income_tax", "bracket", Map.of("brackets", List.of())), RECEIVED));
        }

        @Test
        void rateAboveOne_isRejected() {
            ContractViolationException ex = assertThrows(ContractViolationException.class, () -> validator.validate(
                submission("vat", "rate", Map.of("variable", "vat_rate", "rate", 18)), RECEIVED));
            assertTrue(ex.getMessage().contains("fraction"));
        }

        @Test
        void negativeAmount_isRejected() {
            assertThrows(ContractViolationException.class, () -> validator.validate(
                submission("paye", "deduction", Map.of("variable", "personal_relief", "amount", -1)), RECEIVED));
        }

        @Test
        void threshold_isTyped() {
            EvidenceRule rule = validator.validate(
                submission("vat", "threshold", Map.of("variable", "registration_threshold", "amount", "60000000")),
                RECEIVED);
            RuleData.Threshold threshold = assertInstanceOf(RuleData.Threshold.class, rule.ruleData());
            assertEquals(new BigDecimal("60000000.00"), threshold.amount());
        }
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        void acceptedEvidence_isPendingWithOtherAuthority() {
            EvidenceRule rule = validator.validate(
                submission("vat", "rate", Map.of("variable", "vat_rate", "rate", 0.18)), RECEIVED);
            assertEquals(ValidationStatus.PENDING, rule.validationStatus());
            assertEquals(SourceAuthority.OTHER, rule.sourceAuthority());
            assertEquals(TaxType.VAT, rule.ruleType());
            assertEquals(RuleCategory.RATE, rule.category());
            assertEquals(RECEIVED, rule.createdAt());
            assertNotNull(rule.id());
        }

        @Test
        void formulaWithZeroOrder_isRejected() {
            EvidenceSubmission base = submission("vat", "rate", Map.of("variable", "vat_rate", "rate", 0.18));
            EvidenceSubmission submission = new EvidenceSubmission(null, base.ruleType(), base.category(),
                base.title(), base.ruleData(), List.of(new FormulaDraft("output_vat * 1", "vat_payable", 0)),
                null, null, null, base.documentId(), null, null, null, null, null);
            assertThrows(ContractViolationException.class, () -> validator.validate(submission, RECEIVED));
        }
    }

    private EvidenceSubmission submission(String ruleType, String category, Map<String, Object> ruleData) {
        return new EvidenceSubmission(null, ruleType, category, "Rule title", ruleData, null, null, null, null,
            "doc-1", "chunk-1", 0.9, null, null, null);
    }
}
