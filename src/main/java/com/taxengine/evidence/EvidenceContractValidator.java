package com.taxengine.evidence;

import com.taxengine.contract.ContractViolationException;
import com.taxengine.contract.RuleCategory;
import com.taxengine.contract.SourceAuthority;
import com.taxengine.contract.TaxType;
import com.taxengine.contract.ValidationStatus;
import com.taxengine.rule.FormulaDraft;
import com.taxengine.rule.Numbers;
import com.taxengine.rule.RuleData;
import com.taxengine.rule.TaxBracket;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Checks an evidence submission against the ingestion contract and converts its
 * free-form {@code rule_data} into the typed payload for its category.
 */
@Component
public class EvidenceContractValidator {

    public EvidenceRule validate(EvidenceSubmission submission, Instant receivedAt) {
        requireNonNull(submission, "evidence cannot be null");
        TaxType ruleType = parseEnum(() -> TaxType.fromValue(requireString(submission.ruleType(),
            "rule_type is required")), "rule_type is invalid");
        RuleCategory category = parseEnum(() -> RuleCategory.fromValue(requireString(submission.category(),
            "category is required")), "category is invalid");
        SourceAuthority authority = submission.sourceAuthority() == null
            ? SourceAuthority.OTHER
            : parseEnum(() -> SourceAuthority.fromValue(submission.sourceAuthority()), "source_authority is invalid");
        requireString(submission.title(), "title is required");
        requireString(submission.documentId(), "document_id is required");

        Double confidence = submission.chunkConfidence();
        if (confidence != null && (confidence < 0.0 || confidence > 1.0)) {
            throw new ContractViolationException("chunk_confidence must be between 0 and 1");
        }

        LocalDate effective = parseDate(submission.effectiveDate(), "effective_date");
        LocalDate expiry = parseDate(submission.expiryDate(), "expiry_date");
        if (effective != null && expiry != null && expiry.isBefore(effective)) {
            throw new ContractViolationException("expiry_date must not be before effective_date");
        }

        if (submission.ruleData() == null) {
            throw new ContractViolationException("rule_data is required");
        }
        RuleData ruleData = switch (category) {
            case BRACKET -> bracketSet(submission.ruleData());
            case RATE -> rate(submission.ruleData());
            case THRESHOLD -> new RuleData.Threshold(
                requireString(submission.ruleData().get("variable"), "rule_data.variable is required"),
                requireAmount(submission.ruleData().get("amount"), "rule_data.amount"));
            case DEDUCTION -> new RuleData.Deduction(
                requireString(submission.ruleData().get("variable"), "rule_data.variable is required"),
                requireAmount(submission.ruleData().get("amount"), "rule_data.amount"),
                optionalString(submission.ruleData().get("description")));
            case EXEMPTION -> new RuleData.Exemption(
                requireString(submission.ruleData().get("variable"), "rule_data.variable is required"),
                requireAmount(submission.ruleData().get("amount"), "rule_data.amount"),
                optionalString(submission.ruleData().get("condition")));
            case ALLOWANCE -> new RuleData.Allowance(
                requireString(submission.ruleData().get("variable"), "rule_data.variable is required"),
                requireAmount(submission.ruleData().get("amount"), "rule_data.amount"));
        };

        List<FormulaDraft> formulas = submission.formulas() != null ? submission.formulas() : List.of();
        for (FormulaDraft formula : formulas) {
            requireString(formula.expression(), "formulas[].expression is required");
            requireString(formula.outputVariable(), "formulas[].output_variable is required");
            if (formula.calculationOrder() != null && formula.calculationOrder() < 1) {
                throw new ContractViolationException("formulas[].calculation_order must be >= 1");
            }
        }

        return new EvidenceRule(
            submission.id() != null && !submission.id().isBlank() ? submission.id() : UUID.randomUUID().toString(),
            ruleType, category, submission.title(), ruleData, formulas,
            submission.definitions(), submission.inputs(), optionalString(submission.unit()),
            submission.documentId(), submission.chunkId(),
            confidence != null ? BigDecimal.valueOf(confidence) : null,
            effective, expiry, authority, ValidationStatus.PENDING, receivedAt);
    }

    private RuleData.BracketSet bracketSet(Map<String, Object> data) {
        Object raw = data.get("brackets");
        if (!(raw instanceof List<?> list) || list.isEmpty()) {
            throw new ContractViolationException("rule_data.brackets must be a non-empty array");
        }
        List<TaxBracket> brackets = new ArrayList<>();
        int position = 0;
        for (Object item : list) {
            position++;
            if (!(item instanceof Map<?, ?> bracket)) {
                throw new ContractViolationException("rule_data.brackets[" + position + "] must be an object");
            }
            BigDecimal min = requireAmount(bracket.get("min_income"), "rule_data.brackets[].min_income");
            BigDecimal max = bracket.get("max_income") == null
                ? null
                : requireAmount(bracket.get("max_income"), "rule_data.brackets[].max_income");
            BigDecimal rate = requireRate(bracket.get("rate"), "rule_data.brackets[].rate");
            BigDecimal fixed = bracket.get("fixed_amount") == null
                ? BigDecimal.ZERO
                : requireAmount(bracket.get("fixed_amount"), "rule_data.brackets[].fixed_amount");
            Object order = bracket.get("bracket_order");
            int bracketOrder = order == null ? position : requireInteger(order, "rule_data.brackets[].bracket_order");
            brackets.add(new TaxBracket(min, max, rate, fixed, bracketOrder).normalized());
        }
        return new RuleData.BracketSet(brackets);
    }

    private RuleData.Rate rate(Map<String, Object> data) {
        return new RuleData.Rate(
            requireString(data.get("variable"), "rule_data.variable is required"),
            requireRate(data.get("rate"), "rule_data.rate"),
            optionalString(data.get("applies_to")));
    }

    private BigDecimal requireAmount(Object value, String field) {
        BigDecimal amount = toDecimal(value, field + " must be a number");
        if (amount.signum() < 0) {
            throw new ContractViolationException(field + " must not be negative");
        }
        return Numbers.currency(amount);
    }

    private BigDecimal requireRate(Object value, String field) {
        BigDecimal rate = toDecimal(value, field + " must be a number");
        if (rate.signum() < 0 || rate.compareTo(BigDecimal.ONE) > 0) {
            throw new ContractViolationException(field + " must be a fraction between 0 and 1");
        }
        return Numbers.rate(rate);
    }

    private BigDecimal toDecimal(Object value, String message) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException ex) {
                throw new ContractViolationException(message);
            }
        }
        throw new ContractViolationException(message);
    }

    private int requireInteger(Object value, String message) {
        if (!(value instanceof Integer) && !(value instanceof Long)) {
            throw new ContractViolationException(message + " must be an integer");
        }
        return ((Number) value).intValue();
    }

    private LocalDate parseDate(String value, String field) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException ex) {
            throw new ContractViolationException(field + " must be an ISO date (yyyy-MM-dd)");
        }
    }

    private <T> T parseEnum(Supplier<T> parser, String message) {
        try {
            return parser.get();
        } catch (IllegalArgumentException ex) {
            throw new ContractViolationException(message);
        }
    }

    private String requireString(Object value, String message) {
        if (!(value instanceof String text) || text.isBlank()) {
            throw new ContractViolationException(message);
        }
        return text;
    }

    private String optionalString(Object value) {
        return value instanceof String text && !text.isBlank() ? text : null;
    }

    private void requireNonNull(Object value, String message) {
        if (value == null) {
            throw new ContractViolationException(message);
        }
    }
}
