package com.taxengine.rule;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.taxengine.contract.RuleCategory;

import java.math.BigDecimal;
import java.util.List;

/**
 * Structured payload of an evidence rule, one shape per rule category.
 */
public sealed interface RuleData {

    RuleCategory category();

    /**
     * Payloads that contribute a single named value to the rule's parameters.
     */
    sealed interface Parameter extends RuleData {
        /** Raw term naming the variable; resolved through the registry. */
        String variable();

        BigDecimal value();
    }

    record BracketSet(@JsonProperty("brackets") List<TaxBracket> brackets) implements RuleData {
        public BracketSet {
            brackets = List.copyOf(brackets);
        }

        @Override
        public RuleCategory category() {
            return RuleCategory.BRACKET;
        }
    }

    record Rate(@JsonProperty("variable") String variable,
                @JsonProperty("rate") BigDecimal rate,
                @JsonProperty("applies_to") String appliesTo) implements Parameter {
        @Override
        public RuleCategory category() {
            return RuleCategory.RATE;
        }

        @Override
        public BigDecimal value() {
            return rate;
        }
    }

    record Threshold(@JsonProperty("variable") String variable,
                     @JsonProperty("amount") BigDecimal amount) implements Parameter {
        @Override
        public RuleCategory category() {
            return RuleCategory.THRESHOLD;
        }

        @Override
        public BigDecimal value() {
            return amount;
        }
    }

    record Deduction(@JsonProperty("variable") String variable,
                     @JsonProperty("amount") BigDecimal amount,
                     @JsonProperty("description") String description) implements Parameter {
        @Override
        public RuleCategory category() {
            return RuleCategory.DEDUCTION;
        }

        @Override
        public BigDecimal value() {
            return amount;
        }
    }

    record Exemption(@JsonProperty("variable") String variable,
                     @JsonProperty("amount") BigDecimal amount,
                     @JsonProperty("condition") String condition) implements Parameter {
        @Override
        public RuleCategory category() {
            return RuleCategory.EXEMPTION;
        }

        @Override
        public BigDecimal value() {
            return amount;
        }
    }

    record Allowance(@JsonProperty("variable") String variable,
                     @JsonProperty("amount") BigDecimal amount) implements Parameter {
        @Override
        public RuleCategory category() {
            return RuleCategory.ALLOWANCE;
        }

        @Override
        public BigDecimal value() {
            return amount;
        }
    }
}
