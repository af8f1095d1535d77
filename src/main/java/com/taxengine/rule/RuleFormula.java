package com.taxengine.rule;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A formula owned by an aggregated rule, with its validated position in the dependency order.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RuleFormula(
    @JsonProperty("expression") String expression,
    @JsonProperty("output_variable") String outputVariable,
    @JsonProperty("calculation_order") Integer calculationOrder,
    @JsonProperty("status") FormulaStatus status
) {

    public RuleFormula withStatus(FormulaStatus newStatus) {
        return new RuleFormula(expression, outputVariable, calculationOrder, newStatus);
    }

    public RuleFormula withOrder(int order) {
        return new RuleFormula(expression, outputVariable, order, status);
    }
}
