package com.taxengine.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;

/**
 * One line of a calculation breakdown: a bracket contribution or a formula output.
 * Amounts are rounded for presentation; the calculation itself never used these values.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BreakdownLine(
    @JsonProperty("step") int step,
    @JsonProperty("kind") String kind,
    @JsonProperty("variable") String variable,
    @JsonProperty("expression") String expression,
    @JsonProperty("bracket_order") Integer bracketOrder,
    @JsonProperty("lower_bound") BigDecimal lowerBound,
    @JsonProperty("upper_bound") BigDecimal upperBound,
    @JsonProperty("taxable_slice") BigDecimal taxableSlice,
    @JsonProperty("rate") BigDecimal rate,
    @JsonProperty("amount") BigDecimal amount
) {

    public static final String BRACKET = "bracket";
    public static final String FORMULA = "formula";

    public static BreakdownLine formula(int step, String variable, String expression, BigDecimal amount) {
        return new BreakdownLine(step, FORMULA, variable, expression, null, null, null, null, null, amount);
    }
}
