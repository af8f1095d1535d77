package com.taxengine.rule;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;

/**
 * One band of a progressive schedule. A null {@code maxIncome} marks the open top band;
 * {@code rate} is a fraction (0.06 for 6%).
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TaxBracket(
    @JsonProperty("min_income") BigDecimal minIncome,
    @JsonProperty("max_income") BigDecimal maxIncome,
    @JsonProperty("rate") BigDecimal rate,
    @JsonProperty("fixed_amount") BigDecimal fixedAmount,
    @JsonProperty("bracket_order") int bracketOrder
) {

    public TaxBracket {
        fixedAmount = fixedAmount != null ? fixedAmount : BigDecimal.ZERO;
    }

    public boolean isOpenEnded() {
        return maxIncome == null;
    }

    /** Storage form: currency bounds at 2 places, rate at 4. */
    public TaxBracket normalized() {
        return new TaxBracket(Numbers.currency(minIncome), Numbers.currency(maxIncome), Numbers.rate(rate),
            Numbers.currency(fixedAmount), bracketOrder);
    }
}
