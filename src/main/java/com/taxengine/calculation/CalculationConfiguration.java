package com.taxengine.calculation;

import com.taxengine.formula.FormulaEvaluator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;

@Configuration
public class CalculationConfiguration {

    @Bean
    public CalculationSettings calculationSettings(
            @Value("${taxengine.calculation.ceiling:999999999999999.99}") BigDecimal ceiling,
            @Value("${taxengine.calculation.budget:2s}") Duration budget,
            @Value("${taxengine.calculation.retry.max-attempts:3}") int maxAttempts,
            @Value("${taxengine.calculation.retry.backoff:50ms}") Duration backoff,
            @Value("${taxengine.calculation.default-income-variable:taxable_income}") String defaultIncomeVariable) {
        return new CalculationSettings(ceiling, budget, Math.max(1, maxAttempts), backoff, defaultIncomeVariable);
    }

    @Bean
    public FormulaEvaluator formulaEvaluator(CalculationSettings settings) {
        return new FormulaEvaluator(settings.ceiling());
    }
}
