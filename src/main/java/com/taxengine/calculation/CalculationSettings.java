package com.taxengine.calculation;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * @param ceiling               largest magnitude any intermediate value may reach
 * @param budget                wall-clock limit of one execution attempt
 * @param maxAttempts           attempts for retryable failures, first one included
 * @param backoff               delay before the first retry; doubled for each further one
 * @param defaultIncomeVariable variable fed to the bracket schedule when a rule has no formulas
 */
public record CalculationSettings(BigDecimal ceiling, Duration budget, int maxAttempts, Duration backoff,
                                  String defaultIncomeVariable) {
}
