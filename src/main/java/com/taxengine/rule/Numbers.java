package com.taxengine.rule;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Numeric conventions: full precision while computing, currency at 2 places and
 * rates at 4 places only where values are stored or presented.
 */
public final class Numbers {

    public static final MathContext MATH = MathContext.DECIMAL128;
    public static final int CURRENCY_SCALE = 2;
    public static final int RATE_SCALE = 4;

    private Numbers() {
    }

    public static BigDecimal currency(BigDecimal value) {
        return value == null ? null : value.setScale(CURRENCY_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal rate(BigDecimal value) {
        return value == null ? null : value.setScale(RATE_SCALE, RoundingMode.HALF_UP);
    }

    /** Relative comparison: |a - b| <= tolerance * max(1, |a|, |b|). */
    public static boolean withinTolerance(BigDecimal a, BigDecimal b, BigDecimal tolerance) {
        if (a == null || b == null) {
            return a == b;
        }
        BigDecimal scale = BigDecimal.ONE.max(a.abs()).max(b.abs());
        return a.subtract(b).abs().compareTo(tolerance.multiply(scale, MATH)) <= 0;
    }
}
