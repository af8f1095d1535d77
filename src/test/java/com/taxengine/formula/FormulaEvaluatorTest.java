package com.taxengine.formula;

import com.taxengine.contract.ErrorType;
import com.taxengine.contract.RuleEngineException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

class FormulaEvaluatorTest {

    private static final UnaryOperator<BigDecimal> NO_BRACKETS = income -> {
        throw new AssertionError("bracket_tax not expected");
    };

    private FormulaEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new FormulaEvaluator(new BigDecimal("999999999999999.99"));
    }

    @Test
    void arithmeticWithDecimalPrecision() {
        BigDecimal result = eval("gross * 18% - credit", Map.of(
            "gross", new BigDecimal("1000.10"), "credit", new BigDecimal("0.018")));
        assertEquals(0, new BigDecimal("180.0").compareTo(result));
    }

    @Test
    void conditionalsAndComparisons() {
        assertEquals(0, BigDecimal.TEN.compareTo(eval("if(a >= 5, 10, 20)", Map.of("a", BigDecimal.valueOf(5)))));
        assertEquals(0, BigDecimal.valueOf(20).compareTo(eval("if(a != 5, 10, 20)", Map.of("a", BigDecimal.valueOf(5)))));
    }

    @Test
    void variadicMinAndMax() {
        Map<String, BigDecimal> scope = Map.of("a", BigDecimal.ONE, "b", BigDecimal.TEN);
        assertEquals(0, BigDecimal.ONE.compareTo(eval("min(b, a, 3)", scope)));
        assertEquals(0, BigDecimal.TEN.compareTo(eval("max(0, a, b)", scope)));
        assertEquals(0, BigDecimal.ZERO.compareTo(eval("max(0, a - b)", scope)));
    }

    @Test
    void bracketTax_delegatesToSchedule() {
        BigDecimal result = evaluator.evaluate(FormulaParser.parse("bracket_tax(income) - 100"),
            Map.of("income", BigDecimal.valueOf(1000)), income -> income.multiply(new BigDecimal("0.5")));
        assertEquals(0, BigDecimal.valueOf(400).compareTo(result));
    }

    @Test
    void missingVariable_isVariableMissing() {
        RuleEngineException ex = assertThrows(RuleEngineException.class, () -> eval("a + b", Map.of("a", BigDecimal.ONE)));
        assertEquals(ErrorType.VARIABLE_MISSING, ex.getErrorType());
        assertTrue(ex.getMessage().contains("'b'"));
    }

    @Test
    void divisionByZero_isOverflow() {
        RuleEngineException ex = assertThrows(RuleEngineException.class,
            () -> eval("a / (b - b)", Map.of("a", BigDecimal.ONE, "b", BigDecimal.TEN)));
        assertEquals(ErrorType.CALCULATION_OVERFLOW, ex.getErrorType());
    }

    @Test
    void valueAboveCeiling_isOverflow() {
        RuleEngineException ex = assertThrows(RuleEngineException.class,
            () -> eval("a * a", Map.of("a", new BigDecimal("100000000000"))));
        assertEquals(ErrorType.CALCULATION_OVERFLOW, ex.getErrorType());
    }

    @Test
    void intermediateAboveCeiling_isOverflowEvenIfResultIsSmall() {
        assertThrows(RuleEngineException.class,
            () -> eval("(a * a) / a", Map.of("a", new BigDecimal("100000000000"))));
    }

    private BigDecimal eval(String expression, Map<String, BigDecimal> scope) {
        return evaluator.evaluate(FormulaParser.parse(expression), scope, NO_BRACKETS);
    }
}
