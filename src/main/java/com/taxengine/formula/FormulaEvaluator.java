package com.taxengine.formula;

import com.taxengine.contract.ErrorType;
import com.taxengine.contract.RuleEngineException;
import com.taxengine.rule.Numbers;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Evaluates a formula tree against a variable scope with {@link Numbers#MATH} precision.
 *
 * Every intermediate value is checked against the ceiling; division by zero and
 * values beyond it abort with {@link ErrorType#CALCULATION_OVERFLOW}.
 */
public final class FormulaEvaluator {

    static final String STEP = "evaluating";

    private final BigDecimal ceiling;

    public FormulaEvaluator(BigDecimal ceiling) {
        this.ceiling = ceiling;
    }

    /**
     * @param bracketTax applies the rule's bracket schedule; used by {@code bracket_tax(x)}
     */
    public BigDecimal evaluate(Expr expr, Map<String, BigDecimal> scope, UnaryOperator<BigDecimal> bracketTax) {
        return checked(eval(expr, scope, bracketTax));
    }

    private BigDecimal eval(Expr expr, Map<String, BigDecimal> scope, UnaryOperator<BigDecimal> bracketTax) {
        if (expr instanceof Expr.NumberLiteral literal) {
            return literal.value();
        }
        if (expr instanceof Expr.Variable variable) {
            BigDecimal value = scope.get(variable.name());
            if (value == null) {
                throw new RuleEngineException(ErrorType.VARIABLE_MISSING, STEP,
                    "no value for variable '" + variable.name() + "'");
            }
            return value;
        }
        if (expr instanceof Expr.Negate negate) {
            return eval(negate.operand(), scope, bracketTax).negate();
        }
        if (expr instanceof Expr.Binary binary) {
            BigDecimal left = eval(binary.left(), scope, bracketTax);
            BigDecimal right = eval(binary.right(), scope, bracketTax);
            return checked(apply(binary.operator(), left, right));
        }
        if (expr instanceof Expr.Call call) {
            return checked(call(call, scope, bracketTax));
        }
        throw new IllegalStateException("unsupported expression node " + expr);
    }

    private BigDecimal call(Expr.Call call, Map<String, BigDecimal> scope, UnaryOperator<BigDecimal> bracketTax) {
        List<Expr> args = call.arguments();
        switch (call.function()) {
            case MIN -> {
                BigDecimal min = eval(args.get(0), scope, bracketTax);
                for (int i = 1; i < args.size(); i++) {
                    min = min.min(eval(args.get(i), scope, bracketTax));
                }
                return min;
            }
            case MAX -> {
                BigDecimal max = eval(args.get(0), scope, bracketTax);
                for (int i = 1; i < args.size(); i++) {
                    max = max.max(eval(args.get(i), scope, bracketTax));
                }
                return max;
            }
            case IF -> {
                BigDecimal condition = eval(args.get(0), scope, bracketTax);
                return condition.signum() != 0
                    ? eval(args.get(1), scope, bracketTax)
                    : eval(args.get(2), scope, bracketTax);
            }
            case BRACKET_TAX -> {
                return bracketTax.apply(eval(args.get(0), scope, bracketTax));
            }
            default -> throw new IllegalStateException("unsupported function " + call.function());
        }
    }

    private BigDecimal apply(Expr.Operator operator, BigDecimal left, BigDecimal right) {
        return switch (operator) {
            case ADD -> left.add(right, Numbers.MATH);
            case SUBTRACT -> left.subtract(right, Numbers.MATH);
            case MULTIPLY -> left.multiply(right, Numbers.MATH);
            case DIVIDE -> {
                if (right.signum() == 0) {
                    throw new RuleEngineException(ErrorType.CALCULATION_OVERFLOW, STEP, "division by zero");
                }
                yield left.divide(right, Numbers.MATH);
            }
            case LESS -> truth(left.compareTo(right) < 0);
            case LESS_OR_EQUAL -> truth(left.compareTo(right) <= 0);
            case GREATER -> truth(left.compareTo(right) > 0);
            case GREATER_OR_EQUAL -> truth(left.compareTo(right) >= 0);
            case EQUAL -> truth(left.compareTo(right) == 0);
            case NOT_EQUAL -> truth(left.compareTo(right) != 0);
        };
    }

    private BigDecimal checked(BigDecimal value) {
        if (value.abs().compareTo(ceiling) > 0) {
            throw new RuleEngineException(ErrorType.CALCULATION_OVERFLOW, STEP,
                "value " + value.toPlainString() + " exceeds the calculation ceiling " + ceiling.toPlainString());
        }
        return value;
    }

    private static BigDecimal truth(boolean condition) {
        return condition ? BigDecimal.ONE : BigDecimal.ZERO;
    }
}
