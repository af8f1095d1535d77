package com.taxengine.formula;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Operation tree of a parsed formula. Nodes are plain data; {@link FormulaEvaluator}
 * gives them meaning.
 */
public sealed interface Expr {

    /** Adds every variable this expression reads to {@code into}. */
    void collectReferences(Set<String> into);

    /** Same tree with every variable name passed through {@code rename}. */
    Expr mapVariables(UnaryOperator<String> rename);

    /** Canonical text form, fully parenthesized; equal trees render equally. */
    String render();

    boolean usesBracketTax();

    record NumberLiteral(BigDecimal value) implements Expr {
        @Override
        public void collectReferences(Set<String> into) {
        }

        @Override
        public Expr mapVariables(UnaryOperator<String> rename) {
            return this;
        }

        @Override
        public String render() {
            return value.stripTrailingZeros().toPlainString();
        }

        @Override
        public boolean usesBracketTax() {
            return false;
        }
    }

    record Variable(String name) implements Expr {
        @Override
        public void collectReferences(Set<String> into) {
            into.add(name);
        }

        @Override
        public Expr mapVariables(UnaryOperator<String> rename) {
            return new Variable(rename.apply(name));
        }

        @Override
        public String render() {
            return name;
        }

        @Override
        public boolean usesBracketTax() {
            return false;
        }
    }

    record Negate(Expr operand) implements Expr {
        @Override
        public void collectReferences(Set<String> into) {
            operand.collectReferences(into);
        }

        @Override
        public Expr mapVariables(UnaryOperator<String> rename) {
            return new Negate(operand.mapVariables(rename));
        }

        @Override
        public String render() {
            return "(-" + operand.render() + ")";
        }

        @Override
        public boolean usesBracketTax() {
            return operand.usesBracketTax();
        }
    }

    record Binary(Operator operator, Expr left, Expr right) implements Expr {
        @Override
        public void collectReferences(Set<String> into) {
            left.collectReferences(into);
            right.collectReferences(into);
        }

        @Override
        public Expr mapVariables(UnaryOperator<String> rename) {
            return new Binary(operator, left.mapVariables(rename), right.mapVariables(rename));
        }

        @Override
        public String render() {
            return "(" + left.render() + " " + operator.symbol() + " " + right.render() + ")";
        }

        @Override
        public boolean usesBracketTax() {
            return left.usesBracketTax() || right.usesBracketTax();
        }
    }

    record Call(Function function, List<Expr> arguments) implements Expr {
        public Call {
            arguments = List.copyOf(arguments);
        }

        @Override
        public void collectReferences(Set<String> into) {
            arguments.forEach(a -> a.collectReferences(into));
        }

        @Override
        public Expr mapVariables(UnaryOperator<String> rename) {
            return new Call(function, arguments.stream().map(a -> a.mapVariables(rename)).toList());
        }

        @Override
        public String render() {
            return function.functionName() + "("
                + arguments.stream().map(Expr::render).collect(Collectors.joining(", ")) + ")";
        }

        @Override
        public boolean usesBracketTax() {
            return function == Function.BRACKET_TAX || arguments.stream().anyMatch(Expr::usesBracketTax);
        }
    }

    enum Operator {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        LESS("<"),
        LESS_OR_EQUAL("<="),
        GREATER(">"),
        GREATER_OR_EQUAL(">="),
        EQUAL("=="),
        NOT_EQUAL("!=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    enum Function {
        MIN("min", 1, Integer.MAX_VALUE),
        MAX("max", 1, Integer.MAX_VALUE),
        IF("if", 3, 3),
        BRACKET_TAX("bracket_tax", 1, 1);

        private final String functionName;
        private final int minArity;
        private final int maxArity;

        Function(String functionName, int minArity, int maxArity) {
            this.functionName = functionName;
            this.minArity = minArity;
            this.maxArity = maxArity;
        }

        public String functionName() {
            return functionName;
        }

        public boolean accepts(int arity) {
            return arity >= minArity && arity <= maxArity;
        }

        public static Function byName(String name) {
            for (Function function : values()) {
                if (function.functionName.equalsIgnoreCase(name)) {
                    return function;
                }
            }
            return null;
        }
    }
}
