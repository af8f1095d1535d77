package com.taxengine.formula;

import com.taxengine.rule.RuleFormula;

import java.util.Set;

/**
 * A formula whose identifiers are canonical keys, with its parsed tree and the
 * variables it reads.
 */
public record CompiledFormula(RuleFormula formula, Expr tree, Set<String> references) {

    public CompiledFormula {
        references = Set.copyOf(references);
    }

    public String outputVariable() {
        return formula.outputVariable();
    }

    public int calculationOrder() {
        return formula.calculationOrder();
    }
}
