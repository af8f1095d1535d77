package com.taxengine.formula;

import com.taxengine.rule.RuleFormula;

import java.util.List;
import java.util.Optional;

/**
 * Formulas of one rule in execution order. Every formula only reads inputs,
 * parameters or outputs of formulas before it.
 */
public record CompiledFormulaSet(List<CompiledFormula> ordered) {

    public static final CompiledFormulaSet EMPTY = new CompiledFormulaSet(List.of());

    public CompiledFormulaSet {
        ordered = List.copyOf(ordered);
    }

    public boolean isEmpty() {
        return ordered.isEmpty();
    }

    public List<RuleFormula> formulas() {
        return ordered.stream().map(CompiledFormula::formula).toList();
    }

    /** Output of the last formula in order; the calculation's final amount. */
    public Optional<String> finalOutput() {
        return ordered.isEmpty() ? Optional.empty() : Optional.of(ordered.get(ordered.size() - 1).outputVariable());
    }
}
