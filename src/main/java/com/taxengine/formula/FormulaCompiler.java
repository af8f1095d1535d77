package com.taxengine.formula;

import com.taxengine.contract.ErrorType;
import com.taxengine.contract.RuleEngineException;
import com.taxengine.registry.CanonicalVariableRegistry;
import com.taxengine.registry.Resolution;
import com.taxengine.registry.TermNormalizer;
import com.taxengine.rule.FormulaDraft;
import com.taxengine.rule.FormulaStatus;
import com.taxengine.rule.RuleFormula;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns formula drafts into a validated, dependency-ordered formula set.
 *
 * Compilation is all-or-nothing: the first problem found aborts with a typed
 * {@link RuleEngineException} and no formula of the set is returned.
 */
@Component
public class FormulaCompiler {

    private static final Logger log = LoggerFactory.getLogger(FormulaCompiler.class);

    static final String RESOLUTION_STEP = "variable_resolution";
    static final String COMPILE_STEP = "compile";

    private final CanonicalVariableRegistry registry;

    public FormulaCompiler(CanonicalVariableRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param drafts       formulas as extracted, identifiers still raw terms
     * @param knownSources canonical keys available before any formula runs (inputs and parameters)
     * @param hasBrackets  whether the rule carries a bracket set for {@code bracket_tax}
     */
    public CompiledFormulaSet compile(List<FormulaDraft> drafts, Set<String> knownSources, boolean hasBrackets) {
        if (drafts == null || drafts.isEmpty()) {
            return CompiledFormulaSet.EMPTY;
        }
        List<Parsed> parsed = new ArrayList<>();
        for (FormulaDraft draft : drafts) {
            parsed.add(resolve(draft));
        }

        for (Parsed formula : parsed) {
            if (formula.tree().usesBracketTax() && !hasBrackets) {
                throw new RuleEngineException(ErrorType.RULE_VALIDATION_FAILED, COMPILE_STEP,
                    "formula for '" + formula.output() + "' uses bracket_tax but the rule has no bracket set");
            }
        }

        List<DependencyResolver.Node> nodes = parsed.stream()
            .map(p -> new DependencyResolver.Node(p.output(), p.references(), p.explicitOrder()))
            .toList();
        List<DependencyResolver.Node> sorted = DependencyResolver.order(nodes);

        Set<String> available = new HashSet<>(knownSources);
        Map<String, Parsed> byOutput = new HashMap<>();
        parsed.forEach(p -> byOutput.put(p.output(), p));
        for (DependencyResolver.Node node : sorted) {
            Set<String> unknown = new TreeSet<>(node.references());
            unknown.removeAll(available);
            if (!unknown.isEmpty()) {
                throw new RuleEngineException(ErrorType.VARIABLE_MISSING, RESOLUTION_STEP,
                    "formula for '" + node.output() + "' reads " + String.join(", ", unknown)
                        + " which no input, parameter or earlier formula provides");
            }
            available.add(node.output());
        }

        boolean keepExplicitOrders = parsed.stream().allMatch(p -> p.explicitOrder() != null);
        List<CompiledFormula> compiled = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            Parsed formula = byOutput.get(sorted.get(i).output());
            int order = keepExplicitOrders ? formula.explicitOrder() : i + 1;
            RuleFormula ruleFormula = new RuleFormula(formula.tree().render(), formula.output(), order,
                FormulaStatus.ACTIVE);
            compiled.add(new CompiledFormula(ruleFormula, formula.tree(), formula.references()));
        }
        log.debug("Compiled {} formulas into order {}", compiled.size(),
            compiled.stream().map(CompiledFormula::outputVariable).toList());
        return new CompiledFormulaSet(compiled);
    }

    /**
     * Reloads the active formulas of a stored rule. Their expressions are already in
     * canonical form, so no registry lookup happens here.
     */
    public CompiledFormulaSet load(List<RuleFormula> formulas) {
        List<CompiledFormula> compiled = new ArrayList<>();
        formulas.stream()
            .filter(f -> f.status() == FormulaStatus.ACTIVE)
            .sorted(Comparator.comparing(RuleFormula::calculationOrder))
            .forEach(f -> {
                Expr tree = FormulaParser.parse(f.expression());
                Set<String> references = new HashSet<>();
                tree.collectReferences(references);
                compiled.add(new CompiledFormula(f, tree, references));
            });
        return new CompiledFormulaSet(compiled);
    }

    /**
     * Text used to decide whether two drafts say the same thing: the rendered tree with
     * identifiers resolved where the registry already knows them. Unparseable drafts
     * compare by their whitespace-normalized source.
     */
    public String canonicalText(String expression) {
        try {
            return FormulaParser.parse(expression).mapVariables(this::peekKey).render();
        } catch (FormulaParseException ex) {
            log.debug("Comparing unparseable formula by source text: {}", ex.getMessage());
            return expression == null ? "" : expression.trim().replaceAll("\\s+", " ");
        }
    }

    private String peekKey(String term) {
        return registry.peek(term).map(Resolution::key).orElseGet(() -> TermNormalizer.normalize(term));
    }

    private Parsed resolve(FormulaDraft draft) {
        Expr raw = FormulaParser.parse(draft.expression());
        Resolution output = registry.resolve(draft.outputVariable());
        Set<String> unmapped = new LinkedHashSet<>();
        if (!output.isMapped()) {
            unmapped.add(draft.outputVariable());
        }

        Set<String> rawReferences = new TreeSet<>();
        raw.collectReferences(rawReferences);
        Map<String, String> keys = new HashMap<>();
        for (String term : rawReferences) {
            Resolution resolution = registry.resolve(term);
            if (resolution.isMapped()) {
                keys.put(term, resolution.key());
            } else {
                unmapped.add(term);
            }
        }
        if (!unmapped.isEmpty()) {
            throw new RuleEngineException(ErrorType.VARIABLE_MISSING, RESOLUTION_STEP,
                "unmapped variables in formula for '" + draft.outputVariable() + "': " + String.join(", ", unmapped)
                    + " (pending synonym review)");
        }
        Expr tree = raw.mapVariables(keys::get);
        Set<String> references = new HashSet<>();
        tree.collectReferences(references);
        return new Parsed(output.key(), tree, references, draft.calculationOrder());
    }

    private record Parsed(String output, Expr tree, Set<String> references, Integer explicitOrder) {
    }
}
