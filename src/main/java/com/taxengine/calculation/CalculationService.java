package com.taxengine.calculation;

import com.taxengine.api.CalculationFailedException;
import com.taxengine.audit.AuditService;
import com.taxengine.audit.BreakdownLine;
import com.taxengine.audit.CalculationAudit;
import com.taxengine.audit.CalculationError;
import com.taxengine.contract.ContractViolationException;
import com.taxengine.contract.ErrorType;
import com.taxengine.contract.Failures;
import com.taxengine.contract.RuleEngineException;
import com.taxengine.contract.TaxType;
import com.taxengine.contract.ValidationStatus;
import com.taxengine.formula.CompiledFormula;
import com.taxengine.formula.CompiledFormulaSet;
import com.taxengine.formula.Expr;
import com.taxengine.formula.FormulaCompiler;
import com.taxengine.formula.FormulaEvaluator;
import com.taxengine.registry.CanonicalVariableRegistry;
import com.taxengine.registry.Resolution;
import com.taxengine.registry.TermNormalizer;
import com.taxengine.rule.AggregatedRule;
import com.taxengine.rule.BracketSchedule;
import com.taxengine.rule.Numbers;
import com.taxengine.rule.RuleContent;
import com.taxengine.rule.RuleStore;
import com.taxengine.schema.FormSchema;
import com.taxengine.schema.FormSchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Runs a calculation request against the applicable aggregated rule.
 *
 * An execution works on one immutable rule snapshot and keeps every intermediate
 * value private until it completes, so a failure never leaves partial output behind.
 * Successful executions are audited once per execution id; failed ones leave a
 * {@link CalculationError}. Only infrastructure failures are retried.
 */
@Service
public class CalculationService {

    private static final Logger log = LoggerFactory.getLogger(CalculationService.class);

    static final String BRACKET_TAX_OUTPUT = "bracket_tax";

    private final RuleStore ruleStore;
    private final CanonicalVariableRegistry registry;
    private final FormulaCompiler compiler;
    private final FormulaEvaluator evaluator;
    private final AuditService auditService;
    private final FormSchemaRegistry schemas;
    private final CalculationSettings settings;
    private final Clock clock;

    public CalculationService(RuleStore ruleStore, CanonicalVariableRegistry registry, FormulaCompiler compiler,
                              FormulaEvaluator evaluator, AuditService auditService, FormSchemaRegistry schemas,
                              CalculationSettings settings, Clock clock) {
        this.ruleStore = ruleStore;
        this.registry = registry;
        this.compiler = compiler;
        this.evaluator = evaluator;
        this.auditService = auditService;
        this.schemas = schemas;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Calculates and audits. A request repeating an audited execution id returns the
     * recorded result without running again.
     *
     * @throws CalculationFailedException when the execution fails; the error is already recorded
     */
    public CalculationResult calculate(CalculationRequest request) {
        if (request == null) {
            throw new ContractViolationException("request body is required");
        }
        String executionId = request.executionId() == null || request.executionId().isBlank()
            ? UUID.randomUUID().toString()
            : request.executionId();
        Optional<CalculationAudit> recorded = auditService.audit(executionId);
        if (recorded.isPresent()) {
            log.info("Execution {} already completed; returning the audited result", executionId);
            return CalculationResult.fromAudit(recorded.get());
        }

        TaxType type = parseType(request.calculationType());
        LocalDate date = parseDate(request.targetDate());
        Map<String, BigDecimal> input = coerceInputs(request.inputData());

        for (int attempt = 0; ; attempt++) {
            Execution execution = new Execution(executionId, clock.instant());
            try {
                CalculationAudit audit = execute(execution, type, date, input, request.inputData());
                CalculationAudit stored = auditService.recordSuccess(audit);
                log.info("Execution {} completed: {} on {} with rule {} v{}, final_amount={}{}", executionId,
                    type.getValue(), date, stored.ruleId(), stored.ruleVersion(), stored.finalAmount().toPlainString(),
                    stored.preview() ? " (preview)" : "");
                return CalculationResult.fromAudit(stored);
            } catch (RuntimeException ex) {
                ErrorType errorType = Failures.classify(ex);
                String step = failedStep(ex, execution);
                if (!errorType.isRetryable() || attempt + 1 >= settings.maxAttempts()) {
                    CalculationError error = auditService.recordFailure(executionId, type.getValue(), errorType,
                        describe(ex), step, attempt);
                    throw new CalculationFailedException(error, ex);
                }
                Duration delay = settings.backoff().multipliedBy(1L << attempt);
                log.warn("Execution {} attempt {} failed with {} at {}; retrying in {} ms", executionId, attempt + 1,
                    errorType.getValue(), step, delay.toMillis(), ex);
                pause(delay, executionId, type, step, attempt);
            }
        }
    }

    /**
     * Evaluates {@code rule} as given, with no audit, no retries and no rule lookup.
     * Used to replay regression fixtures.
     */
    public CalculationResult dryRun(AggregatedRule rule, Map<String, Object> inputData) {
        Execution execution = new Execution("dry-run-" + UUID.randomUUID(), clock.instant());
        Evaluation evaluation = evaluate(rule, coerceInputs(inputData), execution);
        return new CalculationResult(execution.executionId, evaluation.outputs(), evaluation.breakdown(), null,
            evaluation.finalAmount(), rule.validationStatus() != ValidationStatus.VALIDATED, rule.ruleId(),
            rule.version());
    }

    private CalculationAudit execute(Execution execution, TaxType type, LocalDate date, Map<String, BigDecimal> input,
                                     Map<String, Object> rawInput) {
        execution.state = ExecutionState.RULE_LOOKUP;
        AggregatedRule rule = selectRule(type, date);
        Evaluation evaluation = evaluate(rule, input, execution);
        Integer schemaVersion = schemas.current(type).map(FormSchema::version).orElse(null);
        Instant finishedAt = clock.instant();
        return new CalculationAudit(execution.executionId, type, rule.ruleId(), rule.version(), schemaVersion,
            rawInput != null ? new LinkedHashMap<>(rawInput) : Map.of(), evaluation.outputs(), evaluation.breakdown(),
            evaluation.finalAmount(), rule.validationStatus() != ValidationStatus.VALIDATED, execution.startedAt,
            Duration.between(execution.startedAt, finishedAt).toMillis());
    }

    private AggregatedRule selectRule(TaxType type, LocalDate date) {
        AggregatedRule rule = ruleStore.findApplicable(type, date)
            .orElseThrow(() -> new RuleEngineException(ErrorType.RULE_VALIDATION_FAILED,
                ExecutionState.RULE_LOOKUP.getValue(),
                "no aggregated " + type.getValue() + " rule effective on or before " + date));
        if (rule.validationStatus() == ValidationStatus.FAILED) {
            if (rule.compileError() != null) {
                throw rule.compileError().toException(rule.ruleId());
            }
            throw new RuleEngineException(ErrorType.RULE_VALIDATION_FAILED, ExecutionState.RULE_LOOKUP.getValue(),
                "rule " + rule.ruleId() + " failed validation");
        }
        return rule;
    }

    private Evaluation evaluate(AggregatedRule rule, Map<String, BigDecimal> input, Execution execution) {
        RuleContent content = rule.content();
        if (!content.allFormulasActive()) {
            throw new RuleEngineException(ErrorType.RULE_VALIDATION_FAILED, ExecutionState.RULE_LOOKUP.getValue(),
                "rule " + rule.ruleId() + " has formulas that are not active; pending aspects: "
                    + content.pendingAspects());
        }
        if (content.formulas().isEmpty() && !content.hasBrackets()) {
            throw new RuleEngineException(ErrorType.RULE_VALIDATION_FAILED, ExecutionState.RULE_LOOKUP.getValue(),
                "rule " + rule.ruleId() + " has neither formulas nor a bracket set; pending aspects: "
                    + content.pendingAspects());
        }

        execution.state = ExecutionState.RESOLVING_VARIABLES;
        Map<String, BigDecimal> scope = new HashMap<>();
        input.forEach((term, value) -> scope.put(inputKey(term), value));
        scope.putAll(content.parameters());
        CompiledFormulaSet formulas = compiler.load(content.formulas());
        Set<String> missing = new TreeSet<>();
        if (formulas.isEmpty()) {
            missing.add(settings.defaultIncomeVariable());
        } else {
            Set<String> produced = new HashSet<>();
            for (CompiledFormula formula : formulas.ordered()) {
                formula.references().stream().filter(r -> !produced.contains(r)).forEach(missing::add);
                produced.add(formula.outputVariable());
            }
        }
        missing.removeAll(scope.keySet());
        if (!missing.isEmpty()) {
            throw new RuleEngineException(ErrorType.VARIABLE_MISSING, execution.state.getValue(),
                "no input value for " + String.join(", ", missing));
        }
        execution.checkDeadline(settings.budget());

        execution.state = ExecutionState.EVALUATING;
        BracketSchedule schedule = content.hasBrackets() ? BracketSchedule.of(content.brackets()) : null;
        List<BreakdownLine> breakdown = new ArrayList<>();
        UnaryOperator<BigDecimal> bracketTax = income -> {
            if (schedule == null) {
                throw new RuleEngineException(ErrorType.RULE_VALIDATION_FAILED, ExecutionState.EVALUATING.getValue(),
                    "rule " + rule.ruleId() + " has no bracket set");
            }
            BracketSchedule.Evaluation result = schedule.evaluate(income);
            result.contributions().forEach(c -> breakdown.add(bracketLine(breakdown.size() + 1, c)));
            return result.total();
        };

        SortedMap<String, BigDecimal> outputs = new TreeMap<>();
        BigDecimal last;
        if (formulas.isEmpty()) {
            Expr defaultTax = new Expr.Call(Expr.Function.BRACKET_TAX,
                List.of(new Expr.Variable(settings.defaultIncomeVariable())));
            last = evaluator.evaluate(defaultTax, scope, bracketTax);
            outputs.put(BRACKET_TAX_OUTPUT, Numbers.currency(last));
        } else {
            last = BigDecimal.ZERO;
            for (CompiledFormula formula : formulas.ordered()) {
                execution.checkDeadline(settings.budget());
                last = evaluator.evaluate(formula.tree(), scope, bracketTax);
                scope.put(formula.outputVariable(), last);
                outputs.put(formula.outputVariable(), Numbers.currency(last));
                breakdown.add(BreakdownLine.formula(breakdown.size() + 1, formula.outputVariable(),
                    formula.formula().expression(), Numbers.currency(last)));
            }
        }
        execution.checkDeadline(settings.budget());
        BigDecimal finalAmount = last.signum() < 0 ? BigDecimal.ZERO : last;
        execution.state = ExecutionState.COMPLETED;
        return new Evaluation(outputs, breakdown, Numbers.currency(finalAmount));
    }

    private static BreakdownLine bracketLine(int step, BracketSchedule.Contribution c) {
        return new BreakdownLine(step, BreakdownLine.BRACKET, null, null, c.bracketOrder(),
            Numbers.currency(c.lowerBound()), Numbers.currency(c.upperBound()), Numbers.currency(c.taxableSlice()),
            Numbers.rate(c.rate()), Numbers.currency(c.amount()));
    }

    private String inputKey(String term) {
        return registry.peek(term).map(Resolution::key).orElseGet(() -> TermNormalizer.normalize(term));
    }

    private void pause(Duration delay, String executionId, TaxType type, String step, int attempt) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            CalculationError error = auditService.recordFailure(executionId, type.getValue(), ErrorType.UNKNOWN_ERROR,
                "interrupted while waiting to retry", step, attempt);
            throw new CalculationFailedException(error, ex);
        }
    }

    private static String failedStep(RuntimeException ex, Execution execution) {
        if (ex instanceof RuleEngineException engine && engine.getFailedStep() != null) {
            return engine.getFailedStep();
        }
        return execution.state.getValue();
    }

    private static String describe(RuntimeException ex) {
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }

    private TaxType parseType(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ContractViolationException("calculationType is required");
        }
        try {
            return TaxType.fromValue(raw.trim());
        } catch (IllegalArgumentException ex) {
            throw new ContractViolationException("calculationType is invalid: " + raw);
        }
    }

    private LocalDate parseDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return LocalDate.now(clock);
        }
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException ex) {
            throw new ContractViolationException("targetDate must be an ISO date (yyyy-MM-dd)");
        }
    }

    private static Map<String, BigDecimal> coerceInputs(Map<String, Object> raw) {
        Map<String, BigDecimal> values = new LinkedHashMap<>();
        if (raw == null) {
            return values;
        }
        raw.forEach((key, value) -> {
            if (key == null || key.isBlank()) {
                throw new ContractViolationException("inputData keys must not be blank");
            }
            if (value == null) {
                return;
            }
            if (value instanceof Boolean flag) {
                values.put(key, flag ? BigDecimal.ONE : BigDecimal.ZERO);
            } else if (value instanceof Number || value instanceof String) {
                try {
                    values.put(key, new BigDecimal(value.toString().trim()));
                } catch (NumberFormatException ex) {
                    throw new ContractViolationException("inputData." + key + " must be numeric");
                }
            } else {
                throw new ContractViolationException("inputData." + key + " must be a number, numeric string or boolean");
            }
        });
        return values;
    }

    private record Evaluation(SortedMap<String, BigDecimal> outputs, List<BreakdownLine> breakdown,
                              BigDecimal finalAmount) {
    }

    /** Mutable bookkeeping of one attempt. */
    private static final class Execution {
        private final String executionId;
        private final Instant startedAt;
        private final long startedNanos = System.nanoTime();
        private ExecutionState state = ExecutionState.PENDING;

        private Execution(String executionId, Instant startedAt) {
            this.executionId = executionId;
            this.startedAt = startedAt;
        }

        void checkDeadline(Duration budget) {
            long elapsed = System.nanoTime() - startedNanos;
            if (elapsed > budget.toNanos()) {
                throw new RuleEngineException(ErrorType.CALCULATION_OVERFLOW, state.getValue(),
                    "execution exceeded its wall-clock budget of " + budget.toMillis() + " ms");
            }
        }
    }
}
