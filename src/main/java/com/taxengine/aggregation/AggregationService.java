package com.taxengine.aggregation;

import com.taxengine.api.AggregationInProgressException;
import com.taxengine.contract.ConflictAspect;
import com.taxengine.contract.ConflictStatus;
import com.taxengine.contract.ContractViolationException;
import com.taxengine.contract.ErrorType;
import com.taxengine.contract.Failures;
import com.taxengine.contract.RuleCategory;
import com.taxengine.contract.RuleEngineException;
import com.taxengine.contract.TaxType;
import com.taxengine.contract.ValidationStatus;
import com.taxengine.evidence.EvidenceRule;
import com.taxengine.evidence.EvidenceRuleStore;
import com.taxengine.formula.CompiledFormulaSet;
import com.taxengine.formula.FormulaCompiler;
import com.taxengine.registry.CanonicalVariableRegistry;
import com.taxengine.registry.TermNormalizer;
import com.taxengine.rule.AggregatedRule;
import com.taxengine.rule.AggregatedRuleSource;
import com.taxengine.rule.BracketSchedule;
import com.taxengine.rule.CompileError;
import com.taxengine.rule.FormulaDraft;
import com.taxengine.rule.FormulaStatus;
import com.taxengine.rule.Numbers;
import com.taxengine.rule.RuleContent;
import com.taxengine.rule.RuleData;
import com.taxengine.rule.RuleFormula;
import com.taxengine.rule.RuleStore;
import com.taxengine.rule.TaxBracket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Reconciles the evidence for one (tax type, target date) into an aggregated rule.
 *
 * Evidence is split into slots (the bracket set, each parameter, each formula output,
 * each definition, the unit). Every slot is decided independently by the
 * {@link ReconciliationPolicy}; a slot whose top-tier evidence disagrees is left out
 * of the rule and recorded as a {@link RuleConflict}. Operator decisions on earlier
 * conflicts are folded in on the next run.
 */
@Service
public class AggregationService {

    private static final Logger log = LoggerFactory.getLogger(AggregationService.class);

    static final String BRACKETS_SLOT = "brackets";
    static final String UNIT_SLOT = "unit";

    private final EvidenceRuleStore evidenceStore;
    private final RuleStore ruleStore;
    private final ConflictStore conflictStore;
    private final AggregationRunStore runStore;
    private final PreflightService preflightService;
    private final CanonicalVariableRegistry registry;
    private final FormulaCompiler compiler;
    private final ReconciliationPolicy policy;
    private final AggregationSettings settings;
    private final Clock clock;

    public AggregationService(EvidenceRuleStore evidenceStore, RuleStore ruleStore, ConflictStore conflictStore,
                              AggregationRunStore runStore, PreflightService preflightService,
                              CanonicalVariableRegistry registry, FormulaCompiler compiler,
                              ReconciliationPolicy policy, AggregationSettings settings, Clock clock) {
        this.evidenceStore = evidenceStore;
        this.ruleStore = ruleStore;
        this.conflictStore = conflictStore;
        this.runStore = runStore;
        this.preflightService = preflightService;
        this.registry = registry;
        this.compiler = compiler;
        this.policy = policy;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Runs one aggregation. At most one run per key is active; a second request while
     * one is queued or running fails with {@link AggregationInProgressException}.
     */
    public AggregationOutcome aggregate(TaxType taxType, LocalDate targetDate) {
        if (taxType == null || targetDate == null) {
            throw new ContractViolationException("tax_type and target_date are required");
        }
        AggregationRun queued = AggregationRun.queued(UUID.randomUUID().toString(), taxType, targetDate,
            clock.instant());
        runStore.tryStart(queued).ifPresent(active -> {
            log.warn("Rejected aggregation for {}: run {} is {}", active.key(), active.id(),
                active.status().getValue());
            throw new AggregationInProgressException(active.key(), active.id());
        });
        AggregationRun run = advance(queued.id(), r -> r.running(clock.instant()));
        log.info("Aggregation run {} started for {}", run.id(), run.key());

        try {
            PreflightRun preflight = preflightService.check(taxType, targetDate, Optional.of(run.id()));
            if (preflight.isBlocked()) {
                AggregationRun blocked = advance(run.id(), r -> r.failed(0, 0, 0, null, null,
                    "preflight blocked", preflight.blockers(), clock.instant()));
                return new AggregationOutcome(blocked, Optional.empty(), preflight.blockers(), List.of());
            }
            return reconcile(run, taxType, targetDate);
        } catch (RuntimeException | Error ex) {
            ErrorType type = Failures.classify(ex);
            log.error("Aggregation run {} for {} failed with {}", run.id(), run.key(), type.getValue(), ex);
            runStore.advance(run.id(), r -> r.failed(r.inputsCount(), r.outputsCount(), r.conflictsCount(),
                r.ruleId(), type, ex.getMessage(), List.of(), clock.instant()));
            throw ex;
        }
    }

    /**
     * Marks an abandoned run failed so its key can be aggregated again.
     */
    public AggregationRun failRun(String runId, String reason) {
        AggregationRun run = runStore.findById(runId)
            .orElseThrow(() -> new NoSuchElementException("unknown aggregation run: " + runId));
        String message = "abandoned: " + (reason == null || reason.isBlank() ? "no reason given" : reason);
        AggregationRun failed = runStore.advance(runId, r -> r.failed(r.inputsCount(), r.outputsCount(),
                r.conflictsCount(), r.ruleId(), ErrorType.UNKNOWN_ERROR, message, r.blockers(), clock.instant()))
            .orElseThrow(() -> new ContractViolationException("aggregation run " + runId + " is already "
                + run.status().getValue()));
        log.warn("Aggregation run {} for {} marked failed: {}", runId, failed.key(), message);
        return failed;
    }

    public List<AggregationRun> runs(Optional<TaxType> taxType, Optional<LocalDate> targetDate) {
        return runStore.list(taxType, targetDate);
    }

    private AggregationOutcome reconcile(AggregationRun run, TaxType taxType, LocalDate targetDate) {
        List<EvidenceRule> evidence = evidenceStore.findApplicable(taxType, targetDate);
        SortedMap<SlotKey, List<SlotCandidate>> slots = new TreeMap<>();
        Set<String> inputs = new TreeSet<>();
        for (EvidenceRule rule : evidence) {
            collect(rule, slots);
            rule.inputs().forEach(term -> inputs.add(registry.resolve(term).key()));
        }

        Draft draft = new Draft();
        List<RuleConflict> blocking = new ArrayList<>();
        List<AggregatedRuleSource> sources = new ArrayList<>();
        for (Map.Entry<SlotKey, List<SlotCandidate>> entry : slots.entrySet()) {
            SlotKey key = entry.getKey();
            List<SlotCandidate> ranked = entry.getValue().stream().sorted(policy.ranking()).toList();
            Optional<RuleConflict> existing = conflictStore.findBySlot(taxType, targetDate, key.aspect(), key.slot());
            ReconciliationPolicy.Outcome outcome = decide(ranked, existing);
            if (outcome instanceof ReconciliationPolicy.Outcome.Accepted accepted) {
                draft.apply(accepted.winner());
                sources.addAll(accepted.sources());
            } else if (outcome instanceof ReconciliationPolicy.Outcome.Conflicted conflicted) {
                RuleConflict conflict = existing.filter(RuleConflict::isBlocking)
                    .map(open -> refreshDetails(open, conflicted.disagreeing()))
                    .orElseGet(() -> openConflict(taxType, targetDate, key, conflicted.disagreeing()));
                blocking.add(conflict);
                draft.pendingAspects.add(key.describe());
                if (key.aspect() == ConflictAspect.FORMULAS) {
                    draft.formulasPending = true;
                }
            }
        }

        RuleEngineException failure = null;
        if (draft.brackets != null) {
            try {
                BracketSchedule.of(draft.brackets);
            } catch (RuleEngineException ex) {
                failure = ex;
            }
        }
        List<RuleFormula> formulas;
        if (draft.formulasPending) {
            formulas = draft.formulaDrafts.entrySet().stream()
                .map(e -> new RuleFormula(e.getValue().expression(), e.getKey(), e.getValue().calculationOrder(),
                    FormulaStatus.INACTIVE))
                .toList();
        } else {
            Set<String> knownSources = new HashSet<>(inputs);
            knownSources.addAll(draft.parameters.keySet());
            try {
                CompiledFormulaSet compiled = compiler.compile(new ArrayList<>(draft.formulaDrafts.values()),
                    knownSources, draft.brackets != null);
                formulas = compiled.formulas();
            } catch (RuleEngineException ex) {
                log.warn("Formula compilation failed for {}: {} at {}: {}", run.key(), ex.getErrorType().getValue(),
                    ex.getFailedStep(), ex.getMessage());
                if (failure == null) {
                    failure = ex;
                }
                formulas = draft.formulaDrafts.entrySet().stream()
                    .map(e -> new RuleFormula(e.getValue().expression(), e.getKey(),
                        e.getValue().calculationOrder(), FormulaStatus.FAILED))
                    .toList();
            }
        }

        RuleContent content = new RuleContent(draft.brackets, draft.parameters, draft.definitions, draft.unit,
            new ArrayList<>(inputs), formulas, draft.pendingAspects);
        AggregatedRule rule = publish(taxType, targetDate, content, sources,
            failure == null ? null : CompileError.of(failure));

        int outputs = slots.size() - blocking.size();
        Set<ConflictAspect> blockingRequired = new TreeSet<>();
        blocking.stream()
            .map(RuleConflict::aspect)
            .filter(settings.requiredAspects()::contains)
            .forEach(blockingRequired::add);

        AggregationRun finished;
        if (failure != null) {
            RuleEngineException cause = failure;
            finished = advance(run.id(), r -> r.failed(evidence.size(), outputs, blocking.size(), rule.ruleId(),
                cause.getErrorType(), cause.getMessage(), List.of(), clock.instant()));
        } else if (!blockingRequired.isEmpty()) {
            String message = "unresolved conflicts on required aspects: "
                + blockingRequired.stream().map(ConflictAspect::getValue).toList();
            finished = advance(run.id(), r -> r.failed(evidence.size(), outputs, blocking.size(), rule.ruleId(),
                null, message, List.of(), clock.instant()));
        } else {
            finished = advance(run.id(), r -> r.completed(evidence.size(), outputs, blocking.size(), rule.ruleId(),
                clock.instant()));
        }
        log.info("Aggregation run {} for {} {}: {} evidence, {} slots accepted, {} conflicts, rule {} v{} ({})",
            finished.id(), finished.key(), finished.status().getValue(), evidence.size(), outputs, blocking.size(),
            rule.ruleId(), rule.version(), rule.validationStatus().getValue());
        return new AggregationOutcome(finished, Optional.of(rule), List.of(), blocking);
    }

    private ReconciliationPolicy.Outcome decide(List<SlotCandidate> ranked, Optional<RuleConflict> existing) {
        if (existing.isPresent()) {
            RuleConflict conflict = existing.get();
            if (conflict.status() == ConflictStatus.RESOLVED) {
                Optional<SlotCandidate> chosen = ranked.stream()
                    .filter(c -> c.evidenceRuleId().equals(conflict.chosenEvidenceId()))
                    .findFirst();
                if (chosen.isPresent()) {
                    return policy.accept(ranked, chosen.get(), AggregatedRuleSource.OPERATOR_DECISION);
                }
                log.warn("Evidence {} chosen for conflict {} no longer applies; reconciling again",
                    conflict.chosenEvidenceId(), conflict.id());
            } else if (conflict.status() == ConflictStatus.DISMISSED) {
                return policy.accept(ranked, ranked.get(0), AggregatedRuleSource.PRIMARY);
            }
        }
        return policy.reconcile(ranked);
    }

    private RuleConflict openConflict(TaxType taxType, LocalDate targetDate, SlotKey key,
                                      List<SlotCandidate> disagreeing) {
        RuleConflict conflict = new RuleConflict(UUID.randomUUID().toString(), taxType, targetDate, key.aspect(),
            key.slot(), ConflictStatus.OPEN, disagreeing.stream().map(SlotCandidate::toConflictCandidate).toList(),
            Map.of(), null, null, clock.instant());
        conflictStore.save(conflict);
        log.info("Opened conflict {} for {}:{} on {} between {}", conflict.id(), taxType.getValue(), targetDate,
            key.describe(), disagreeing.stream().map(SlotCandidate::evidenceRuleId).toList());
        return conflict;
    }

    /** Keeps a still-blocking conflict in step with the values that currently disagree. */
    private RuleConflict refreshDetails(RuleConflict open, List<SlotCandidate> disagreeing) {
        List<ConflictCandidate> details = disagreeing.stream().map(SlotCandidate::toConflictCandidate).toList();
        if (details.equals(open.details())) {
            return open;
        }
        RuleConflict refreshed = conflictStore.save(open.withDetails(details));
        log.info("Conflict {} on {} now between {}", open.id(), open.slot(),
            details.stream().map(ConflictCandidate::evidenceRuleId).toList());
        return refreshed;
    }

    /**
     * Stores the rule unless nothing changed. The version moves only with the content hash;
     * a new version starts over as pending (or failed when it did not compile). Replacing an
     * existing snapshot goes through compare-and-set so a validation-status transition that
     * lands in between is re-read rather than overwritten.
     */
    private AggregatedRule publish(TaxType taxType, LocalDate targetDate, RuleContent content,
                                   List<AggregatedRuleSource> sources, CompileError compileError) {
        String ruleId = AggregatedRule.ruleId(taxType, targetDate);
        String hash = content.fingerprint();
        while (true) {
            Instant now = clock.instant();
            Optional<AggregatedRule> existing = ruleStore.findById(ruleId);
            AggregatedRule next;
            if (existing.isPresent() && existing.get().contentHash().equals(hash)) {
                AggregatedRule current = existing.get();
                if (current.sources().equals(sources)) {
                    return current;
                }
                next = new AggregatedRule(ruleId, taxType, targetDate, current.version(),
                    AggregatedRule.SOURCE_KIND, current.content(), sources, current.validationStatus(), hash,
                    current.compileError(), current.createdAt(), now);
            } else {
                int version = existing.map(r -> r.version() + 1).orElse(1);
                ValidationStatus status = compileError != null ? ValidationStatus.FAILED : ValidationStatus.PENDING;
                next = new AggregatedRule(ruleId, taxType, targetDate, version, AggregatedRule.SOURCE_KIND,
                    content, sources, status, hash, compileError,
                    existing.map(AggregatedRule::createdAt).orElse(now), now);
            }
            if (existing.isEmpty()) {
                ruleStore.save(next);
            } else if (!ruleStore.compareAndSet(existing.get(), next)) {
                log.debug("Rule {} changed while publishing; reading it again", ruleId);
                continue;
            }
            if (existing.isEmpty() || existing.get().version() != next.version()) {
                log.info("Published aggregated rule {} version {} ({})", ruleId, next.version(),
                    next.validationStatus().getValue());
            }
            return next;
        }
    }

    private void collect(EvidenceRule rule, SortedMap<SlotKey, List<SlotCandidate>> slots) {
        RuleData data = rule.ruleData();
        if (data instanceof RuleData.BracketSet bracketSet) {
            List<TaxBracket> brackets = bracketSet.brackets().stream()
                .map(TaxBracket::normalized)
                .sorted(Comparator.comparingInt(TaxBracket::bracketOrder))
                .toList();
            add(slots, rule, ConflictAspect.BRACKETS, BRACKETS_SLOT, brackets, brackets);
        } else if (data instanceof RuleData.Parameter parameter) {
            ConflictAspect aspect = data.category() == RuleCategory.RATE ? ConflictAspect.OTHER : ConflictAspect.THRESHOLDS;
            BigDecimal value = data.category() == RuleCategory.RATE
                ? Numbers.rate(parameter.value())
                : Numbers.currency(parameter.value());
            add(slots, rule, aspect, registry.resolve(parameter.variable()).key(), value, value);
        }
        for (FormulaDraft formula : rule.formulas()) {
            String output = registry.resolve(formula.outputVariable()).key();
            add(slots, rule, ConflictAspect.FORMULAS, output, formula, compiler.canonicalText(formula.expression()));
        }
        rule.definitions().forEach((term, meaning) -> {
            String text = meaning == null ? "" : meaning.trim();
            add(slots, rule, ConflictAspect.DEFINITIONS, TermNormalizer.normalize(term), text, comparableText(text));
        });
        if (rule.unit() != null) {
            add(slots, rule, ConflictAspect.UNITS, UNIT_SLOT, rule.unit().trim(), comparableText(rule.unit()));
        }
    }

    private static void add(SortedMap<SlotKey, List<SlotCandidate>> slots, EvidenceRule rule, ConflictAspect aspect,
                            String slot, Object value, Object comparable) {
        slots.computeIfAbsent(new SlotKey(aspect, slot), k -> new ArrayList<>())
            .add(new SlotCandidate(rule, aspect, slot, value, comparable));
    }

    private static String comparableText(String text) {
        return text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private AggregationRun advance(String runId, UnaryOperator<AggregationRun> change) {
        return runStore.advance(runId, change)
            .orElseGet(() -> runStore.findById(runId).orElseThrow());
    }

    private record SlotKey(ConflictAspect aspect, String slot) implements Comparable<SlotKey> {

        @Override
        public int compareTo(SlotKey other) {
            int byAspect = aspect.compareTo(other.aspect);
            return byAspect != 0 ? byAspect : slot.compareTo(other.slot);
        }

        /** Entry for {@code pending_aspects}: the aspect alone for single-slot aspects. */
        String describe() {
            return aspect == ConflictAspect.BRACKETS || aspect == ConflictAspect.UNITS
                ? aspect.getValue()
                : aspect.getValue() + ":" + slot;
        }
    }

    /** Accepted values accumulated while walking the slots. */
    private static final class Draft {
        private List<TaxBracket> brackets;
        private final SortedMap<String, BigDecimal> parameters = new TreeMap<>();
        private final SortedMap<String, String> definitions = new TreeMap<>();
        private final SortedMap<String, FormulaDraft> formulaDrafts = new TreeMap<>();
        private final List<String> pendingAspects = new ArrayList<>();
        private String unit;
        private boolean formulasPending;

        @SuppressWarnings("unchecked")
        void apply(SlotCandidate winner) {
            switch (winner.aspect()) {
                case BRACKETS -> brackets = (List<TaxBracket>) winner.value();
                case THRESHOLDS, OTHER -> parameters.put(winner.slot(), (BigDecimal) winner.value());
                case DEFINITIONS -> definitions.put(winner.slot(), (String) winner.value());
                case UNITS -> unit = (String) winner.value();
                case FORMULAS -> formulaDrafts.put(winner.slot(), (FormulaDraft) winner.value());
                case INPUTS -> throw new IllegalStateException("inputs are unioned, not reconciled");
            }
        }
    }
}
