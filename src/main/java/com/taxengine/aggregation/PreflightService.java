package com.taxengine.aggregation;

import com.taxengine.contract.PreflightStatus;
import com.taxengine.contract.TaxType;
import com.taxengine.evidence.EvidenceRule;
import com.taxengine.evidence.EvidenceRuleStore;
import com.taxengine.rule.RuleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Readiness check run before aggregation and on demand. The most recent
 * {@value #HISTORY_LIMIT} checks are kept for inspection.
 */
@Service
public class PreflightService {

    private static final Logger log = LoggerFactory.getLogger(PreflightService.class);

    static final int HISTORY_LIMIT = 1000;

    private final EvidenceRuleStore evidenceStore;
    private final RuleStore ruleStore;
    private final AggregationRunStore runStore;
    private final Clock clock;
    private final CopyOnWriteArrayList<PreflightRun> history = new CopyOnWriteArrayList<>();

    public PreflightService(EvidenceRuleStore evidenceStore, RuleStore ruleStore,
                            AggregationRunStore runStore, Clock clock) {
        this.evidenceStore = evidenceStore;
        this.ruleStore = ruleStore;
        this.runStore = runStore;
        this.clock = clock;
    }

    public PreflightRun check(TaxType taxType, LocalDate targetDate) {
        return check(taxType, targetDate, Optional.empty());
    }

    /**
     * @param ownRunId run performing the check; it does not count as a concurrent aggregation
     */
    public PreflightRun check(TaxType taxType, LocalDate targetDate, Optional<String> ownRunId) {
        List<EvidenceRule> inForce = evidenceStore.findInForce(taxType, targetDate);
        long usable = inForce.stream().filter(EvidenceRule::isUsable).count();
        int aggregated = (int) ruleStore.list(Optional.of(taxType)).stream()
            .filter(r -> !r.targetDate().isAfter(targetDate))
            .count();

        List<String> blockers = new ArrayList<>();
        if (inForce.isEmpty()) {
            blockers.add(PreflightRun.NO_EVIDENCE);
        } else if (usable == 0) {
            blockers.add(PreflightRun.INVALID_EVIDENCE_ONLY);
        }
        runStore.findActive(taxType, targetDate)
            .filter(active -> ownRunId.map(own -> !own.equals(active.id())).orElse(true))
            .ifPresent(active -> blockers.add(PreflightRun.AGGREGATION_IN_PROGRESS));

        PreflightRun run = new PreflightRun(UUID.randomUUID().toString(), taxType, targetDate,
            blockers.isEmpty() ? PreflightStatus.OK : PreflightStatus.BLOCKED,
            (int) usable, aggregated, blockers, clock.instant());
        synchronized (history) {
            history.add(run);
            if (history.size() > HISTORY_LIMIT) {
                history.remove(0);
            }
        }
        if (run.isBlocked()) {
            log.warn("Preflight blocked for {} on {}: {}", taxType.getValue(), targetDate, blockers);
        } else {
            log.debug("Preflight ok for {} on {}: {} evidence, {} aggregated", taxType.getValue(), targetDate,
                usable, aggregated);
        }
        return run;
    }

    /** Recorded checks, oldest first, optionally narrowed to one tax type and date. */
    public List<PreflightRun> history(Optional<TaxType> taxType, Optional<LocalDate> targetDate) {
        return history.stream()
            .filter(r -> taxType.map(t -> t == r.taxType()).orElse(true))
            .filter(r -> targetDate.map(d -> d.equals(r.targetDate())).orElse(true))
            .toList();
    }
}
