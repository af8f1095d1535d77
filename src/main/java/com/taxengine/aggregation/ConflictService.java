package com.taxengine.aggregation;

import com.taxengine.contract.ConflictStatus;
import com.taxengine.contract.ContractViolationException;
import com.taxengine.contract.TaxType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Operator decisions on conflicts. A decision is folded into the aggregated rule
 * by the next aggregation run, never applied directly.
 */
@Service
public class ConflictService {

    private static final Logger log = LoggerFactory.getLogger(ConflictService.class);

    private final ConflictStore store;
    private final Clock clock;

    public ConflictService(ConflictStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public List<RuleConflict> list(Optional<TaxType> taxType, Optional<LocalDate> targetDate,
                                   Optional<ConflictStatus> status) {
        return store.list(taxType, targetDate, status);
    }

    public RuleConflict get(String id) {
        return store.findById(id).orElseThrow(() -> new NoSuchElementException("unknown conflict: " + id));
    }

    /**
     * Moves a conflict to {@code under_review}, {@code resolved} or {@code dismissed}.
     * Resolving requires {@code details.chosen_evidence_id} naming one of the disagreeing candidates.
     */
    public synchronized RuleConflict resolve(String id, ConflictStatus target, Map<String, Object> details,
                                             String decidedBy) {
        RuleConflict conflict = get(id);
        if (target == null || target == ConflictStatus.OPEN) {
            throw new ContractViolationException("status must be under_review, resolved or dismissed");
        }
        if (conflict.status().isTerminal()) {
            throw new ContractViolationException("conflict " + id + " is already " + conflict.status().getValue());
        }
        if (target.isTerminal() && (decidedBy == null || decidedBy.isBlank())) {
            throw new ContractViolationException("decided_by is required");
        }

        Map<String, Object> resolution = new LinkedHashMap<>();
        if (details != null) {
            details.forEach((k, v) -> {
                if (v != null) {
                    resolution.put(k, v);
                }
            });
        }
        if (target == ConflictStatus.RESOLVED) {
            Object chosen = resolution.get(RuleConflict.CHOSEN_EVIDENCE_ID);
            if (chosen == null || conflict.details().stream()
                    .noneMatch(c -> c.evidenceRuleId().equals(chosen.toString()))) {
                throw new ContractViolationException(
                    "details.chosen_evidence_id must name one of the conflicting evidence rules");
            }
        }

        RuleConflict decided = store.save(conflict.decide(target, resolution, decidedBy, clock.instant()));
        log.info("Conflict {} ({} {} {}/{}) moved {} -> {} by {}", id, conflict.taxType().getValue(),
            conflict.targetDate(), conflict.aspect().getValue(), conflict.slot(),
            conflict.status().getValue(), target.getValue(), decidedBy);
        return decided;
    }
}
