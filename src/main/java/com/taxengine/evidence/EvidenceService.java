package com.taxengine.evidence;

import com.taxengine.api.DuplicateEvidenceException;
import com.taxengine.contract.ContractViolationException;
import com.taxengine.contract.TaxType;
import com.taxengine.contract.ValidationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

@Service
public class EvidenceService {

    private static final Logger log = LoggerFactory.getLogger(EvidenceService.class);

    private final EvidenceContractValidator validator;
    private final EvidenceRuleStore store;
    private final Clock clock;

    public EvidenceService(EvidenceContractValidator validator, EvidenceRuleStore store, Clock clock) {
        this.validator = validator;
        this.store = store;
        this.clock = clock;
    }

    public EvidenceRule ingest(EvidenceSubmission submission) {
        if (submission != null && submission.id() != null && store.existsById(submission.id())) {
            throw new DuplicateEvidenceException(submission.id());
        }
        EvidenceRule rule = validator.validate(submission, clock.instant());
        store.append(rule);
        log.info("Ingested evidence rule id={} type={} category={} authority={} document={}",
            rule.id(), rule.ruleType().getValue(), rule.category().getValue(),
            rule.sourceAuthority().getValue(), rule.documentId());
        return rule;
    }

    public List<EvidenceRule> query(Optional<TaxType> ruleType, Optional<LocalDate> inForceOn, int limit) {
        return store.query(ruleType, inForceOn, limit);
    }

    /**
     * The only mutation evidence allows after ingestion.
     */
    public synchronized EvidenceRule updateValidationStatus(String id, ValidationStatus target) {
        EvidenceRule current = store.findById(id)
            .orElseThrow(() -> new NoSuchElementException("unknown evidence rule: " + id));
        if (target == null) {
            throw new ContractViolationException("validation_status is required");
        }
        if (!current.validationStatus().canTransitionTo(target)) {
            throw new ContractViolationException("evidence " + id + " cannot move from "
                + current.validationStatus().getValue() + " to " + target.getValue());
        }
        EvidenceRule updated = store.replace(current.withValidationStatus(target));
        log.info("Evidence rule {} validation_status {} -> {}", id,
            current.validationStatus().getValue(), target.getValue());
        return updated;
    }
}
