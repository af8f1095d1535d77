package com.taxengine.audit;

import com.taxengine.contract.ContractViolationException;
import com.taxengine.contract.ErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;

/**
 * Writes the outcome of every calculation: an audit on success, an error otherwise.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditStore store;
    private final Clock clock;

    public AuditService(AuditStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public CalculationAudit recordSuccess(CalculationAudit audit) {
        CalculationAudit stored = store.saveAudit(audit);
        if (stored != audit) {
            log.info("Execution {} already audited; keeping the first record", audit.executionId());
        }
        return stored;
    }

    public CalculationError recordFailure(String executionId, String calculationType, ErrorType errorType,
                                          String message, String failedStep, int retryCount) {
        CalculationError error = new CalculationError(UUID.randomUUID().toString(), executionId, calculationType,
            errorType, message, failedStep, retryCount, false, null, clock.instant(), null);
        store.saveError(error);
        log.warn("Execution {} failed with {} at {} after {} retries: {}", executionId, errorType.getValue(),
            failedStep, retryCount, message);
        return error;
    }

    public Optional<CalculationAudit> audit(String executionId) {
        return store.findAudit(executionId);
    }

    public List<CalculationError> errors(Optional<Boolean> resolved, Optional<String> executionId) {
        return store.errors(resolved, executionId);
    }

    public CalculationError resolveError(String id, String resolvedBy) {
        CalculationError error = store.findError(id)
            .orElseThrow(() -> new NoSuchElementException("unknown calculation error: " + id));
        if (resolvedBy == null || resolvedBy.isBlank()) {
            throw new ContractViolationException("resolved_by is required");
        }
        if (error.resolved()) {
            throw new ContractViolationException("calculation error " + id + " is already resolved");
        }
        CalculationError resolved = store.saveError(error.resolve(resolvedBy, clock.instant()));
        log.info("Calculation error {} resolved by {}", id, resolvedBy);
        return resolved;
    }

    public long auditCount() {
        return store.auditCount();
    }
}
