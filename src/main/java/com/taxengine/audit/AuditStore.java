package com.taxengine.audit;

import java.util.List;
import java.util.Optional;

public interface AuditStore {

    /**
     * Stores the audit unless one already exists for its execution id.
     *
     * @return the audit now on record for that execution id
     */
    CalculationAudit saveAudit(CalculationAudit audit);

    Optional<CalculationAudit> findAudit(String executionId);

    CalculationError saveError(CalculationError error);

    Optional<CalculationError> findError(String id);

    List<CalculationError> errors(Optional<Boolean> resolved, Optional<String> executionId);

    long auditCount();
}
