package com.taxengine.audit;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryAuditStore implements AuditStore {

    private final ConcurrentHashMap<String, CalculationAudit> audits = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CalculationError> errors = new ConcurrentHashMap<>();

    @Override
    public CalculationAudit saveAudit(CalculationAudit audit) {
        CalculationAudit existing = audits.putIfAbsent(audit.executionId(), audit);
        return existing != null ? existing : audit;
    }

    @Override
    public Optional<CalculationAudit> findAudit(String executionId) {
        return Optional.ofNullable(audits.get(executionId));
    }

    @Override
    public CalculationError saveError(CalculationError error) {
        errors.put(error.id(), error);
        return error;
    }

    @Override
    public Optional<CalculationError> findError(String id) {
        return Optional.ofNullable(errors.get(id));
    }

    @Override
    public List<CalculationError> errors(Optional<Boolean> resolved, Optional<String> executionId) {
        return errors.values().stream()
            .filter(e -> resolved.map(r -> r == e.resolved()).orElse(true))
            .filter(e -> executionId.map(id -> id.equals(e.executionId())).orElse(true))
            .sorted(Comparator.comparing(CalculationError::createdAt).thenComparing(CalculationError::id))
            .toList();
    }

    @Override
    public long auditCount() {
        return audits.size();
    }
}
