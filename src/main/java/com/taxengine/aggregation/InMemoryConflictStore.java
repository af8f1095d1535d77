package com.taxengine.aggregation;

import com.taxengine.contract.ConflictAspect;
import com.taxengine.contract.ConflictStatus;
import com.taxengine.contract.TaxType;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryConflictStore implements ConflictStore {

    private final ConcurrentHashMap<String, RuleConflict> conflicts = new ConcurrentHashMap<>();

    @Override
    public RuleConflict save(RuleConflict conflict) {
        conflicts.put(conflict.id(), conflict);
        return conflict;
    }

    @Override
    public Optional<RuleConflict> findById(String id) {
        return Optional.ofNullable(conflicts.get(id));
    }

    @Override
    public Optional<RuleConflict> findBySlot(TaxType taxType, LocalDate targetDate, ConflictAspect aspect, String slot) {
        return conflicts.values().stream()
            .filter(c -> c.matches(taxType, targetDate, aspect, slot))
            .max(Comparator.comparing(RuleConflict::createdAt).thenComparing(RuleConflict::id));
    }

    @Override
    public List<RuleConflict> list(Optional<TaxType> taxType, Optional<LocalDate> targetDate,
                                   Optional<ConflictStatus> status) {
        return conflicts.values().stream()
            .filter(c -> taxType.map(t -> t == c.taxType()).orElse(true))
            .filter(c -> targetDate.map(d -> d.equals(c.targetDate())).orElse(true))
            .filter(c -> status.map(s -> s == c.status()).orElse(true))
            .sorted(Comparator.comparing(RuleConflict::createdAt).thenComparing(RuleConflict::id))
            .toList();
    }

    @Override
    public long countBlocking() {
        return conflicts.values().stream().filter(RuleConflict::isBlocking).count();
    }
}
