package com.taxengine.aggregation;

import com.taxengine.contract.TaxType;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

@Component
public class InMemoryAggregationRunStore implements AggregationRunStore {

    private final ConcurrentHashMap<String, AggregationRun> runs = new ConcurrentHashMap<>();

    @Override
    public synchronized Optional<AggregationRun> tryStart(AggregationRun queued) {
        Optional<AggregationRun> active = findActive(queued.taxType(), queued.targetDate());
        if (active.isPresent()) {
            return active;
        }
        runs.put(queued.id(), queued);
        return Optional.empty();
    }

    @Override
    public synchronized Optional<AggregationRun> advance(String id, UnaryOperator<AggregationRun> change) {
        AggregationRun current = runs.get(id);
        if (current == null) {
            throw new IllegalArgumentException("unknown aggregation run: " + id);
        }
        if (current.status().isTerminal()) {
            return Optional.empty();
        }
        AggregationRun next = change.apply(current);
        runs.put(id, next);
        return Optional.of(next);
    }

    @Override
    public Optional<AggregationRun> findById(String id) {
        return Optional.ofNullable(runs.get(id));
    }

    @Override
    public Optional<AggregationRun> findActive(TaxType taxType, LocalDate targetDate) {
        return runs.values().stream()
            .filter(r -> r.taxType() == taxType && r.targetDate().equals(targetDate))
            .filter(r -> !r.status().isTerminal())
            .findFirst();
    }

    @Override
    public List<AggregationRun> list(Optional<TaxType> taxType, Optional<LocalDate> targetDate) {
        return runs.values().stream()
            .filter(r -> taxType.map(t -> t == r.taxType()).orElse(true))
            .filter(r -> targetDate.map(d -> d.equals(r.targetDate())).orElse(true))
            .sorted(Comparator.comparing(AggregationRun::createdAt).thenComparing(AggregationRun::id))
            .toList();
    }
}
