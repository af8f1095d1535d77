package com.taxengine.rule;

import com.taxengine.contract.TaxType;
import com.taxengine.contract.ValidationStatus;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryRuleStore implements RuleStore {

    private final ConcurrentHashMap<String, AggregatedRule> rules = new ConcurrentHashMap<>();

    @Override
    public AggregatedRule save(AggregatedRule rule) {
        rules.put(rule.ruleId(), rule);
        return rule;
    }

    @Override
    public Optional<AggregatedRule> findById(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    @Override
    public boolean compareAndSet(AggregatedRule expected, AggregatedRule next) {
        return rules.replace(expected.ruleId(), expected, next);
    }

    @Override
    public Optional<AggregatedRule> findApplicable(TaxType taxType, LocalDate date) {
        return rules.values().stream()
            .filter(r -> r.taxType() == taxType)
            .filter(r -> r.validationStatus() != ValidationStatus.DEPRECATED)
            .filter(r -> !r.targetDate().isAfter(date))
            .max(Comparator.comparing(AggregatedRule::targetDate));
    }

    @Override
    public List<AggregatedRule> list(Optional<TaxType> taxType) {
        return rules.values().stream()
            .filter(r -> taxType.map(t -> t == r.taxType()).orElse(true))
            .sorted(Comparator.comparing(AggregatedRule::taxType).thenComparing(AggregatedRule::targetDate))
            .toList();
    }

    @Override
    public long count() {
        return rules.size();
    }
}
