package com.taxengine.evidence;

import com.taxengine.contract.TaxType;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

@Component
public class InMemoryEvidenceRuleStore implements EvidenceRuleStore {

    private final CopyOnWriteArrayList<EvidenceRule> rules = new CopyOnWriteArrayList<>();

    @Override
    public EvidenceRule append(EvidenceRule rule) {
        rules.add(rule);
        return rule;
    }

    @Override
    public Optional<EvidenceRule> findById(String id) {
        return rules.stream().filter(r -> r.id().equals(id)).findFirst();
    }

    @Override
    public boolean existsById(String id) {
        return rules.stream().anyMatch(r -> r.id().equals(id));
    }

    @Override
    public List<EvidenceRule> findApplicable(TaxType taxType, LocalDate date) {
        return rules.stream()
            .filter(r -> r.appliesTo(taxType, date))
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public List<EvidenceRule> findInForce(TaxType taxType, LocalDate date) {
        return rules.stream()
            .filter(r -> r.ruleType() == taxType || r.ruleType() == TaxType.GENERAL)
            .filter(r -> r.inForceOn(date))
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public List<EvidenceRule> query(Optional<TaxType> ruleType, Optional<LocalDate> inForceOn, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        return rules.stream()
            .filter(r -> ruleType.map(t -> t == r.ruleType()).orElse(true))
            .filter(r -> inForceOn.map(r::inForceOn).orElse(true))
            .limit(limit)
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public synchronized EvidenceRule replace(EvidenceRule rule) {
        for (int i = 0; i < rules.size(); i++) {
            if (rules.get(i).id().equals(rule.id())) {
                rules.set(i, rule);
                return rule;
            }
        }
        throw new IllegalArgumentException("unknown evidence rule: " + rule.id());
    }

    @Override
    public long count() {
        return rules.size();
    }
}
