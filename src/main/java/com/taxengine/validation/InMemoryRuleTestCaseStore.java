package com.taxengine.validation;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryRuleTestCaseStore implements RuleTestCaseStore {

    private final ConcurrentHashMap<String, RuleTestCase> testCases = new ConcurrentHashMap<>();

    @Override
    public RuleTestCase upsert(RuleTestCase testCase) {
        testCases.put(key(testCase.ruleId(), testCase.testName()), testCase);
        return testCase;
    }

    @Override
    public Optional<RuleTestCase> find(String ruleId, String testName) {
        return Optional.ofNullable(testCases.get(key(ruleId, testName)));
    }

    @Override
    public List<RuleTestCase> findByRule(String ruleId) {
        return testCases.values().stream()
            .filter(t -> t.ruleId().equals(ruleId))
            .sorted(Comparator.comparing(RuleTestCase::testName))
            .toList();
    }

    @Override
    public boolean delete(String ruleId, String testName) {
        return testCases.remove(key(ruleId, testName)) != null;
    }

    private static String key(String ruleId, String testName) {
        return ruleId + "\u0000" + testName;
    }
}
