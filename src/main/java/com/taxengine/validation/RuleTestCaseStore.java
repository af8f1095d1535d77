package com.taxengine.validation;

import java.util.List;
import java.util.Optional;

public interface RuleTestCaseStore {

    /** Inserts or replaces the fixture with the same rule id and test name. */
    RuleTestCase upsert(RuleTestCase testCase);

    Optional<RuleTestCase> find(String ruleId, String testName);

    /** Fixtures of a rule ordered by test name. */
    List<RuleTestCase> findByRule(String ruleId);

    boolean delete(String ruleId, String testName);
}
