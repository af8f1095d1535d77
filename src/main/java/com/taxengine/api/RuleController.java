package com.taxengine.api;

import com.taxengine.contract.ValidationStatus;
import com.taxengine.rule.AggregatedRule;
import com.taxengine.rule.RuleStore;
import com.taxengine.validation.RuleTestCase;
import com.taxengine.validation.RuleValidationService;
import com.taxengine.validation.TestCaseDraft;
import com.taxengine.validation.ValidationReport;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Aggregated rules, their regression fixtures and the validation gate.
 */
@RestController
@RequestMapping("/v1/rules")
public class RuleController {

    private final RuleStore ruleStore;
    private final RuleValidationService validationService;

    public RuleController(RuleStore ruleStore, RuleValidationService validationService) {
        this.ruleStore = ruleStore;
        this.validationService = validationService;
    }

    @GetMapping
    public List<AggregatedRule> list(@RequestParam(name = "tax_type", required = false) String taxType) {
        return ruleStore.list(RequestValues.optionalTaxType(taxType, "tax_type"));
    }

    @GetMapping("/{ruleId}")
    public ResponseEntity<AggregatedRule> get(@PathVariable String ruleId) {
        return ruleStore.findById(ruleId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/{ruleId}/test-cases")
    public List<RuleTestCase> testCases(@PathVariable String ruleId) {
        return validationService.testCases(ruleId);
    }

    @PostMapping("/{ruleId}/test-cases")
    public RuleTestCase upsertTestCase(@PathVariable String ruleId, @RequestBody TestCaseDraft draft) {
        return validationService.upsertTestCase(ruleId, draft);
    }

    @DeleteMapping("/{ruleId}/test-cases/{testName}")
    public ResponseEntity<Void> deleteTestCase(@PathVariable String ruleId, @PathVariable String testName) {
        validationService.deleteTestCase(ruleId, testName);
        return ResponseEntity.noContent().build();
    }

    /**
     * A transition to {@code validated} that does not clear the gate answers 422 with the report.
     */
    @PostMapping("/{ruleId}/validation")
    public ResponseEntity<ValidationReport> transition(@PathVariable String ruleId,
                                                       @RequestBody Map<String, Object> request) {
        ValidationStatus target = RequestValues.parse(
            RequestValues.requireString(request.get("validation_status"), "validation_status is required"),
            ValidationStatus::fromValue, "validation_status");
        ValidationReport report = validationService.transition(ruleId, target);
        if (!report.applied()) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(report);
        }
        return ResponseEntity.ok(report);
    }
}
