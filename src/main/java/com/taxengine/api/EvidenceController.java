package com.taxengine.api;

import com.taxengine.contract.ValidationStatus;
import com.taxengine.evidence.EvidenceRule;
import com.taxengine.evidence.EvidenceService;
import com.taxengine.evidence.EvidenceSubmission;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/evidence")
public class EvidenceController {

    private final EvidenceService evidenceService;

    public EvidenceController(EvidenceService evidenceService) {
        this.evidenceService = evidenceService;
    }

    @PostMapping
    public Map<String, Object> ingest(@RequestBody EvidenceSubmission submission) {
        EvidenceRule stored = evidenceService.ingest(submission);
        return Map.of(
            "status", "accepted",
            "evidence_id", stored.id(),
            "validation_status", stored.validationStatus().getValue()
        );
    }

    @GetMapping
    public List<EvidenceRule> query(@RequestParam(name = "rule_type", required = false) String ruleType,
                                    @RequestParam(name = "date", required = false) String date,
                                    @RequestParam(defaultValue = "100") int limit) {
        return evidenceService.query(
            RequestValues.optionalTaxType(ruleType, "rule_type"),
            RequestValues.optionalDate(date, "date"),
            Math.min(limit, 1000)
        );
    }

    @PostMapping("/{id}/validation-status")
    public EvidenceRule updateValidationStatus(@PathVariable String id, @RequestBody Map<String, Object> request) {
        ValidationStatus target = RequestValues.parse(
            RequestValues.requireString(request.get("validation_status"), "validation_status is required"),
            ValidationStatus::fromValue, "validation_status");
        return evidenceService.updateValidationStatus(id, target);
    }
}
