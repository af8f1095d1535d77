package com.taxengine.api;

import com.taxengine.aggregation.ConflictService;
import com.taxengine.aggregation.RuleConflict;
import com.taxengine.contract.ConflictStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/v1/conflicts")
public class ConflictController {

    private final ConflictService conflictService;

    public ConflictController(ConflictService conflictService) {
        this.conflictService = conflictService;
    }

    @GetMapping
    public List<RuleConflict> list(@RequestParam(name = "tax_type", required = false) String taxType,
                                   @RequestParam(name = "date", required = false) String date,
                                   @RequestParam(name = "status", required = false) String status) {
        Optional<ConflictStatus> statusFilter = status == null || status.isBlank()
            ? Optional.empty()
            : Optional.of(RequestValues.parse(status, ConflictStatus::fromValue, "status"));
        return conflictService.list(RequestValues.optionalTaxType(taxType, "tax_type"),
            RequestValues.optionalDate(date, "date"), statusFilter);
    }

    @GetMapping("/{id}")
    public RuleConflict get(@PathVariable String id) {
        return conflictService.get(id);
    }

    /**
     * Body: {"status": "resolved", "details": {"chosen_evidence_id": "..."}, "decided_by": "..."}
     */
    @PostMapping("/{id}/resolve")
    public RuleConflict resolve(@PathVariable String id, @RequestBody Map<String, Object> request) {
        ConflictStatus status = RequestValues.parse(
            RequestValues.requireString(request.get("status"), "status is required"),
            ConflictStatus::fromValue, "status");
        return conflictService.resolve(id, status,
            RequestValues.optionalObject(request.get("details"), "details"),
            RequestValues.optionalString(request.get("decided_by")));
    }
}
