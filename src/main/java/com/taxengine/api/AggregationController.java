package com.taxengine.api;

import com.taxengine.aggregation.AggregationOutcome;
import com.taxengine.aggregation.AggregationRun;
import com.taxengine.aggregation.AggregationService;
import com.taxengine.aggregation.PreflightRun;
import com.taxengine.aggregation.PreflightService;
import com.taxengine.contract.TaxType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregation runs and preflight checks.
 *
 * POST /v1/admin/aggregate
 * GET  /v1/admin/aggregation-runs
 * POST /v1/admin/aggregation-runs/{id}/fail
 * GET  /v1/admin/preflight
 * GET  /v1/admin/preflight-runs
 */
@RestController
@RequestMapping("/v1/admin")
public class AggregationController {

    private final AggregationService aggregationService;
    private final PreflightService preflightService;

    public AggregationController(AggregationService aggregationService, PreflightService preflightService) {
        this.aggregationService = aggregationService;
        this.preflightService = preflightService;
    }

    @PostMapping("/aggregate")
    public Map<String, Object> aggregate(@RequestBody Map<String, Object> request) {
        TaxType taxType = RequestValues.taxType(RequestValues.optionalString(request.get("tax_type")), "tax_type");
        LocalDate targetDate = RequestValues.date(RequestValues.optionalString(request.get("target_date")),
            "target_date");
        AggregationOutcome outcome = aggregationService.aggregate(taxType, targetDate);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("runId", outcome.run().id());
        body.put("status", outcome.status());
        if (outcome.isBlocked()) {
            body.put("blockers", outcome.blockers());
        }
        outcome.rule().ifPresent(rule -> {
            body.put("ruleId", rule.ruleId());
            body.put("ruleVersion", rule.version());
            body.put("validationStatus", rule.validationStatus().getValue());
        });
        body.put("conflictIds", outcome.conflicts().stream().map(c -> c.id()).toList());
        if (outcome.run().message() != null) {
            body.put("message", outcome.run().message());
        }
        return body;
    }

    @GetMapping("/aggregation-runs")
    public List<AggregationRun> runs(@RequestParam(name = "tax_type", required = false) String taxType,
                                     @RequestParam(name = "date", required = false) String date) {
        return aggregationService.runs(RequestValues.optionalTaxType(taxType, "tax_type"),
            RequestValues.optionalDate(date, "date"));
    }

    @PostMapping("/aggregation-runs/{id}/fail")
    public AggregationRun failRun(@PathVariable String id,
                                  @RequestBody(required = false) Map<String, Object> request) {
        String reason = request != null ? RequestValues.optionalString(request.get("reason")) : null;
        return aggregationService.failRun(id, reason);
    }

    @GetMapping("/preflight")
    public PreflightRun preflight(@RequestParam(name = "tax_type", required = false) String taxType,
                                  @RequestParam(name = "date", required = false) String date) {
        return preflightService.check(RequestValues.taxType(taxType, "tax_type"), RequestValues.date(date, "date"));
    }

    @GetMapping("/preflight-runs")
    public List<PreflightRun> preflightRuns(@RequestParam(name = "tax_type", required = false) String taxType,
                                            @RequestParam(name = "date", required = false) String date) {
        return preflightService.history(RequestValues.optionalTaxType(taxType, "tax_type"),
            RequestValues.optionalDate(date, "date"));
    }
}
