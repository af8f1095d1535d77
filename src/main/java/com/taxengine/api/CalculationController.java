package com.taxengine.api;

import com.taxengine.audit.AuditService;
import com.taxengine.audit.CalculationAudit;
import com.taxengine.audit.CalculationError;
import com.taxengine.calculation.CalculationRequest;
import com.taxengine.calculation.CalculationResult;
import com.taxengine.calculation.CalculationService;
import org.springframework.http.ResponseEntity;
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

/**
 * Calculation entrypoint plus read access to the audit trail.
 *
 * POST /v1/calculate
 * GET  /v1/calculations/{executionId}
 * GET  /v1/calculation-errors
 * POST /v1/calculation-errors/{id}/resolve
 */
@RestController
@RequestMapping("/v1")
public class CalculationController {

    private final CalculationService calculationService;
    private final AuditService auditService;

    public CalculationController(CalculationService calculationService, AuditService auditService) {
        this.calculationService = calculationService;
        this.auditService = auditService;
    }

    @PostMapping("/calculate")
    public CalculationResult calculate(@RequestBody CalculationRequest request) {
        return calculationService.calculate(request);
    }

    @GetMapping("/calculations/{executionId}")
    public ResponseEntity<CalculationAudit> audit(@PathVariable String executionId) {
        return auditService.audit(executionId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/calculation-errors")
    public List<CalculationError> errors(@RequestParam(required = false) Boolean resolved,
                                         @RequestParam(name = "execution_id", required = false) String executionId) {
        return auditService.errors(Optional.ofNullable(resolved), Optional.ofNullable(executionId));
    }

    @PostMapping("/calculation-errors/{id}/resolve")
    public CalculationError resolveError(@PathVariable String id, @RequestBody Map<String, Object> request) {
        return auditService.resolveError(id,
            RequestValues.requireString(request.get("resolved_by"), "resolved_by is required"));
    }
}
