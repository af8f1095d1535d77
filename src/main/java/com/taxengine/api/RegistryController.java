package com.taxengine.api;

import com.taxengine.contract.SynonymStatus;
import com.taxengine.contract.VariableDataType;
import com.taxengine.registry.CanonicalVariable;
import com.taxengine.registry.CanonicalVariableRegistry;
import com.taxengine.registry.SynonymProposal;
import com.taxengine.registry.VariableSynonym;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical variables and the synonym review queue.
 */
@RestController
@RequestMapping("/v1/admin")
public class RegistryController {

    private final CanonicalVariableRegistry registry;

    public RegistryController(CanonicalVariableRegistry registry) {
        this.registry = registry;
    }

    @PutMapping("/canonical-variables/{key}")
    public CanonicalVariable upsertVariable(@PathVariable String key,
                                            @RequestBody(required = false) Map<String, Object> request) {
        Map<String, Object> body = request != null ? request : Map.of();
        String dataType = RequestValues.optionalString(body.get("data_type"));
        return registry.upsertVariable(
            key,
            RequestValues.optionalString(body.get("label")),
            dataType != null ? RequestValues.parse(dataType, VariableDataType::fromValue, "data_type") : null,
            RequestValues.optionalString(body.get("unit")),
            RequestValues.optionalString(body.get("category"))
        );
    }

    @GetMapping("/canonical-variables")
    public List<CanonicalVariable> variables(@RequestParam(name = "include_inactive", defaultValue = "false")
                                             boolean includeInactive) {
        return registry.variables(includeInactive);
    }

    @GetMapping("/canonical-variables/{key}")
    public ResponseEntity<CanonicalVariable> variable(@PathVariable String key) {
        return registry.variable(key)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/canonical-variables/{key}/deactivate")
    public CanonicalVariable deactivate(@PathVariable String key,
                                        @RequestBody(required = false) Map<String, Object> request) {
        Map<String, Object> body = request != null ? request : Map.of();
        return registry.deactivate(key,
            RequestValues.optionalString(body.get("reason")),
            RequestValues.optionalString(body.get("replaced_by")));
    }

    @PostMapping("/proposals")
    public List<VariableSynonym> propose(@RequestBody List<SynonymProposal> proposals) {
        return registry.propose(proposals);
    }

    @GetMapping("/proposals")
    public List<VariableSynonym> proposals(@RequestParam(name = "status", required = false) String status,
                                           @RequestParam(name = "document_id", required = false) String documentId,
                                           @RequestParam(name = "tax_type", required = false) String taxType) {
        Optional<SynonymStatus> statusFilter = status == null || status.isBlank()
            ? Optional.empty()
            : Optional.of(RequestValues.parse(status, SynonymStatus::fromValue, "status"));
        return registry.synonyms(statusFilter, Optional.ofNullable(documentId),
            RequestValues.optionalTaxType(taxType, "tax_type"));
    }

    @PostMapping("/proposals/{id}/approve")
    public VariableSynonym approve(@PathVariable String id, @RequestBody Map<String, Object> request) {
        return registry.approveSynonym(id,
            RequestValues.requireString(request.get("variable_key"), "variable_key is required"),
            RequestValues.requireString(request.get("decided_by"), "decided_by is required"));
    }

    @PostMapping("/proposals/{id}/reject")
    public VariableSynonym reject(@PathVariable String id, @RequestBody Map<String, Object> request) {
        return registry.rejectSynonym(id,
            RequestValues.requireString(request.get("decided_by"), "decided_by is required"));
    }
}
