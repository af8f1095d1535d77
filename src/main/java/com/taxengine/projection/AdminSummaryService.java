package com.taxengine.projection;

import com.taxengine.aggregation.ConflictStore;
import com.taxengine.audit.AuditService;
import com.taxengine.contract.SynonymStatus;
import com.taxengine.evidence.EvidenceRuleStore;
import com.taxengine.registry.CanonicalVariableRegistry;
import com.taxengine.rule.RuleStore;
import com.taxengine.schema.FormSchemaRegistry;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Builds the admin summary by reading every store. Nothing is cached.
 */
@Service
public class AdminSummaryService {

    private final EvidenceRuleStore evidenceStore;
    private final RuleStore ruleStore;
    private final ConflictStore conflictStore;
    private final CanonicalVariableRegistry registry;
    private final FormSchemaRegistry schemas;
    private final AuditService auditService;
    private final Clock clock;

    public AdminSummaryService(EvidenceRuleStore evidenceStore, RuleStore ruleStore, ConflictStore conflictStore,
                               CanonicalVariableRegistry registry, FormSchemaRegistry schemas,
                               AuditService auditService, Clock clock) {
        this.evidenceStore = evidenceStore;
        this.ruleStore = ruleStore;
        this.conflictStore = conflictStore;
        this.registry = registry;
        this.schemas = schemas;
        this.auditService = auditService;
        this.clock = clock;
    }

    public AdminSummary summarize() {
        Map<String, Long> byStatus = ruleStore.list(Optional.empty()).stream()
            .collect(Collectors.groupingBy(r -> r.validationStatus().getValue(), TreeMap::new, Collectors.counting()));
        return new AdminSummary(
            evidenceStore.count(),
            ruleStore.count(),
            byStatus,
            conflictStore.countBlocking(),
            registry.synonyms(Optional.of(SynonymStatus.PENDING), Optional.empty(), Optional.empty()).size(),
            registry.variables(false).size(),
            schemas.activeCount(),
            auditService.auditCount(),
            auditService.errors(Optional.of(false), Optional.empty()).size(),
            clock.instant()
        );
    }
}
