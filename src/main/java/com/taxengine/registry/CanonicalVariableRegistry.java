package com.taxengine.registry;

import com.taxengine.contract.ContractViolationException;
import com.taxengine.contract.SynonymStatus;
import com.taxengine.contract.TaxType;
import com.taxengine.contract.VariableDataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps raw extracted terms to canonical variable keys.
 *
 * Resolution never fails silently: an unknown term is registered as a pending
 * synonym so that an operator can map it later. Only {@link #approveSynonym} and
 * {@link #rejectSynonym} change a synonym's status, and approval is the only
 * way a term becomes bound to a variable.
 */
@Service
public class CanonicalVariableRegistry {

    private static final Logger log = LoggerFactory.getLogger(CanonicalVariableRegistry.class);

    private final Map<String, CanonicalVariable> variables = new ConcurrentHashMap<>();
    private final Map<String, VariableSynonym> synonymsById = new ConcurrentHashMap<>();
    private final Map<String, String> synonymIdsByNormalizedTerm = new ConcurrentHashMap<>();
    private final Clock clock;

    public CanonicalVariableRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Resolves a term to its canonical key, registering a pending synonym when
     * nothing matches.
     */
    public synchronized Resolution resolve(String term) {
        String normalized = requireTerm(term);
        Optional<Resolution> known = lookup(normalized);
        if (known.isPresent()) {
            return known.get();
        }
        VariableSynonym created = newSynonym(term, normalized,
            new SynonymProposal(term, null, null, null, null));
        log.info("Registered pending synonym '{}' for unmapped term '{}'", created.normalizedTerm(), term);
        return new Resolution.Unmapped(normalized, created.id());
    }

    /**
     * Side-effect free variant of {@link #resolve}: returns empty for terms the
     * registry has never seen.
     */
    public Optional<Resolution> peek(String term) {
        if (term == null || TermNormalizer.normalize(term).isEmpty()) {
            return Optional.empty();
        }
        return lookup(TermNormalizer.normalize(term));
    }

    private Optional<Resolution> lookup(String normalized) {
        CanonicalVariable direct = variables.get(normalized);
        if (direct != null && direct.active()) {
            return Optional.of(new Resolution.Mapped(direct.key()));
        }
        String synonymId = synonymIdsByNormalizedTerm.get(normalized);
        if (synonymId == null) {
            return Optional.empty();
        }
        VariableSynonym synonym = synonymsById.get(synonymId);
        if (synonym.status() == SynonymStatus.APPROVED) {
            CanonicalVariable bound = variables.get(synonym.variableKey());
            if (bound != null && bound.active()) {
                return Optional.of(new Resolution.Mapped(bound.key()));
            }
        }
        return Optional.of(new Resolution.Unmapped(normalized, synonym.id()));
    }

    /**
     * Ingests a batch of proposals. A proposal for an already known normalized
     * term merges into the existing record instead of creating a duplicate.
     */
    public synchronized List<VariableSynonym> propose(List<SynonymProposal> batch) {
        List<VariableSynonym> touched = new ArrayList<>();
        for (SynonymProposal proposal : batch) {
            String normalized = requireTerm(proposal.term());
            String existingId = synonymIdsByNormalizedTerm.get(normalized);
            if (existingId != null) {
                VariableSynonym merged = synonymsById.get(existingId).mergeProposal(proposal);
                synonymsById.put(existingId, merged);
                touched.add(merged);
            } else {
                touched.add(newSynonym(proposal.term(), normalized, proposal));
            }
        }
        log.info("Ingested {} synonym proposals", batch.size());
        return touched;
    }

    public synchronized VariableSynonym approveSynonym(String synonymId, String variableKey, String decidedBy) {
        VariableSynonym synonym = requirePending(synonymId);
        requireString(decidedBy, "decided_by is required");
        CanonicalVariable variable = variables.get(TermNormalizer.normalize(variableKey));
        if (variable == null || !variable.active()) {
            throw new ContractViolationException("variable_key does not name an active canonical variable: " + variableKey);
        }
        VariableSynonym approved = synonym.decide(SynonymStatus.APPROVED, variable.key(), decidedBy, clock.instant());
        synonymsById.put(synonymId, approved);
        log.info("Synonym '{}' approved as '{}' by {}", synonym.normalizedTerm(), variable.key(), decidedBy);
        return approved;
    }

    public synchronized VariableSynonym rejectSynonym(String synonymId, String decidedBy) {
        VariableSynonym synonym = requirePending(synonymId);
        requireString(decidedBy, "decided_by is required");
        VariableSynonym rejected = synonym.decide(SynonymStatus.REJECTED, null, decidedBy, clock.instant());
        synonymsById.put(synonymId, rejected);
        log.info("Synonym '{}' rejected by {}", synonym.normalizedTerm(), decidedBy);
        return rejected;
    }

    /**
     * Creates a variable or redefines an existing one. The version is bumped only
     * when the definition actually changes; upserting a deactivated key revives it.
     */
    public synchronized CanonicalVariable upsertVariable(String key, String label, VariableDataType dataType,
                                                         String unit, String category) {
        String normalized = requireTerm(key);
        VariableDataType type = dataType != null ? dataType : VariableDataType.NUMBER;
        CanonicalVariable existing = variables.get(normalized);
        CanonicalVariable result;
        if (existing == null) {
            result = new CanonicalVariable(normalized, label != null ? label : normalized, type, unit, category,
                1, true, null, null, null);
            log.info("Created canonical variable '{}'", normalized);
        } else {
            String effectiveLabel = label != null ? label : existing.label();
            if (existing.active() && existing.sameDefinition(effectiveLabel, type, unit, category)) {
                return existing;
            }
            result = existing.redefine(effectiveLabel, type, unit, category);
            log.info("Redefined canonical variable '{}' at version {}", normalized, result.version());
        }
        variables.put(normalized, result);
        return result;
    }

    public synchronized CanonicalVariable deactivate(String key, String reason, String replacedBy) {
        CanonicalVariable existing = variables.get(TermNormalizer.normalize(key));
        if (existing == null) {
            throw new ContractViolationException("unknown canonical variable: " + key);
        }
        if (replacedBy != null && !variables.containsKey(TermNormalizer.normalize(replacedBy))) {
            throw new ContractViolationException("replaced_by does not name a canonical variable: " + replacedBy);
        }
        CanonicalVariable deactivated = existing.deactivate(reason,
            replacedBy != null ? TermNormalizer.normalize(replacedBy) : null, clock.instant());
        variables.put(existing.key(), deactivated);
        log.info("Deactivated canonical variable '{}'", existing.key());
        return deactivated;
    }

    public Optional<CanonicalVariable> variable(String key) {
        return Optional.ofNullable(variables.get(TermNormalizer.normalize(key)));
    }

    public List<CanonicalVariable> variables(boolean includeInactive) {
        return variables.values().stream()
            .filter(v -> includeInactive || v.active())
            .sorted(Comparator.comparing(CanonicalVariable::key))
            .toList();
    }

    public Optional<VariableSynonym> synonym(String synonymId) {
        return Optional.ofNullable(synonymsById.get(synonymId));
    }

    public List<VariableSynonym> synonyms(Optional<SynonymStatus> status,
                                          Optional<String> documentId,
                                          Optional<TaxType> taxType) {
        return synonymsById.values().stream()
            .filter(s -> status.map(st -> st == s.status()).orElse(true))
            .filter(s -> documentId.map(d -> d.equals(s.documentId())).orElse(true))
            .filter(s -> taxType.map(t -> t == s.taxType()).orElse(true))
            .sorted(Comparator.comparing(VariableSynonym::createdAt).thenComparing(VariableSynonym::id))
            .toList();
    }

    private VariableSynonym newSynonym(String rawTerm, String normalized, SynonymProposal proposal) {
        VariableSynonym synonym = new VariableSynonym(
            UUID.randomUUID().toString(), rawTerm, normalized, null,
            proposal.suggestedVariableKey(), proposal.confidence(), proposal.documentId(), proposal.taxType(),
            SynonymStatus.PENDING, null, null, 1, clock.instant());
        synonymsById.put(synonym.id(), synonym);
        synonymIdsByNormalizedTerm.put(normalized, synonym.id());
        return synonym;
    }

    private VariableSynonym requirePending(String synonymId) {
        VariableSynonym synonym = synonymsById.get(synonymId);
        if (synonym == null) {
            throw new ContractViolationException("unknown synonym: " + synonymId);
        }
        if (synonym.status() != SynonymStatus.PENDING) {
            throw new ContractViolationException("synonym " + synonymId + " is already " + synonym.status().getValue());
        }
        return synonym;
    }

    private String requireTerm(String term) {
        String normalized = TermNormalizer.normalize(term);
        if (normalized.isEmpty()) {
            throw new ContractViolationException("term must contain at least one letter or digit");
        }
        return normalized;
    }

    private void requireString(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new ContractViolationException(message);
        }
    }
}
