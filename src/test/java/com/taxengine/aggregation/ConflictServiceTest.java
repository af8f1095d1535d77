package com.taxengine.aggregation;

import com.taxengine.TestEngine;
import com.taxengine.contract.ConflictAspect;
import com.taxengine.contract.ConflictStatus;
import com.taxengine.contract.ContractViolationException;
import com.taxengine.contract.SourceAuthority;
import com.taxengine.contract.TaxType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ConflictServiceTest {

    private static final LocalDate DATE = LocalDate.parse("2025-04-01");

    private ConflictStore store;
    private ConflictService service;
    private RuleConflict conflict;

    @BeforeEach
    void setUp() {
        store = new InMemoryConflictStore();
        service = new ConflictService(store, TestEngine.CLOCK);
        conflict = store.save(new RuleConflict("c-1", TaxType.VAT, DATE, ConflictAspect.OTHER, "vat_rate",
            ConflictStatus.OPEN, List.of(
                new ConflictCandidate("e-1", SourceAuthority.ACT, DATE, null, new BigDecimal("0.18")),
                new ConflictCandidate("e-2", SourceAuthority.ACT, DATE, null, new BigDecimal("0.15"))),
            Map.of(), null, null, TestEngine.CLOCK.instant()));
    }

    @Test
    void resolve_recordsChoiceAndDecider() {
        RuleConflict resolved = service.resolve(conflict.id(), ConflictStatus.RESOLVED,
            Map.of(RuleConflict.CHOSEN_EVIDENCE_ID, "e-2", "note", "gazette superseded"), "reviewer");

        assertEquals(ConflictStatus.RESOLVED, resolved.status());
        assertEquals("e-2", resolved.chosenEvidenceId());
        assertEquals("reviewer", resolved.decidedBy());
        assertNotNull(resolved.decidedAt());
        assertFalse(resolved.isBlocking());
    }

    @Test
    void resolve_requiresChosenCandidate() {
        assertThrows(ContractViolationException.class, () -> service.resolve(conflict.id(), ConflictStatus.RESOLVED,
            Map.of(RuleConflict.CHOSEN_EVIDENCE_ID, "e-9"), "reviewer"));
        assertThrows(ContractViolationException.class, () -> service.resolve(conflict.id(), ConflictStatus.RESOLVED,
            Map.of(), "reviewer"));
    }

    @Test
    void nullDetailValues_areDropped() {
        Map<String, Object> details = new HashMap<>();
        details.put("note", null);
        RuleConflict dismissed = service.resolve(conflict.id(), ConflictStatus.DISMISSED, details, "reviewer");
        assertTrue(dismissed.resolution().isEmpty());
    }

    @Test
    void underReview_staysBlockingAndNeedsNoDecider() {
        RuleConflict reviewing = service.resolve(conflict.id(), ConflictStatus.UNDER_REVIEW, null, null);
        assertEquals(ConflictStatus.UNDER_REVIEW, reviewing.status());
        assertTrue(reviewing.isBlocking());
    }

    @Test
    void terminalConflict_cannotBeReopened() {
        service.resolve(conflict.id(), ConflictStatus.DISMISSED, Map.of(), "reviewer");
        assertThrows(ContractViolationException.class,
            () -> service.resolve(conflict.id(), ConflictStatus.UNDER_REVIEW, Map.of(), "reviewer"));
        assertThrows(ContractViolationException.class,
            () -> service.resolve(conflict.id(), ConflictStatus.OPEN, Map.of(), "reviewer"));
    }

    @Test
    void terminalDecision_requiresDecider() {
        assertThrows(ContractViolationException.class,
            () -> service.resolve(conflict.id(), ConflictStatus.DISMISSED, Map.of(), " "));
    }

    @Test
    void listFiltersByStatus() {
        assertEquals(1, service.list(Optional.of(TaxType.VAT), Optional.of(DATE),
            Optional.of(ConflictStatus.OPEN)).size());
        assertTrue(service.list(Optional.empty(), Optional.empty(), Optional.of(ConflictStatus.RESOLVED)).isEmpty());
        assertThrows(NoSuchElementException.class, () -> service.get("missing"));
    }
}
