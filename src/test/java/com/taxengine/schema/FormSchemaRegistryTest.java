package com.taxengine.schema;

import com.taxengine.TestEngine;
import com.taxengine.contract.ContractViolationException;
import com.taxengine.contract.TaxType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class FormSchemaRegistryTest {

    private FormSchemaRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new FormSchemaRegistry(TestEngine.CLOCK);
    }

    @Test
    void registeredVersions_startInactive() {
        FormSchema first = registry.register(TaxType.VAT, Map.of("fields", List.of("output_vat")));
        FormSchema second = registry.register(TaxType.VAT, Map.of("fields", List.of("output_vat", "input_vat")));

        assertEquals(1, first.version());
        assertEquals(2, second.version());
        assertTrue(registry.current(TaxType.VAT).isEmpty());
    }

    @Test
    void activation_keepsOneActiveSchemaPerType() {
        registry.register(TaxType.VAT, Map.of("v", 1));
        registry.register(TaxType.VAT, Map.of("v", 2));
        registry.register(TaxType.PAYE, Map.of("v", 1));

        registry.activate(TaxType.VAT, 1);
        registry.activate(TaxType.PAYE, 1);
        registry.activate(TaxType.VAT, 2);

        assertEquals(2, registry.current(TaxType.VAT).orElseThrow().version());
        assertEquals(1, registry.versions(TaxType.VAT).stream().filter(FormSchema::active).count());
        assertEquals(2, registry.activeCount());
    }

    @Test
    void unknownVersion_isNotFound() {
        registry.register(TaxType.VAT, Map.of("v", 1));
        assertThrows(NoSuchElementException.class, () -> registry.activate(TaxType.VAT, 2));
        assertThrows(NoSuchElementException.class, () -> registry.activate(TaxType.SSCL, 1));
    }

    @Test
    void emptySchema_isRejected() {
        assertThrows(ContractViolationException.class, () -> registry.register(TaxType.VAT, Map.of()));
    }
}
