package com.taxengine.schema;

import com.taxengine.contract.ContractViolationException;
import com.taxengine.contract.TaxType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Form schema versions per tax type. At most one version of a type is active at any
 * time; {@link #activate} is the only operation that changes which one.
 */
@Service
public class FormSchemaRegistry {

    private static final Logger log = LoggerFactory.getLogger(FormSchemaRegistry.class);

    private final Map<TaxType, List<FormSchema>> schemas = new EnumMap<>(TaxType.class);
    private final Clock clock;

    public FormSchemaRegistry(Clock clock) {
        this.clock = clock;
    }

    /** Stores a new inactive version, numbered after the latest one. */
    public synchronized FormSchema register(TaxType type, Map<String, Object> schemaData) {
        if (type == null) {
            throw new ContractViolationException("schema_type is required");
        }
        if (schemaData == null || schemaData.isEmpty()) {
            throw new ContractViolationException("schema_data must be a non-empty object");
        }
        List<FormSchema> versions = schemas.computeIfAbsent(type, t -> new ArrayList<>());
        FormSchema schema = new FormSchema(type, versions.size() + 1, schemaData, false, clock.instant(), null);
        versions.add(schema);
        log.info("Registered form schema {} version {}", type.getValue(), schema.version());
        return schema;
    }

    /**
     * Makes {@code version} the active schema of {@code type}, deactivating the previous one
     * in the same step.
     */
    public synchronized FormSchema activate(TaxType type, int version) {
        List<FormSchema> versions = schemas.getOrDefault(type, List.of());
        if (version < 1 || version > versions.size()) {
            throw new NoSuchElementException("unknown form schema " + type.getValue() + " version " + version);
        }
        Instant now = clock.instant();
        for (int i = 0; i < versions.size(); i++) {
            FormSchema schema = versions.get(i);
            boolean target = schema.version() == version;
            if (schema.active() != target) {
                versions.set(i, schema.withActive(target, now));
            }
        }
        log.info("Activated form schema {} version {}", type.getValue(), version);
        return versions.get(version - 1);
    }

    public synchronized Optional<FormSchema> current(TaxType type) {
        return schemas.getOrDefault(type, List.of()).stream().filter(FormSchema::active).findFirst();
    }

    public synchronized List<FormSchema> versions(TaxType type) {
        return List.copyOf(schemas.getOrDefault(type, List.of()));
    }

    public synchronized long activeCount() {
        return schemas.values().stream().flatMap(List::stream).filter(FormSchema::active).count();
    }
}
