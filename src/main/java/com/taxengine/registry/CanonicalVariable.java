package com.taxengine.registry;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.taxengine.contract.VariableDataType;

import java.time.Instant;
import java.util.Objects;

/**
 * A stable, typed identifier for a tax concept, e.g. {@code gross_income}.
 * Variables are never removed; retiring one sets {@code active=false}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CanonicalVariable(
    @JsonProperty("key") String key,
    @JsonProperty("label") String label,
    @JsonProperty("data_type") VariableDataType dataType,
    @JsonProperty("unit") String unit,
    @JsonProperty("category") String category,
    @JsonProperty("version") int version,
    @JsonProperty("active") boolean active,
    @JsonProperty("deprecated_at") Instant deprecatedAt,
    @JsonProperty("deprecation_reason") String deprecationReason,
    @JsonProperty("replaced_by") String replacedBy
) {

    boolean sameDefinition(String otherLabel, VariableDataType otherType, String otherUnit, String otherCategory) {
        return Objects.equals(label, otherLabel)
            && dataType == otherType
            && Objects.equals(unit, otherUnit)
            && Objects.equals(category, otherCategory);
    }

    CanonicalVariable redefine(String newLabel, VariableDataType newType, String newUnit, String newCategory) {
        return new CanonicalVariable(key, newLabel, newType, newUnit, newCategory, version + 1,
            true, null, null, null);
    }

    CanonicalVariable deactivate(String reason, String replacement, Instant at) {
        return new CanonicalVariable(key, label, dataType, unit, category, version,
            false, at, reason, replacement);
    }
}
