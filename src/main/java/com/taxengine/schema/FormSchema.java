package com.taxengine.schema;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.taxengine.contract.TaxType;

import java.time.Instant;
import java.util.Map;

/**
 * A versioned input form definition for one tax type. Its content is produced and
 * rendered elsewhere; only the version and the active flag matter here.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FormSchema(
    @JsonProperty("schema_type") TaxType schemaType,
    @JsonProperty("version") int version,
    @JsonProperty("schema_data") Map<String, Object> schemaData,
    @JsonProperty("active") boolean active,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("activated_at") Instant activatedAt
) {

    FormSchema withActive(boolean nowActive, Instant at) {
        return new FormSchema(schemaType, version, schemaData, nowActive, createdAt, nowActive ? at : activatedAt);
    }
}
