package com.taxengine.rule;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The reconciled content of an aggregated rule: everything that must be identical
 * when the same evidence is aggregated twice. Ids and timestamps live outside.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RuleContent(
    @JsonProperty("brackets") List<TaxBracket> brackets,
    @JsonProperty("parameters") SortedMap<String, BigDecimal> parameters,
    @JsonProperty("definitions") SortedMap<String, String> definitions,
    @JsonProperty("unit") String unit,
    @JsonProperty("inputs") List<String> inputs,
    @JsonProperty("formulas") List<RuleFormula> formulas,
    @JsonProperty("pending_aspects") List<String> pendingAspects
) {

    private static final ObjectMapper CANONICAL = new ObjectMapper()
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    public RuleContent {
        brackets = brackets != null ? List.copyOf(brackets) : null;
        parameters = Collections.unmodifiableSortedMap(new TreeMap<>(parameters != null ? parameters : new TreeMap<>()));
        definitions = Collections.unmodifiableSortedMap(new TreeMap<>(definitions != null ? definitions : new TreeMap<>()));
        inputs = inputs != null ? inputs.stream().distinct().sorted().toList() : List.of();
        formulas = formulas != null ? List.copyOf(formulas) : List.of();
        pendingAspects = pendingAspects != null ? pendingAspects.stream().distinct().sorted().toList() : List.of();
    }

    @JsonIgnore
    public boolean hasBrackets() {
        return brackets != null && !brackets.isEmpty();
    }

    @JsonIgnore
    public boolean allFormulasActive() {
        return formulas.stream().allMatch(f -> f.status() == FormulaStatus.ACTIVE);
    }

    /**
     * SHA-256 over the canonical JSON rendering. Equal content always yields the same value.
     */
    public String fingerprint() {
        try {
            byte[] json = CANONICAL.writeValueAsString(this).getBytes(StandardCharsets.UTF_8);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(json));
        } catch (JsonProcessingException | NoSuchAlgorithmException ex) {
            throw new IllegalStateException("cannot fingerprint rule content", ex);
        }
    }
}
