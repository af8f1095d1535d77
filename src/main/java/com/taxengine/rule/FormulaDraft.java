package com.taxengine.rule;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A formula as extracted from one document, before aggregation and compilation.
 * {@code calculationOrder} is optional; when present it must agree with the dependency graph.
 */
public record FormulaDraft(
    @JsonProperty("expression") String expression,
    @JsonProperty("output_variable") String outputVariable,
    @JsonProperty("calculation_order") Integer calculationOrder
) {
}
