package com.taxengine.api;

import com.taxengine.contract.ContractViolationException;
import com.taxengine.contract.TaxType;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Reads request fields and query parameters, reporting bad values as contract violations.
 */
final class RequestValues {

    private RequestValues() {
    }

    static String requireString(Object value, String message) {
        if (!(value instanceof String text) || text.isBlank()) {
            throw new ContractViolationException(message);
        }
        return text;
    }

    static String optionalString(Object value) {
        return value instanceof String text && !text.isBlank() ? text : null;
    }

    static TaxType taxType(String raw, String field) {
        return parse(requireString(raw, field + " is required"), TaxType::fromValue, field);
    }

    static Optional<TaxType> optionalTaxType(String raw, String field) {
        return raw == null || raw.isBlank() ? Optional.empty() : Optional.of(taxType(raw, field));
    }

    static LocalDate date(String raw, String field) {
        String text = requireString(raw, field + " is required");
        try {
            return LocalDate.parse(text.trim());
        } catch (DateTimeParseException ex) {
            throw new ContractViolationException(field + " must be an ISO date (yyyy-MM-dd)");
        }
    }

    static Optional<LocalDate> optionalDate(String raw, String field) {
        return raw == null || raw.isBlank() ? Optional.empty() : Optional.of(date(raw, field));
    }

    static <T> T parse(String raw, Function<String, T> parser, String field) {
        try {
            return parser.apply(raw.trim());
        } catch (IllegalArgumentException ex) {
            throw new ContractViolationException(field + " is invalid: " + raw);
        }
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> optionalObject(Object value, String field) {
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?>)) {
            throw new ContractViolationException(field + " must be an object");
        }
        return (Map<String, Object>) value;
    }
}
