package com.cosmosdash.common.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * Reads a logical field from a document whose key names vary by upstream.
 * Candidates are tried in order and the first present, non-empty value wins.
 * Unparseable values fall back to a default instead of failing the record.
 */
public final class FieldExtractor {

    private FieldExtractor() {}

    public static Optional<JsonNode> first(JsonNode document, List<String> candidates) {
        if (document == null || !document.isObject()) {
            return Optional.empty();
        }
        for (String key : candidates) {
            JsonNode value = document.get(key);
            if (isPresent(value)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /**
     * @return the first non-empty value as text, or "" when none
     */
    public static String text(JsonNode document, List<String> candidates) {
        return first(document, candidates)
                .map(value -> value.isValueNode() ? value.asText() : value.toString())
                .orElse("");
    }

    /**
     * Accepts floating point, integer and numeric-string encodings.
     *
     * @return the coerced value, or 0 when absent or unparseable
     */
    public static double number(JsonNode document, List<String> candidates) {
        return first(document, candidates).flatMap(FieldExtractor::toDouble).orElse(0.0);
    }

    /**
     * RFC 3339 strings or epoch seconds (number or numeric string).
     */
    public static Optional<Instant> instant(JsonNode document, List<String> candidates) {
        return first(document, candidates).flatMap(FieldExtractor::toInstant);
    }

    static Optional<Double> toDouble(JsonNode value) {
        if (value.isNumber()) {
            return Optional.of(value.asDouble());
        }
        if (value.isTextual()) {
            try {
                return Optional.of(Double.parseDouble(value.asText().trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    static Optional<Instant> toInstant(JsonNode value) {
        if (value.isNumber()) {
            return Optional.of(Instant.ofEpochSecond(value.asLong()));
        }
        if (!value.isTextual()) {
            return Optional.empty();
        }
        String text = value.asText().trim();
        try {
            return Optional.of(OffsetDateTime.parse(text).toInstant());
        } catch (DateTimeParseException e) {
            return toDouble(value).map(seconds -> Instant.ofEpochSecond(seconds.longValue()));
        }
    }

    private static boolean isPresent(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return false;
        }
        if (value.isTextual()) {
            return !value.asText().isBlank();
        }
        if (value.isContainerNode()) {
            return !value.isEmpty();
        }
        return true;
    }
}
