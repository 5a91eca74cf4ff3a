package com.cosmosdash.common.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Declared shape of one upstream integration: where its list of items lives
 * and which keys feed each logical field.
 * <p>
 * Item paths are dotted object paths tried in order; {@link #ROOT} means the
 * body is itself the array. No tree scanning happens, so a body that matches
 * no declared path yields {@link Optional#empty()}.
 *
 * <pre>
 * PayloadSchema schema = PayloadSchema.builder()
 *         .itemsAt("items", "results")
 *         .field("title", "title", "name")
 *         .build();
 * </pre>
 */
public final class PayloadSchema {

    public static final String ROOT = "$";

    private final List<String> itemPaths;
    private final Map<String, List<String>> fields;

    private PayloadSchema(List<String> itemPaths, Map<String, List<String>> fields) {
        this.itemPaths = List.copyOf(itemPaths);
        this.fields = Map.copyOf(fields);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<List<JsonNode>> items(JsonNode body) {
        if (body == null) {
            return Optional.empty();
        }
        for (String path : itemPaths) {
            JsonNode node = resolve(body, path);
            if (node != null && node.isArray()) {
                List<JsonNode> items = new ArrayList<>(node.size());
                node.forEach(items::add);
                return Optional.of(items);
            }
        }
        return Optional.empty();
    }

    public String text(JsonNode item, String field) {
        return FieldExtractor.text(item, candidates(field));
    }

    public double number(JsonNode item, String field) {
        return FieldExtractor.number(item, candidates(field));
    }

    public Optional<Instant> instant(JsonNode item, String field) {
        return FieldExtractor.instant(item, candidates(field));
    }

    public List<String> itemPaths() {
        return itemPaths;
    }

    private List<String> candidates(String field) {
        List<String> keys = fields.get(field);
        if (keys == null) {
            throw new IllegalArgumentException("Undeclared field '" + field + "'");
        }
        return keys;
    }

    private static JsonNode resolve(JsonNode body, String path) {
        if (ROOT.equals(path)) {
            return body;
        }
        JsonNode node = body;
        for (String segment : path.split("\\.")) {
            if (node == null || !node.isObject()) {
                return null;
            }
            node = node.get(segment);
        }
        return node;
    }

    public static final class Builder {
        private final List<String> itemPaths = new ArrayList<>();
        private final Map<String, List<String>> fields = new LinkedHashMap<>();

        public Builder itemsAt(String... paths) {
            itemPaths.addAll(List.of(paths));
            return this;
        }

        public Builder field(String logicalName, String... candidateKeys) {
            if (candidateKeys.length == 0) {
                throw new IllegalArgumentException("Field '" + logicalName + "' needs at least one key");
            }
            fields.put(logicalName, List.of(candidateKeys));
            return this;
        }

        public PayloadSchema build() {
            return new PayloadSchema(itemPaths, fields);
        }
    }
}
