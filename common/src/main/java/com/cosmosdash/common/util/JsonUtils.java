package com.cosmosdash.common.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared Jackson setup and payload column helpers.
 */
public final class JsonUtils {

    private static final Logger log = LoggerFactory.getLogger(JsonUtils.class);

    private static final ObjectMapper MAPPER = newMapper();

    private JsonUtils() {}

    /**
     * Mapper with java.time support, ISO timestamps and lenient unknown properties.
     */
    public static ObjectMapper newMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Serialize a document for a text/jsonb column. Null becomes "{}".
     */
    public static String toJson(JsonNode node) {
        if (node == null) {
            return "{}";
        }
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Document not serializable: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parse a stored document. Corrupt rows come back as an empty object.
     */
    public static JsonNode parseTree(String json) {
        if (json == null || json.isBlank()) {
            return MAPPER.createObjectNode();
        }
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Stored payload is not valid JSON: {}", e.getOriginalMessage());
            return MAPPER.createObjectNode();
        }
    }
}
