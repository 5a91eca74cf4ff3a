package com.cosmosdash.common.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;

/**
 * Structured-value support shared by every {@link CacheStore} backend.
 * Values are stored as JSON strings.
 */
@Slf4j
public abstract class AbstractCacheStore implements CacheStore {

    protected final ObjectMapper json;

    protected AbstractCacheStore(ObjectMapper json) {
        this.json = json;
    }

    @Override
    public <T> Optional<T> getJson(String key, Class<T> type) {
        return decode(key, json.constructType(type));
    }

    @Override
    public <T> Optional<T> getJson(String key, TypeReference<T> type) {
        return decode(key, json.getTypeFactory().constructType(type));
    }

    @Override
    public void setJson(String key, Object value, Duration ttl) {
        try {
            set(key, json.writeValueAsString(value), ttl);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value for key '" + key + "' is not serializable", e);
        }
    }

    private <T> Optional<T> decode(String key, JavaType type) {
        Optional<String> raw = get(key);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(json.readValue(raw.get(), type));
        } catch (JsonProcessingException e) {
            log.warn("Discarding undecodable cache entry {}: {}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
