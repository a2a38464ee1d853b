package com.aigreentick.services.groupcast.support;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.aigreentick.services.groupcast.store.enums.CollectionName;
import com.aigreentick.services.groupcast.store.service.PersistenceException;
import com.aigreentick.services.groupcast.store.service.PersistenceGateway;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Keeps collections as JSON strings so every read returns a fresh copy, like the real store.
 */
public class InMemoryPersistenceGateway implements PersistenceGateway {

    private final Map<CollectionName, String> documents = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private boolean failWrites;

    @Override
    public <T> Optional<T> read(CollectionName collection, TypeReference<T> type) {
        String json = documents.get(collection);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Corrupt document " + collection, e);
        }
    }

    @Override
    public boolean write(CollectionName collection, Object value) {
        if (failWrites) {
            return false;
        }
        try {
            documents.put(collection, objectMapper.writeValueAsString(value));
            return true;
        } catch (JsonProcessingException e) {
            return false;
        }
    }

    public void setFailWrites(boolean failWrites) {
        this.failWrites = failWrites;
    }

    public boolean contains(CollectionName collection) {
        return documents.containsKey(collection);
    }
}
