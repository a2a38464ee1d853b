package com.aigreentick.services.groupcast.store.service;

import java.util.Optional;

import com.aigreentick.services.groupcast.store.enums.CollectionName;
import com.fasterxml.jackson.core.type.TypeReference;

/**
 * Whole-document access to the named collections.
 * There are no partial updates: callers read, modify and write back.
 */
public interface PersistenceGateway {

    /**
     * Reads a collection.
     *
     * @return the stored value, or empty if the collection was never written
     * @throws PersistenceException if the stored document cannot be read or decoded
     */
    <T> Optional<T> read(CollectionName collection, TypeReference<T> type);

    /**
     * Replaces a collection.
     *
     * @return {@code false} if the write failed; the failure is logged
     */
    boolean write(CollectionName collection, Object value);
}
