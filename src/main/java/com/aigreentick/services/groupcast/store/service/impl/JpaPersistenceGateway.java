package com.aigreentick.services.groupcast.store.service.impl;

import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.aigreentick.services.groupcast.store.enums.CollectionName;
import com.aigreentick.services.groupcast.store.model.StoredDocument;
import com.aigreentick.services.groupcast.store.repository.StoredDocumentRepository;
import com.aigreentick.services.groupcast.store.service.PersistenceException;
import com.aigreentick.services.groupcast.store.service.PersistenceGateway;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaPersistenceGateway implements PersistenceGateway {

    private final StoredDocumentRepository repository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional(readOnly = true)
    public <T> Optional<T> read(CollectionName collection, TypeReference<T> type) {
        Optional<StoredDocument> document;
        try {
            document = repository.findById(collection.getKey());
        } catch (RuntimeException e) {
            throw new PersistenceException("Failed to load collection " + collection.getKey(), e);
        }

        if (document.isEmpty()) {
            return Optional.empty();
        }

        try {
            return Optional.ofNullable(objectMapper.readValue(document.get().getData(), type));
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Corrupt document for collection " + collection.getKey(), e);
        }
    }

    @Override
    public boolean write(CollectionName collection, Object value) {
        try {
            String json = objectMapper.writeValueAsString(value);
            StoredDocument document = repository.findById(collection.getKey())
                    .orElseGet(() -> StoredDocument.builder().name(collection.getKey()).build());
            document.setData(json);
            repository.save(document);
            return true;
        } catch (Exception e) {
            log.error("Failed to save collection {}", collection.getKey(), e);
            return false;
        }
    }
}
