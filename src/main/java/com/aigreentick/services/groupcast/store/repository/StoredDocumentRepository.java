package com.aigreentick.services.groupcast.store.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.aigreentick.services.groupcast.store.model.StoredDocument;

@Repository
public interface StoredDocumentRepository extends JpaRepository<StoredDocument, String> {

}
