package com.aigreentick.services.groupcast.store.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One named collection, stored whole as a JSON document.
 */
@Data
@Entity
@Table(name = "stored_documents")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredDocument {

    @Id
    @Column(name = "name", nullable = false, length = 64)
    private String name;

    @Lob
    @Column(name = "data", nullable = false)
    private String data;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
