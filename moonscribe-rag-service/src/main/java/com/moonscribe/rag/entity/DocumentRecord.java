package com.moonscribe.rag.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A caller's ingested document. The id is also written into every vector of the document.
 */
@Entity
@Table(name = "documents", indexes = {
    @Index(name = "idx_document_user", columnList = "userId")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentRecord {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false)
    private String userId;

    @Column(nullable = false, length = 500)
    private String filename;

    private String sourceType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Status status;

    private int chunkCount;

    private int pageCount;

    private int wordCount;

    /** Set when the text looks like a scan with little extractable text. */
    private boolean ocrRequired;

    private String errorMessage;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public enum Status {
        PROCESSING,
        READY,
        ERROR
    }
}
