package com.moonscribe.rag.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "credit_transactions", indexes = {
    @Index(name = "idx_credit_tx_user", columnList = "userId")
})
public class CreditTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String userId;

    /** Negative for deductions. */
    @Column(nullable = false)
    private int amount;

    private int balanceAfter;

    @Column(nullable = false)
    private String type;

    private String description;

    private String referenceType;

    @Column(columnDefinition = "CLOB")
    private String metadata;

    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
