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
@Table(name = "credits")
public class CreditAccount {

    @Id
    private String userId;

    @Builder.Default
    private int balance = 0;

    @Builder.Default
    private int lifetimeUsed = 0;

    @Builder.Default
    private int lifetimePurchased = 0;

    private LocalDateTime updatedAt;

    @PrePersist
    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
