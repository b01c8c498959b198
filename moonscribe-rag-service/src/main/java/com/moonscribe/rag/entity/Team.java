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
@Table(name = "teams", indexes = {
    @Index(name = "idx_team_owner", columnList = "ownerId")
})
public class Team {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private String ownerId;

    /** base64(IV + ciphertext + GCM tag), see ApiKeyCipher. */
    @Column(columnDefinition = "CLOB")
    private String apiKeyEncrypted;

    @Builder.Default
    private String apiProvider = "openai";

    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();
}
