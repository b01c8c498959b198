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
@Table(name = "conversation_messages", indexes = {
    @Index(name = "idx_message_conversation", columnList = "conversationId")
})
public class ConversationMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long conversationId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Role role;

    @Lob
    @Column(columnDefinition = "CLOB", nullable = false)
    private String content;

    /** JSON array of the cited sources, assistant messages only. */
    @Lob
    @Column(columnDefinition = "CLOB")
    private String sources;

    private String modelUsed;

    private Integer tokensUsed;

    private Double costEstimate;

    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public enum Role {
        USER,
        ASSISTANT
    }
}
