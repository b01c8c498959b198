package com.moonscribe.rag.conversation;

import com.moonscribe.rag.dto.SourceReference;
import com.moonscribe.rag.entity.Conversation;
import com.moonscribe.rag.entity.ConversationMessage;
import com.moonscribe.rag.json.Json;
import com.moonscribe.rag.repository.ConversationMessageRepository;
import com.moonscribe.rag.repository.ConversationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Question and answer history of signed-in callers.
 */
@Service
public class ConversationStore {
    private static final Logger log = LoggerFactory.getLogger(ConversationStore.class);

    static final int TITLE_LENGTH = 50;

    private final ConversationRepository conversations;
    private final ConversationMessageRepository messages;

    public ConversationStore(ConversationRepository conversations, ConversationMessageRepository messages) {
        this.conversations = conversations;
        this.messages = messages;
    }

    /**
     * Appends a question and its answer. A missing or foreign conversation id starts a new
     * conversation titled after the question.
     *
     * @return id of the conversation the exchange was saved in
     */
    @Transactional
    public Long recordExchange(String userId, Long conversationId, String question, String answer,
                               List<SourceReference> sources, String model, int tokensUsed, double costEstimate) {
        Conversation conversation = conversationId == null
                ? null
                : conversations.findByIdAndUserId(conversationId, userId).orElse(null);
        if (conversation == null) {
            if (conversationId != null) {
                log.warn("[ASK] conversation {} not found for user {}, starting a new one", conversationId, userId);
            }
            conversation = conversations.save(Conversation.builder()
                    .userId(userId)
                    .title(title(question))
                    .build());
        }

        messages.save(ConversationMessage.builder()
                .conversationId(conversation.getId())
                .role(ConversationMessage.Role.USER)
                .content(question)
                .build());
        messages.save(ConversationMessage.builder()
                .conversationId(conversation.getId())
                .role(ConversationMessage.Role.ASSISTANT)
                .content(answer == null ? "" : answer)
                .sources(Json.tryWrite(sources).orElse(null))
                .modelUsed(model)
                .tokensUsed(tokensUsed)
                .costEstimate(costEstimate)
                .build());

        conversation.setUpdatedAt(LocalDateTime.now());
        conversations.save(conversation);
        return conversation.getId();
    }

    @Transactional(readOnly = true)
    public List<Conversation> list(String userId) {
        return conversations.findByUserIdOrderByUpdatedAtDesc(userId);
    }

    @Transactional(readOnly = true)
    public Optional<ConversationThread> thread(String userId, Long conversationId) {
        return conversations.findByIdAndUserId(conversationId, userId)
                .map(c -> new ConversationThread(c, messages.findByConversationIdOrderByIdAsc(c.getId())));
    }

    static String title(String question) {
        String q = question.trim();
        return q.length() > TITLE_LENGTH ? q.substring(0, TITLE_LENGTH) + "..." : q;
    }
}
