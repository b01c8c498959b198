package com.moonscribe.rag.conversation;

import com.moonscribe.rag.dto.SourceReference;
import com.moonscribe.rag.entity.Conversation;
import com.moonscribe.rag.entity.ConversationMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(ConversationStore.class)
class ConversationStoreTest {

    private static final List<SourceReference> SOURCES = List.of(new SourceReference(1, "bio.pdf", 92));

    @Autowired
    private ConversationStore store;

    @Test
    @DisplayName("Should start a conversation titled after the question and save both messages")
    void shouldStartConversation() {
        // given
        String question = "How do mitochondria turn glucose into usable energy for the cell?";

        // when
        Long id = store.recordExchange("user-1", null, question, "Via ATP synthase [1].",
                SOURCES, "gpt-3.5-turbo", 120, 0.0001);

        // then
        ConversationThread thread = store.thread("user-1", id).orElseThrow();
        assertThat(thread.conversation().getTitle())
                .isEqualTo("How do mitochondria turn glucose into usable energ...");
        assertThat(thread.messages()).extracting(ConversationMessage::getRole)
                .containsExactly(ConversationMessage.Role.USER, ConversationMessage.Role.ASSISTANT);
        ConversationMessage answer = thread.messages().get(1);
        assertThat(answer.getContent()).isEqualTo("Via ATP synthase [1].");
        assertThat(answer.getSources()).contains("\"source\":\"bio.pdf\"");
        assertThat(answer.getModelUsed()).isEqualTo("gpt-3.5-turbo");
        assertThat(answer.getTokensUsed()).isEqualTo(120);
    }

    @Test
    @DisplayName("Should append to an existing conversation")
    void shouldAppend() {
        Long id = store.recordExchange("user-1", null, "First?", "One.", SOURCES, "gpt-4", 10, 0.0);

        Long again = store.recordExchange("user-1", id, "Second?", "Two.", SOURCES, "gpt-4", 10, 0.0);

        assertThat(again).isEqualTo(id);
        assertThat(store.thread("user-1", id).orElseThrow().messages()).hasSize(4);
        assertThat(store.list("user-1")).hasSize(1);
    }

    @Test
    @DisplayName("Another user's conversation id starts a new conversation")
    void shouldNotAppendToForeignConversation() {
        Long theirs = store.recordExchange("owner", null, "Theirs?", "Yes.", SOURCES, "gpt-4", 10, 0.0);

        Long mine = store.recordExchange("intruder", theirs, "Mine?", "No.", SOURCES, "gpt-4", 10, 0.0);

        assertThat(mine).isNotEqualTo(theirs);
        assertThat(store.thread("owner", theirs).orElseThrow().messages()).hasSize(2);
        assertThat(store.thread("intruder", theirs)).isEmpty();
        assertThat(store.list("intruder")).extracting(Conversation::getTitle).containsExactly("Mine?");
    }

    @Test
    @DisplayName("Short questions are used as the title unchanged")
    void shouldKeepShortTitle() {
        assertThat(ConversationStore.title("  What is ATP?  ")).isEqualTo("What is ATP?");
        assertThat(ConversationStore.title("x".repeat(50))).isEqualTo("x".repeat(50));
    }
}
