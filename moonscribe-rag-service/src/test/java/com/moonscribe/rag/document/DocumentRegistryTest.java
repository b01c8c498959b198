package com.moonscribe.rag.document;

import com.moonscribe.rag.entity.DocumentRecord;
import com.moonscribe.rag.repository.DocumentRecordRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(DocumentRegistry.class)
class DocumentRegistryTest {

    @Autowired
    private DocumentRegistry registry;

    @Autowired
    private DocumentRecordRepository records;

    @Nested
    @DisplayName("Opening a record")
    class Open {

        @Test
        @DisplayName("Should store a processing record under the requested id")
        void shouldOpenUnderRequestedId() {
            String id = registry.open("user-1", "doc-1", "notes.pdf", "pdf", 3, 900, false);

            assertThat(id).isEqualTo("doc-1");
            DocumentRecord record = records.findById("doc-1").orElseThrow();
            assertThat(record.getUserId()).isEqualTo("user-1");
            assertThat(record.getStatus()).isEqualTo(DocumentRecord.Status.PROCESSING);
            assertThat(record.getPageCount()).isEqualTo(3);
            assertThat(record.getWordCount()).isEqualTo(900);
            assertThat(record.getCreatedAt()).isNotNull();
        }

        @Test
        @DisplayName("Should assign an id when the caller sent none")
        void shouldAssignId() {
            String id = registry.open("user-1", null, "notes.pdf", null, 1, 10, true);

            assertThat(id).isNotBlank();
            assertThat(records.findById(id).orElseThrow().isOcrRequired()).isTrue();
        }

        @Test
        @DisplayName("Should never take over another user's document id")
        void shouldNotReuseForeignId() {
            registry.open("owner", "doc-1", "theirs.pdf", null, 1, 10, false);

            String id = registry.open("intruder", "doc-1", "mine.pdf", null, 1, 10, false);

            assertThat(id).isNotEqualTo("doc-1");
            assertThat(records.findById("doc-1").orElseThrow().getFilename()).isEqualTo("theirs.pdf");
        }

        @Test
        @DisplayName("Anonymous callers keep their id and store nothing")
        void shouldSkipAnonymousCaller() {
            assertThat(registry.open(null, "doc-9", "notes.pdf", null, 1, 10, false)).isEqualTo("doc-9");
            assertThat(registry.open(null, null, "notes.pdf", null, 1, 10, false)).isNull();
            assertThat(records.count()).isZero();
        }
    }

    @Nested
    @DisplayName("Status changes")
    class StatusChanges {

        @Test
        @DisplayName("Ready records carry their chunk count")
        void shouldMarkReady() {
            registry.open("user-1", "doc-1", "notes.pdf", null, 3, 900, false);

            registry.markReady("doc-1", 12);

            DocumentRecord record = records.findById("doc-1").orElseThrow();
            assertThat(record.getStatus()).isEqualTo(DocumentRecord.Status.READY);
            assertThat(record.getChunkCount()).isEqualTo(12);
        }

        @Test
        @DisplayName("Failed records keep the error")
        void shouldMarkFailed() {
            registry.open("user-1", "doc-1", "notes.pdf", null, 3, 900, false);

            registry.markFailed("doc-1", "OpenAI embed HTTP 500");

            DocumentRecord record = records.findById("doc-1").orElseThrow();
            assertThat(record.getStatus()).isEqualTo(DocumentRecord.Status.ERROR);
            assertThat(record.getErrorMessage()).isEqualTo("OpenAI embed HTTP 500");
        }

        @Test
        @DisplayName("Re-ingesting reopens the record and clears the old error")
        void shouldReopen() {
            registry.open("user-1", "doc-1", "notes.pdf", null, 3, 900, false);
            registry.markFailed("doc-1", "timeout");

            registry.open("user-1", "doc-1", "notes.pdf", null, 3, 900, false);

            DocumentRecord record = records.findById("doc-1").orElseThrow();
            assertThat(record.getStatus()).isEqualTo(DocumentRecord.Status.PROCESSING);
            assertThat(record.getErrorMessage()).isNull();
        }

        @Test
        @DisplayName("Unknown ids are ignored")
        void shouldIgnoreUnknownId() {
            registry.markReady(null, 3);
            registry.markReady("missing", 3);

            assertThat(records.count()).isZero();
        }
    }

    @Test
    @DisplayName("Removing a source drops only the caller's records for it")
    void shouldRemoveSource() {
        registry.open("user-1", "doc-1", "notes.pdf", null, 1, 10, false);
        registry.open("user-1", "doc-2", "other.pdf", null, 1, 10, false);
        registry.open("user-2", "doc-3", "notes.pdf", null, 1, 10, false);

        int removed = registry.removeSource("user-1", "notes.pdf");

        assertThat(removed).isEqualTo(1);
        assertThat(registry.list("user-1")).extracting(DocumentRecord::getId).containsExactly("doc-2");
        assertThat(registry.list("user-2")).extracting(DocumentRecord::getId).containsExactly("doc-3");
    }
}
