package com.moonscribe.rag.document;

import com.moonscribe.rag.entity.DocumentRecord;
import com.moonscribe.rag.repository.DocumentRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Tracks the documents signed-in callers ingest: PROCESSING while chunks are embedded, then
 * READY with the chunk count, or ERROR. Registry writes never fail an ingestion.
 */
@Service
public class DocumentRegistry {
    private static final Logger log = LoggerFactory.getLogger(DocumentRegistry.class);

    private final DocumentRecordRepository repository;

    public DocumentRegistry(DocumentRecordRepository repository) {
        this.repository = repository;
    }

    /**
     * Opens (or reopens) the record of a document about to be indexed.
     *
     * @return the document id to tag vectors with: the requested id, a new id for a signed-in
     *         caller without one, or the requested id as-is (possibly null) when nothing was stored
     */
    public String open(String userId, String requestedId, String filename, String sourceType,
                       int pageCount, int wordCount, boolean ocrRequired) {
        if (userId == null || userId.isBlank()) {
            return requestedId;
        }
        String id = requestedId != null && !requestedId.isBlank() ? requestedId : UUID.randomUUID().toString();
        try {
            DocumentRecord record = repository.findById(id).orElse(null);
            if (record != null && !userId.equals(record.getUserId())) {
                log.warn("[INGEST] document id {} belongs to another user, storing under a new id", id);
                id = UUID.randomUUID().toString();
                record = null;
            }
            if (record == null) {
                record = DocumentRecord.builder().id(id).userId(userId).build();
            }
            record.setFilename(filename);
            record.setSourceType(sourceType);
            record.setStatus(DocumentRecord.Status.PROCESSING);
            record.setChunkCount(0);
            record.setPageCount(pageCount);
            record.setWordCount(wordCount);
            record.setOcrRequired(ocrRequired);
            record.setErrorMessage(null);
            repository.save(record);
            return id;
        } catch (DataAccessException e) {
            log.warn("[INGEST] could not create document record for '{}': {}", filename, e.getMessage());
            return requestedId;
        }
    }

    public void markReady(String documentId, int chunkCount) {
        update(documentId, DocumentRecord.Status.READY, chunkCount, null);
    }

    public void markFailed(String documentId, String error) {
        update(documentId, DocumentRecord.Status.ERROR, 0, error);
    }

    public List<DocumentRecord> list(String userId) {
        return repository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    /**
     * Deletes the caller's records for a filename.
     *
     * @return number of records removed
     */
    public int removeSource(String userId, String filename) {
        List<DocumentRecord> records = repository.findByUserIdAndFilename(userId, filename);
        repository.deleteAll(records);
        return records.size();
    }

    private void update(String documentId, DocumentRecord.Status status, int chunkCount, String error) {
        if (documentId == null) {
            return;
        }
        try {
            repository.findById(documentId).ifPresent(record -> {
                record.setStatus(status);
                record.setChunkCount(chunkCount);
                record.setErrorMessage(error);
                repository.save(record);
            });
        } catch (DataAccessException e) {
            log.warn("[INGEST] could not mark document {} as {}: {}", documentId, status, e.getMessage());
        }
    }
}
