package com.moonscribe.rag.service;

import com.moonscribe.rag.chunk.Chunk;
import com.moonscribe.rag.chunk.DocumentChunker;
import com.moonscribe.rag.credit.CreditAction;
import com.moonscribe.rag.credit.CreditSettlement;
import com.moonscribe.rag.credit.KeyResolution;
import com.moonscribe.rag.credit.KeyResolver;
import com.moonscribe.rag.document.DocumentRegistry;
import com.moonscribe.rag.dto.IngestRequest;
import com.moonscribe.rag.dto.IngestResponse;
import com.moonscribe.rag.entity.DocumentRecord;
import com.moonscribe.rag.ingest.EmbeddingBatch;
import com.moonscribe.rag.ingest.EmbeddingBatcher;
import com.moonscribe.rag.ingest.ExtractionQuality;
import com.moonscribe.rag.llm.ProviderKind;
import com.moonscribe.rag.metrics.RagMetrics;
import com.moonscribe.rag.usage.UsageOperation;
import com.moonscribe.rag.usage.UsageRecorder;
import com.moonscribe.rag.vector.EmbeddingVector;
import com.moonscribe.rag.vector.VectorIndexClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Chunks extracted document text, embeds every chunk and writes the vectors to the index.
 * Nothing is written unless every chunk embedded successfully.
 */
@Service
public class IngestionService {
    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final DocumentChunker chunker;
    private final EmbeddingBatcher batcher;
    private final VectorIndexClient vectorIndex;
    private final KeyResolver keyResolver;
    private final CreditSettlement settlement;
    private final DocumentRegistry documents;
    private final UsageRecorder usage;
    private final RagMetrics metrics;

    public IngestionService(DocumentChunker chunker,
                            EmbeddingBatcher batcher,
                            VectorIndexClient vectorIndex,
                            KeyResolver keyResolver,
                            CreditSettlement settlement,
                            DocumentRegistry documents,
                            UsageRecorder usage,
                            RagMetrics metrics) {
        this.chunker = chunker;
        this.batcher = batcher;
        this.vectorIndex = vectorIndex;
        this.keyResolver = keyResolver;
        this.settlement = settlement;
        this.documents = documents;
        this.usage = usage;
        this.metrics = metrics;
    }

    public IngestResponse ingest(String userId, IngestRequest request) {
        request.validate();
        long start = System.currentTimeMillis();
        int pages = request.getPageCountOrDefault();
        int words = request.getWordCountOrDefault();

        KeyResolution resolution = keyResolver.resolve(
                userId, request.apiKey(), ProviderKind.OPENAI, CreditAction.UPLOAD_DOCUMENT_PAGE, pages);
        String embeddingKey = keyResolver.embeddingKey(resolution);

        Optional<String> warning = ExtractionQuality.scannedTextWarning(request.text(), request.pageCount());
        warning.ifPresent(w -> log.warn("[INGEST] source='{}': {}", request.source(), w));

        String documentId = documents.open(userId, request.documentId(), request.source(), request.sourceType(),
                pages, words, warning.isPresent());

        int targetTokens = request.chunkTokens() != null ? request.chunkTokens() : chunker.defaultTargetTokens();
        List<Chunk> chunks = chunker.chunk(request.source(), request.text(), targetTokens);
        log.info("[INGEST] source='{}' pages={} words={} chunks={} keySource={}",
                request.source(), pages, words, chunks.size(), resolution.keySource().id());

        EmbeddingBatch batch;
        try {
            batch = embedAndIndex(chunks, embeddingKey, documentId, request);
        } catch (RuntimeException e) {
            documents.markFailed(documentId, e.getMessage());
            throw e;
        }
        documents.markReady(documentId, chunks.size());
        usage.record(userId, resolution.keySource(), ProviderKind.OPENAI, batcher.model(),
                UsageOperation.EMBEDDING, batch.totalTokens());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("referenceType", "document");
        metadata.put("source", request.source());
        if (documentId != null) {
            metadata.put("documentId", documentId);
        }
        metadata.put("pages", pages);
        metadata.put("chunks", chunks.size());
        metadata.put("tokens", batch.totalTokens());
        Integer remaining = settlement.settle(resolution,
                "Uploaded " + request.source() + " (" + pages + (pages == 1 ? " page)" : " pages)"), metadata);

        long elapsed = System.currentTimeMillis() - start;
        metrics.recordIngest(elapsed, chunks.size());
        log.info("[TIMING] ingest of '{}' took {}ms ({} chunks, {} embedding tokens)",
                request.source(), elapsed, chunks.size(), batch.totalTokens());

        return new IngestResponse(
                true,
                request.source(),
                chunks.size(),
                documentId,
                pages,
                resolution.keySource().id(),
                resolution.teamName(),
                resolution.cost(),
                remaining,
                batch.totalTokens(),
                words,
                warning.orElse(null),
                warning.isPresent());
    }

    private EmbeddingBatch embedAndIndex(List<Chunk> chunks, String embeddingKey, String documentId, IngestRequest request) {
        List<String> texts = new ArrayList<>(chunks.size());
        for (Chunk chunk : chunks) {
            texts.add(chunk.text());
        }
        EmbeddingBatch batch = batcher.embed(texts, embeddingKey);

        List<EmbeddingVector> vectors = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            vectors.add(EmbeddingVector.forChunk(chunks.get(i), batch.vectors().get(i),
                    documentId, request.sourceType(), request.url()));
        }
        vectorIndex.upsert(vectors);
        return batch;
    }

    public List<DocumentRecord> listDocuments(String userId) {
        return documents.list(userId);
    }

    /**
     * Removes every indexed chunk of a source, and the caller's document records for it.
     */
    public void deleteSource(String userId, String source) {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source is required");
        }
        vectorIndex.deleteBySource(source);
        if (userId != null && !userId.isBlank()) {
            int removed = documents.removeSource(userId, source);
            log.info("[INGEST] deleted source '{}' and {} document records of user {}", source, removed, userId);
        }
    }
}
