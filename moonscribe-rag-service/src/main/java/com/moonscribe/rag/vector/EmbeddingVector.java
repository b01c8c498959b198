package com.moonscribe.rag.vector;

import com.moonscribe.rag.chunk.Chunk;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A chunk's embedding as stored in the index.
 *
 * @param id       deterministic per (source, chunk index), see {@link #idFor}
 * @param metadata payload stored next to the vector
 */
public record EmbeddingVector(String id, float[] values, Map<String, Object> metadata) {

    public static final String TEXT = "text";
    public static final String SOURCE = "source";
    public static final String CHUNK_INDEX = "chunk_index";
    public static final String DOCUMENT_ID = "document_id";
    public static final String SOURCE_TYPE = "source_type";
    public static final String URL = "url";
    public static final String START_TIME = "start_time";
    public static final String MEDIA_ID = "audio_id";

    public EmbeddingVector {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id is required");
        }
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("values are required for id=" + id);
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Name-based UUID of {@code "<source>-chunk-<index>"}. Re-ingesting a source with the same
     * chunking yields the same ids and overwrites the previous vectors.
     */
    public static String idFor(String source, int chunkIndex) {
        String name = source + "-chunk-" + chunkIndex;
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)).toString();
    }

    public static EmbeddingVector forChunk(Chunk chunk, float[] values, String documentId, String sourceType, String url) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(TEXT, chunk.text());
        metadata.put(SOURCE, chunk.sourceId());
        metadata.put(CHUNK_INDEX, chunk.index());
        metadata.put(SOURCE_TYPE, sourceType == null || sourceType.isBlank() ? "document" : sourceType);
        if (documentId != null && !documentId.isBlank()) {
            metadata.put(DOCUMENT_ID, documentId);
        }
        if (url != null && !url.isBlank()) {
            metadata.put(URL, url);
        }
        return new EmbeddingVector(idFor(chunk.sourceId(), chunk.index()), values, metadata);
    }

    public int dimension() {
        return values.length;
    }
}
