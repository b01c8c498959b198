package com.moonscribe.rag.chunk;

/**
 * A bounded slice of one source document's text. The unit of embedding and retrieval.
 */
public record Chunk(String text, String sourceId, int index) {

    public Chunk {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("chunk text cannot be blank");
        }
        if (index < 0) {
            throw new IllegalArgumentException("chunk index cannot be negative: " + index);
        }
    }
}
