package com.moonscribe.rag.ingest;

import java.util.List;

/**
 * Embeddings of a batch of texts, in input order, with the tokens billed for all of them.
 */
public record EmbeddingBatch(List<float[]> vectors, int totalTokens) {

    public EmbeddingBatch {
        vectors = List.copyOf(vectors);
    }

    public int size() {
        return vectors.size();
    }
}
