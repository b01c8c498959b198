package com.moonscribe.rag.vector;

import java.util.List;

/**
 * Vector store boundary. Failures surface as
 * {@link com.moonscribe.rag.exception.UpstreamProviderException}.
 */
public interface VectorIndexClient {

    /** Inserts or overwrites vectors by id. All vectors must match the index dimension. */
    void upsert(List<EmbeddingVector> vectors);

    /** Nearest neighbours by descending score. */
    List<SearchHit> query(float[] vector, int topK, MetadataFilter filter, boolean includeMetadata);

    /** Removes every vector whose {@code source} equals the given name. */
    void deleteBySource(String source);
}
