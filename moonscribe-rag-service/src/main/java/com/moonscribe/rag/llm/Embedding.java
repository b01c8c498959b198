package com.moonscribe.rag.llm;

/**
 * One embedding vector and the tokens the provider billed for it.
 */
public record Embedding(float[] values, int tokensUsed) {

    public int dimension() {
        return values.length;
    }
}
