package com.moonscribe.rag.llm;

public interface EmbeddingsClient {

    String model();

    /**
     * @throws com.moonscribe.rag.exception.UpstreamProviderException when the call fails
     */
    Embedding embed(String text, String apiKey);
}
