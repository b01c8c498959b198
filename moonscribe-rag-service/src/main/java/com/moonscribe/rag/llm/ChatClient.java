package com.moonscribe.rag.llm;

public interface ChatClient {

    ProviderKind provider();

    /**
     * Sends a single-turn prompt and normalizes the provider's response envelope.
     *
     * @throws com.moonscribe.rag.exception.UpstreamProviderException when the call fails
     */
    ChatCompletion complete(String prompt, String model, CompletionSettings settings, String apiKey);
}
