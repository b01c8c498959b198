package com.moonscribe.rag.llm;

/**
 * Sampling settings for one completion call.
 *
 * @param jsonOutput ask the provider for a JSON document where it supports a response format
 */
public record CompletionSettings(double temperature, int maxTokens, boolean jsonOutput) {

    public static CompletionSettings text(double temperature, int maxTokens) {
        return new CompletionSettings(temperature, maxTokens, false);
    }

    public static CompletionSettings json(double temperature, int maxTokens) {
        return new CompletionSettings(temperature, maxTokens, true);
    }
}
