package com.moonscribe.rag.llm;

/**
 * Provider-independent completion result.
 */
public record ChatCompletion(String text, int tokensUsed, ProviderKind provider, String model) {}
