package com.moonscribe.rag.llm;

/**
 * An API key together with the provider it authenticates against.
 */
public record ProviderCredential(ProviderKind provider, String apiKey) {

    public ProviderCredential {
        if (provider == null) {
            throw new IllegalArgumentException("provider is required");
        }
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("apiKey is required");
        }
    }

    @Override
    public String toString() {
        return "ProviderCredential[provider=" + provider + ", apiKey=****]";
    }
}
