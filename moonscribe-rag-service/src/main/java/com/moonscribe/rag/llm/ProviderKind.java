package com.moonscribe.rag.llm;

import java.util.Locale;

/**
 * The closed set of completion providers. Each has its own wire shape, normalized by a
 * {@link ChatClient} adapter.
 */
public enum ProviderKind {
    OPENAI("openai"),
    ANTHROPIC("anthropic");

    private final String id;

    ProviderKind(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Lenient lookup by id; blank means the default provider.
     */
    public static ProviderKind fromId(String value) {
        if (value == null || value.isBlank()) {
            return OPENAI;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ProviderKind kind : values()) {
            if (kind.id.equals(normalized) || kind.name().equalsIgnoreCase(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown provider: " + value);
    }
}
