package com.moonscribe.rag.credit;

/**
 * Which tier supplied the provider key for a request, in priority order.
 */
public enum KeySource {
    BYOK("byok"),
    TEAM("team"),
    CREDITS("credits");

    private final String id;

    KeySource(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
