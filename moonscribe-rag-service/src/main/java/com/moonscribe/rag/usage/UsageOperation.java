package com.moonscribe.rag.usage;

public enum UsageOperation {
    EMBEDDING("embedding"),
    CHAT("chat"),
    FLASHCARD("flashcard");

    private final String id;

    UsageOperation(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
