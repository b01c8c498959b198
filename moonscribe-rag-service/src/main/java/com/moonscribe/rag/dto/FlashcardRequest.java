package com.moonscribe.rag.dto;

import java.util.List;

public record FlashcardRequest(
        List<String> sourceFilenames,
        String apiKey,
        String provider,
        String model,
        Integer count
) {
    private static final int DEFAULT_COUNT = 10;
    private static final int MAX_COUNT = 50;

    public void validate() {
        if (sourceFilenames == null || sourceFilenames.isEmpty()
                || sourceFilenames.stream().allMatch(s -> s == null || s.isBlank())) {
            throw new IllegalArgumentException("No source files provided");
        }
        if (count != null && (count < 1 || count > MAX_COUNT)) {
            throw new IllegalArgumentException("count must be between 1 and " + MAX_COUNT);
        }
    }

    public int getCountOrDefault() {
        return count != null ? count : DEFAULT_COUNT;
    }
}
