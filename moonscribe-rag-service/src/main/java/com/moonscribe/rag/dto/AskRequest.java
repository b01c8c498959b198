package com.moonscribe.rag.dto;

import java.util.List;

/**
 * @param sourceFilenames restrict retrieval to these sources; takes precedence over documentIds
 * @param provider        {@code openai} (default) or {@code anthropic}
 * @param conversationId  conversation to append the exchange to; a new one is started when absent
 */
public record AskRequest(
        String question,
        List<String> sourceFilenames,
        List<String> documentIds,
        String apiKey,
        String provider,
        String model,
        Long conversationId
) {
    public void validate() {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("question is required");
        }
    }

    public List<String> getSourceFilenamesOrEmpty() {
        return sourceFilenames != null ? sourceFilenames : List.of();
    }

    public List<String> getDocumentIdsOrEmpty() {
        return documentIds != null ? documentIds : List.of();
    }
}
