package com.moonscribe.rag.dto;

import java.util.List;
import java.util.Map;

public record FlashcardResponse(
        List<Flashcard> flashcards,
        List<String> sources,
        Map<String, List<Flashcard>> flashcardsBySource,
        String keySource,
        String teamName,
        Integer remainingBalance,
        int tokensUsed,
        boolean noRelevantContent
) {
    public static FlashcardResponse noRelevantContent(String keySource, String teamName, Integer remainingBalance, int tokensUsed) {
        return new FlashcardResponse(List.of(), List.of(), Map.of(), keySource, teamName, remainingBalance, tokensUsed, true);
    }
}
