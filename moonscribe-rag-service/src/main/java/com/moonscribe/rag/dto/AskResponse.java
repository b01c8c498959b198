package com.moonscribe.rag.dto;

import java.util.List;

public record AskResponse(
        String answer,
        List<SourceReference> sources,
        String keySource,
        String teamName,
        Integer remainingBalance,
        int tokensUsed,
        boolean noRelevantContent,
        Long conversationId
) {
    public static final String NO_CONTENT_ANSWER =
            "I couldn't find relevant information in your documents to answer this question.";

    public static AskResponse noRelevantContent(String keySource, String teamName, Integer remainingBalance,
                                                int tokensUsed, Long conversationId) {
        return new AskResponse(NO_CONTENT_ANSWER, List.of(), keySource, teamName, remainingBalance, tokensUsed, true,
                conversationId);
    }
}
