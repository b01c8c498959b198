package com.moonscribe.rag.dto;

/**
 * @param warning     set when the text looks like a scan with little extractable text
 * @param ocrRequired true together with {@code warning}
 */
public record IngestResponse(
        boolean success,
        String source,
        int chunks,
        String documentId,
        int pageCount,
        String keySource,
        String teamName,
        int creditsUsed,
        Integer remainingBalance,
        int tokensUsed,
        int wordCount,
        String warning,
        boolean ocrRequired
) {}
