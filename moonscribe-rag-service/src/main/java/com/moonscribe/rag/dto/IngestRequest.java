package com.moonscribe.rag.dto;

import com.moonscribe.rag.chunk.DocumentChunker;

import java.util.regex.Pattern;

/**
 * Extracted document text to index. Binary parsing happens upstream of this service.
 *
 * @param source      display name of the document, also the vector id namespace
 * @param apiKey      caller's own OpenAI key (optional)
 * @param pageCount   page count reported by the extractor (optional, 1 when absent)
 * @param wordCount   word count reported by the extractor (optional, counted from the text when absent)
 * @param chunkTokens override of the target chunk size in tokens (optional)
 */
public record IngestRequest(
        String source,
        String text,
        Integer pageCount,
        Integer wordCount,
        String documentId,
        String sourceType,
        String url,
        String apiKey,
        Integer chunkTokens
) {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public void validate() {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source is required");
        }
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text is required");
        }
        if (pageCount != null && pageCount < 1) {
            throw new IllegalArgumentException("pageCount must be at least 1");
        }
        if (wordCount != null && wordCount < 0) {
            throw new IllegalArgumentException("wordCount must not be negative");
        }
        if (chunkTokens != null && chunkTokens < 1) {
            throw new IllegalArgumentException("chunkTokens must be positive");
        }
        if (chunkTokens != null && chunkTokens > DocumentChunker.MAX_TARGET_TOKENS) {
            throw new IllegalArgumentException("chunkTokens must be at most " + DocumentChunker.MAX_TARGET_TOKENS);
        }
    }

    public int getPageCountOrDefault() {
        return pageCount != null ? pageCount : 1;
    }

    public int getWordCountOrDefault() {
        if (wordCount != null) {
            return wordCount;
        }
        String trimmed = text == null ? "" : text.trim();
        return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
    }
}
