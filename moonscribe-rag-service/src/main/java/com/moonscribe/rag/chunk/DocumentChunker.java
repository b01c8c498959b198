package com.moonscribe.rag.chunk;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Paragraph-first chunker.
 *
 * Paragraphs (separated by blank lines) are packed into chunks of at most
 * {@code targetTokenSize * 4} characters. A paragraph that alone exceeds the limit is split
 * on sentence boundaries, and a sentence that alone exceeds it is sliced. Text without any
 * blank line is sliced at the limit directly.
 */
public class DocumentChunker {

    /** Rough characters-per-token ratio used to turn a token budget into a char limit. */
    public static final int CHARS_PER_TOKEN = 4;

    /** Largest token budget whose character limit still fits in an int. */
    public static final int MAX_TARGET_TOKENS = Integer.MAX_VALUE / CHARS_PER_TOKEN;

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");
    private static final String PARAGRAPH_JOIN = "\n\n";
    private static final String SENTENCE_JOIN = " ";

    private final int defaultTargetTokens;

    public DocumentChunker(int defaultTargetTokens) {
        checkTargetTokens(defaultTargetTokens);
        this.defaultTargetTokens = defaultTargetTokens;
    }

    public int defaultTargetTokens() {
        return defaultTargetTokens;
    }

    public List<Chunk> chunk(String sourceId, String text) {
        return chunk(sourceId, text, defaultTargetTokens);
    }

    public List<Chunk> chunk(String sourceId, String text, int targetTokenSize) {
        List<String> pieces = split(text, targetTokenSize);
        List<Chunk> chunks = new ArrayList<>(pieces.size());
        for (int i = 0; i < pieces.size(); i++) {
            chunks.add(new Chunk(pieces.get(i), sourceId, i));
        }
        return chunks;
    }

    public List<String> split(String text, int targetTokenSize) {
        checkTargetTokens(targetTokenSize);
        if (text == null || text.isBlank()) {
            return List.of();
        }

        int limit = targetTokenSize * CHARS_PER_TOKEN;
        List<String> out = new ArrayList<>();

        if (!PARAGRAPH_BREAK.matcher(text).find()) {
            slice(out, text, limit);
            return out;
        }

        StringBuilder cur = new StringBuilder();
        for (String para : PARAGRAPH_BREAK.split(text)) {
            String p = para.trim();
            if (p.isEmpty()) continue;

            if (!cur.isEmpty() && cur.length() + PARAGRAPH_JOIN.length() + p.length() > limit) {
                flush(out, cur);
            }
            if (!cur.isEmpty()) cur.append(PARAGRAPH_JOIN);
            cur.append(p);

            // Only reachable with a single paragraph in the buffer.
            if (cur.length() > limit) {
                String oversized = cur.toString();
                cur.setLength(0);
                cur.append(splitSentences(out, oversized, limit));
            }
        }
        flush(out, cur);
        return out;
    }

    /**
     * Packs sentences into {@code out} and returns the unflushed tail, which keeps
     * accumulating with the paragraphs that follow.
     */
    private static String splitSentences(List<String> out, String paragraph, int limit) {
        StringBuilder cur = new StringBuilder();
        for (String sentence : SENTENCE_BREAK.split(paragraph)) {
            String s = sentence.trim();
            if (s.isEmpty()) continue;

            if (s.length() > limit) {
                flush(out, cur);
                slice(out, s, limit);
                continue;
            }
            if (!cur.isEmpty() && cur.length() + SENTENCE_JOIN.length() + s.length() > limit) {
                flush(out, cur);
            }
            if (!cur.isEmpty()) cur.append(SENTENCE_JOIN);
            cur.append(s);
        }
        return cur.toString();
    }

    private static void checkTargetTokens(int targetTokenSize) {
        if (targetTokenSize <= 0) {
            throw new IllegalArgumentException("targetTokenSize must be positive");
        }
        if (targetTokenSize > MAX_TARGET_TOKENS) {
            throw new IllegalArgumentException("targetTokenSize must be at most " + MAX_TARGET_TOKENS);
        }
    }

    private static void slice(List<String> out, String text, int limit) {
        for (int start = 0; start < text.length(); start += limit) {
            add(out, text.substring(start, Math.min(text.length(), start + limit)));
        }
    }

    private static void flush(List<String> out, StringBuilder cur) {
        add(out, cur.toString());
        cur.setLength(0);
    }

    private static void add(List<String> out, String s) {
        String trimmed = s.trim();
        if (!trimmed.isEmpty()) out.add(trimmed);
    }
}
