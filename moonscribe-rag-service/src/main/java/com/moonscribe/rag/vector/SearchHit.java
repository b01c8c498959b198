package com.moonscribe.rag.vector;

/**
 * One retrieved chunk.
 *
 * @param score     similarity in [0, 1]
 * @param timestamp start offset in seconds for media sources, else null
 */
public record SearchHit(String text,
                        String source,
                        double score,
                        String sourceType,
                        String url,
                        Double timestamp,
                        String mediaId) {

    public static SearchHit of(String text, String source, double score) {
        return new SearchHit(text, source, score, "document", null, null, null);
    }
}
