package com.moonscribe.rag.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Keyword-based query expansion: a query with more than two keywords gets its first five
 * keywords appended, which weights them in the query embedding.
 */
public class QueryExpander {

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for",
            "of", "with", "by", "from", "as", "is", "was", "are", "were", "be",
            "been", "being", "have", "has", "had", "do", "does", "did", "will",
            "would", "should", "could", "may", "might", "must", "can", "this",
            "that", "these", "those", "what", "which", "who", "when", "where",
            "why", "how", "about", "into", "through", "during", "including");

    private static final int MAX_KEY_TERMS = 5;

    public String expand(String query) {
        if (query == null || query.isBlank()) {
            return query;
        }
        List<String> keywords = keywords(query);
        if (keywords.size() <= 2) {
            return query;
        }
        List<String> keyTerms = keywords.subList(0, Math.min(MAX_KEY_TERMS, keywords.size()));
        return (query + " " + String.join(" ", keyTerms)).trim();
    }

    List<String> keywords(String query) {
        List<String> out = new ArrayList<>();
        for (String word : query.toLowerCase(Locale.ROOT).trim().split("\\s+")) {
            if (word.length() > 2 && !STOP_WORDS.contains(word)) {
                out.add(word);
            }
        }
        return out;
    }
}
