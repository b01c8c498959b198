package com.moonscribe.rag.parse;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Result of reading an array of items out of a model response.
 *
 * @param items      parsed items, empty when {@link Kind#FAILED}
 * @param rawExcerpt start of the raw response, kept for diagnostics
 */
public record ParseOutcome(Kind kind, List<JsonNode> items, String rawExcerpt) {

    public enum Kind {
        /** The whole response was JSON in an accepted shape. */
        STRICT,
        /** The array was recovered from surrounding text. */
        FALLBACK,
        FAILED
    }

    public ParseOutcome {
        items = List.copyOf(items);
    }

    public boolean isFailed() {
        return kind == Kind.FAILED;
    }
}
