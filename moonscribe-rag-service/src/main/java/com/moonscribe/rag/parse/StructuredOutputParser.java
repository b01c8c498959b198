package com.moonscribe.rag.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.moonscribe.rag.exception.StructuredOutputException;
import com.moonscribe.rag.json.Json;
import com.moonscribe.rag.metrics.RagMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads a JSON array of items from a model response.
 *
 * Accepted shapes are a bare array or an object holding the array under one of the
 * configured field names. When the response is not such a document, the text from the first
 * {@code [} to the last {@code ]} is tried, then the first balanced bracket span.
 */
public class StructuredOutputParser {
    private static final Logger log = LoggerFactory.getLogger(StructuredOutputParser.class);

    static final int EXCERPT_LENGTH = 200;

    private final List<String> arrayFields;
    private final RagMetrics metrics;

    public StructuredOutputParser(List<String> arrayFields, RagMetrics metrics) {
        if (arrayFields == null || arrayFields.isEmpty()) {
            throw new IllegalArgumentException("at least one accepted array field is required");
        }
        this.arrayFields = List.copyOf(arrayFields);
        this.metrics = metrics;
    }

    public ParseOutcome parse(String raw) {
        String excerpt = excerpt(raw);
        if (raw == null || raw.isBlank()) {
            metrics.recordParseFailure();
            return new ParseOutcome(ParseOutcome.Kind.FAILED, List.of(), excerpt);
        }

        Optional<List<JsonNode>> strict = readAcceptedShape(raw.trim());
        if (strict.isPresent()) {
            return new ParseOutcome(ParseOutcome.Kind.STRICT, strict.get(), excerpt);
        }

        Optional<List<JsonNode>> recovered = extractArray(raw);
        if (recovered.isPresent()) {
            metrics.recordParseFallback();
            log.warn("[PARSE] response was not an accepted JSON document, recovered {} items from embedded array",
                    recovered.get().size());
            return new ParseOutcome(ParseOutcome.Kind.FALLBACK, recovered.get(), excerpt);
        }

        metrics.recordParseFailure();
        log.warn("[PARSE] no JSON array found in response: {}", excerpt);
        return new ParseOutcome(ParseOutcome.Kind.FAILED, List.of(), excerpt);
    }

    /**
     * Like {@link #parse} but a failed outcome raises.
     *
     * @throws StructuredOutputException with the start of the raw response
     */
    public ParseOutcome parseOrThrow(String raw) {
        ParseOutcome outcome = parse(raw);
        if (outcome.isFailed()) {
            throw new StructuredOutputException("Could not parse structured output.", outcome.rawExcerpt());
        }
        return outcome;
    }

    private Optional<List<JsonNode>> readAcceptedShape(String text) {
        JsonNode root = readTree(text);
        if (root == null) {
            return Optional.empty();
        }
        if (root.isArray()) {
            return Optional.of(elements(root));
        }
        if (root.isObject()) {
            for (String field : arrayFields) {
                JsonNode arr = root.get(field);
                if (arr != null && arr.isArray()) {
                    return Optional.of(elements(arr));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<List<JsonNode>> extractArray(String raw) {
        int start = raw.indexOf('[');
        if (start < 0) {
            return Optional.empty();
        }
        int last = raw.lastIndexOf(']');
        if (last > start) {
            JsonNode node = readTree(raw.substring(start, last + 1));
            if (node != null && node.isArray()) {
                return Optional.of(elements(node));
            }
        }
        int end = matchingBracket(raw, start);
        if (end > start && end != last) {
            JsonNode node = readTree(raw.substring(start, end + 1));
            if (node != null && node.isArray()) {
                return Optional.of(elements(node));
            }
        }
        return Optional.empty();
    }

    // Bracket depth scan that skips brackets inside JSON strings.
    static int matchingBracket(String s, int open) {
        int depth = 0;
        boolean inString = false;
        for (int i = open; i < s.length(); i++) {
            char c = s.charAt(i);
            if (inString) {
                if (c == '\\') i++;
                else if (c == '"') inString = false;
                continue;
            }
            if (c == '"') inString = true;
            else if (c == '[') depth++;
            else if (c == ']' && --depth == 0) return i;
        }
        return -1;
    }

    private static JsonNode readTree(String text) {
        try {
            return Json.STRICT_READER.readTree(text);
        } catch (JsonProcessingException e) {
            log.trace("[PARSE] not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static List<JsonNode> elements(JsonNode array) {
        List<JsonNode> out = new ArrayList<>(array.size());
        array.forEach(out::add);
        return out;
    }

    static String excerpt(String raw) {
        if (raw == null) return "";
        return raw.length() <= EXCERPT_LENGTH ? raw : raw.substring(0, EXCERPT_LENGTH);
    }
}
