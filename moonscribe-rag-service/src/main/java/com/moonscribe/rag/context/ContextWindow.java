package com.moonscribe.rag.context;

import com.moonscribe.rag.vector.SearchHit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hits selected for a prompt, by descending score.
 *
 * @param canonicalNames normalized source key to the first-seen display name, for the sources
 *                       present in {@code hits}, in first-seen order
 */
public record ContextWindow(List<SearchHit> hits, Map<String, String> canonicalNames) {

    public ContextWindow {
        hits = List.copyOf(hits);
        canonicalNames = Collections.unmodifiableMap(new LinkedHashMap<>(canonicalNames));
    }

    public static ContextWindow empty() {
        return new ContextWindow(List.of(), Map.of());
    }

    public boolean isEmpty() {
        return hits.isEmpty();
    }

    public int size() {
        return hits.size();
    }

    public List<String> sourceNames() {
        return new ArrayList<>(canonicalNames.values());
    }

    public String canonicalName(String source) {
        return canonicalNames.getOrDefault(ContextSelector.normalize(source), source);
    }

    /**
     * Hits grouped under their canonical source name; groups in first-seen order, hits by
     * descending score.
     */
    public Map<String, List<SearchHit>> bySource() {
        Map<String, List<SearchHit>> groups = new LinkedHashMap<>();
        for (String name : canonicalNames.values()) {
            groups.put(name, new ArrayList<>());
        }
        for (SearchHit hit : hits) {
            groups.get(canonicalName(hit.source())).add(hit);
        }
        return groups;
    }
}
