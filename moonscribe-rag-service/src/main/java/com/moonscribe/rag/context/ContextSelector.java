package com.moonscribe.rag.context;

import com.moonscribe.rag.vector.SearchHit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Two-stage selection: cap each source at {@code maxPerSource} best hits, then merge by score
 * and keep the best {@code maxTotal}. All sorts are stable, so equal scores keep retrieval
 * order.
 */
public class ContextSelector {

    private static final Comparator<SearchHit> BY_SCORE_DESC =
            Comparator.comparingDouble(SearchHit::score).reversed();

    private final int defaultMaxPerSource;
    private final int defaultMaxTotal;
    private final int minTextLength;

    public ContextSelector(int defaultMaxPerSource, int defaultMaxTotal, int minTextLength) {
        if (defaultMaxPerSource <= 0 || defaultMaxTotal <= 0) {
            throw new IllegalArgumentException("maxPerSource and maxTotal must be positive");
        }
        this.defaultMaxPerSource = defaultMaxPerSource;
        this.defaultMaxTotal = defaultMaxTotal;
        this.minTextLength = Math.max(0, minTextLength);
    }

    public ContextWindow select(List<SearchHit> hits) {
        return select(hits, defaultMaxPerSource, defaultMaxTotal);
    }

    public ContextWindow select(List<SearchHit> hits, int maxPerSource, int maxTotal) {
        if (maxPerSource <= 0 || maxTotal <= 0) {
            throw new IllegalArgumentException("maxPerSource and maxTotal must be positive");
        }
        if (hits == null || hits.isEmpty()) {
            return ContextWindow.empty();
        }

        Map<String, String> canonical = new LinkedHashMap<>();
        Map<String, List<SearchHit>> groups = new LinkedHashMap<>();
        for (SearchHit hit : hits) {
            if (hit.text() == null || hit.text().trim().length() < minTextLength) continue;

            String key = normalize(hit.source());
            canonical.putIfAbsent(key, hit.source());
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(hit);
        }

        List<SearchHit> merged = new ArrayList<>();
        for (List<SearchHit> group : groups.values()) {
            group.sort(BY_SCORE_DESC);
            merged.addAll(group.subList(0, Math.min(maxPerSource, group.size())));
        }
        merged.sort(BY_SCORE_DESC);
        List<SearchHit> selected = merged.subList(0, Math.min(maxTotal, merged.size()));

        Map<String, String> present = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : canonical.entrySet()) {
            boolean kept = selected.stream().anyMatch(h -> normalize(h.source()).equals(e.getKey()));
            if (kept) present.put(e.getKey(), e.getValue());
        }
        return new ContextWindow(selected, present);
    }

    static String normalize(String source) {
        return source == null ? "" : source.trim().toLowerCase(Locale.ROOT);
    }
}
