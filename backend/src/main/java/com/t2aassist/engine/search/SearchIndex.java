package com.t2aassist.engine.search;

import com.t2aassist.engine.catalog.CodeCatalog;

import java.util.*;

/**
 * Inverted index over a {@link CodeCatalog}, built once per data version.
 *
 * Relevance of a code d for query tokens T:
 * <pre>
 *   score(d) = sum over t in T present in d of (2 * tfLabel(t,d) + tfDescription(t,d)) * idf(t)
 *              / sqrt(tokenCount(d))
 *   idf(t)   = ln(1 + N / df(t))
 * </pre>
 * plus {@link #EXACT_LABEL_BONUS} when the normalized label equals the normalized query.
 * Label hits weigh twice as much as description hits; the square root damps long texts.
 */
public final class SearchIndex {

    public static final double EXACT_LABEL_BONUS = 1000.0;

    private final long version;
    private final List<IndexedCode> entries;
    private final Map<String, List<IndexedCode>> postings;

    private SearchIndex(long version, List<IndexedCode> entries, Map<String, List<IndexedCode>> postings) {
        this.version = version;
        this.entries = entries;
        this.postings = postings;
    }

    public static SearchIndex build(CodeCatalog catalog) {
        List<IndexedCode> entries = catalog.codes().stream().map(IndexedCode::new).toList();
        Map<String, List<IndexedCode>> postings = new HashMap<>();
        for (IndexedCode entry : entries) {
            for (String token : entry.distinctTokens()) {
                postings.computeIfAbsent(token, k -> new ArrayList<>()).add(entry);
            }
        }
        // entries are in catalog (identifier) order, so every posting list is too
        postings.replaceAll((k, v) -> List.copyOf(v));
        return new SearchIndex(catalog.version(), entries, Map.copyOf(postings));
    }

    public static SearchIndex empty() {
        return build(CodeCatalog.empty());
    }

    public long version() {
        return version;
    }

    public int size() {
        return entries.size();
    }

    /**
     * All indexed codes in ascending identifier order.
     */
    public List<IndexedCode> entries() {
        return entries;
    }

    public int documentFrequency(String token) {
        return postings.getOrDefault(token, List.of()).size();
    }

    public double idf(String token) {
        int df = documentFrequency(token);
        if (df == 0) {
            return 0.0;
        }
        return Math.log(1.0 + (double) entries.size() / df);
    }

    /**
     * Codes containing every token, scanning the rarest token's posting list.
     */
    public List<IndexedCode> containingAll(List<String> tokens) {
        if (tokens.isEmpty()) {
            return List.of();
        }
        List<IndexedCode> rarest = null;
        for (String token : tokens) {
            List<IndexedCode> posting = postings.getOrDefault(token, List.of());
            if (rarest == null || posting.size() < rarest.size()) {
                rarest = posting;
            }
        }
        return rarest.stream()
            .filter(entry -> tokens.stream().allMatch(entry::hasToken))
            .toList();
    }

    /**
     * Codes containing at least one token, each listed once.
     */
    public Collection<IndexedCode> containingAny(List<String> tokens) {
        Set<IndexedCode> union = new LinkedHashSet<>();
        for (String token : tokens) {
            union.addAll(postings.getOrDefault(token, List.of()));
        }
        return union;
    }

    public double relevance(IndexedCode entry, List<String> tokens, String normalizedQuery) {
        double sum = 0.0;
        for (String token : tokens) {
            int weighted = 2 * entry.labelFrequency(token) + entry.descriptionFrequency(token);
            if (weighted > 0) {
                sum += weighted * idf(token);
            }
        }
        double score = sum / Math.sqrt(Math.max(entry.tokenCount(), 1));
        if (!normalizedQuery.isEmpty() && normalizedQuery.equals(entry.normalizedLabel())) {
            score += EXACT_LABEL_BONUS;
        }
        return score;
    }
}
