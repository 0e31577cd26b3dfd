package com.t2aassist.engine.search;

import com.t2aassist.engine.catalog.CatalogCode;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Search-side view of a code: normalized text and per-field term frequencies.
 */
public final class IndexedCode {

    private final CatalogCode code;
    private final String normalizedLabel;
    private final String normalizedDescription;
    private final Map<String, Integer> labelFrequencies;
    private final Map<String, Integer> descriptionFrequencies;
    private final int tokenCount;

    IndexedCode(CatalogCode code) {
        this.code = code;
        this.normalizedLabel = TextNormalizer.normalize(code.label());
        this.normalizedDescription = TextNormalizer.normalize(code.description());
        this.labelFrequencies = frequencies(normalizedLabel);
        this.descriptionFrequencies = frequencies(normalizedDescription);
        this.tokenCount = TextNormalizer.tokens(normalizedLabel).size()
            + TextNormalizer.tokens(normalizedDescription).size();
    }

    private static Map<String, Integer> frequencies(String normalized) {
        Map<String, Integer> counts = new HashMap<>();
        for (String token : TextNormalizer.tokens(normalized)) {
            counts.merge(token, 1, Integer::sum);
        }
        return Map.copyOf(counts);
    }

    public CatalogCode code() {
        return code;
    }

    public String normalizedLabel() {
        return normalizedLabel;
    }

    public String normalizedDescription() {
        return normalizedDescription;
    }

    public boolean hasToken(String token) {
        return labelFrequencies.containsKey(token) || descriptionFrequencies.containsKey(token);
    }

    public int labelFrequency(String token) {
        return labelFrequencies.getOrDefault(token, 0);
    }

    public int descriptionFrequency(String token) {
        return descriptionFrequencies.getOrDefault(token, 0);
    }

    public int tokenCount() {
        return tokenCount;
    }

    Set<String> distinctTokens() {
        Set<String> all = new HashSet<>(labelFrequencies.keySet());
        all.addAll(descriptionFrequencies.keySet());
        return all;
    }
}
