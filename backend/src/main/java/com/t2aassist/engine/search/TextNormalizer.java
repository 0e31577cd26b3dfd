package com.t2aassist.engine.search;

import java.text.Normalizer;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Normalization shared by indexing and querying.
 *
 * Lowercases, strips diacritics, unfolds the French ligatures (œ, æ) and turns every
 * run of non letter/digit characters into a single space. The result is a fixed point: {@code normalize(normalize(s)) == normalize(s)}.
 */
public final class TextNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern SEPARATORS = Pattern.compile("[^\\p{L}\\p{Nd}]+");

    // Articles and prepositions ("de", "la", "du") are at most two letters long
    private static final int MIN_QUERY_TOKEN_LENGTH = 3;

    private TextNormalizer() {
    }

    public static String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT);
        String decomposed = Normalizer.normalize(lower, Normalizer.Form.NFKD);
        String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("").toLowerCase(Locale.ROOT)
            .replace("œ", "oe")
            .replace("æ", "ae");
        return SEPARATORS.matcher(stripped).replaceAll(" ").trim();
    }

    /**
     * Split already-normalized text into tokens.
     */
    public static List<String> tokens(String normalized) {
        if (normalized == null || normalized.isEmpty()) {
            return List.of();
        }
        return List.of(normalized.split(" "));
    }

    /**
     * Distinct query tokens in query order. Short words are dropped from multi-word
     * queries unless nothing else would be left.
     */
    public static List<String> queryTokens(String query) {
        List<String> all = tokens(normalize(query));
        Set<String> distinct = new LinkedHashSet<>(all);
        if (distinct.size() > 1) {
            List<String> meaningful = distinct.stream()
                .filter(t -> t.length() >= MIN_QUERY_TOKEN_LENGTH)
                .toList();
            if (!meaningful.isEmpty()) {
                return meaningful;
            }
        }
        return List.copyOf(distinct);
    }
}
