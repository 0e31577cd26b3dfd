package com.t2aassist.engine.search;

import java.util.List;

/**
 * A parsed search request.
 *
 * @param normalized the whole query after {@link TextNormalizer#normalize(String)}
 * @param tokens     distinct meaningful tokens, see {@link TextNormalizer#queryTokens(String)}
 * @param limit      maximum number of hits; below 1 the engine answers with an invalid-limit reason
 */
public record SearchQuery(String raw, String normalized, List<String> tokens, int limit, boolean includeRetired) {

    public SearchQuery {
        tokens = List.copyOf(tokens);
    }

    public static SearchQuery parse(String raw, int limit, boolean includeRetired) {
        return new SearchQuery(raw, TextNormalizer.normalize(raw), TextNormalizer.queryTokens(raw), limit, includeRetired);
    }

    public boolean hasValidLimit() {
        return limit >= 1;
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }
}
