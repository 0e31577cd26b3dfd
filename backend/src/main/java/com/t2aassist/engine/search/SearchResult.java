package com.t2aassist.engine.search;

import com.t2aassist.model.enums.SearchReason;
import com.t2aassist.model.enums.SearchStage;

import java.util.List;

/**
 * Outcome of one search.
 *
 * @param stage the stage that produced the hits, null when nothing matched
 */
public record SearchResult(
    String query,
    String normalizedQuery,
    SearchStage stage,
    SearchReason reason,
    List<SearchHit> hits,
    long dataVersion
) {

    public SearchResult {
        hits = List.copyOf(hits);
    }

    static SearchResult empty(SearchQuery query, SearchReason reason, long dataVersion) {
        return new SearchResult(query.raw(), query.normalized(), null, reason, List.of(), dataVersion);
    }
}
