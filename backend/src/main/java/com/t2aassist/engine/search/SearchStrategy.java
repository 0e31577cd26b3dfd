package com.t2aassist.engine.search;

import com.t2aassist.model.enums.SearchStage;

import java.util.List;

/**
 * One stage of the cascading search.
 */
public interface SearchStrategy {

    SearchStage stage();

    /**
     * Whether this stage can produce anything the previous stages could not.
     */
    default boolean appliesTo(SearchQuery query) {
        return true;
    }

    /**
     * Rank every matching code and return the best {@code query.limit()} of them, best first.
     * Never returns null.
     */
    List<SearchHit> search(SearchQuery query, SearchIndex index);
}
