package com.t2aassist.engine.search;

import com.t2aassist.model.enums.SearchStage;

import java.util.Comparator;
import java.util.List;

/**
 * Every query token must appear in the label or the description.
 * Ranked by relevance, then identifier.
 */
public class ConjunctiveTokenStrategy implements SearchStrategy {

    private static final Comparator<SearchHit> ORDER = Comparator
        .comparingDouble(SearchHit::score).reversed()
        .thenComparing(hit -> hit.code().id());

    @Override
    public SearchStage stage() {
        return SearchStage.CONJUNCTIVE;
    }

    @Override
    public List<SearchHit> search(SearchQuery query, SearchIndex index) {
        BoundedRanking<SearchHit> ranking = new BoundedRanking<>(query.limit(), ORDER);
        for (IndexedCode entry : index.containingAll(query.tokens())) {
            if (!query.includeRetired() && !entry.code().isActive()) {
                continue;
            }
            ranking.offer(new SearchHit(entry.code(), index.relevance(entry, query.tokens(), query.normalized())));
        }
        return ranking.toSortedList();
    }
}
