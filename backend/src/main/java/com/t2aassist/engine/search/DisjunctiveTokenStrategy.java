package com.t2aassist.engine.search;

import com.t2aassist.model.enums.SearchStage;

import java.util.Comparator;
import java.util.List;

/**
 * At least one query token must appear. Ranked by number of matched tokens,
 * then relevance, then identifier.
 */
public class DisjunctiveTokenStrategy implements SearchStrategy {

    private record Candidate(SearchHit hit, int matched) {
    }

    private static final Comparator<Candidate> ORDER = Comparator
        .comparingInt(Candidate::matched).reversed()
        .thenComparing(Comparator.comparingDouble((Candidate c) -> c.hit().score()).reversed())
        .thenComparing(c -> c.hit().code().id());

    @Override
    public SearchStage stage() {
        return SearchStage.DISJUNCTIVE;
    }

    // A single token cannot match "any" where it failed to match "all"
    @Override
    public boolean appliesTo(SearchQuery query) {
        return query.tokens().size() > 1;
    }

    @Override
    public List<SearchHit> search(SearchQuery query, SearchIndex index) {
        BoundedRanking<Candidate> ranking = new BoundedRanking<>(query.limit(), ORDER);
        for (IndexedCode entry : index.containingAny(query.tokens())) {
            if (!query.includeRetired() && !entry.code().isActive()) {
                continue;
            }
            int matched = (int) query.tokens().stream().filter(entry::hasToken).count();
            double score = index.relevance(entry, query.tokens(), query.normalized());
            ranking.offer(new Candidate(new SearchHit(entry.code(), score), matched));
        }
        return ranking.toSortedList().stream().map(Candidate::hit).toList();
    }
}
