package com.t2aassist.engine.search;

import com.t2aassist.engine.EngineMetrics;
import com.t2aassist.engine.snapshot.DataSnapshot;
import com.t2aassist.model.enums.SearchReason;

import java.util.List;

/**
 * Cascading code search. Stages run in order and the first one that returns
 * anything answers the query.
 *
 * Stateless: every call works on the snapshot it is given and never throws for
 * bad input, it reports a {@link SearchReason} instead.
 */
public class SearchEngine {

    private final List<SearchStrategy> strategies;
    private final EngineMetrics metrics;

    public SearchEngine(List<SearchStrategy> strategies, EngineMetrics metrics) {
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one search strategy is required");
        }
        this.strategies = List.copyOf(strategies);
        this.metrics = metrics;
    }

    /**
     * The default cascade: conjunctive, disjunctive, then substring.
     */
    public static List<SearchStrategy> defaultStrategies() {
        return List.of(new ConjunctiveTokenStrategy(), new DisjunctiveTokenStrategy(), new SubstringStrategy());
    }

    public SearchResult search(DataSnapshot snapshot, String query, int limit) {
        return search(snapshot, SearchQuery.parse(query, limit, false));
    }

    public SearchResult search(DataSnapshot snapshot, SearchQuery query) {
        metrics.searchRequested();
        if (!snapshot.isConsistent()) {
            metrics.versionMismatch();
            return SearchResult.empty(query, SearchReason.DATA_VERSION_MISMATCH, snapshot.version());
        }
        if (!query.hasValidLimit()) {
            return SearchResult.empty(query, SearchReason.INVALID_LIMIT, snapshot.version());
        }
        if (query.isEmpty()) {
            metrics.emptyQuery();
            return SearchResult.empty(query, SearchReason.EMPTY_QUERY, snapshot.version());
        }

        for (SearchStrategy strategy : strategies) {
            if (!strategy.appliesTo(query)) {
                continue;
            }
            List<SearchHit> hits = strategy.search(query, snapshot.index());
            if (!hits.isEmpty()) {
                metrics.stageAnswered(strategy.stage(), hits.size());
                return new SearchResult(query.raw(), query.normalized(), strategy.stage(),
                    SearchReason.MATCHED, hits, snapshot.version());
            }
        }

        metrics.noMatch();
        return SearchResult.empty(query, SearchReason.NO_MATCH, snapshot.version());
    }
}
