package com.t2aassist.engine.search;

import com.t2aassist.model.enums.SearchStage;

import java.util.Comparator;
import java.util.List;

/**
 * Fallback for partial words: the query tokens must occur, in order, as fragments of
 * the normalized label or, failing that, of the normalized description.
 *
 * Ranked by the position of the first fragment (label positions come before any
 * description position), then identifier. The score is {@code 1 / (1 + position)}.
 */
public class SubstringStrategy implements SearchStrategy {

    private record Candidate(IndexedCode entry, int position) {
    }

    private static final Comparator<Candidate> ORDER = Comparator
        .comparingInt(Candidate::position)
        .thenComparing(c -> c.entry().code().id());

    @Override
    public SearchStage stage() {
        return SearchStage.SUBSTRING;
    }

    @Override
    public List<SearchHit> search(SearchQuery query, SearchIndex index) {
        BoundedRanking<Candidate> ranking = new BoundedRanking<>(query.limit(), ORDER);
        for (IndexedCode entry : index.entries()) {
            if (!query.includeRetired() && !entry.code().isActive()) {
                continue;
            }
            int position = matchPosition(entry, query.tokens());
            if (position >= 0) {
                ranking.offer(new Candidate(entry, position));
            }
        }
        return ranking.toSortedList().stream()
            .map(c -> new SearchHit(c.entry().code(), 1.0 / (1 + c.position())))
            .toList();
    }

    private static int matchPosition(IndexedCode entry, List<String> fragments) {
        int inLabel = orderedMatch(entry.normalizedLabel(), fragments);
        if (inLabel >= 0) {
            return inLabel;
        }
        int inDescription = orderedMatch(entry.normalizedDescription(), fragments);
        if (inDescription >= 0) {
            // past the end of the label, so any label match ranks first
            return entry.normalizedLabel().length() + 1 + inDescription;
        }
        return -1;
    }

    /**
     * Index of the first fragment when all fragments appear in order, else -1.
     */
    static int orderedMatch(String text, List<String> fragments) {
        if (text.isEmpty() || fragments.isEmpty()) {
            return -1;
        }
        int first = -1;
        int from = 0;
        for (String fragment : fragments) {
            int at = text.indexOf(fragment, from);
            if (at < 0) {
                return -1;
            }
            if (first < 0) {
                first = at;
            }
            from = at + fragment.length();
        }
        return first;
    }
}
