package com.t2aassist.service;

import com.t2aassist.engine.EngineMetrics;
import com.t2aassist.engine.catalog.CatalogCode;
import com.t2aassist.engine.graph.Neighbor;
import com.t2aassist.engine.search.SearchEngine;
import com.t2aassist.engine.search.SearchQuery;
import com.t2aassist.engine.search.SearchResult;
import com.t2aassist.engine.snapshot.DataSnapshot;
import com.t2aassist.engine.snapshot.SnapshotHolder;
import com.t2aassist.model.enums.AssociationKind;
import com.t2aassist.model.enums.AssociationTier;
import com.t2aassist.model.enums.SearchStage;
import jakarta.persistence.EntityNotFoundException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;

/**
 * Code Search Service
 *
 * Free-text search, code details and association listings against the current
 * data snapshot. Each call reads the snapshot once and works on it throughout.
 */
@Service
public class CodeSearchService {

    private final SnapshotHolder snapshotHolder;
    private final SearchEngine searchEngine;
    private final EngineMetrics engineMetrics;

    public CodeSearchService(SnapshotHolder snapshotHolder, SearchEngine searchEngine, EngineMetrics engineMetrics) {
        this.snapshotHolder = snapshotHolder;
        this.searchEngine = searchEngine;
        this.engineMetrics = engineMetrics;
    }

    /**
     * A code linked to another one in the compatibility graph.
     *
     * @param code null when the linked identifier is missing from the catalog
     */
    public record LinkedCode(String codeId, CatalogCode code, AssociationTier tier,
                             Integer supportCount, AssociationKind officialKind) {
    }

    /**
     * Search results with the association count of each hit, from the same snapshot.
     */
    public record EnrichedSearch(SearchResult result, Map<String, Integer> associationCounts) {
    }

    public record DataStats(
        String versionLabel,
        long dataVersion,
        Instant loadedAt,
        int activeCodes,
        int retiredCodes,
        Map<AssociationTier, Long> pairsByTier,
        long staleReferencesSkipped,
        Map<SearchStage, Long> hitsByStage
    ) {
    }

    public EnrichedSearch search(String query, int limit, boolean includeRetired) {
        DataSnapshot snapshot = snapshotHolder.current();
        SearchResult result = searchEngine.search(snapshot, SearchQuery.parse(query, limit, includeRetired));
        Map<String, Integer> counts = new LinkedHashMap<>();
        result.hits().forEach(hit -> counts.put(hit.code().id(), snapshot.graph().associationCount(hit.code().id())));
        return new EnrichedSearch(result, counts);
    }

    /**
     * Look up a code, retired ones included.
     *
     * @throws EntityNotFoundException if the code is not in the catalog
     */
    public CatalogCode getCode(String id) {
        return snapshotHolder.current().catalog().find(id)
            .orElseThrow(() -> new EntityNotFoundException("Code not found: " + id));
    }

    public int getAssociationCount(String id) {
        return snapshotHolder.current().graph().associationCount(id);
    }

    /**
     * Every code linked to {@code id} at any compatibility tier, most trusted first,
     * then by work value and identifier.
     */
    public List<LinkedCode> getAssociations(String id) {
        DataSnapshot snapshot = snapshotHolder.current();
        CatalogCode code = snapshot.catalog().find(id)
            .orElseThrow(() -> new EntityNotFoundException("Code not found: " + id));

        List<LinkedCode> linked = new ArrayList<>();
        for (Neighbor neighbor : snapshot.graph().neighbors(code.id(), AssociationTier.CROSS_REGION)) {
            CatalogCode target = snapshot.catalog().find(neighbor.codeId()).orElse(null);
            linked.add(new LinkedCode(neighbor.codeId(), target, neighbor.tier(),
                neighbor.supportCount(), neighbor.officialKind()));
        }
        linked.sort(Comparator
            .comparingInt((LinkedCode l) -> l.tier().getTrust()).reversed()
            .thenComparing(Comparator.comparingDouble((LinkedCode l) -> l.code() == null ? 0.0 : l.code().workValue()).reversed())
            .thenComparing(LinkedCode::codeId));
        return linked;
    }

    public DataStats getStats() {
        DataSnapshot snapshot = snapshotHolder.current();
        int active = snapshot.catalog().activeCount();
        Map<SearchStage, Long> hits = new EnumMap<>(SearchStage.class);
        for (SearchStage stage : SearchStage.values()) {
            hits.put(stage, engineMetrics.stageHitCount(stage));
        }
        return new DataStats(
            snapshot.label(),
            snapshot.version(),
            snapshot.loadedAt(),
            active,
            snapshot.catalog().size() - active,
            snapshot.graph().countByTier(),
            engineMetrics.staleReferenceCount(),
            hits
        );
    }
}
