package com.t2aassist.engine.snapshot;

import com.t2aassist.engine.catalog.CodeCatalog;
import com.t2aassist.engine.graph.CompatibilityGraph;
import com.t2aassist.engine.search.SearchIndex;

import java.time.Instant;
import java.util.Objects;

/**
 * One point-in-time load of the reference data: catalog, compatibility graph and
 * search index, published together so readers always see a matching set.
 */
public record DataSnapshot(String label, Instant loadedAt, CodeCatalog catalog, CompatibilityGraph graph, SearchIndex index) {

    public DataSnapshot {
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(index, "index");
    }

    /**
     * Snapshot served before the first load completes.
     */
    public static DataSnapshot empty() {
        return new DataSnapshot("empty", Instant.EPOCH, CodeCatalog.empty(), CompatibilityGraph.empty(), SearchIndex.empty());
    }

    public long version() {
        return catalog.version();
    }

    public boolean isConsistent() {
        return catalog.version() == graph.version() && catalog.version() == index.version();
    }

    /**
     * @throws DataVersionMismatchException if the parts come from different loads
     */
    public DataSnapshot requireConsistent() {
        if (!isConsistent()) {
            throw new DataVersionMismatchException(catalog.version(), graph.version(), index.version());
        }
        return this;
    }
}
