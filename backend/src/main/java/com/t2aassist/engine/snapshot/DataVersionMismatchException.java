package com.t2aassist.engine.snapshot;

/**
 * Raised when a query meets a catalog, graph and index from different data versions.
 * Fatal to the call only; retrying picks up the current snapshot.
 */
public class DataVersionMismatchException extends RuntimeException {

    private final long catalogVersion;
    private final long graphVersion;

    public DataVersionMismatchException(long catalogVersion, long graphVersion, long indexVersion) {
        super("Inconsistent data snapshot: catalog v" + catalogVersion
            + ", graph v" + graphVersion + ", index v" + indexVersion);
        this.catalogVersion = catalogVersion;
        this.graphVersion = graphVersion;
    }

    public long getCatalogVersion() {
        return catalogVersion;
    }

    public long getGraphVersion() {
        return graphVersion;
    }
}
