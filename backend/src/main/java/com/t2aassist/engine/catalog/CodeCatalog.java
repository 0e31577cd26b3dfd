package com.t2aassist.engine.catalog;

import java.util.*;

/**
 * Versioned, immutable mapping from code identifier to {@link CatalogCode}.
 * Identifiers are matched case-insensitively and stored upper case.
 */
public final class CodeCatalog {

    private final long version;
    private final Map<String, CatalogCode> codes;
    private final int activeCount;

    private CodeCatalog(long version, Map<String, CatalogCode> codes) {
        this.version = version;
        this.codes = Collections.unmodifiableMap(codes);
        this.activeCount = (int) codes.values().stream().filter(CatalogCode::isActive).count();
    }

    /**
     * Build a catalog from ingested codes.
     *
     * @throws IllegalArgumentException if two codes share an identifier
     */
    public static CodeCatalog of(long version, Collection<CatalogCode> codes) {
        Map<String, CatalogCode> byId = new TreeMap<>();
        for (CatalogCode code : codes) {
            if (byId.putIfAbsent(code.id(), code) != null) {
                throw new IllegalArgumentException("Duplicate code identifier: " + code.id());
            }
        }
        return new CodeCatalog(version, new LinkedHashMap<>(byId));
    }

    public static CodeCatalog empty() {
        return new CodeCatalog(0L, new LinkedHashMap<>());
    }

    public static String normalizeId(String id) {
        return id == null ? "" : id.trim().toUpperCase(Locale.ROOT);
    }

    public long version() {
        return version;
    }

    public Optional<CatalogCode> find(String id) {
        return Optional.ofNullable(codes.get(normalizeId(id)));
    }

    public boolean contains(String id) {
        return codes.containsKey(normalizeId(id));
    }

    /**
     * All codes in ascending identifier order, retired ones included.
     */
    public Collection<CatalogCode> codes() {
        return codes.values();
    }

    public int size() {
        return codes.size();
    }

    public int activeCount() {
        return activeCount;
    }
}
