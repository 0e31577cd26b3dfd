package com.t2aassist.engine.graph;

import com.t2aassist.engine.catalog.CodeCatalog;
import com.t2aassist.model.enums.AssociationTier;

import java.util.*;

/**
 * Immutable, undirected compatibility relation over code pairs.
 *
 * Built once per data version by {@link TierMergePolicy}. A pair is held either
 * as an {@link Association} or as an incompatibility, never both.
 */
public final class CompatibilityGraph {

    private final long version;
    private final Map<CodePair, Association> associations;
    private final Set<CodePair> incompatibilities;
    private final Map<String, List<Neighbor>> adjacency;
    private final Map<String, Set<String>> incompatibleWith;

    CompatibilityGraph(long version, Map<CodePair, Association> associations, Set<CodePair> incompatibilities) {
        this.version = version;
        this.associations = Collections.unmodifiableMap(new LinkedHashMap<>(associations));
        this.incompatibilities = Collections.unmodifiableSet(new LinkedHashSet<>(incompatibilities));

        Map<String, List<Neighbor>> adj = new HashMap<>();
        for (Association association : this.associations.values()) {
            CodePair pair = association.pair();
            adj.computeIfAbsent(pair.first(), k -> new ArrayList<>()).add(Neighbor.from(pair.first(), association));
            adj.computeIfAbsent(pair.second(), k -> new ArrayList<>()).add(Neighbor.from(pair.second(), association));
        }
        adj.values().forEach(list -> list.sort(Comparator.comparing(Neighbor::codeId)));
        adj.replaceAll((k, v) -> List.copyOf(v));
        this.adjacency = Collections.unmodifiableMap(adj);

        Map<String, Set<String>> incompatible = new HashMap<>();
        for (CodePair pair : this.incompatibilities) {
            incompatible.computeIfAbsent(pair.first(), k -> new TreeSet<>()).add(pair.second());
            incompatible.computeIfAbsent(pair.second(), k -> new TreeSet<>()).add(pair.first());
        }
        incompatible.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        this.incompatibleWith = Collections.unmodifiableMap(incompatible);
    }

    public static CompatibilityGraph empty() {
        return new CompatibilityGraph(0L, Map.of(), Set.of());
    }

    public long version() {
        return version;
    }

    /**
     * Resolve a pair. The same code on both sides is {@link AssociationTier#UNKNOWN}.
     */
    public AssociationTier tierOf(String codeA, String codeB) {
        String a = CodeCatalog.normalizeId(codeA);
        String b = CodeCatalog.normalizeId(codeB);
        if (a.equals(b)) {
            return AssociationTier.UNKNOWN;
        }
        CodePair pair = CodePair.of(a, b);
        if (incompatibilities.contains(pair)) {
            return AssociationTier.INCOMPATIBLE;
        }
        Association association = associations.get(pair);
        return association == null ? AssociationTier.UNKNOWN : association.tier();
    }

    public boolean isIncompatible(String codeA, String codeB) {
        return tierOf(codeA, codeB) == AssociationTier.INCOMPATIBLE;
    }

    public Optional<Association> association(String codeA, String codeB) {
        String a = CodeCatalog.normalizeId(codeA);
        String b = CodeCatalog.normalizeId(codeB);
        if (a.equals(b)) {
            return Optional.empty();
        }
        return Optional.ofNullable(associations.get(CodePair.of(a, b)));
    }

    /**
     * Codes linked to {@code code} with a tier at least as trusted as {@code minTier},
     * in ascending identifier order.
     */
    public List<Neighbor> neighbors(String code, AssociationTier minTier) {
        if (!minTier.isCompatible()) {
            throw new IllegalArgumentException("minTier must be a compatibility tier, got " + minTier);
        }
        List<Neighbor> all = adjacency.getOrDefault(CodeCatalog.normalizeId(code), List.of());
        return all.stream().filter(n -> n.tier().isAtLeast(minTier)).toList();
    }

    public Set<String> incompatibleWith(String code) {
        return incompatibleWith.getOrDefault(CodeCatalog.normalizeId(code), Set.of());
    }

    public int associationCount(String code) {
        return adjacency.getOrDefault(CodeCatalog.normalizeId(code), List.of()).size();
    }

    public Collection<Association> associations() {
        return associations.values();
    }

    public Set<CodePair> incompatibilities() {
        return incompatibilities;
    }

    public Map<AssociationTier, Long> countByTier() {
        Map<AssociationTier, Long> counts = new EnumMap<>(AssociationTier.class);
        for (Association association : associations.values()) {
            counts.merge(association.tier(), 1L, Long::sum);
        }
        counts.put(AssociationTier.INCOMPATIBLE, (long) incompatibilities.size());
        return counts;
    }
}
