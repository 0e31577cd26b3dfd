package com.t2aassist.engine.graph;

import com.t2aassist.engine.catalog.CatalogCode;
import com.t2aassist.engine.catalog.CodeCatalog;
import com.t2aassist.model.enums.AssociationKind;
import com.t2aassist.model.enums.AssociationTier;

import java.util.*;

/**
 * Tier-merge policy for the three association sources.
 *
 * Precedence, per unordered pair:
 * 1. incompatibility record: INCOMPATIBLE, any competing record is scrubbed
 * 2. official + observed: VERIFIED
 * 3. official only: OFFICIAL
 * 4. observed only: SAME_REGION when both codes share a chapter, else CROSS_REGION
 *
 * Self-references are dropped. Observed duplicates of one pair add up their support.
 * Codes missing from the catalog are kept (the plan assembler skips and counts them)
 * and compare as having no region.
 */
public final class TierMergePolicy {

    private TierMergePolicy() {
    }

    /**
     * Outcome of a merge with the counters the loader reports.
     */
    public record MergeResult(CompatibilityGraph graph, int scrubbedPairs, int selfReferences) {
    }

    public static MergeResult merge(long version,
                                    CodeCatalog catalog,
                                    Collection<OfficialRecord> official,
                                    Collection<ObservedRecord> observed,
                                    Collection<IncompatibilityRecord> incompatible) {
        int[] selfReferences = {0};

        Set<CodePair> incompatiblePairs = new LinkedHashSet<>();
        for (IncompatibilityRecord record : incompatible) {
            pairOf(record.code(), record.incompatibleCode(), selfReferences).ifPresent(incompatiblePairs::add);
        }

        Map<CodePair, AssociationKind> officialKinds = new HashMap<>();
        for (OfficialRecord record : official) {
            pairOf(record.code(), record.associatedCode(), selfReferences).ifPresent(pair ->
                officialKinds.merge(pair, kindOrGesture(record.kind()), TierMergePolicy::preferredKind));
        }

        Map<CodePair, Integer> support = new HashMap<>();
        for (ObservedRecord record : observed) {
            pairOf(record.code(), record.associatedCode(), selfReferences).ifPresent(pair ->
                support.merge(pair, Math.max(record.supportCount(), 1), Integer::sum));
        }

        Set<CodePair> allPairs = new TreeSet<>(Comparator.comparing(CodePair::first).thenComparing(CodePair::second));
        allPairs.addAll(officialKinds.keySet());
        allPairs.addAll(support.keySet());

        Map<CodePair, Association> associations = new LinkedHashMap<>();
        int scrubbed = 0;
        for (CodePair pair : allPairs) {
            if (incompatiblePairs.contains(pair)) {
                scrubbed++;
                continue;
            }
            AssociationKind kind = officialKinds.get(pair);
            Integer count = support.get(pair);
            AssociationTier tier;
            if (kind != null && count != null) {
                tier = AssociationTier.VERIFIED;
            } else if (kind != null) {
                tier = AssociationTier.OFFICIAL;
            } else {
                tier = sameRegion(catalog, pair) ? AssociationTier.SAME_REGION : AssociationTier.CROSS_REGION;
            }
            associations.put(pair, new Association(pair, tier, count, kind));
        }

        CompatibilityGraph graph = new CompatibilityGraph(version, associations, incompatiblePairs);
        return new MergeResult(graph, scrubbed, selfReferences[0]);
    }

    private static Optional<CodePair> pairOf(String a, String b, int[] selfReferences) {
        String x = CodeCatalog.normalizeId(a);
        String y = CodeCatalog.normalizeId(b);
        if (x.isEmpty() || y.isEmpty()) {
            return Optional.empty();
        }
        if (x.equals(y)) {
            selfReferences[0]++;
            return Optional.empty();
        }
        return Optional.of(CodePair.of(x, y));
    }

    private static boolean sameRegion(CodeCatalog catalog, CodePair pair) {
        Optional<CatalogCode> first = catalog.find(pair.first());
        Optional<CatalogCode> second = catalog.find(pair.second());
        return first.isPresent() && second.isPresent() && first.get().sharesRegionWith(second.get());
    }

    private static AssociationKind kindOrGesture(AssociationKind kind) {
        return kind == null ? AssociationKind.COMPLEMENTARY_GESTURE : kind;
    }

    // Both directions may be listed with different kinds; keep the result independent of row order.
    private static AssociationKind preferredKind(AssociationKind a, AssociationKind b) {
        return a.ordinal() <= b.ordinal() ? a : b;
    }
}
