package com.t2aassist.engine.plan;

import com.t2aassist.engine.EngineMetrics;
import com.t2aassist.engine.catalog.CatalogCode;
import com.t2aassist.engine.catalog.CodeCatalog;
import com.t2aassist.engine.graph.CompatibilityGraph;
import com.t2aassist.engine.graph.Neighbor;
import com.t2aassist.engine.snapshot.DataSnapshot;
import com.t2aassist.model.enums.AssociationTier;
import com.t2aassist.model.enums.InclusionReason;
import com.t2aassist.model.enums.UnknownPairPolicy;

import java.util.*;

/**
 * Builds billing plans around a principal code.
 *
 * Candidates are the principal's neighbours at any compatibility tier plus the
 * user-forced codes. They are sorted by tier trust, work value (descending) and
 * identifier, then accepted greedily: each acceptance re-checks the candidate
 * against the principal and every code already accepted, so no two plan entries
 * ever form an incompatible pair.
 */
public class PlanAssembler {

    static final Comparator<PlanEntry> ACCEPTANCE_ORDER = Comparator
        .comparingInt((PlanEntry e) -> e.tier().getTrust()).reversed()
        .thenComparing(Comparator.comparingDouble(PlanEntry::workValue).reversed())
        .thenComparing(PlanEntry::codeId);

    private final EngineMetrics metrics;
    private final UnknownPairPolicy unknownPairPolicy;
    private final int maxSuggestions;

    public PlanAssembler(EngineMetrics metrics, UnknownPairPolicy unknownPairPolicy, int maxSuggestions) {
        if (maxSuggestions < 0) {
            throw new IllegalArgumentException("maxSuggestions must not be negative");
        }
        this.metrics = metrics;
        this.unknownPairPolicy = unknownPairPolicy;
        this.maxSuggestions = maxSuggestions;
    }

    public BillingPlan buildPlan(DataSnapshot snapshot, String principal) {
        return buildPlan(snapshot, PlanRequest.of(principal));
    }

    /**
     * @throws InvalidPrincipalException if the principal is unknown or retired
     * @throws com.t2aassist.engine.snapshot.DataVersionMismatchException if the snapshot is inconsistent
     * @throws IllegalArgumentException if a forced code is unknown or retired
     */
    public BillingPlan buildPlan(DataSnapshot snapshot, PlanRequest request) {
        if (!snapshot.isConsistent()) {
            metrics.versionMismatch();
            snapshot.requireConsistent();
        }
        CodeCatalog catalog = snapshot.catalog();
        CompatibilityGraph graph = snapshot.graph();

        CatalogCode principal = catalog.find(request.principal()).orElse(null);
        if (principal == null) {
            metrics.invalidPrincipal();
            throw new InvalidPrincipalException(request.principal(), InvalidPrincipalException.Reason.NOT_FOUND);
        }
        if (!principal.isActive()) {
            metrics.invalidPrincipal();
            throw new InvalidPrincipalException(principal.id(), InvalidPrincipalException.Reason.RETIRED);
        }

        Set<String> stale = new TreeSet<>();
        Set<String> retired = new TreeSet<>();
        Map<String, PlanEntry> candidates = new LinkedHashMap<>();

        for (Neighbor neighbor : graph.neighbors(principal.id(), AssociationTier.CROSS_REGION)) {
            if (request.excluded().contains(neighbor.codeId())) {
                continue;
            }
            CatalogCode code = resolve(catalog, neighbor.codeId(), stale, retired);
            if (code != null) {
                candidates.put(code.id(), new PlanEntry(code, neighbor.tier(),
                    InclusionReason.of(neighbor.tier(), neighbor.officialKind()),
                    neighbor.supportCount(), false, true));
            }
        }

        List<RejectedCandidate> rejected = new ArrayList<>();
        for (String forcedId : new TreeSet<>(request.forced())) {
            if (forcedId.equals(principal.id()) || request.excluded().contains(forcedId)
                    || candidates.containsKey(forcedId)) {
                continue;
            }
            CatalogCode code = catalog.find(forcedId)
                .orElseThrow(() -> new IllegalArgumentException("Forced code " + forcedId + " is not in the catalog"));
            if (!code.isActive()) {
                throw new IllegalArgumentException("Forced code " + forcedId + " is retired");
            }
            AssociationTier tier = graph.tierOf(principal.id(), forcedId);
            if (tier == AssociationTier.INCOMPATIBLE) {
                rejected.add(new RejectedCandidate(forcedId, tier, principal.id()));
                continue;
            }
            candidates.put(forcedId, new PlanEntry(code, tier, InclusionReason.of(tier, null), null, false, true));
        }

        List<PlanEntry> ordered = new ArrayList<>(candidates.values());
        ordered.sort(ACCEPTANCE_ORDER);

        List<PlanEntry> accepted = new ArrayList<>();
        List<String> planCodes = new ArrayList<>();
        planCodes.add(principal.id());

        for (PlanEntry candidate : ordered) {
            Optional<String> clash = firstIncompatible(graph, candidate.codeId(), planCodes);
            if (clash.isPresent()) {
                rejected.add(new RejectedCandidate(candidate.codeId(), candidate.tier(), clash.get()));
                continue;
            }
            accepted.add(candidate);
            planCodes.add(candidate.codeId());
        }

        List<PlanEntry> suggestions = unknownPairPolicy == UnknownPairPolicy.SUGGEST
            ? suggest(catalog, graph, principal, accepted, planCodes, request, candidates.keySet(), stale, retired)
            : List.of();

        metrics.planBuilt(stale.size(), retired.size());

        PlanEntry principalEntry = PlanEntry.principal(principal);
        return new BillingPlan(snapshot.version(), principalEntry, accepted, rejected,
            suggestions, stale.size(), retired.size(), BillingPlan.totalOf(principalEntry, accepted));
    }

    /**
     * Codes linked to an accepted secondary but unrecorded with the principal,
     * compatible with everything in the plan.
     */
    private List<PlanEntry> suggest(CodeCatalog catalog, CompatibilityGraph graph, CatalogCode principal,
                                    List<PlanEntry> accepted, List<String> planCodes, PlanRequest request,
                                    Set<String> alreadyConsidered, Set<String> stale, Set<String> retired) {
        if (maxSuggestions == 0) {
            return List.of();
        }
        Map<String, PlanEntry> found = new TreeMap<>();
        for (PlanEntry secondary : accepted) {
            for (Neighbor neighbor : graph.neighbors(secondary.codeId(), AssociationTier.CROSS_REGION)) {
                String id = neighbor.codeId();
                if (id.equals(principal.id()) || alreadyConsidered.contains(id) || found.containsKey(id)
                        || request.excluded().contains(id)
                        || graph.tierOf(principal.id(), id) != AssociationTier.UNKNOWN) {
                    continue;
                }
                CatalogCode code = resolve(catalog, id, stale, retired);
                if (code == null || firstIncompatible(graph, id, planCodes).isPresent()) {
                    continue;
                }
                found.put(id, new PlanEntry(code, AssociationTier.UNKNOWN, InclusionReason.LINKED_TO_SECONDARY,
                    neighbor.supportCount(), false, false));
            }
        }
        return found.values().stream().sorted(ACCEPTANCE_ORDER).limit(maxSuggestions).toList();
    }

    private static CatalogCode resolve(CodeCatalog catalog, String id, Set<String> stale, Set<String> retired) {
        Optional<CatalogCode> code = catalog.find(id);
        if (code.isEmpty()) {
            stale.add(id);
            return null;
        }
        if (!code.get().isActive()) {
            retired.add(id);
            return null;
        }
        return code.get();
    }

    private static Optional<String> firstIncompatible(CompatibilityGraph graph, String candidate, List<String> planCodes) {
        Set<String> clashes = graph.incompatibleWith(candidate);
        if (clashes.isEmpty()) {
            return Optional.empty();
        }
        return planCodes.stream().filter(clashes::contains).findFirst();
    }
}
