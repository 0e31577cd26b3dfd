package com.t2aassist.service;

import com.t2aassist.engine.catalog.CatalogCode;
import com.t2aassist.engine.catalog.CodeCatalog;
import com.t2aassist.engine.graph.CompatibilityGraph;
import com.t2aassist.engine.snapshot.DataSnapshot;
import com.t2aassist.engine.snapshot.SnapshotHolder;
import com.t2aassist.model.enums.AssociationTier;
import com.t2aassist.model.enums.IssueType;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Compatibility Check Service
 *
 * Checks a set of codes the user picked by hand: unknown or retired codes,
 * incompatible pairs, and pairs with a known association (informational).
 * An OK finding is appended when nothing blocks billing the set together.
 */
@Service
public class CompatibilityCheckService {

    private final SnapshotHolder snapshotHolder;

    public CompatibilityCheckService(SnapshotHolder snapshotHolder) {
        this.snapshotHolder = snapshotHolder;
    }

    /**
     * One finding of a check.
     *
     * @param tier resolved tier for pair findings, null otherwise
     */
    public record CompatibilityIssue(IssueType type, List<String> codes, AssociationTier tier, String message) {

        public boolean isBlocking() {
            return type == IssueType.UNKNOWN_CODE || type == IssueType.RETIRED_CODE
                || type == IssueType.INCOMPATIBLE_PAIR;
        }
    }

    public List<CompatibilityIssue> check(List<String> codes) {
        DataSnapshot snapshot = snapshotHolder.current().requireConsistent();
        CodeCatalog catalog = snapshot.catalog();
        CompatibilityGraph graph = snapshot.graph();

        List<String> ids = codes.stream()
            .map(CodeCatalog::normalizeId)
            .filter(id -> !id.isEmpty())
            .distinct()
            .toList();

        List<CompatibilityIssue> issues = new ArrayList<>();
        List<String> known = new ArrayList<>();
        for (String id : ids) {
            Optional<CatalogCode> code = catalog.find(id);
            if (code.isEmpty()) {
                issues.add(new CompatibilityIssue(IssueType.UNKNOWN_CODE, List.of(id), null,
                    "Code " + id + " not found in the CCAM catalog"));
                continue;
            }
            known.add(id);
            if (!code.get().isActive()) {
                String until = code.get().dateEnd() != null ? " (valid until " + code.get().dateEnd() + ")" : "";
                issues.add(new CompatibilityIssue(IssueType.RETIRED_CODE, List.of(id), null,
                    "Code " + id + " is retired" + until));
            }
        }

        for (int i = 0; i < known.size(); i++) {
            for (int j = i + 1; j < known.size(); j++) {
                String a = known.get(i);
                String b = known.get(j);
                AssociationTier tier = graph.tierOf(a, b);
                if (tier == AssociationTier.INCOMPATIBLE) {
                    issues.add(new CompatibilityIssue(IssueType.INCOMPATIBLE_PAIR, List.of(a, b), tier,
                        a + " and " + b + " cannot be billed together"));
                } else if (tier.isCompatible()) {
                    issues.add(new CompatibilityIssue(IssueType.KNOWN_ASSOCIATION, List.of(a, b), tier,
                        a + " -> " + b + " : known association (" + tier.getValue() + ")"));
                }
            }
        }

        if (issues.stream().noneMatch(CompatibilityIssue::isBlocking)) {
            issues.add(new CompatibilityIssue(IssueType.OK, ids, null,
                "No incompatibility detected between the selected codes"));
        }
        return issues;
    }
}
