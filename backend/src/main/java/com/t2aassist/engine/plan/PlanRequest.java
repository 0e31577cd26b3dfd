package com.t2aassist.engine.plan;

import com.t2aassist.engine.catalog.CodeCatalog;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * A billing-plan request.
 *
 * @param excluded codes the user removed; never considered
 * @param forced   codes the user wants even though their pair with the principal is unrecorded
 */
public record PlanRequest(String principal, Set<String> excluded, Set<String> forced) {

    public PlanRequest {
        principal = CodeCatalog.normalizeId(principal);
        excluded = normalize(excluded);
        forced = normalize(forced);
    }

    public static PlanRequest of(String principal) {
        return new PlanRequest(principal, Set.of(), Set.of());
    }

    private static Set<String> normalize(Set<String> ids) {
        if (ids == null) {
            return Set.of();
        }
        return ids.stream()
            .map(CodeCatalog::normalizeId)
            .filter(id -> !id.isEmpty())
            .collect(Collectors.toUnmodifiableSet());
    }
}
