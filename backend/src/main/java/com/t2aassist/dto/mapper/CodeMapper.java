package com.t2aassist.dto.mapper;

import com.t2aassist.dto.response.*;
import com.t2aassist.dto.response.AssociationsResponseDto.AssociationDto;
import com.t2aassist.dto.response.BillingPlanDto.EntryDto;
import com.t2aassist.dto.response.BillingPlanDto.RejectedDto;
import com.t2aassist.dto.response.CompatibilityCheckDto.IssueDto;
import com.t2aassist.dto.response.SearchResponseDto.HitDto;
import com.t2aassist.engine.catalog.CatalogCode;
import com.t2aassist.engine.plan.BillingPlan;
import com.t2aassist.engine.plan.PlanEntry;
import com.t2aassist.engine.plan.RejectedCandidate;
import com.t2aassist.engine.search.SearchResult;
import com.t2aassist.model.enums.AssociationTier;
import com.t2aassist.service.CodeSearchService.DataStats;
import com.t2aassist.service.CodeSearchService.EnrichedSearch;
import com.t2aassist.service.CodeSearchService.LinkedCode;
import com.t2aassist.service.CompatibilityCheckService.CompatibilityIssue;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mapper from engine results to response DTOs.
 */
@Component
public class CodeMapper {

    // ========================================================================
    // Codes
    // ========================================================================

    public CodeDto toDto(CatalogCode code, int associationCount) {
        if (code == null) {
            return null;
        }
        return new CodeDto(
            code.id(),
            code.label(),
            code.description(),
            code.workValue(),
            code.privateWorkValue(),
            code.status().getValue(),
            code.region(),
            code.regionTitle(),
            code.paragraphTitle(),
            code.activity(),
            code.classant(),
            code.codingInstruction(),
            code.dateEnd(),
            associationCount
        );
    }

    // ========================================================================
    // Search
    // ========================================================================

    public SearchResponseDto toSearchResponse(EnrichedSearch search) {
        SearchResult result = search.result();
        List<HitDto> hits = result.hits().stream()
            .map(hit -> new HitDto(
                hit.code().id(),
                hit.code().label(),
                hit.code().workValue(),
                hit.code().status().getValue(),
                hit.code().regionTitle(),
                hit.code().paragraphTitle(),
                hit.score(),
                search.associationCounts().getOrDefault(hit.code().id(), 0)))
            .toList();

        return new SearchResponseDto(
            result.query(),
            result.normalizedQuery(),
            result.stage() != null ? result.stage().getValue() : null,
            result.reason().getValue(),
            hits.size(),
            result.dataVersion(),
            hits
        );
    }

    public AssociationsResponseDto toAssociationsResponse(String code, List<LinkedCode> linked) {
        List<AssociationDto> associations = linked.stream()
            .map(l -> new AssociationDto(
                l.codeId(),
                l.code() != null ? l.code().label() : null,
                l.code() != null ? l.code().workValue() : null,
                l.tier().getValue(),
                l.supportCount(),
                l.officialKind() != null ? l.officialKind().getValue() : null))
            .toList();
        return new AssociationsResponseDto(code, associations.size(), associations);
    }

    // ========================================================================
    // Billing plan
    // ========================================================================

    public BillingPlanDto toDto(BillingPlan plan) {
        return new BillingPlanDto(
            plan.dataVersion(),
            toEntryDto(plan.principal()),
            plan.secondaries().stream().map(this::toEntryDto).toList(),
            plan.suggestions().stream().map(this::toEntryDto).toList(),
            plan.rejected().stream().map(this::toRejectedDto).toList(),
            plan.totalWorkValue(),
            plan.staleReferences(),
            plan.retiredSkipped()
        );
    }

    private EntryDto toEntryDto(PlanEntry entry) {
        return new EntryDto(
            entry.codeId(),
            entry.code().label(),
            entry.workValue(),
            entry.tier() != null ? entry.tier().getValue() : null,
            entry.reason() != null ? entry.reason().getValue() : null,
            entry.supportCount(),
            entry.included()
        );
    }

    private RejectedDto toRejectedDto(RejectedCandidate rejected) {
        return new RejectedDto(rejected.codeId(), rejected.tier().getValue(), rejected.conflictsWith());
    }

    // ========================================================================
    // Compatibility check and stats
    // ========================================================================

    public CompatibilityCheckDto toCheckDto(List<String> codes, List<CompatibilityIssue> issues) {
        List<IssueDto> dtos = issues.stream()
            .map(i -> new IssueDto(
                i.type().getValue(),
                i.codes(),
                i.tier() != null ? i.tier().getValue() : null,
                i.message()))
            .toList();
        return new CompatibilityCheckDto(codes, dtos);
    }

    public DataStatsDto toDto(DataStats stats) {
        Map<String, Long> byTier = new LinkedHashMap<>();
        for (AssociationTier tier : AssociationTier.values()) {
            Long count = stats.pairsByTier().get(tier);
            if (count != null) {
                byTier.put(tier.getValue(), count);
            }
        }
        Map<String, Long> byStage = new LinkedHashMap<>();
        stats.hitsByStage().forEach((stage, count) -> byStage.put(stage.getValue(), count));

        return new DataStatsDto(
            stats.versionLabel(),
            stats.dataVersion(),
            stats.loadedAt(),
            stats.activeCodes(),
            stats.retiredCodes(),
            byTier,
            stats.staleReferencesSkipped(),
            byStage
        );
    }
}
