package com.t2aassist.engine;

import com.t2aassist.model.enums.SearchStage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.EnumMap;
import java.util.Map;

/**
 * Counters published by the search engine and the plan assembler.
 * The engine only counts; formatting and export belong to the Micrometer registry.
 */
public class EngineMetrics {

    private final Counter searches;
    private final Counter emptyQueries;
    private final Counter unanswered;
    private final Map<SearchStage, Counter> stageAnswers = new EnumMap<>(SearchStage.class);
    private final Map<SearchStage, Counter> stageHits = new EnumMap<>(SearchStage.class);
    private final Counter plansBuilt;
    private final Counter invalidPrincipals;
    private final Counter staleReferences;
    private final Counter retiredCandidates;
    private final Counter versionMismatches;

    public EngineMetrics(MeterRegistry registry) {
        this.searches = registry.counter("t2a.search.requests");
        this.emptyQueries = registry.counter("t2a.search.empty_queries");
        this.unanswered = registry.counter("t2a.search.no_match");
        for (SearchStage stage : SearchStage.values()) {
            stageAnswers.put(stage, registry.counter("t2a.search.stage.answers", "stage", stage.getValue()));
            stageHits.put(stage, registry.counter("t2a.search.stage.hits", "stage", stage.getValue()));
        }
        this.plansBuilt = registry.counter("t2a.plan.built");
        this.invalidPrincipals = registry.counter("t2a.plan.invalid_principal");
        this.staleReferences = registry.counter("t2a.plan.stale_references");
        this.retiredCandidates = registry.counter("t2a.plan.retired_candidates");
        this.versionMismatches = registry.counter("t2a.data.version_mismatch");
    }

    public void searchRequested() {
        searches.increment();
    }

    public void emptyQuery() {
        emptyQueries.increment();
    }

    public void noMatch() {
        unanswered.increment();
    }

    public void stageAnswered(SearchStage stage, int hits) {
        stageAnswers.get(stage).increment();
        stageHits.get(stage).increment(hits);
    }

    public void planBuilt(int staleSkipped, int retiredSkipped) {
        plansBuilt.increment();
        if (staleSkipped > 0) {
            staleReferences.increment(staleSkipped);
        }
        if (retiredSkipped > 0) {
            retiredCandidates.increment(retiredSkipped);
        }
    }

    public void invalidPrincipal() {
        invalidPrincipals.increment();
    }

    public void versionMismatch() {
        versionMismatches.increment();
    }

    public long staleReferenceCount() {
        return (long) staleReferences.count();
    }

    public long stageHitCount(SearchStage stage) {
        return (long) stageHits.get(stage).count();
    }

    public long stageAnswerCount(SearchStage stage) {
        return (long) stageAnswers.get(stage).count();
    }
}
