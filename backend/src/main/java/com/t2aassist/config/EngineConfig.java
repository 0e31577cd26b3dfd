package com.t2aassist.config;

import com.t2aassist.engine.EngineMetrics;
import com.t2aassist.engine.plan.PlanAssembler;
import com.t2aassist.engine.search.SearchEngine;
import com.t2aassist.engine.snapshot.SnapshotHolder;
import com.t2aassist.model.enums.UnknownPairPolicy;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the search and planning engine.
 * The engine classes are plain Java; only this configuration knows about Spring.
 */
@Configuration
public class EngineConfig {

    @Value("${t2a.plan.unknown-pairs:HIDE}")
    private UnknownPairPolicy unknownPairPolicy;

    @Value("${t2a.plan.max-suggestions:10}")
    private int maxSuggestions;

    @Bean
    public EngineMetrics engineMetrics(MeterRegistry meterRegistry) {
        return new EngineMetrics(meterRegistry);
    }

    @Bean
    public SnapshotHolder snapshotHolder() {
        return new SnapshotHolder();
    }

    @Bean
    public SearchEngine searchEngine(EngineMetrics engineMetrics) {
        return new SearchEngine(SearchEngine.defaultStrategies(), engineMetrics);
    }

    @Bean
    public PlanAssembler planAssembler(EngineMetrics engineMetrics) {
        return new PlanAssembler(engineMetrics, unknownPairPolicy, maxSuggestions);
    }
}
