package com.t2aassist.service;

import com.t2aassist.engine.catalog.CatalogCode;
import com.t2aassist.engine.catalog.CodeCatalog;
import com.t2aassist.engine.graph.IncompatibilityRecord;
import com.t2aassist.engine.graph.ObservedRecord;
import com.t2aassist.engine.graph.OfficialRecord;
import com.t2aassist.engine.graph.TierMergePolicy;
import com.t2aassist.engine.graph.TierMergePolicy.MergeResult;
import com.t2aassist.engine.search.SearchIndex;
import com.t2aassist.engine.snapshot.DataSnapshot;
import com.t2aassist.engine.snapshot.SnapshotHolder;
import com.t2aassist.model.enums.CodeStatus;
import com.t2aassist.model.reference.CcamCode;
import com.t2aassist.repository.CcamCodeRepository;
import com.t2aassist.repository.IncompatibilityRepository;
import com.t2aassist.repository.ObservedAssociationRepository;
import com.t2aassist.repository.OfficialAssociationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Snapshot Loader Service
 *
 * Reads the reference tables written by the ingestion pipeline, merges the three
 * association sources into a compatibility graph, indexes the catalog and publishes
 * the result as one snapshot. Queries in flight keep the snapshot they started with.
 */
@Service
@Slf4j
@Transactional(readOnly = true)
public class SnapshotLoaderService {

    private final CcamCodeRepository codeRepository;
    private final OfficialAssociationRepository officialRepository;
    private final ObservedAssociationRepository observedRepository;
    private final IncompatibilityRepository incompatibilityRepository;
    private final SnapshotHolder snapshotHolder;
    private final String versionLabel;
    private final AtomicLong versions = new AtomicLong();

    public SnapshotLoaderService(
            CcamCodeRepository codeRepository,
            OfficialAssociationRepository officialRepository,
            ObservedAssociationRepository observedRepository,
            IncompatibilityRepository incompatibilityRepository,
            SnapshotHolder snapshotHolder,
            @Value("${t2a.data.version-label:CCAM}") String versionLabel) {
        this.codeRepository = codeRepository;
        this.officialRepository = officialRepository;
        this.observedRepository = observedRepository;
        this.incompatibilityRepository = incompatibilityRepository;
        this.snapshotHolder = snapshotHolder;
        this.versionLabel = versionLabel;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void loadOnStartup() {
        reload();
    }

    /**
     * Build a new snapshot from the database and make it current.
     * Reloads run one at a time, so snapshots are published in version order.
     */
    public synchronized DataSnapshot reload() {
        long version = versions.incrementAndGet();
        log.info("Loading reference data, version {} ({})", version, versionLabel);

        List<CatalogCode> codes = codeRepository.findAll().stream()
            .map(SnapshotLoaderService::toCatalogCode)
            .toList();
        CodeCatalog catalog = CodeCatalog.of(version, codes);

        List<OfficialRecord> official = officialRepository.findAll().stream()
            .map(a -> new OfficialRecord(a.getCode(), a.getAssociatedCode(), a.getAssociationType()))
            .toList();
        List<ObservedRecord> observed = observedRepository.findAll().stream()
            .map(a -> new ObservedRecord(a.getCode(), a.getAssociatedCode(),
                a.getSupportCount() == null ? 1 : a.getSupportCount()))
            .toList();
        List<IncompatibilityRecord> incompatible = incompatibilityRepository.findAll().stream()
            .map(i -> new IncompatibilityRecord(i.getCode(), i.getIncompatibleCode()))
            .toList();

        MergeResult merge = TierMergePolicy.merge(version, catalog, official, observed, incompatible);
        if (merge.scrubbedPairs() > 0) {
            log.info("Scrubbed {} compatibility records overridden by incompatibilities", merge.scrubbedPairs());
        }
        if (merge.selfReferences() > 0) {
            log.warn("Ignored {} self-referencing association records", merge.selfReferences());
        }

        DataSnapshot snapshot = new DataSnapshot(versionLabel, Instant.now(), catalog, merge.graph(),
            SearchIndex.build(catalog));
        DataSnapshot previous = snapshotHolder.publish(snapshot);

        log.info("Published data version {}: {} codes ({} active), {} associations, {} incompatibilities (replaced v{})",
            version, catalog.size(), catalog.activeCount(), merge.graph().associations().size(),
            merge.graph().incompatibilities().size(), previous.version());
        return snapshot;
    }

    static CatalogCode toCatalogCode(CcamCode entity) {
        CodeStatus status = entity.getStatus() != null ? entity.getStatus()
            : entity.getDateEnd() != null ? CodeStatus.RETIRED : CodeStatus.ACTIVE;
        String description = entity.getDescription() != null ? entity.getDescription() : entity.getParagraphTitle();
        double workValue = entity.getIcrPublic() != null ? entity.getIcrPublic() : 0.0;
        return new CatalogCode(
            entity.getCode(),
            entity.getLabel(),
            description,
            workValue,
            status,
            entity.getChapterNum(),
            entity.getChapterTitle(),
            entity.getParagraphTitle(),
            entity.getIcrPrivate(),
            entity.getActivity(),
            entity.getClassant(),
            entity.getCodingInstruction(),
            entity.getDateEnd()
        );
    }
}
