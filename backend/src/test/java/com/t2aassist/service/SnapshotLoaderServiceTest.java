package com.t2aassist.service;

import com.t2aassist.engine.catalog.CatalogCode;
import com.t2aassist.engine.snapshot.DataSnapshot;
import com.t2aassist.engine.snapshot.SnapshotHolder;
import com.t2aassist.model.enums.AssociationKind;
import com.t2aassist.model.enums.AssociationTier;
import com.t2aassist.model.enums.CodeStatus;
import com.t2aassist.model.reference.CcamCode;
import com.t2aassist.model.reference.Incompatibility;
import com.t2aassist.model.reference.ObservedAssociation;
import com.t2aassist.model.reference.OfficialAssociation;
import com.t2aassist.repository.CcamCodeRepository;
import com.t2aassist.repository.IncompatibilityRepository;
import com.t2aassist.repository.ObservedAssociationRepository;
import com.t2aassist.repository.OfficialAssociationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SnapshotLoaderServiceTest {

    @Mock
    private CcamCodeRepository codeRepository;
    @Mock
    private OfficialAssociationRepository officialRepository;
    @Mock
    private ObservedAssociationRepository observedRepository;
    @Mock
    private IncompatibilityRepository incompatibilityRepository;

    private SnapshotHolder holder;
    private SnapshotLoaderService loader;

    @BeforeEach
    void setUp() {
        holder = new SnapshotHolder();
        loader = new SnapshotLoaderService(codeRepository, officialRepository, observedRepository,
            incompatibilityRepository, holder, "CCAM V80");
    }

    private void stubTables() {
        when(codeRepository.findAll()).thenReturn(sampleCodes());
        stubAssociations();
    }

    private static List<CcamCode> sampleCodes() {
        return List.of(
            CcamCode.builder().code("HHFA016").label("Appendicectomie par coelioscopie")
                .icrPublic(163.0).chapterNum("07").build(),
            CcamCode.builder().code("ZZLP025").label("Anesthesie generale")
                .icrPublic(60.0).chapterNum("19").build(),
            CcamCode.builder().code("HHFA001").label("Appendicectomie ancienne technique")
                .icrPublic(120.0).status(CodeStatus.RETIRED).build()
        );
    }

    private void stubAssociations() {
        when(officialRepository.findAll()).thenReturn(List.of(
            OfficialAssociation.builder().code("HHFA016").associatedCode("ZZLP025")
                .associationType(AssociationKind.COMPLEMENTARY_ANESTHESIA).build()
        ));
        when(observedRepository.findAll()).thenReturn(List.of(
            ObservedAssociation.builder().code("HHFA016").associatedCode("ZZLP025").supportCount(12).build(),
            ObservedAssociation.builder().code("HHFA016").associatedCode("HHFA016").build()
        ));
        when(incompatibilityRepository.findAll()).thenReturn(List.of(
            Incompatibility.builder().code("HHFA001").incompatibleCode("HHFA016").build()
        ));
    }

    @Test
    void testReload_publishesConsistentSnapshot() {
        stubTables();

        DataSnapshot snapshot = loader.reload();

        assertThat(holder.current()).isSameAs(snapshot);
        assertThat(snapshot.isConsistent()).isTrue();
        assertThat(snapshot.label()).isEqualTo("CCAM V80");
        assertThat(snapshot.catalog().size()).isEqualTo(3);
        assertThat(snapshot.catalog().activeCount()).isEqualTo(2);
        assertThat(snapshot.graph().tierOf("HHFA016", "ZZLP025")).isEqualTo(AssociationTier.VERIFIED);
        assertThat(snapshot.graph().isIncompatible("HHFA016", "HHFA001")).isTrue();
        assertThat(snapshot.graph().associations()).hasSize(1);
        assertThat(snapshot.index().size()).isEqualTo(3);
    }

    @Test
    void testEachReload_getsNewVersion() {
        stubTables();

        long first = loader.reload().version();
        long second = loader.reload().version();

        assertThat(second).isGreaterThan(first);
        assertThat(holder.current().version()).isEqualTo(second);
    }

    @Test
    void testOverlappingReloads_leaveNewestSnapshotCurrent() throws Exception {
        CountDownLatch firstInside = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        when(codeRepository.findAll()).thenAnswer(invocation -> {
            if (calls.incrementAndGet() == 1) {
                firstInside.countDown();
                releaseFirst.await(5, TimeUnit.SECONDS);
            }
            return sampleCodes();
        });
        stubAssociations();

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<DataSnapshot> first = pool.submit(loader::reload);
            assertThat(firstInside.await(5, TimeUnit.SECONDS)).isTrue();

            AtomicReference<DataSnapshot> second = new AtomicReference<>();
            Thread secondReload = new Thread(() -> second.set(loader.reload()));
            secondReload.start();
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
            while (secondReload.isAlive() && secondReload.getState() != Thread.State.BLOCKED
                    && System.nanoTime() < deadline) {
                Thread.sleep(5);
            }
            releaseFirst.countDown();

            DataSnapshot firstSnapshot = first.get(5, TimeUnit.SECONDS);
            secondReload.join(5_000);

            assertThat(second.get()).isNotNull();
            assertThat(second.get().version()).isGreaterThan(firstSnapshot.version());
            assertThat(holder.current()).isSameAs(second.get());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testToCatalogCode_fillsGapsFromRelatedColumns() {
        CcamCode entity = CcamCode.builder()
            .code("hhfa020")
            .label("Appendicectomie")
            .paragraphTitle("Exérèse de l'appendice")
            .status(null)
            .dateEnd(LocalDate.of(2020, 12, 31))
            .build();

        CatalogCode code = SnapshotLoaderService.toCatalogCode(entity);

        assertThat(code.id()).isEqualTo("HHFA020");
        assertThat(code.status()).isEqualTo(CodeStatus.RETIRED);
        assertThat(code.description()).isEqualTo("Exérèse de l'appendice");
        assertThat(code.workValue()).isZero();
    }
}
