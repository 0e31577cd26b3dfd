package com.t2aassist.engine.graph;

import com.t2aassist.engine.catalog.CatalogCode;
import com.t2aassist.engine.catalog.CodeCatalog;
import com.t2aassist.engine.graph.TierMergePolicy.MergeResult;
import com.t2aassist.model.enums.AssociationKind;
import com.t2aassist.model.enums.AssociationTier;
import com.t2aassist.model.enums.CodeStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TierMergePolicyTest {

    private CodeCatalog catalog;

    @BeforeEach
    void setUp() {
        catalog = CodeCatalog.of(1L, List.of(
            CatalogCode.of("AAAA001", "A", 10, CodeStatus.ACTIVE, "07"),
            CatalogCode.of("BBBB001", "B", 5, CodeStatus.ACTIVE, "07"),
            CatalogCode.of("CCCC001", "C", 8, CodeStatus.ACTIVE, "19"),
            CatalogCode.of("DDDD001", "D", 2, CodeStatus.ACTIVE, null)
        ));
    }

    private MergeResult merge(List<OfficialRecord> official, List<ObservedRecord> observed,
                              List<IncompatibilityRecord> incompatible) {
        return TierMergePolicy.merge(1L, catalog, official, observed, incompatible);
    }

    @Test
    void testOfficialAndObserved_resolveToVerified() {
        CompatibilityGraph graph = merge(
            List.of(new OfficialRecord("AAAA001", "CCCC001", AssociationKind.COMPLEMENTARY_GESTURE)),
            List.of(new ObservedRecord("CCCC001", "AAAA001", 4)),
            List.of()).graph();

        assertThat(graph.tierOf("AAAA001", "CCCC001")).isEqualTo(AssociationTier.VERIFIED);
        assertThat(graph.association("CCCC001", "AAAA001")).get()
            .satisfies(a -> {
                assertThat(a.supportCount()).isEqualTo(4);
                assertThat(a.officialKind()).isEqualTo(AssociationKind.COMPLEMENTARY_GESTURE);
            });
    }

    @Test
    void testOfficialOnly_resolvesToOfficial() {
        CompatibilityGraph graph = merge(
            List.of(new OfficialRecord("AAAA001", "BBBB001", AssociationKind.COMPLEMENTARY_ANESTHESIA)),
            List.of(), List.of()).graph();

        assertThat(graph.tierOf("BBBB001", "AAAA001")).isEqualTo(AssociationTier.OFFICIAL);
        assertThat(graph.association("AAAA001", "BBBB001").get().supportCount()).isNull();
    }

    @Test
    void testObservedOnly_tierFollowsRegion() {
        CompatibilityGraph graph = merge(List.of(), List.of(
            new ObservedRecord("AAAA001", "BBBB001", 2),
            new ObservedRecord("AAAA001", "CCCC001", 2),
            new ObservedRecord("AAAA001", "DDDD001", 2),
            new ObservedRecord("AAAA001", "ZZZZ999", 2)
        ), List.of()).graph();

        assertThat(graph.tierOf("AAAA001", "BBBB001")).isEqualTo(AssociationTier.SAME_REGION);
        assertThat(graph.tierOf("AAAA001", "CCCC001")).isEqualTo(AssociationTier.CROSS_REGION);
        assertThat(graph.tierOf("AAAA001", "DDDD001")).isEqualTo(AssociationTier.CROSS_REGION);
        // codes missing from the catalog stay in the graph for the assembler to count
        assertThat(graph.tierOf("AAAA001", "ZZZZ999")).isEqualTo(AssociationTier.CROSS_REGION);
    }

    @Test
    void testIncompatibility_overridesEveryOtherRecord() {
        MergeResult result = merge(
            List.of(new OfficialRecord("AAAA001", "BBBB001", AssociationKind.COMPLEMENTARY_GESTURE)),
            List.of(new ObservedRecord("BBBB001", "AAAA001", 9)),
            List.of(new IncompatibilityRecord("BBBB001", "AAAA001")));
        CompatibilityGraph graph = result.graph();

        assertThat(graph.tierOf("AAAA001", "BBBB001")).isEqualTo(AssociationTier.INCOMPATIBLE);
        assertThat(graph.association("AAAA001", "BBBB001")).isEmpty();
        assertThat(graph.neighbors("AAAA001", AssociationTier.CROSS_REGION)).isEmpty();
        assertThat(result.scrubbedPairs()).isEqualTo(1);
    }

    @Test
    void testUnrecordedPair_isUnknown() {
        CompatibilityGraph graph = merge(List.of(), List.of(), List.of()).graph();

        assertThat(graph.tierOf("AAAA001", "BBBB001")).isEqualTo(AssociationTier.UNKNOWN);
    }

    @Test
    void testSelfReferences_areDropped() {
        MergeResult result = merge(
            List.of(new OfficialRecord("AAAA001", "AAAA001", AssociationKind.COMPLEMENTARY_GESTURE)),
            List.of(new ObservedRecord("BBBB001", "bbbb001", 1)),
            List.of());

        assertThat(result.selfReferences()).isEqualTo(2);
        assertThat(result.graph().associations()).isEmpty();
    }

    @Test
    void testObservedDuplicates_sumSupportAcrossDirections() {
        CompatibilityGraph graph = merge(List.of(), List.of(
            new ObservedRecord("AAAA001", "BBBB001", 3),
            new ObservedRecord("BBBB001", "AAAA001", 4)
        ), List.of()).graph();

        assertThat(graph.associations()).hasSize(1);
        assertThat(graph.association("AAAA001", "BBBB001").get().supportCount()).isEqualTo(7);
    }

    @Test
    void testOfficialKind_doesNotDependOnRowOrder() {
        CompatibilityGraph forward = merge(List.of(
            new OfficialRecord("AAAA001", "BBBB001", AssociationKind.COMPLEMENTARY_ANESTHESIA),
            new OfficialRecord("BBBB001", "AAAA001", AssociationKind.COMPLEMENTARY_GESTURE)
        ), List.of(), List.of()).graph();
        CompatibilityGraph backward = merge(List.of(
            new OfficialRecord("BBBB001", "AAAA001", AssociationKind.COMPLEMENTARY_GESTURE),
            new OfficialRecord("AAAA001", "BBBB001", AssociationKind.COMPLEMENTARY_ANESTHESIA)
        ), List.of(), List.of()).graph();

        assertThat(forward.association("AAAA001", "BBBB001").get().officialKind())
            .isEqualTo(backward.association("AAAA001", "BBBB001").get().officialKind())
            .isEqualTo(AssociationKind.COMPLEMENTARY_GESTURE);
    }

    @Test
    void testIdentifiers_areCaseInsensitive() {
        CompatibilityGraph graph = merge(
            List.of(new OfficialRecord("aaaa001", " BBBB001 ", AssociationKind.COMPLEMENTARY_GESTURE)),
            List.of(), List.of(new IncompatibilityRecord("cccc001", "AAAA001"))).graph();

        assertThat(graph.tierOf("AAAA001", "bbbb001")).isEqualTo(AssociationTier.OFFICIAL);
        assertThat(graph.isIncompatible("CCCC001", "aaaa001")).isTrue();
    }
}
