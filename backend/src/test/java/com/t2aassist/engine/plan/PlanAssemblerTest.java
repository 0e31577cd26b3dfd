package com.t2aassist.engine.plan;

import com.t2aassist.engine.EngineMetrics;
import com.t2aassist.engine.SnapshotFixture;
import com.t2aassist.engine.graph.CompatibilityGraph;
import com.t2aassist.engine.snapshot.DataSnapshot;
import com.t2aassist.engine.snapshot.DataVersionMismatchException;
import com.t2aassist.model.enums.AssociationKind;
import com.t2aassist.model.enums.AssociationTier;
import com.t2aassist.model.enums.InclusionReason;
import com.t2aassist.model.enums.UnknownPairPolicy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlanAssemblerTest {

    private EngineMetrics metrics;
    private PlanAssembler assembler;

    @BeforeEach
    void setUp() {
        metrics = new EngineMetrics(new SimpleMeterRegistry());
        assembler = new PlanAssembler(metrics, UnknownPairPolicy.HIDE, 10);
    }

    /**
     * A (10, region 07) verified with B (5, region 07), observed with C (8, region 19);
     * B and C are incompatible.
     */
    private static SnapshotFixture threeCodes() {
        return SnapshotFixture.create()
            .code("AAAA001", 10, "07")
            .code("BBBB001", 5, "07")
            .code("CCCC001", 8, "19")
            .verified("AAAA001", "BBBB001")
            .observed("AAAA001", "CCCC001", 1)
            .incompatible("BBBB001", "CCCC001");
    }

    @Nested
    class GreedyAcceptance {

        @Test
        void testHigherTrustWins_lowerTrustClashIsRejected() {
            BillingPlan plan = assembler.buildPlan(threeCodes().build(), "AAAA001");

            assertThat(plan.principal().codeId()).isEqualTo("AAAA001");
            assertThat(plan.secondaries()).extracting(PlanEntry::codeId).containsExactly("BBBB001");
            assertThat(plan.secondaries().get(0).tier()).isEqualTo(AssociationTier.VERIFIED);
            assertThat(plan.secondaries().get(0).reason()).isEqualTo(InclusionReason.OFFICIAL_GESTURE_CONFIRMED);
            assertThat(plan.totalWorkValue()).isEqualTo(15.0);
            assertThat(plan.rejected()).singleElement()
                .isEqualTo(new RejectedCandidate("CCCC001", AssociationTier.CROSS_REGION, "BBBB001"));
        }

        @Test
        void testSecondaries_orderedByTrustThenWorkValueThenIdentifier() {
            DataSnapshot snapshot = SnapshotFixture.create()
                .code("PPPP001", 50, "07")
                .code("AAAA002", 1, "07")
                .code("BBBB002", 30, "07")
                .code("CCCC002", 30, "07")
                .code("DDDD002", 99, "19")
                .code("EEEE002", 20, "07")
                .official("PPPP001", "AAAA002", AssociationKind.COMPLEMENTARY_ANESTHESIA)
                .observed("PPPP001", "BBBB002", 1)
                .observed("PPPP001", "CCCC002", 5)
                .observed("PPPP001", "DDDD002", 5)
                .official("PPPP001", "EEEE002")
                .build();

            BillingPlan plan = assembler.buildPlan(snapshot, "pppp001");

            assertThat(plan.secondaries()).extracting(PlanEntry::codeId)
                .containsExactly("EEEE002", "AAAA002", "BBBB002", "CCCC002", "DDDD002");
            assertThat(plan.secondaries().get(1).reason()).isEqualTo(InclusionReason.OFFICIAL_ANESTHESIA);
            assertThat(plan.secondaries().get(4).reason()).isEqualTo(InclusionReason.OBSERVED_CROSS_REGION);
            assertThat(plan.totalWorkValue()).isEqualTo(50 + 20 + 1 + 30 + 30 + 99);
        }

        @Test
        void testPrincipalWithoutNeighbours_yieldsPrincipalOnlyPlan() {
            DataSnapshot snapshot = SnapshotFixture.create().code("AAAA001", 42.5, "07").build();

            BillingPlan plan = assembler.buildPlan(snapshot, "AAAA001");

            assertThat(plan.secondaries()).isEmpty();
            assertThat(plan.rejected()).isEmpty();
            assertThat(plan.includedCodes()).containsExactly("AAAA001");
            assertThat(plan.totalWorkValue()).isEqualTo(42.5);
        }

        @Test
        void testSameInput_yieldsSamePlan() {
            DataSnapshot snapshot = threeCodes().build();

            assertThat(assembler.buildPlan(snapshot, "AAAA001")).isEqualTo(assembler.buildPlan(snapshot, "AAAA001"));
        }

        @Test
        void testRandomGraphs_neverContainIncompatiblePairs() {
            Random random = new Random(20240917L);
            for (int round = 0; round < 20; round++) {
                SnapshotFixture fixture = SnapshotFixture.create();
                int size = 25;
                for (int i = 0; i < size; i++) {
                    fixture.code(id(i), 1 + random.nextInt(200), random.nextBoolean() ? "07" : "19");
                }
                for (int i = 0; i < size; i++) {
                    for (int j = i + 1; j < size; j++) {
                        int roll = random.nextInt(10);
                        if (roll == 0) {
                            fixture.incompatible(id(i), id(j));
                        } else if (roll == 1) {
                            fixture.official(id(i), id(j));
                        } else if (roll == 2) {
                            fixture.observed(id(i), id(j), 1 + random.nextInt(5));
                        } else if (roll == 3) {
                            fixture.verified(id(i), id(j));
                        }
                    }
                }
                DataSnapshot snapshot = fixture.build();
                CompatibilityGraph graph = snapshot.graph();

                for (int p = 0; p < size; p++) {
                    BillingPlan plan = assembler.buildPlan(snapshot, id(p));
                    List<String> codes = plan.includedCodes();
                    for (int a = 0; a < codes.size(); a++) {
                        for (int b = a + 1; b < codes.size(); b++) {
                            assertThat(graph.isIncompatible(codes.get(a), codes.get(b)))
                                .as("%s and %s in plan for %s", codes.get(a), codes.get(b), id(p))
                                .isFalse();
                        }
                    }
                    assertThat(plan.secondaries()).isSortedAccordingTo(PlanAssembler.ACCEPTANCE_ORDER);
                    double expected = plan.entries().stream().mapToDouble(PlanEntry::workValue).sum();
                    assertThat(plan.totalWorkValue()).isEqualTo(expected);
                }
            }
        }

        private String id(int i) {
            return String.format("RAND%03d", i);
        }
    }

    @Nested
    class DataQuality {

        @Test
        void testStaleAndRetiredTargets_areSkippedAndCounted() {
            DataSnapshot snapshot = threeCodes()
                .retired("RRRR001", 40, "07")
                .official("AAAA001", "RRRR001")
                .observed("AAAA001", "GONE001", 3)
                .observed("AAAA001", "GONE002", 3)
                .build();

            BillingPlan plan = assembler.buildPlan(snapshot, "AAAA001");

            assertThat(plan.secondaries()).extracting(PlanEntry::codeId).containsExactly("BBBB001");
            assertThat(plan.staleReferences()).isEqualTo(2);
            assertThat(plan.retiredSkipped()).isEqualTo(1);
            assertThat(metrics.staleReferenceCount()).isEqualTo(2);
        }

        @Test
        void testUnknownPrincipal_isRejected() {
            assertThatThrownBy(() -> assembler.buildPlan(threeCodes().build(), "ZZZZ999"))
                .isInstanceOf(InvalidPrincipalException.class)
                .satisfies(e -> {
                    InvalidPrincipalException ex = (InvalidPrincipalException) e;
                    assertThat(ex.getCode()).isEqualTo("ZZZZ999");
                    assertThat(ex.getReason()).isEqualTo(InvalidPrincipalException.Reason.NOT_FOUND);
                });
        }

        @Test
        void testRetiredPrincipal_isRejected() {
            DataSnapshot snapshot = threeCodes().retired("RRRR001", 40, "07").build();

            assertThatThrownBy(() -> assembler.buildPlan(snapshot, "RRRR001"))
                .isInstanceOf(InvalidPrincipalException.class)
                .extracting("reason")
                .isEqualTo(InvalidPrincipalException.Reason.RETIRED);
        }

        @Test
        void testMixedVersions_areRejected() {
            DataSnapshot current = threeCodes().build(1L);
            DataSnapshot newer = threeCodes().build(2L);
            DataSnapshot mixed = new DataSnapshot("mixed", Instant.now(), current.catalog(), newer.graph(), current.index());

            assertThatThrownBy(() -> assembler.buildPlan(mixed, "AAAA001"))
                .isInstanceOf(DataVersionMismatchException.class);
        }
    }

    @Nested
    class UserOverrides {

        @Test
        void testExcludedCode_letsTheNextCandidateIn() {
            BillingPlan plan = assembler.buildPlan(threeCodes().build(),
                new PlanRequest("AAAA001", Set.of("bbbb001"), Set.of()));

            assertThat(plan.secondaries()).extracting(PlanEntry::codeId).containsExactly("CCCC001");
            assertThat(plan.rejected()).isEmpty();
            assertThat(plan.totalWorkValue()).isEqualTo(18.0);
        }

        @Test
        void testForcedUnrecordedCode_isIncludedAsUserForced() {
            DataSnapshot snapshot = threeCodes().code("DDDD001", 3, "19").build();

            BillingPlan plan = assembler.buildPlan(snapshot, new PlanRequest("AAAA001", Set.of(), Set.of("DDDD001")));

            assertThat(plan.secondaries()).extracting(PlanEntry::codeId).containsExactly("BBBB001", "DDDD001");
            PlanEntry forced = plan.secondaries().get(1);
            assertThat(forced.tier()).isEqualTo(AssociationTier.UNKNOWN);
            assertThat(forced.reason()).isEqualTo(InclusionReason.USER_FORCED);
            assertThat(plan.totalWorkValue()).isEqualTo(18.0);
        }

        @Test
        void testForcedCode_stillCheckedAgainstThePlan() {
            DataSnapshot snapshot = threeCodes()
                .code("DDDD001", 3, "19")
                .code("EEEE001", 3, "19")
                .incompatible("DDDD001", "BBBB001")
                .incompatible("EEEE001", "AAAA001")
                .build();

            BillingPlan plan = assembler.buildPlan(snapshot,
                new PlanRequest("AAAA001", Set.of(), Set.of("DDDD001", "EEEE001")));

            assertThat(plan.secondaries()).extracting(PlanEntry::codeId).containsExactly("BBBB001");
            assertThat(plan.rejected())
                .containsExactlyInAnyOrder(
                    new RejectedCandidate("EEEE001", AssociationTier.INCOMPATIBLE, "AAAA001"),
                    new RejectedCandidate("DDDD001", AssociationTier.UNKNOWN, "BBBB001"),
                    new RejectedCandidate("CCCC001", AssociationTier.CROSS_REGION, "BBBB001"));
        }

        @Test
        void testForcedUnknownOrRetiredCode_isRejected() {
            DataSnapshot snapshot = threeCodes().retired("RRRR001", 1, "07").build();

            assertThatThrownBy(() -> assembler.buildPlan(snapshot,
                new PlanRequest("AAAA001", Set.of(), Set.of("NOPE001"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("NOPE001");
            assertThatThrownBy(() -> assembler.buildPlan(snapshot,
                new PlanRequest("AAAA001", Set.of(), Set.of("RRRR001"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("retired");
        }
    }

    @Nested
    class Suggestions {

        private DataSnapshot snapshot() {
            return threeCodes()
                .code("FFFF001", 7, "19")
                .code("GGGG001", 2, "19")
                .official("BBBB001", "FFFF001")
                .observed("BBBB001", "GGGG001", 2)
                .incompatible("GGGG001", "AAAA001")
                .build();
        }

        @Test
        void testHidePolicy_returnsNoSuggestions() {
            assertThat(assembler.buildPlan(snapshot(), "AAAA001").suggestions()).isEmpty();
        }

        @Test
        void testSuggestPolicy_listsCodesLinkedToAcceptedSecondaries() {
            PlanAssembler suggesting = new PlanAssembler(metrics, UnknownPairPolicy.SUGGEST, 10);

            BillingPlan plan = suggesting.buildPlan(snapshot(), "AAAA001");

            assertThat(plan.suggestions()).singleElement().satisfies(s -> {
                assertThat(s.codeId()).isEqualTo("FFFF001");
                assertThat(s.tier()).isEqualTo(AssociationTier.UNKNOWN);
                assertThat(s.reason()).isEqualTo(InclusionReason.LINKED_TO_SECONDARY);
                assertThat(s.included()).isFalse();
            });
            assertThat(plan.totalWorkValue()).isEqualTo(15.0);
            assertThat(plan.includedCodes()).doesNotContain("FFFF001");
        }

        @Test
        void testSuggestPolicy_respectsCap() {
            PlanAssembler capped = new PlanAssembler(metrics, UnknownPairPolicy.SUGGEST, 0);

            assertThat(capped.buildPlan(snapshot(), "AAAA001").suggestions()).isEmpty();
        }

        @Test
        void testNegativeCap_isRejected() {
            assertThatThrownBy(() -> new PlanAssembler(metrics, UnknownPairPolicy.SUGGEST, -1))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
