package com.funnelduck.funnel;

import static com.funnelduck.funnel.FunnelReferenceModel.event;
import static org.assertj.core.api.Assertions.*;

import com.funnelduck.test.TestBase;
import com.funnelduck.test.TestCategories;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Edge cases of funnel evaluation, checked against the in-memory model.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Funnel Semantics Tests")
public class FunnelReferenceModelTest extends TestBase {

    private static final long HOUR_MS = 3_600_000L;

    @Nested
    @DisplayName("Ordered And Strict")
    class OrderTests {

        @Test
        @DisplayName("An unrelated event between steps only breaks strict funnels")
        void testOutsideEvent() {
            List<String> steps = List.of("signup", "purchase");
            List<FunnelReferenceModel.Event> events = List.of(
                event("signup", 0), event("browse", 10), event("purchase", 20));

            logStep("Given: signup, browse, purchase within one hour");
            assertThat(FunnelReferenceModel.orderedMaxStep(events, steps, HOUR_MS, false)).isEqualTo(2);

            logStep("Then: strict mode drops the person for the outside event");
            assertThat(FunnelReferenceModel.strictEligible(events, Set.copyOf(steps))).isFalse();
        }

        @Test
        @DisplayName("A funnel event out of order stops a strict chain")
        void testOutOfOrder() {
            List<String> steps = List.of("a", "b", "c");
            List<FunnelReferenceModel.Event> events = List.of(event("a", 0), event("c", 10), event("b", 20));

            assertThat(FunnelReferenceModel.orderedMaxStep(events, steps, HOUR_MS, false)).isEqualTo(2);
            assertThat(FunnelReferenceModel.orderedMaxStep(events, steps, HOUR_MS, true)).isEqualTo(1);
            assertThat(FunnelReferenceModel.strictEligible(events, Set.copyOf(steps))).isTrue();
        }

        @Test
        @DisplayName("Steps past the window do not count")
        void testWindow() {
            List<String> steps = List.of("a", "b");
            List<FunnelReferenceModel.Event> events = List.of(event("a", 0), event("b", HOUR_MS + 1));

            assertThat(FunnelReferenceModel.orderedMaxStep(events, steps, HOUR_MS, false)).isEqualTo(1);
        }

        @Test
        @DisplayName("A later start can reach further than an earlier one")
        void testLaterStart() {
            List<String> steps = List.of("a", "b");
            List<FunnelReferenceModel.Event> events = List.of(
                event("a", 0), event("a", 2 * HOUR_MS), event("b", 2 * HOUR_MS + 5));

            assertThat(FunnelReferenceModel.orderedMaxStep(events, steps, HOUR_MS, false)).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Unordered")
    class UnorderedTests {

        @Test
        @DisplayName("Best coverage counts steps inside one window from any anchor")
        void testPartialCoverage() {
            List<List<Long>> times = List.of(List.of(0L), List.of(50L), List.of(9_999_999L));

            assertThat(FunnelReferenceModel.unorderedMaxStep(times, 100_000)).isEqualTo(2);
            assertThat(FunnelReferenceModel.unorderedAnchor(times, 100_000)).isZero();
        }

        @Test
        @DisplayName("People without a step-0 event reach no step")
        void testNoFirstStep() {
            List<List<Long>> times = List.of(List.of(), List.of(50L), List.of(60L));

            assertThat(FunnelReferenceModel.unorderedMaxStep(times, 1_000)).isZero();
        }

        @Test
        @DisplayName("Steps may happen in any order")
        void testReverseOrder() {
            List<List<Long>> times = List.of(List.of(100L), List.of(50L), List.of(10L));

            assertThat(FunnelReferenceModel.unorderedMaxStep(times, 1_000)).isEqualTo(3);
            assertThat(FunnelReferenceModel.unorderedAnchor(times, 1_000)).isEqualTo(10L);
        }

        @Test
        @DisplayName("The latest full anchor wins, searching later steps first")
        void testAnchorPrecedence() {
            List<List<Long>> times = List.of(List.of(100L, 5_000L), List.of(200L, 5_100L));

            assertThat(FunnelReferenceModel.unorderedAnchor(times, 1_000)).isEqualTo(5_000L);
        }
    }

    @Nested
    @DisplayName("Exclusions")
    class ExclusionTests {

        @Test
        @DisplayName("A clean pair rescues a user with a tainted pair")
        void testCleanPairRescue() {
            logStep("Given: pairs (0, 600) with an excluded event at 500 and a clean pair (1000, 2000)");
            assertThat(FunnelReferenceModel.excluded(
                List.of(0L, 1_000L), List.of(600L, 2_000L), List.of(500L), 10_000, null)).isFalse();

            logStep("Then: without the clean pair the user is excluded");
            assertThat(FunnelReferenceModel.excluded(
                List.of(0L), List.of(600L), List.of(500L), 10_000, null)).isTrue();
        }

        @Test
        @DisplayName("Pairs longer than the window are ignored")
        void testPairOutsideWindow() {
            assertThat(FunnelReferenceModel.excluded(
                List.of(0L), List.of(600L), List.of(500L), 500, null)).isFalse();
        }

        @Test
        @DisplayName("Events at the pair boundaries do not taint it")
        void testBoundaries() {
            assertThat(FunnelReferenceModel.excluded(
                List.of(0L), List.of(600L), List.of(0L, 600L), 10_000, null)).isFalse();
        }

        @Test
        @DisplayName("Unordered exclusions ignore from-steps outside the anchor window")
        void testAnchorGuard() {
            assertThat(FunnelReferenceModel.excluded(
                List.of(0L), List.of(600L), List.of(500L), 1_000, 5_000L)).isFalse();
            assertThat(FunnelReferenceModel.excluded(
                List.of(5_100L), List.of(5_600L), List.of(5_500L), 1_000, 5_000L)).isTrue();
        }
    }
}
