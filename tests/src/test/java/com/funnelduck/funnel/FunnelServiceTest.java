package com.funnelduck.funnel;

import static org.assertj.core.api.Assertions.*;

import com.funnelduck.cohort.CohortFilterInput;
import com.funnelduck.exception.BadRequestException;
import com.funnelduck.exception.QueryExecutionException;
import com.funnelduck.generator.CompiledQuery;
import com.funnelduck.runtime.EngineConfig;
import com.funnelduck.runtime.EventStore;
import com.funnelduck.test.TestBase;
import com.funnelduck.test.TestCategories;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link FunnelService} against a stub store.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("FunnelService Tests")
public class FunnelServiceTest extends TestBase {

    private static final String PROJECT = "00000000-0000-0000-0000-000000000001";
    private static final String COHORT_A = "aaaaaaaa-0000-0000-0000-000000000001";
    private static final String COHORT_B = "bbbbbbbb-0000-0000-0000-000000000002";

    private static Map<String, Object> stepRow(int stepNum, long entered, Double avgSeconds) {
        Map<String, Object> row = new HashMap<>();
        row.put("step_num", stepNum);
        row.put("entered", entered);
        row.put("next_step", 0L);
        row.put("avg_time_seconds", avgSeconds);
        return row;
    }

    private static Map<String, Object> breakdownRow(String value, int stepNum, long entered, long total) {
        Map<String, Object> row = stepRow(stepNum, entered, null);
        row.put("breakdown_value", value);
        row.put("total_bd_count", total);
        return row;
    }

    private static FunnelRequest.Builder request() {
        return FunnelRequest.builder(PROJECT, "2026-01-01", "2026-01-31").steps("signup", "purchase");
    }

    @Nested
    @DisplayName("Plain Funnels")
    class PlainTests {

        @Test
        @DisplayName("One query, one result per step")
        void testPlainFunnel() {
            List<CompiledQuery> seen = Collections.synchronizedList(new ArrayList<>());
            EventStore store = query -> {
                seen.add(query);
                return List.of(stepRow(1, 1, null), stepRow(2, 1, 86_400.0));
            };

            try (FunnelService service = new FunnelService(store)) {
                FunnelResult result = service.run(request().build());

                logStep("Then: both steps are counted once, a day apart");
                assertThat(result.breakdown()).isFalse();
                assertThat(result.aggregateSteps()).isNull();
                assertThat(result.steps()).extracting(FunnelStepResult::count).containsExactly(1L, 1L);
                assertThat(result.steps().get(1).conversionRate()).isEqualTo(1.0);
                assertThat(result.steps().get(1).avgTimeToConvertSeconds()).isEqualTo(86_400L);
                assertThat(result.compiledQueries()).containsExactlyElementsOf(seen);
            }
        }

        @Test
        @DisplayName("No rows yields zero steps")
        void testNoRows() {
            try (FunnelService service = new FunnelService(query -> List.of())) {
                FunnelResult result = service.run(request().build());

                assertThat(result.steps()).hasSize(2);
                assertThat(result.steps()).allSatisfy(s -> {
                    assertThat(s.count()).isZero();
                    assertThat(s.conversionRate()).isZero();
                });
            }
        }

        @Test
        @DisplayName("Sampling factor is reported back")
        void testSamplingReported() {
            try (FunnelService service = new FunnelService(query -> List.of())) {
                FunnelResult result = service.run(request().samplingFactor(0.5).build());

                assertThat(result.samplingFactor()).isEqualTo(0.5);
                assertThat(result.compiledQueries().get(0).params()).containsEntry("sample_pct", 50L);
            }
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Windows over the configured ceiling are rejected before querying")
        void testWindowCeiling() {
            List<CompiledQuery> seen = new ArrayList<>();
            try (FunnelService service = new FunnelService(query -> {
                seen.add(query);
                return List.of();
            }, null, new EngineConfig(25, 1, 7))) {
                assertThatThrownBy(() -> service.run(request().windowDays(8).build()))
                    .isInstanceOf(BadRequestException.class)
                    .hasMessageContaining("(7 days)");
            }
            assertThat(seen).isEmpty();
        }

        @Test
        @DisplayName("A raised ceiling setting still rejects windows over 90 days")
        void testWindowCeilingCannotBeRaised() {
            try (FunnelService service = new FunnelService(query -> List.of(), null, new EngineConfig(25, 1, 365))) {
                assertThatThrownBy(() -> service.run(request().windowDays(200).build()))
                    .isInstanceOf(BadRequestException.class)
                    .hasMessageContaining("(90 days)");
            }
        }

        @Test
        @DisplayName("NaN sampling factors are rejected")
        void testNaNSampling() {
            assertThatThrownBy(() -> request().samplingFactor(Double.NaN).build())
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("sampling_factor must be in (0, 1]");
        }

        @Test
        @DisplayName("Unordered funnels reject steps sharing an event")
        void testUnorderedOverlap() {
            FunnelRequest req = FunnelRequest.builder(PROJECT, "2026-01-01", "2026-01-31")
                .steps("a", "b", "a")
                .orderType(FunnelOrderType.UNORDERED)
                .build();

            try (FunnelService service = new FunnelService(query -> List.of())) {
                assertThatThrownBy(() -> service.run(req))
                    .isInstanceOf(BadRequestException.class)
                    .hasMessageContaining("steps 0 and 2 share the event 'a'");
            }
        }

        @Test
        @DisplayName("Exclusions must reference a valid step range")
        void testExclusionRange() {
            FunnelRequest req = request().exclusion(new FunnelExclusion("refund", 1, 1)).build();

            try (FunnelService service = new FunnelService(query -> List.of())) {
                assertThatThrownBy(() -> service.run(req)).isInstanceOf(BadRequestException.class);
            }
        }
    }

    @Nested
    @DisplayName("Property Breakdown")
    class PropertyBreakdownTests {

        @Test
        @DisplayName("Runs the breakdown and aggregate queries and flags truncation")
        void testTruncation() {
            EventStore store = query -> {
                if (query.sql().contains("breakdown_value")) {
                    return List.of(
                        breakdownRow("Chrome", 1, 10, 3),
                        breakdownRow("Chrome", 2, 4, 3),
                        breakdownRow("Firefox", 1, 6, 3),
                        breakdownRow("Firefox", 2, 3, 3));
                }
                return List.of(stepRow(1, 20, null), stepRow(2, 8, 60.0));
            };

            try (FunnelService service = new FunnelService(store)) {
                FunnelResult result = service.run(request().breakdownProperty("browser").breakdownLimit(2).build());

                assertThat(result.breakdown()).isTrue();
                assertThat(result.breakdownProperty()).isEqualTo("browser");
                assertThat(result.breakdownTruncated()).isTrue();
                assertThat(result.compiledQueries()).hasSize(2);
                assertThat(result.steps()).extracting(FunnelStepResult::breakdownValue)
                    .containsExactly("Chrome", "Chrome", "Firefox", "Firefox");
                assertThat(result.aggregateSteps()).extracting(FunnelStepResult::count).containsExactly(20L, 8L);
                assertThat(result.aggregateSteps().get(1).avgTimeToConvertSeconds()).isEqualTo(60L);
            }
        }

        @Test
        @DisplayName("Not truncated when every value fits")
        void testNotTruncated() {
            EventStore store = query -> query.sql().contains("breakdown_value")
                ? List.of(breakdownRow("Chrome", 1, 10, 1))
                : List.of(stepRow(1, 10, null));

            try (FunnelService service = new FunnelService(store)) {
                FunnelResult result = service.run(request().breakdownProperty("browser").build());

                assertThat(result.breakdownTruncated()).isFalse();
                assertThat(result.compiledQueries().get(0).sql()).contains("LIMIT 25");
            }
        }
    }

    @Nested
    @DisplayName("Cohort Breakdown")
    class CohortBreakdownTests {

        @Test
        @DisplayName("Runs one query per cohort on the breakdown pool")
        void testConcurrentGroups() {
            Set<String> threads = ConcurrentHashMap.newKeySet();
            EventStore store = query -> {
                threads.add(Thread.currentThread().getName());
                if (query.params().containsValue(COHORT_A)) {
                    return List.of(stepRow(1, 5, null), stepRow(2, 1, 10.0));
                }
                return List.of(stepRow(1, 9, null), stepRow(2, 3, 20.0));
            };
            FunnelRequest req = request()
                .breakdownCohorts(List.of(
                    CohortFilterInput.materialized(COHORT_A, "Trial"),
                    CohortFilterInput.staticCohort(COHORT_B, "Paying")))
                .build();

            try (FunnelService service = new FunnelService(store, null, new EngineConfig(25, 2, 90))) {
                FunnelResult result = service.run(req);

                logStep("Then: groups are ordered by their first step count");
                assertThat(result.breakdownProperty()).isEqualTo("$cohort");
                assertThat(result.breakdownTruncated()).isFalse();
                assertThat(result.steps()).extracting(FunnelStepResult::breakdownValue)
                    .containsExactly("Paying", "Paying", "Trial", "Trial");
                assertThat(result.aggregateSteps()).extracting(FunnelStepResult::count).containsExactly(14L, 4L);
                assertThat(result.aggregateSteps().get(1).avgTimeToConvertSeconds()).isNull();
                assertThat(result.compiledQueries()).hasSize(2);
            }
            assertThat(threads).allMatch(name -> name.startsWith("funnel-breakdown-"));
        }

        @Test
        @DisplayName("A failing group fails the request with the store's exception")
        void testFailurePropagation() {
            EventStore store = query -> {
                if (query.params().containsValue(COHORT_B)) {
                    throw new QueryExecutionException("Memory limit (total) exceeded", query.sql());
                }
                return List.of(stepRow(1, 1, null));
            };
            FunnelRequest req = request()
                .breakdownCohorts(List.of(
                    CohortFilterInput.materialized(COHORT_A, "Trial"),
                    CohortFilterInput.materialized(COHORT_B, "Paying")))
                .build();

            try (FunnelService service = new FunnelService(store, null, EngineConfig.defaults())) {
                assertThatThrownBy(() -> service.run(req))
                    .isInstanceOf(QueryExecutionException.class)
                    .hasMessageContaining("Memory limit");
            }
        }
    }

    @Nested
    @DisplayName("Time To Convert")
    class TimeToConvertTests {

        @Test
        @DisplayName("Parses the distribution row")
        void testTimeToConvert() {
            Map<String, Object> row = new HashMap<>();
            row.put("avg_seconds", 20.0);
            row.put("sample_size", 3L);
            row.put("min_seconds", 10.0);
            row.put("max_seconds", 30.0);
            row.put("durations", List.of(10.0, 20.0, 30.0));

            try (FunnelService service = new FunnelService(query -> List.of(row))) {
                TimeToConvertResult result = service.timeToConvert(request().build(), 0, 1);

                assertThat(result.sampleSize()).isEqualTo(3);
                assertThat(result.averageSeconds()).isEqualTo(20L);
                assertThat(result.medianSeconds()).isEqualTo(20L);
                assertThat(result.bins()).extracting(TimeToConvertResult.Bin::count).containsExactly(1L, 2L);
            }
        }

        @Test
        @DisplayName("Rejects a step range outside the funnel")
        void testBadRange() {
            try (FunnelService service = new FunnelService(query -> List.of())) {
                assertThatThrownBy(() -> service.timeToConvert(request().build(), 0, 2))
                    .isInstanceOf(BadRequestException.class)
                    .hasMessageContaining("out of range");
            }
        }
    }
}
