package com.funnelduck.funnel;

import static org.assertj.core.api.Assertions.*;

import com.funnelduck.exception.BadRequestException;
import com.funnelduck.generator.CompiledQuery;
import com.funnelduck.generator.SQLCompiler;
import com.funnelduck.test.TestBase;
import com.funnelduck.test.TestCategories;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("TimeToConvert Tests")
public class TimeToConvertTest extends TestBase {

    private static Map<String, Object> row(long sampleSize, Double avg, Double min, Double max, Object durations) {
        Map<String, Object> row = new HashMap<>();
        row.put("sample_size", sampleSize);
        row.put("avg_seconds", avg);
        row.put("min_seconds", min);
        row.put("max_seconds", max);
        row.put("durations", durations);
        return row;
    }

    @Nested
    @DisplayName("Statistics")
    class StatisticsTests {

        @Test
        @DisplayName("The median averages the two middle values for even counts")
        void testMedian() {
            assertThat(TimeToConvert.median(List.of(10.0, 20.0, 30.0, 40.0, 100.0))).isEqualTo(30.0);
            assertThat(TimeToConvert.median(List.of(1.0, 2.0, 3.0, 4.0))).isEqualTo(2.5);
        }

        @Test
        @DisplayName("Histogram bin count grows with the cube root of the sample")
        void testHistogram() {
            List<TimeToConvertResult.Bin> bins =
                TimeToConvert.histogram(List.of(10.0, 20.0, 30.0, 40.0, 100.0), 10, 100, 5);

            assertThat(bins).containsExactly(
                new TimeToConvertResult.Bin(10, 55, 4),
                new TimeToConvertResult.Bin(55, 100, 1));
        }

        @Test
        @DisplayName("Identical durations produce a single one-second bin")
        void testZeroRange() {
            assertThat(TimeToConvert.histogram(List.of(7.0, 7.0), 7, 7, 2))
                .containsExactly(new TimeToConvertResult.Bin(7, 8, 2));
        }

        @Test
        @DisplayName("Bins are at least one second wide")
        void testMinimumWidth() {
            List<TimeToConvertResult.Bin> bins = TimeToConvert.histogram(
                List.of(0.0, 0.1, 0.2, 0.3, 0.4, 0.5, 0.6, 0.7, 0.8, 0.9), 0, 0.9, 10);

            assertThat(bins).extracting(TimeToConvertResult.Bin::count).containsExactly(10L, 0L, 0L);
        }
    }

    @Nested
    @DisplayName("Row Parsing")
    class ParsingTests {

        @Test
        @DisplayName("A populated row yields average, median and bins")
        void testParse() {
            TimeToConvertResult r = TimeToConvert.parseRows(List.of(
                row(5, 40.0, 10.0, 100.0, List.of(100.0, 10.0, 40.0, 20.0, 30.0))), 0, 2);

            assertThat(r.fromStep()).isZero();
            assertThat(r.toStep()).isEqualTo(2);
            assertThat(r.averageSeconds()).isEqualTo(40L);
            assertThat(r.medianSeconds()).isEqualTo(30L);
            assertThat(r.sampleSize()).isEqualTo(5L);
            assertThat(r.bins()).hasSize(2);
        }

        @Test
        @DisplayName("Durations may arrive as arrays")
        void testArrayDurations() {
            TimeToConvertResult r = TimeToConvert.parseRows(List.of(
                row(2, 15.0, null, null, new Object[] {10.0, 20.0})), 0, 1);

            assertThat(r.medianSeconds()).isEqualTo(15L);
            assertThat(r.bins()).extracting(TimeToConvertResult.Bin::count).containsExactly(1L, 1L);
        }

        @Test
        @DisplayName("No conversions yields an empty result")
        void testEmpty() {
            assertThat(TimeToConvert.parseRows(List.of(), 0, 1)).isEqualTo(TimeToConvertResult.empty(0, 1));
            assertThat(TimeToConvert.parseRows(List.of(row(0, null, null, null, List.of())), 0, 1))
                .isEqualTo(TimeToConvertResult.empty(0, 1));
        }
    }

    @Nested
    @DisplayName("Query")
    class QueryTests {

        @Test
        @DisplayName("Durations come from the per-user step timestamps")
        void testQuery() {
            FunnelRequest request = FunnelRequest.builder("p", "2025-01-01", "2025-01-31")
                .steps("a", "b", "c").build();
            FunnelScope scope = FunnelScope.of(request, 3600, null);

            CompiledQuery q = new SQLCompiler().compile(TimeToConvert.buildQuery(scope, 0, 2));

            assertThat(q.sql())
                .contains("converted AS (\nSELECT\n  (step_2_ms - step_0_ms) / 1000 AS duration_seconds\n"
                    + "FROM funnel_per_user\nWHERE max_step >= {to_step_num:UInt64} AND step_0_ms > 0 AND step_2_ms > 0")
                .contains("duration_seconds >= 0 AND duration_seconds <= {window_seconds:Float64}")
                .contains("groupArrayIf(duration_seconds, ")
                .endsWith("FROM converted");
            assertThat(q.params()).containsEntry("to_step_num", 3L).containsEntry("window_seconds", 3600.0);
        }

        @Test
        @DisplayName("Step pairs must be increasing and inside the funnel")
        void testValidateSteps() {
            assertThatThrownBy(() -> TimeToConvert.validateSteps(3, 2, 1))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("strictly less");
            assertThatThrownBy(() -> TimeToConvert.validateSteps(3, 0, 3))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("out of range");
        }
    }
}
