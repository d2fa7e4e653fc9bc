package com.funnelduck.funnel;

import static org.assertj.core.api.Assertions.*;

import com.funnelduck.runtime.EventStore;
import com.funnelduck.runtime.JdbcEventStore;
import com.funnelduck.test.TestBase;
import com.funnelduck.test.TestCategories;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.testcontainers.clickhouse.ClickHouseContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/**
 * Runs compiled funnel queries on a ClickHouse server and checks step counts
 * and conversion times for hand-made event histories.
 *
 * <p>Every test writes its events under a fresh project id, so tests share
 * one server and one {@code events} table.
 */
@TestCategories.Tier2
@TestCategories.Integration
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Funnels on ClickHouse")
public class FunnelClickHouseTest extends TestBase {

    private static final String DAY = "2026-01-10 ";

    @Container
    private static final ClickHouseContainer CLICKHOUSE =
        new ClickHouseContainer(DockerImageName.parse("clickhouse/clickhouse-server:24.3"));

    @BeforeAll
    static void createSchema() throws SQLException {
        execute("CREATE TABLE events (project_id UUID, person_id UUID, distinct_id String, "
            + "event_name String, timestamp DateTime64(3), properties String DEFAULT '{}') "
            + "ENGINE = MergeTree ORDER BY (project_id, timestamp)");
        execute("CREATE TABLE person_overrides (project_id UUID, distinct_id String, person_id UUID) "
            + "ENGINE = MergeTree ORDER BY (project_id, distinct_id)");
        execute("CREATE DICTIONARY person_overrides_dict (project_id UUID, distinct_id String, person_id UUID) "
            + "PRIMARY KEY project_id, distinct_id "
            + "SOURCE(CLICKHOUSE(TABLE 'person_overrides' USER '" + CLICKHOUSE.getUsername()
            + "' PASSWORD '" + CLICKHOUSE.getPassword() + "')) "
            + "LAYOUT(COMPLEX_KEY_HASHED()) LIFETIME(0)");
    }

    private static Connection connect() throws SQLException {
        return DriverManager.getConnection(CLICKHOUSE.getJdbcUrl(), CLICKHOUSE.getUsername(), CLICKHOUSE.getPassword());
    }

    private static void execute(String sql) throws SQLException {
        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }

    private static EventStore store() {
        return new JdbcEventStore(FunnelClickHouseTest::connect);
    }

    /**
     * One project's event history; {@code at} is a time of day on 2026-01-10.
     */
    private static final class History {
        final String projectId = UUID.randomUUID().toString();

        String person() {
            return UUID.randomUUID().toString();
        }

        History event(String person, String eventName, String at) throws SQLException {
            execute("INSERT INTO events (project_id, person_id, distinct_id, event_name, timestamp) VALUES ('"
                + projectId + "', '" + person + "', '" + person + "', '" + eventName + "', '" + DAY + at + "')");
            return this;
        }

        FunnelRequest.Builder request(String... steps) {
            return FunnelRequest.builder(projectId, "2026-01-01", "2026-01-31").steps(steps);
        }
    }

    private static FunnelResult run(FunnelRequest request) {
        try (FunnelService service = new FunnelService(store())) {
            return service.run(request);
        }
    }

    @Nested
    @DisplayName("Ordered")
    class OrderedTests {

        @Test
        @DisplayName("Counts people per step and averages the time between steps")
        void testPlainFunnel() throws SQLException {
            History h = new History();
            String converted = h.person();
            String dropped = h.person();
            String slow = h.person();
            h.event(converted, "signup", "10:00:00.000").event(converted, "purchase", "10:01:00.000");
            h.event(slow, "signup", "11:00:00.000").event(slow, "purchase", "11:03:00.000");
            h.event(dropped, "signup", "12:00:00.000");

            FunnelResult result = run(h.request("signup", "purchase").build());

            logStep("Then: three signed up, two purchased, 2 minutes apart on average");
            assertThat(result.steps()).extracting(FunnelStepResult::count).containsExactly(3L, 2L);
            assertThat(result.steps().get(1).avgTimeToConvertSeconds()).isEqualTo(120L);
        }

        @Test
        @DisplayName("Steps out of order only count up to the last one in order")
        void testOutOfOrder() throws SQLException {
            History h = new History();
            String p = h.person();
            h.event(p, "a", "10:00:00.000").event(p, "c", "10:00:01.000").event(p, "b", "10:00:02.000");

            FunnelResult result = run(h.request("a", "b", "c").build());

            assertThat(result.steps()).extracting(FunnelStepResult::count).containsExactly(1L, 1L, 0L);
        }

        @Test
        @DisplayName("A step missing from the anchor's window leaves no bogus conversion time")
        void testBrokenChainAverage() throws SQLException {
            History h = new History();
            String p = h.person();
            h.event(p, "a", "10:00:00.000")
                .event(p, "c", "10:00:05.000")
                .event(p, "a", "10:00:20.000")
                .event(p, "b", "10:00:22.000")
                .event(p, "c", "10:00:25.000");

            FunnelResult result = run(h.request("a", "b", "c").window(10, "second").build());

            logStep("Then: all three steps are reached and no average exceeds the window");
            assertThat(result.steps()).extracting(FunnelStepResult::count).containsExactly(1L, 1L, 1L);
            assertThat(result.steps().get(1).avgTimeToConvertSeconds()).isNull();
            assertThat(result.steps().get(2).avgTimeToConvertSeconds()).isNull();
        }

        @Test
        @DisplayName("Steps outside the conversion window are not reached")
        void testWindow() throws SQLException {
            History h = new History();
            String p = h.person();
            h.event(p, "signup", "10:00:00.000").event(p, "purchase", "10:00:30.000");

            FunnelResult result = run(h.request("signup", "purchase").window(10, "second").build());

            assertThat(result.steps()).extracting(FunnelStepResult::count).containsExactly(1L, 0L);
        }
    }

    @Nested
    @DisplayName("Strict")
    class StrictTests {

        @Test
        @DisplayName("Other events in range drop the person from a strict funnel only")
        void testOtherEvents() throws SQLException {
            History h = new History();
            String p = h.person();
            h.event(p, "a", "10:00:00.000").event(p, "x", "10:00:01.000").event(p, "b", "10:00:02.000");

            FunnelResult ordered = run(h.request("a", "b").build());
            FunnelResult strict = run(h.request("a", "b").orderType(FunnelOrderType.STRICT).build());

            assertThat(ordered.steps()).extracting(FunnelStepResult::count).containsExactly(1L, 1L);
            assertThat(strict.steps()).extracting(FunnelStepResult::count).containsExactly(0L, 0L);
        }
    }

    @Nested
    @DisplayName("Unordered")
    class UnorderedTests {

        @Test
        @DisplayName("Steps count in any order; people without the first step are left out")
        void testAnyOrder() throws SQLException {
            History h = new History();
            String reversed = h.person();
            String noFirstStep = h.person();
            h.event(reversed, "c", "10:00:00.000").event(reversed, "b", "10:00:10.000").event(reversed, "a", "10:00:20.000");
            h.event(noFirstStep, "b", "11:00:00.000").event(noFirstStep, "c", "11:00:10.000");

            FunnelResult result = run(h.request("a", "b", "c").orderType(FunnelOrderType.UNORDERED).build());

            logStep("Then: only the person who did all three steps is counted");
            assertThat(result.steps()).extracting(FunnelStepResult::count).containsExactly(1L, 1L, 1L);
        }
    }

    @Nested
    @DisplayName("Exclusions")
    class ExclusionTests {

        @Test
        @DisplayName("An excluded event between the steps removes the person")
        void testExclusion() throws SQLException {
            History h = new History();
            String tainted = h.person();
            String clean = h.person();
            h.event(tainted, "signup", "10:00:00.000").event(tainted, "logout", "10:00:05.000")
                .event(tainted, "purchase", "10:00:10.000");
            h.event(clean, "signup", "11:00:00.000").event(clean, "purchase", "11:00:10.000");

            FunnelResult result = run(h.request("signup", "purchase")
                .exclusion(new FunnelExclusion("logout", 0, 1)).build());

            assertThat(result.steps()).extracting(FunnelStepResult::count).containsExactly(1L, 1L);
            assertThat(result.steps().get(1).avgTimeToConvertSeconds()).isEqualTo(10L);
        }
    }

    @Nested
    @DisplayName("Time To Convert")
    class TimeToConvertTests {

        @Test
        @DisplayName("Average and median over converted people")
        void testTimeToConvert() throws SQLException {
            History h = new History();
            String fast = h.person();
            String slow = h.person();
            h.event(fast, "signup", "10:00:00.000").event(fast, "purchase", "10:01:00.000");
            h.event(slow, "signup", "11:00:00.000").event(slow, "purchase", "11:02:00.000");

            try (FunnelService service = new FunnelService(store())) {
                TimeToConvertResult result = service.timeToConvert(h.request("signup", "purchase").build(), 0, 1);

                assertThat(result.sampleSize()).isEqualTo(2);
                assertThat(result.averageSeconds()).isEqualTo(90L);
            }
        }
    }
}
