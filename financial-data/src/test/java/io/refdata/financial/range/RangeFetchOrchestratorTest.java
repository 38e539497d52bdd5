package io.refdata.financial.range;

import io.refdata.dataset.TypedDataset;
import io.refdata.financial.ApiFixtures;
import io.refdata.financial.http.HttpStatusException;
import io.refdata.financial.http.ScriptedTransport;
import io.refdata.financial.schema.RangeStep;
import io.refdata.financial.schema.SubscriptionPlan;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static io.refdata.financial.ApiFixtures.quote;
import static io.refdata.financial.http.ScriptedTransport.ok;
import static org.junit.jupiter.api.Assertions.*;

public class RangeFetchOrchestratorTest {
    static final LocalDate MAR1 = LocalDate.of(2024, 3, 1);
    static final LocalDate MAR8 = LocalDate.of(2024, 3, 8);

    // weekdays carry two codes, weekends nothing
    static ScriptedTransport quotesServer() {
        return new ScriptedTransport(r -> {
            String date = ScriptedTransport.query(r).get("date");
            LocalDate d = LocalDate.parse(date, DateTimeFormatter.BASIC_ISO_DATE);
            if (d.getDayOfWeek().getValue() >= 6) return ok(ApiFixtures.page("daily_quotes", List.of()));
            return ok(ApiFixtures.page("daily_quotes", List.of(
                    quote("7203", d.toString(), 3500, 1),
                    quote("1301", d.toString(), 4100, 1))));
        });
    }

    @Test
    void inverted_range_makes_no_requests() throws Exception {
        ScriptedTransport t = quotesServer();
        Optional<TypedDataset> out = ApiFixtures.orchestrator(t, SubscriptionPlan.LIGHT, 4, null)
                .fetchRange("daily_quotes", MAR8, MAR1);
        assertTrue(out.isEmpty());
        assertTrue(t.requests().isEmpty());
    }

    @Test
    void daily_range_stitches_units_in_sort_order() throws Exception {
        ScriptedTransport t = quotesServer();
        TypedDataset ds = ApiFixtures.orchestrator(t, SubscriptionPlan.LIGHT, 1, null)
                .fetchRange("daily_quotes", MAR1, MAR8).orElseThrow();
        assertEquals(8, t.requests().size());
        assertEquals(12, ds.size());
        assertEquals(MAR1, ds.value(0, "Date"));
        assertEquals("1301", ds.value(0, "Code"));
        assertEquals(MAR8, ds.value(11, "Date"));
    }

    @Test
    void parallel_workers_give_the_same_result() throws Exception {
        TypedDataset sequential = ApiFixtures.orchestrator(quotesServer(), SubscriptionPlan.LIGHT, 1, null)
                .fetchRange("daily_quotes", MAR1, MAR8).orElseThrow();
        TypedDataset parallel = ApiFixtures.orchestrator(quotesServer(), SubscriptionPlan.LIGHT, 4, null)
                .fetchRange("daily_quotes", MAR1, MAR8).orElseThrow();
        assertEquals(sequential, parallel);
    }

    @Test
    void a_failing_unit_aborts_the_range() {
        ScriptedTransport t = new ScriptedTransport(r -> {
            if ("20240305".equals(ScriptedTransport.query(r).get("date"))) return ScriptedTransport.status(403);
            return ok(ApiFixtures.page("daily_quotes", List.of()));
        });
        HttpStatusException e = assertThrows(HttpStatusException.class,
                () -> ApiFixtures.orchestrator(t, SubscriptionPlan.LIGHT, 3, null).fetchRange("daily_quotes", MAR1, MAR8));
        assertEquals(403, e.status());

        ScriptedTransport seq = new ScriptedTransport(r -> {
            if ("20240305".equals(ScriptedTransport.query(r).get("date"))) return ScriptedTransport.status(403);
            return ok(ApiFixtures.page("daily_quotes", List.of()));
        });
        assertThrows(HttpStatusException.class,
                () -> ApiFixtures.orchestrator(seq, SubscriptionPlan.LIGHT, 1, null).fetchRange("daily_quotes", MAR1, MAR8));
        assertEquals(5, seq.requests().size());
    }

    @Test
    void all_empty_units_yield_nothing() throws Exception {
        ScriptedTransport t = ScriptedTransport.sequence(ok(ApiFixtures.page("daily_quotes", List.of())));
        assertTrue(ApiFixtures.orchestrator(t, SubscriptionPlan.LIGHT, 2, null)
                .fetchRange("daily_quotes", MAR1, MAR8).isEmpty());
        assertEquals(8, t.requests().size());
    }

    @Test
    void span_endpoints_take_one_request() throws Exception {
        ScriptedTransport t = ScriptedTransport.sequence(ok(ApiFixtures.page("topix", List.of(
                ApiFixtures.topix("2024-03-04", 2700), ApiFixtures.topix("2024-03-01", 2690)))));
        TypedDataset ds = ApiFixtures.orchestrator(t, SubscriptionPlan.LIGHT, 4, null)
                .fetchRange("topix", MAR1, MAR8).orElseThrow();
        assertEquals(1, t.requests().size());
        assertEquals(Map.of("from", "20240301", "to", "20240308"), ScriptedTransport.query(t.requests().get(0)));
        assertEquals(List.of(MAR1, LocalDate.of(2024, 3, 4)), ds.columnValues("Date"));
    }

    @Test
    void step_can_be_overridden() throws Exception {
        ScriptedTransport t = ScriptedTransport.sequence(ok(ApiFixtures.page("daily_quotes", List.of())));
        ApiFixtures.orchestrator(t, SubscriptionPlan.LIGHT, 1, null).fetchRange("daily_quotes", MAR1, MAR8, RangeStep.SPAN);
        assertEquals(1, t.requests().size());
    }

    @Test
    void cached_days_are_not_refetched(@TempDir Path dir) throws Exception {
        UnitCache cache = new UnitCache(dir);
        ScriptedTransport first = quotesServer();
        TypedDataset a = ApiFixtures.orchestrator(first, SubscriptionPlan.LIGHT, 2, cache)
                .fetchRange("daily_quotes", MAR1, MAR8).orElseThrow();
        assertEquals(8, first.requests().size());
        assertTrue(Files.exists(dir.resolve("2024").resolve("daily_quotes_20240304.csv")));

        // empty weekend days and the last day of the range are fetched again
        assertFalse(Files.exists(dir.resolve("2024").resolve("daily_quotes_20240302.csv")));
        assertFalse(Files.exists(dir.resolve("2024").resolve("daily_quotes_20240308.csv")));

        ScriptedTransport second = quotesServer();
        TypedDataset b = ApiFixtures.orchestrator(second, SubscriptionPlan.LIGHT, 2, cache)
                .fetchRange("daily_quotes", MAR1, MAR8).orElseThrow();
        assertEquals(List.of("20240302", "20240303", "20240308"), second.requests().stream()
                .map(r -> ScriptedTransport.query(r).get("date")).sorted().toList());
        assertEquals(a, b);

        // a plan with more columns does not trust entries written for fewer
        ScriptedTransport third = quotesServer();
        ApiFixtures.orchestrator(third, SubscriptionPlan.PREMIUM, 1, cache).fetchRange("daily_quotes", MAR1, MAR1);
        assertEquals(1, third.requests().size());
    }

    @Test
    void interruption_stops_before_the_next_unit() {
        ScriptedTransport t = new ScriptedTransport(r -> {
            Thread.currentThread().interrupt();
            return ok(ApiFixtures.page("daily_quotes", List.of()));
        });
        try {
            assertThrows(InterruptedException.class,
                    () -> ApiFixtures.orchestrator(t, SubscriptionPlan.LIGHT, 1, null).fetchRange("daily_quotes", MAR1, MAR8));
            assertEquals(1, t.requests().size());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void first_failure_cancels_units_in_flight() throws Exception {
        CountDownLatch slowStarted = new CountDownLatch(1);
        CountDownLatch slowInterrupted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ScriptedTransport t = new ScriptedTransport(r -> {
            String date = ScriptedTransport.query(r).get("date");
            if ("20240302".equals(date)) {
                slowStarted.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    slowInterrupted.countDown();
                    throw e;
                }
            }
            if ("20240301".equals(date)) {
                slowStarted.await(5, TimeUnit.SECONDS);
                return ScriptedTransport.status(403);
            }
            return ok(ApiFixtures.page("daily_quotes", List.of()));
        });
        try {
            long t0 = System.nanoTime();
            assertThrows(HttpStatusException.class,
                    () -> ApiFixtures.orchestrator(t, SubscriptionPlan.LIGHT, 2, null).fetchRange("daily_quotes", MAR1, MAR8));
            assertTrue(slowInterrupted.await(5, TimeUnit.SECONDS), "the unit still running was not interrupted");
            assertTrue(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - t0) < 10);
        } finally {
            release.countDown();
        }
    }
}
