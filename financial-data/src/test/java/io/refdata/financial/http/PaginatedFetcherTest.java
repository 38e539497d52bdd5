package io.refdata.financial.http;

import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import io.refdata.financial.ApiFixtures;
import io.refdata.metrics.Metrics;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static io.refdata.financial.http.ScriptedTransport.ok;
import static org.junit.jupiter.api.Assertions.*;

public class PaginatedFetcherTest {
    final MetricRegistry registry = new MetricRegistry();
    final Metrics metrics = new Metrics(registry);

    PaginatedFetcher fetcher(ScriptedTransport t, int maxPages) {
        return new PaginatedFetcher(ApiFixtures.client(t, metrics), maxPages, metrics);
    }

    @Test
    void follows_pagination_key_and_keeps_arrival_order() throws Exception {
        ScriptedTransport t = new ScriptedTransport(r -> switch (ScriptedTransport.query(r).getOrDefault("pagination_key", "")) {
            case "" -> ok("{\"info\":[{\"Code\":\"1301\"},{\"Code\":\"1305\"}],\"pagination_key\":\"p2\"}");
            case "p2" -> ok("{\"info\":[{\"Code\":\"1332\"}],\"pagination_key\":\"p3\"}");
            default -> ok("{\"info\":[{\"Code\":\"1333\"}]}");
        });

        List<Map<String, Object>> records = fetcher(t, 0).fetchAll("listed/info", Map.of("date", "20240304"), "info");

        assertEquals(List.of("1301", "1305", "1332", "1333"), records.stream().map(r -> r.get("Code")).toList());
        assertEquals(3, t.requests().size());
        assertEquals("p3", ScriptedTransport.query(t.requests().get(2)).get("pagination_key"));
        assertEquals("20240304", ScriptedTransport.query(t.requests().get(2)).get("date"));
        assertEquals(3, registry.counter("pages.fetched").getCount());
        assertEquals(4, registry.counter("records.fetched").getCount());
    }

    @Test
    void single_page_and_null_cursor_end_the_loop() throws Exception {
        ScriptedTransport t = ScriptedTransport.sequence(ok("{\"topix\":[],\"pagination_key\":null}"));
        assertTrue(fetcher(t, 0).fetchAll("indices/topix", Map.of(), "topix").isEmpty());
        assertEquals(1, t.requests().size());
    }

    @Test
    void repeated_cursor_is_rejected() {
        ScriptedTransport t = ScriptedTransport.sequence(ok("{\"info\":[{}],\"pagination_key\":\"same\"}"));
        ProtocolViolationException e = assertThrows(ProtocolViolationException.class,
                () -> fetcher(t, 0).fetchAll("listed/info", Map.of(), "info"));
        assertTrue(e.getMessage().contains("same"));
        assertEquals(2, t.requests().size());
    }

    @Test
    void page_limit_bounds_the_loop() {
        int[] n = {0};
        ScriptedTransport t = new ScriptedTransport(r -> ok("{\"info\":[],\"pagination_key\":\"k" + (n[0]++) + "\"}"));
        assertThrows(ProtocolViolationException.class, () -> fetcher(t, 2).fetchAll("listed/info", Map.of(), "info"));
        assertEquals(2, t.requests().size());
    }

    @Test
    void missing_result_array_is_rejected() {
        ScriptedTransport t = ScriptedTransport.sequence(ok("{\"message\":\"no data\"}"));
        assertThrows(ProtocolViolationException.class, () -> fetcher(t, 0).fetchAll("listed/info", Map.of(), "info"));
    }

    @Test
    void records_keep_json_scalar_types() throws Exception {
        JsonNode item = ApiFixtures.MAPPER.readTree(
                "{\"Code\":\"7203\",\"Volume\":1200,\"Close\":2510.5,\"Big\":123456789012345678901234567890,"
                        + "\"Flag\":true,\"Missing\":null,\"Nested\":{\"a\":1}}");
        Map<String, Object> rec = PaginatedFetcher.toRecord(item);
        assertEquals("7203", rec.get("Code"));
        assertEquals(1200L, rec.get("Volume"));
        assertEquals(2510.5, rec.get("Close"));
        assertEquals(new BigInteger("123456789012345678901234567890"), rec.get("Big"));
        assertEquals(Boolean.TRUE, rec.get("Flag"));
        assertTrue(rec.containsKey("Missing"));
        assertNull(rec.get("Missing"));
        assertEquals("{\"a\":1}", rec.get("Nested"));
        assertThrows(ProtocolViolationException.class, () -> PaginatedFetcher.toRecord(ApiFixtures.MAPPER.readTree("[1]")));
    }
}
