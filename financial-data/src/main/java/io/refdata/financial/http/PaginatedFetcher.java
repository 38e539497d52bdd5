package io.refdata.financial.http;

import com.codahale.metrics.Counter;
import com.fasterxml.jackson.databind.JsonNode;
import io.refdata.error.RefDataException;
import io.refdata.metrics.Metrics;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drains a paged endpoint: keeps requesting with the returned {@code pagination_key} until a page arrives without
 * one. Records are read from the same result field on every page and returned in arrival order.
 */
public class PaginatedFetcher {
    public static final String PAGINATION_KEY = "pagination_key";
    public static final int DEFAULT_MAX_PAGES = 10_000;

    private final RetryingHttpClient client;
    private final int maxPages;
    private final Counter pages;
    private final Counter records;

    public PaginatedFetcher(RetryingHttpClient client, int maxPages, Metrics metrics) {
        this.client = client;
        this.maxPages = maxPages <= 0 ? DEFAULT_MAX_PAGES : maxPages;
        this.pages = metrics.counter("pages.fetched");
        this.records = metrics.counter("records.fetched");
    }

    public List<Map<String, Object>> fetchAll(String path, Map<String, String> params, String resultKey)
            throws RefDataException, InterruptedException {
        Map<String, String> query = new LinkedHashMap<>(params);
        query.remove(PAGINATION_KEY);
        List<Map<String, Object>> out = new ArrayList<>();
        String previousCursor = null;
        for (int page = 1; ; page++) {
            if (page > maxPages) {
                throw new ProtocolViolationException(path + " still paginating after " + maxPages + " pages");
            }
            JsonNode body = client.get(path, query);
            JsonNode items = body.get(resultKey);
            if (items == null || !items.isArray()) {
                throw new ProtocolViolationException(path + " response has no '" + resultKey + "' array");
            }
            for (JsonNode item : items) out.add(toRecord(item));
            pages.inc();
            records.inc(items.size());

            JsonNode cursor = body.get(PAGINATION_KEY);
            if (cursor == null || cursor.isNull()) return out;
            String next = cursor.asText();
            if (next.equals(previousCursor)) {
                throw new ProtocolViolationException(path + " repeated pagination_key " + next);
            }
            previousCursor = next;
            query.put(PAGINATION_KEY, next);
        }
    }

    static Map<String, Object> toRecord(JsonNode item) throws ProtocolViolationException {
        if (!item.isObject()) throw new ProtocolViolationException("expected a JSON object record, got " + item.getNodeType());
        Map<String, Object> rec = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            rec.put(f.getKey(), scalar(f.getValue()));
        }
        return rec;
    }

    private static Object scalar(JsonNode v) {
        if (v == null || v.isNull() || v.isMissingNode()) return null;
        if (v.isTextual()) return v.textValue();
        if (v.isIntegralNumber()) return v.canConvertToLong() ? (Object) v.longValue() : v.bigIntegerValue();
        if (v.isNumber()) return v.doubleValue();
        if (v.isBoolean()) return v.booleanValue();
        return v.toString();
    }
}
