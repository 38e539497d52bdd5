package io.refdata.financial.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.refdata.dataset.ColumnType;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Endpoint schemas loaded once from {@code endpoints.json} on the classpath.
 */
public final class EndpointCatalog {
    public static final String RESOURCE = "/endpoints.json";

    private final Map<String, EndpointSchema> byId;

    public EndpointCatalog(Collection<EndpointSchema> schemas) {
        Map<String, EndpointSchema> m = new LinkedHashMap<>();
        for (EndpointSchema s : schemas) {
            if (m.put(s.id(), s) != null) throw new IllegalArgumentException("duplicate endpoint " + s.id());
        }
        this.byId = Map.copyOf(m);
    }

    public static EndpointCatalog load(ObjectMapper mapper) {
        try (InputStream in = EndpointCatalog.class.getResourceAsStream(RESOURCE)) {
            if (in == null) throw new IllegalStateException(RESOURCE + " not found on classpath");
            return parse(mapper.readTree(in));
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + RESOURCE, e);
        }
    }

    static EndpointCatalog parse(JsonNode root) {
        List<EndpointSchema> schemas = new ArrayList<>();
        for (JsonNode e : root.path("endpoints")) {
            List<EndpointColumn> cols = new ArrayList<>();
            for (JsonNode c : e.path("columns")) {
                cols.add(new EndpointColumn(
                        c.path("name").asText(),
                        ColumnType.of(c.path("type").asText()),
                        SubscriptionPlan.of(c.path("plan").asText("LIGHT"))));
            }
            List<String> sortKey = new ArrayList<>();
            for (JsonNode k : e.path("sortKey")) sortKey.add(k.asText());
            EndpointSchema s = new EndpointSchema(
                    e.path("id").asText(),
                    e.path("path").asText(),
                    e.path("resultKey").asText(),
                    RangeStep.valueOf(e.path("step").asText("DAILY")),
                    e.path("dateColumn").asText(),
                    sortKey,
                    cols);
            validate(s);
            schemas.add(s);
        }
        return new EndpointCatalog(schemas);
    }

    private static void validate(EndpointSchema s) {
        List<String> names = new ArrayList<>();
        for (EndpointColumn c : s.columns()) names.add(c.name());
        if (s.id().isEmpty() || s.path().isEmpty() || s.resultKey().isEmpty()) {
            throw new IllegalStateException("endpoint entry missing id, path or resultKey: " + s.id());
        }
        if (!names.contains(s.dateColumn())) {
            throw new IllegalStateException(s.id() + ": date column " + s.dateColumn() + " is not declared");
        }
        for (String k : s.sortKey()) {
            if (!names.contains(k)) throw new IllegalStateException(s.id() + ": sort key " + k + " is not declared");
        }
    }

    public EndpointSchema get(String id) {
        EndpointSchema s = byId.get(id);
        if (s == null) throw new NoSuchElementException("unknown endpoint " + id + ", known: " + byId.keySet());
        return s;
    }

    public Collection<EndpointSchema> all() { return byId.values(); }
}
