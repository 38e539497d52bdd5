package io.refdata.financial.schema;

import io.refdata.dataset.Column;
import io.refdata.dataset.SchemaException;
import io.refdata.dataset.TypedDataset;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns raw endpoint records into a {@link TypedDataset} with the endpoint's declared columns for the configured
 * subscription plan. Fields absent from a record become null cells; fields not declared are dropped.
 */
public class DatasetNormalizer {
    private final EndpointCatalog catalog;
    private final SubscriptionPlan plan;

    public DatasetNormalizer(EndpointCatalog catalog, SubscriptionPlan plan) {
        this.catalog = catalog;
        this.plan = plan;
    }

    public SubscriptionPlan plan() { return plan; }

    public EndpointCatalog catalog() { return catalog; }

    public List<Column> columns(String endpointId) {
        return catalog.get(endpointId).columnsFor(plan);
    }

    public TypedDataset normalize(String endpointId, List<Map<String, Object>> records) throws SchemaException {
        EndpointSchema schema = catalog.get(endpointId);
        List<Column> cols = schema.columnsFor(plan);
        if (records.isEmpty()) return TypedDataset.empty(cols);
        List<List<Object>> rows = new ArrayList<>(records.size());
        for (Map<String, Object> rec : records) {
            Object[] cells = new Object[cols.size()];
            for (int i = 0; i < cells.length; i++) {
                Column c = cols.get(i);
                cells[i] = c.type().parse(rec.get(c.name()), endpointId + "." + c.name());
            }
            rows.add(TypedDataset.row(cells));
        }
        return new TypedDataset(cols, rows).sortedBy(schema.sortKey());
    }
}
