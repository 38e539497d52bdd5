package io.refdata.financial.schema;

import io.refdata.dataset.Column;

import java.util.ArrayList;
import java.util.List;

/**
 * Static description of one endpoint: where it lives, which field holds its records, the declared columns in
 * output order and how rows are sorted.
 */
public record EndpointSchema(
        String id,
        String path,
        String resultKey,
        RangeStep step,
        String dateColumn,
        List<String> sortKey,
        List<EndpointColumn> columns
) {
    public EndpointSchema {
        sortKey = List.copyOf(sortKey);
        columns = List.copyOf(columns);
    }

    /** Columns visible under {@code plan}, in declared order. */
    public List<Column> columnsFor(SubscriptionPlan plan) {
        List<Column> out = new ArrayList<>(columns.size());
        for (EndpointColumn c : columns) {
            if (plan.includes(c.plan())) out.add(c.column());
        }
        return out;
    }
}
