package io.refdata.financial.schema;

import io.refdata.dataset.Column;
import io.refdata.dataset.ColumnType;

public record EndpointColumn(String name, ColumnType type, SubscriptionPlan plan) {
    public Column column() { return Column.of(name, type); }
}
