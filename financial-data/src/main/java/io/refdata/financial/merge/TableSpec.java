package io.refdata.financial.merge;

import java.time.LocalTime;
import java.util.List;
import java.util.Objects;

/**
 * A persisted table: the endpoint feeding it, the business key that identifies a row, the column that drives the
 * watermark and the local time from which the current day's data is considered published.
 */
public record TableSpec(String name, String endpointId, List<String> businessKey, String dateColumn, LocalTime cutoff) {
    public TableSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(endpointId, "endpointId");
        Objects.requireNonNull(dateColumn, "dateColumn");
        Objects.requireNonNull(cutoff, "cutoff");
        businessKey = List.copyOf(businessKey);
        if (businessKey.isEmpty()) throw new IllegalArgumentException(name + ": empty business key");
    }
}
