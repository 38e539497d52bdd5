package io.refdata.store;

import io.refdata.dataset.SchemaException;
import io.refdata.dataset.TypedDataset;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Persisted time series, partitioned by {@link StoreColumns#PARTITION_DT}.
 * <p>
 * {@link #upload} replaces every partition present in the given rows. Callers must hand over the complete row set
 * of each partition they touch: rows of a touched partition that are missing from the upload are gone afterwards.
 */
public interface TimeSeriesStore {

    /**
     * Rows of {@code table} whose {@code dt} is at or after {@code startDt} and whose symbol is one of
     * {@code symbols}, ordered by {@code dt}. Empty when the table holds no such rows.
     *
     * @param filter column projection; only {@code "*"} is supported
     */
    Optional<TypedDataset> query(String table, String filter, LocalDateTime startDt, List<String> symbols)
            throws IOException, SchemaException;

    /**
     * @throws SchemaException when {@code rows} lacks the {@code symbol}, {@code dt} or {@code partition_dt} column
     */
    void upload(String table, TypedDataset rows) throws IOException, SchemaException;
}
