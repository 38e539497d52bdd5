package io.refdata.store;

import io.refdata.dataset.Column;
import io.refdata.dataset.ColumnType;
import io.refdata.dataset.SchemaException;
import io.refdata.dataset.TypedDataset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static io.refdata.dataset.TypedDataset.row;
import static org.junit.jupiter.api.Assertions.*;

public class PartitionedCsvStoreTest {
    static final List<Column> COLS = List.of(Column.of("Date", ColumnType.DATE), Column.of("Close", ColumnType.FLOAT));

    static TypedDataset topix(String symbol, LocalDate... dates) throws SchemaException {
        List<List<Object>> rows = new ArrayList<>();
        for (int i = 0; i < dates.length; i++) rows.add(row(dates[i], 2000.0 + i));
        return StoreColumns.decorate(new TypedDataset(COLS, rows), "Date", symbol);
    }

    @Test
    void writes_hive_layout_and_reads_back_sorted(@TempDir Path dir) throws Exception {
        PartitionedCsvStore store = new PartitionedCsvStore(dir);
        store.upload("topix", topix("jquants_api",
                LocalDate.of(2024, 3, 4), LocalDate.of(2024, 2, 29), LocalDate.of(2024, 3, 1)));

        assertTrue(Files.exists(dir.resolve("topix/partition_dt=2024-02-01/symbol=jquants_api/data.csv")));
        assertTrue(Files.exists(dir.resolve("topix/partition_dt=2024-03-01/symbol=jquants_api/data.csv")));

        TypedDataset all = store.query("topix", "*", LocalDateTime.of(2024, 1, 1, 0, 0), List.of("jquants_api")).orElseThrow();
        assertEquals(List.of(LocalDate.of(2024, 2, 29), LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 4)),
                all.columnValues("Date"));

        TypedDataset recent = store.query("topix", "*", LocalDateTime.of(2024, 3, 2, 0, 0), List.of("jquants_api")).orElseThrow();
        assertEquals(List.of(LocalDate.of(2024, 3, 4)), recent.columnValues("Date"));
    }

    @Test
    void upload_replaces_whole_partition(@TempDir Path dir) throws Exception {
        PartitionedCsvStore store = new PartitionedCsvStore(dir);
        store.upload("topix", topix("jquants_api", LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 4)));
        store.upload("topix", topix("jquants_api", LocalDate.of(2024, 3, 5)));
        TypedDataset back = store.query("topix", "*", LocalDateTime.of(2024, 3, 1, 0, 0), List.of("jquants_api")).orElseThrow();
        assertEquals(List.of(LocalDate.of(2024, 3, 5)), back.columnValues("Date"));
        try (var files = Files.walk(dir)) {
            assertTrue(files.noneMatch(p -> p.toString().endsWith(".tmp")));
        }
    }

    @Test
    void symbols_select_sub_directories(@TempDir Path dir) throws Exception {
        PartitionedCsvStore store = new PartitionedCsvStore(dir);
        store.upload("topix", topix("a", LocalDate.of(2024, 3, 1)).concat(topix("b", LocalDate.of(2024, 3, 2))));
        LocalDateTime start = LocalDateTime.of(2024, 3, 1, 0, 0);
        assertEquals(1, store.query("topix", "*", start, List.of("b")).orElseThrow().size());
        assertEquals(2, store.query("topix", "*", start, List.of("a", "b")).orElseThrow().size());
        assertTrue(store.query("topix", "*", start, List.of("c")).isEmpty());
        assertTrue(store.query("missing", "*", start, List.of("a")).isEmpty());
    }

    @Test
    void rejects_rows_without_store_columns(@TempDir Path dir) throws Exception {
        PartitionedCsvStore store = new PartitionedCsvStore(dir);
        TypedDataset bare = new TypedDataset(COLS, List.of(row(LocalDate.of(2024, 3, 1), 1.0)));
        assertThrows(SchemaException.class, () -> store.upload("topix", bare));
        assertThrows(IllegalArgumentException.class,
                () -> store.query("topix", "Date", LocalDateTime.of(2024, 3, 1, 0, 0), List.of("a")));
        try (var files = Files.list(dir)) {
            assertEquals(0, files.count());
        }
    }
}
