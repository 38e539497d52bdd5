package io.refdata.store;

import io.refdata.dataset.CsvCodec;
import io.refdata.dataset.SchemaException;
import io.refdata.dataset.TypedDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Local Hive-style layout: {@code <root>/<table>/partition_dt=<yyyy-MM-dd>/symbol=<symbol>/data.csv}.
 * Each touched partition file is written next to the old one and moved over it, so a failed upload leaves the
 * previous partition readable.
 */
public class PartitionedCsvStore implements TimeSeriesStore {
    private static final Logger log = LoggerFactory.getLogger(PartitionedCsvStore.class);
    private static final String PARTITION_PREFIX = StoreColumns.PARTITION_DT + "=";
    private static final String SYMBOL_PREFIX = StoreColumns.SYMBOL + "=";
    private static final String DATA_FILE = "data.csv";

    private final Path root;

    public PartitionedCsvStore(Path root) throws IOException {
        this.root = root;
        Files.createDirectories(root);
    }

    public Path root() { return root; }

    @Override
    public Optional<TypedDataset> query(String table, String filter, LocalDateTime startDt, List<String> symbols)
            throws IOException, SchemaException {
        requireStarFilter(filter);
        Path tableDir = root.resolve(table);
        if (!Files.isDirectory(tableDir)) return Optional.empty();

        LocalDate firstPartition = StoreColumns.partitionOf(startDt.toLocalDate());
        TreeMap<LocalDate, Path> partitions = new TreeMap<>();
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(tableDir, PARTITION_PREFIX + "*")) {
            for (Path p : ds) {
                LocalDate d = partitionDate(p);
                if (d != null && !d.isBefore(firstPartition)) partitions.put(d, p);
            }
        }
        TypedDataset out = null;
        for (Path partition : partitions.values()) {
            for (String symbol : symbols) {
                Path file = partition.resolve(SYMBOL_PREFIX + symbol).resolve(DATA_FILE);
                if (!Files.exists(file)) continue;
                TypedDataset part = CsvCodec.read(file);
                out = out == null ? part : out.concat(part);
            }
        }
        if (out == null) return Optional.empty();
        int dt = out.indexOf(StoreColumns.DT);
        TypedDataset rows = out
                .filter(r -> r.get(dt) != null && !((LocalDateTime) r.get(dt)).isBefore(startDt))
                .sortedBy(List.of(StoreColumns.DT));
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows);
    }

    @Override
    public void upload(String table, TypedDataset rows) throws IOException, SchemaException {
        StoreColumns.require(rows);
        int pi = rows.indexOf(StoreColumns.PARTITION_DT);
        int si = rows.indexOf(StoreColumns.SYMBOL);
        Map<List<Object>, List<List<Object>>> groups = new LinkedHashMap<>();
        for (List<Object> r : rows.rows()) {
            if (r.get(pi) == null || r.get(si) == null) {
                throw new SchemaException("row without partition_dt or symbol: " + r);
            }
            groups.computeIfAbsent(List.of(r.get(pi), r.get(si)), k -> new ArrayList<>()).add(r);
        }
        for (Map.Entry<List<Object>, List<List<Object>>> e : groups.entrySet()) {
            LocalDate partition = (LocalDate) e.getKey().get(0);
            String symbol = (String) e.getKey().get(1);
            Path dir = root.resolve(table).resolve(PARTITION_PREFIX + partition).resolve(SYMBOL_PREFIX + symbol);
            replace(dir.resolve(DATA_FILE), new TypedDataset(rows.columns(), e.getValue()));
        }
        log.info("uploaded table={} rows={} partitions={}", table, rows.size(), groups.size());
    }

    static void replace(Path target, TypedDataset data) throws IOException {
        Files.createDirectories(target.getParent());
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        CsvCodec.write(tmp, data);
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    static void requireStarFilter(String filter) {
        if (filter != null && !"*".equals(filter.trim())) {
            throw new IllegalArgumentException("only the '*' filter is supported, got " + filter);
        }
    }

    private static LocalDate partitionDate(Path dir) {
        String name = dir.getFileName().toString();
        try {
            return LocalDate.parse(name.substring(PARTITION_PREFIX.length()));
        } catch (DateTimeParseException e) {
            log.warn("ignoring unexpected directory {}", dir);
            return null;
        }
    }
}
