package io.refdata.store;

import io.refdata.dataset.CsvCodec;
import io.refdata.dataset.SchemaException;
import io.refdata.dataset.TypedDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One file per table holding every row: {@code <table>_<firstDate>_<saveDate>.csv}, both dates as yyyyMMdd.
 * An upload merges into the newest snapshot, writes a new file and only then deletes the older ones.
 */
public class SnapshotFileStore implements TimeSeriesStore {
    private static final Logger log = LoggerFactory.getLogger(SnapshotFileStore.class);
    private static final DateTimeFormatter BASIC = DateTimeFormatter.BASIC_ISO_DATE;

    private final Path dir;
    private final Clock clock;

    public SnapshotFileStore(Path dir, Clock clock) throws IOException {
        this.dir = dir;
        this.clock = clock;
        Files.createDirectories(dir);
    }

    @Override
    public Optional<TypedDataset> query(String table, String filter, LocalDateTime startDt, List<String> symbols)
            throws IOException, SchemaException {
        PartitionedCsvStore.requireStarFilter(filter);
        Optional<Snapshot> latest = latest(table);
        if (latest.isEmpty()) return Optional.empty();
        TypedDataset all = CsvCodec.read(latest.get().path());
        int dt = all.indexOf(StoreColumns.DT);
        int sym = all.indexOf(StoreColumns.SYMBOL);
        Set<String> wanted = new HashSet<>(symbols);
        TypedDataset rows = all
                .filter(r -> r.get(dt) != null && !((LocalDateTime) r.get(dt)).isBefore(startDt) && wanted.contains(r.get(sym)))
                .sortedBy(List.of(StoreColumns.DT));
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows);
    }

    @Override
    public void upload(String table, TypedDataset rows) throws IOException, SchemaException {
        StoreColumns.require(rows);
        List<Snapshot> existing = snapshots(table);
        TypedDataset merged = rows;
        if (!existing.isEmpty()) {
            TypedDataset prior = CsvCodec.read(existing.get(existing.size() - 1).path());
            Set<Object> touched = new HashSet<>(rows.columnValues(StoreColumns.PARTITION_DT));
            int pi = prior.indexOf(StoreColumns.PARTITION_DT);
            merged = prior.filter(r -> !touched.contains(r.get(pi))).concat(rows);
        }
        merged = merged.sortedBy(List.of(StoreColumns.DT));
        if (merged.isEmpty()) {
            log.info("nothing to snapshot for table={}", table);
            return;
        }
        LocalDate first = StoreColumns.dtOf(merged, 0).toLocalDate();
        Path target = dir.resolve(table + "_" + BASIC.format(first) + "_" + BASIC.format(LocalDate.now(clock)) + ".csv");
        PartitionedCsvStore.replace(target, merged);
        for (Snapshot old : existing) {
            if (!old.path().equals(target)) Files.deleteIfExists(old.path());
        }
        log.info("saved snapshot {} rows={}", target.getFileName(), merged.size());
    }

    record Snapshot(Path path, LocalDate firstDate, LocalDate saveDate) {}

    Optional<Snapshot> latest(String table) throws IOException {
        List<Snapshot> all = snapshots(table);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(all.size() - 1));
    }

    /** Snapshots of a table, oldest save date first. */
    List<Snapshot> snapshots(String table) throws IOException {
        Pattern p = Pattern.compile(Pattern.quote(table) + "_(\\d{8})_(\\d{8})\\.csv");
        List<Snapshot> out = new ArrayList<>();
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir, table + "_*.csv")) {
            for (Path f : ds) {
                Matcher m = p.matcher(f.getFileName().toString());
                if (!m.matches()) continue;
                out.add(new Snapshot(f, LocalDate.parse(m.group(1), BASIC), LocalDate.parse(m.group(2), BASIC)));
            }
        }
        out.sort((a, b) -> {
            int c = a.saveDate().compareTo(b.saveDate());
            return c != 0 ? c : a.path().getFileName().toString().compareTo(b.path().getFileName().toString());
        });
        return out;
    }
}
