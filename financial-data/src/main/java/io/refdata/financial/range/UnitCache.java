package io.refdata.financial.range;

import io.refdata.dataset.Column;
import io.refdata.dataset.CsvCodec;
import io.refdata.dataset.SchemaException;
import io.refdata.dataset.TypedDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Normalized per-day results kept under {@code <dir>/<yyyy>/<endpoint>_<yyyyMMdd>.csv} so a rebuild over a long
 * history does not refetch days it already has.
 */
public class UnitCache {
    private static final Logger log = LoggerFactory.getLogger(UnitCache.class);

    private final Path dir;

    public UnitCache(Path dir) { this.dir = dir; }

    Path fileFor(String endpointId, LocalDate date) {
        return dir.resolve(String.valueOf(date.getYear())).resolve(endpointId + "_" + FetchUnit.BASIC.format(date) + ".csv");
    }

    /** Cached rows, or empty when nothing is cached or the cached columns differ from {@code expected}. */
    public Optional<TypedDataset> read(String endpointId, LocalDate date, List<Column> expected)
            throws IOException, SchemaException {
        Path f = fileFor(endpointId, date);
        if (!Files.exists(f)) return Optional.empty();
        TypedDataset ds = CsvCodec.read(f);
        if (!ds.columns().equals(expected)) {
            log.info("ignoring cached {} written with a different schema", f);
            return Optional.empty();
        }
        return Optional.of(ds);
    }

    public void write(String endpointId, LocalDate date, TypedDataset ds) throws IOException {
        Path f = fileFor(endpointId, date);
        Path tmp = f.resolveSibling(f.getFileName() + ".tmp");
        CsvCodec.write(tmp, ds);
        Files.move(tmp, f, StandardCopyOption.REPLACE_EXISTING);
    }
}
