package io.refdata.financial.merge;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import io.refdata.dataset.SchemaException;
import io.refdata.dataset.TypedDataset;
import io.refdata.error.RefDataException;
import io.refdata.financial.range.RangeFetchOrchestrator;
import io.refdata.metrics.Metrics;
import io.refdata.notify.Notifier;
import io.refdata.store.StoreColumns;
import io.refdata.store.TimeSeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Brings one table up to date: load the recent stored rows, work out the days missing since the newest stored date,
 * fetch them, merge on the business key with fetched rows winning, and write the result back. The store is written
 * once, at the end; a failure anywhere before leaves it as it was.
 */
public class IncrementalMergePipeline {
    private static final Logger log = LoggerFactory.getLogger(IncrementalMergePipeline.class);

    private final RangeFetchOrchestrator orchestrator;
    private final TimeSeriesStore store;
    private final Notifier notifier;
    private final Clock clock;
    private final ZoneId zone;
    private final LocalDate initialStart;
    private final int lookbackMonths;
    private final String symbol;
    private final boolean rebuild;
    private final List<FetchCheck> checks;
    private final Counter fetchedRows;
    private final Counter persistedRows;

    private IncrementalMergePipeline(Builder b) {
        this.orchestrator = b.orchestrator;
        this.store = b.store;
        this.notifier = b.notifier;
        this.clock = b.clock;
        this.zone = b.zone;
        this.initialStart = b.initialStart;
        this.lookbackMonths = b.lookbackMonths;
        this.symbol = b.symbol;
        this.rebuild = b.rebuild;
        this.checks = List.copyOf(b.checks);
        this.fetchedRows = b.metrics.counter("merge.rows.fetched");
        this.persistedRows = b.metrics.counter("merge.rows.persisted");
    }

    public static Builder builder() { return new Builder(); }

    public MergeOutcome run(TableSpec table) throws RefDataException, IOException, InterruptedException {
        ZonedDateTime now = ZonedDateTime.now(clock).withZoneSameInstant(zone);

        enter(table, MergeState.LOAD_PRIOR);
        Optional<TypedDataset> prior = rebuild ? Optional.empty() : loadPrior(table, now.toLocalDate());
        int priorRows = prior.map(TypedDataset::size).orElse(0);

        enter(table, MergeState.COMPUTE_WINDOW);
        FetchWindow window = window(table, prior, now);
        if (window.isEmpty()) {
            log.info("{} is already up to date ({})", table.name(), window);
            return new MergeOutcome(table.name(), MergeState.NO_NEW_DATA, window, 0, priorRows);
        }

        MergeState stage = enter(table, MergeState.FETCH);
        try {
            Optional<TypedDataset> fetched = orchestrator.fetchRange(table.endpointId(), window.start(), window.end());
            if (fetched.isEmpty()) {
                log.info("no new data in {} ({})", table.name(), window);
                notifySafely("There's no new data in " + table.name() + ". (" + window + ")");
                return new MergeOutcome(table.name(), MergeState.NO_NEW_DATA, window, 0, priorRows);
            }
            TypedDataset fresh = fetched.get();
            fetchedRows.inc(fresh.size());
            for (FetchCheck check : checks) {
                for (String line : check.inspect(table, fresh)) {
                    log.warn(line);
                    notifySafely(line);
                }
            }

            stage = enter(table, MergeState.MERGE);
            TypedDataset merged = merge(prior, StoreColumns.decorate(fresh, table.dateColumn(), symbol), table);

            stage = enter(table, MergeState.PERSIST);
            store.upload(table.name(), merged);
            persistedRows.inc(merged.size());
            log.info("renewed and uploaded {}: fetched={} persisted={} ({})", table.name(), fresh.size(), merged.size(), window);
            notifySafely("Renewed and uploaded: " + table.name() + " (" + window + ", " + fresh.size() + " new rows)");
            return new MergeOutcome(table.name(), MergeState.PERSIST, window, fresh.size(), merged.size());
        } catch (RefDataException | IOException | RuntimeException e) {
            log.error("{} failed during {} ({})", table.name(), stage, window, e);
            notifySafely("Failed to update " + table.name() + ". (" + window + "): " + e.getMessage());
            throw e;
        }
    }

    private static MergeState enter(TableSpec table, MergeState stage) {
        log.debug("{}: {}", table.name(), stage);
        return stage;
    }

    private Optional<TypedDataset> loadPrior(TableSpec table, LocalDate today) throws IOException, SchemaException {
        LocalDate from = today.withDayOfMonth(1).minusMonths(lookbackMonths);
        Optional<TypedDataset> prior = store.query(table.name(), "*", from.atStartOfDay(), List.of(symbol));
        prior.ifPresent(p -> log.info("{}: {} stored rows since {}", table.name(), p.size(), from));
        return prior;
    }

    FetchWindow window(TableSpec table, Optional<TypedDataset> prior, ZonedDateTime now) {
        LocalDate start = prior
                .flatMap(p -> p.max(table.dateColumn()))
                .map(d -> ((LocalDate) d).plusDays(1))
                .orElse(initialStart);
        LocalDate end = now.toLocalDate();
        if (now.toLocalTime().isBefore(table.cutoff())) end = end.minusDays(1);
        return new FetchWindow(start, end);
    }

    /**
     * Prior rows followed by fresh rows, one row per business key (the later occurrence wins), stably sorted by the
     * table's date column. Running it again with the same fresh rows gives the same result.
     *
     * @throws SchemaException when the fresh rows do not carry exactly the prior columns
     */
    public static TypedDataset merge(Optional<TypedDataset> prior, TypedDataset fresh, TableSpec table)
            throws SchemaException {
        TypedDataset combined = fresh;
        if (prior.isPresent()) {
            TypedDataset p = prior.get();
            if (!p.columns().equals(fresh.columns())) {
                throw new SchemaException(table.name() + ": fetched columns " + fresh.columns()
                        + " do not match stored columns " + p.columns());
            }
            combined = p.concat(fresh);
        }
        TypedDataset merged = combined.dropDuplicatesKeepLast(table.businessKey()).sortedBy(List.of(table.dateColumn()));
        if (prior.isPresent() && merged.columnCount() != prior.get().columnCount()) {
            throw new SchemaException(table.name() + ": merge changed the column count from "
                    + prior.get().columnCount() + " to " + merged.columnCount());
        }
        return merged;
    }

    private void notifySafely(String message) {
        try {
            notifier.send(message);
        } catch (IOException | RuntimeException e) {
            log.warn("notification failed: {}", message, e);
        }
    }

    public static final class Builder {
        private RangeFetchOrchestrator orchestrator;
        private TimeSeriesStore store;
        private Notifier notifier = Notifier.logging();
        private Clock clock = Clock.systemUTC();
        private ZoneId zone = ZoneId.of("Asia/Tokyo");
        private LocalDate initialStart = LocalDate.of(2024, 1, 1);
        private int lookbackMonths = 1;
        private String symbol = "jquants_api";
        private boolean rebuild;
        private final List<FetchCheck> checks = new ArrayList<>();
        private Metrics metrics = new Metrics(new MetricRegistry());

        public Builder orchestrator(RangeFetchOrchestrator o) { this.orchestrator = o; return this; }
        public Builder store(TimeSeriesStore s) { this.store = s; return this; }
        public Builder notifier(Notifier n) { this.notifier = n; return this; }
        public Builder clock(Clock c) { this.clock = c; return this; }
        public Builder zone(ZoneId z) { this.zone = z; return this; }
        public Builder initialStart(LocalDate d) { this.initialStart = d; return this; }
        public Builder lookbackMonths(int n) { this.lookbackMonths = Math.max(0, n); return this; }
        public Builder symbol(String s) { this.symbol = s; return this; }
        public Builder rebuild(boolean r) { this.rebuild = r; return this; }
        public Builder check(FetchCheck c) { this.checks.add(c); return this; }
        public Builder metrics(Metrics m) { this.metrics = m; return this; }

        public IncrementalMergePipeline build() {
            Objects.requireNonNull(orchestrator, "orchestrator");
            Objects.requireNonNull(store, "store");
            Objects.requireNonNull(notifier, "notifier");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(zone, "zone");
            Objects.requireNonNull(initialStart, "initialStart");
            Objects.requireNonNull(symbol, "symbol");
            Objects.requireNonNull(metrics, "metrics");
            return new IncrementalMergePipeline(this);
        }
    }
}
