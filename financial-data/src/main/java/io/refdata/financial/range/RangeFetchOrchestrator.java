package io.refdata.financial.range;

import com.codahale.metrics.Counter;
import io.refdata.dataset.Column;
import io.refdata.dataset.TypedDataset;
import io.refdata.error.RefDataException;
import io.refdata.financial.http.PaginatedFetcher;
import io.refdata.financial.schema.DatasetNormalizer;
import io.refdata.financial.schema.EndpointSchema;
import io.refdata.financial.schema.RangeStep;
import io.refdata.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fetches an endpoint over a date range, one request per {@link FetchUnit}, and stitches the per-unit datasets into
 * one sorted dataset. Any unit failing aborts the whole range: with several workers the remaining units are
 * cancelled and the first failure is rethrown.
 */
public class RangeFetchOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(RangeFetchOrchestrator.class);
    static final int PROGRESS_EVERY = 100;

    private final PaginatedFetcher fetcher;
    private final DatasetNormalizer normalizer;
    private final int workers;
    private final UnitCache cache;
    private final Counter units;

    /**
     * @param cache may be null
     */
    public RangeFetchOrchestrator(PaginatedFetcher fetcher, DatasetNormalizer normalizer, int workers, UnitCache cache,
                                  Metrics metrics) {
        this.fetcher = fetcher;
        this.normalizer = normalizer;
        this.workers = Math.max(1, workers);
        this.cache = cache;
        this.units = metrics.counter("range.units");
    }

    public Optional<TypedDataset> fetchRange(String endpointId, LocalDate start, LocalDate end)
            throws RefDataException, IOException, InterruptedException {
        return fetchRange(endpointId, start, end, normalizer.catalog().get(endpointId).step());
    }

    /**
     * @return the rows of every unit, sorted by the endpoint's sort key, or empty when the range produced none
     */
    public Optional<TypedDataset> fetchRange(String endpointId, LocalDate start, LocalDate end, RangeStep step)
            throws RefDataException, IOException, InterruptedException {
        EndpointSchema schema = normalizer.catalog().get(endpointId);
        List<FetchUnit> plan = FetchUnit.plan(step, start, end);
        if (plan.isEmpty()) return Optional.empty();
        log.info("fetching {} {}..{} in {} unit(s)", endpointId, start, end, plan.size());

        List<TypedDataset> parts = workers == 1 || plan.size() == 1
                ? runSequential(schema, plan, end)
                : runParallel(schema, plan, end);
        TypedDataset all = TypedDataset.concatAll(normalizer.columns(endpointId), parts).sortedBy(schema.sortKey());
        return all.isEmpty() ? Optional.empty() : Optional.of(all);
    }

    private List<TypedDataset> runSequential(EndpointSchema schema, List<FetchUnit> plan, LocalDate end)
            throws RefDataException, IOException, InterruptedException {
        List<TypedDataset> out = new ArrayList<>(plan.size());
        for (int i = 0; i < plan.size(); i++) {
            if (Thread.interrupted()) throw new InterruptedException("range fetch of " + schema.id() + " cancelled");
            out.add(fetchUnit(schema, plan.get(i), end));
            progress(schema.id(), i + 1, plan.size());
        }
        return out;
    }

    private List<TypedDataset> runParallel(EndpointSchema schema, List<FetchUnit> plan, LocalDate end)
            throws RefDataException, IOException, InterruptedException {
        AtomicInteger threadNo = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(workers, plan.size()), r -> {
            Thread t = new Thread(r, "range-" + schema.id() + "-" + threadNo.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        CompletionService<Indexed> done = new ExecutorCompletionService<>(pool);
        List<Future<Indexed>> futures = new ArrayList<>(plan.size());
        try {
            for (int i = 0; i < plan.size(); i++) {
                int idx = i;
                FetchUnit unit = plan.get(i);
                futures.add(done.submit(() -> new Indexed(idx, fetchUnit(schema, unit, end))));
            }
            TypedDataset[] results = new TypedDataset[plan.size()];
            for (int n = 1; n <= plan.size(); n++) {
                Indexed r = done.take().get();
                results[r.index()] = r.dataset();
                progress(schema.id(), n, plan.size());
            }
            return Arrays.asList(results);
        } catch (ExecutionException e) {
            cancelAll(futures);
            throw unwrap(e);
        } catch (InterruptedException e) {
            cancelAll(futures);
            throw e;
        } finally {
            pool.shutdownNow();
        }
    }

    private record Indexed(int index, TypedDataset dataset) {}

    // Empty days and the last day of the range are never cached: upstream may not have published them yet.
    private TypedDataset fetchUnit(EndpointSchema schema, FetchUnit unit, LocalDate end)
            throws RefDataException, IOException, InterruptedException {
        units.inc();
        List<Column> columns = normalizer.columns(schema.id());
        if (cache != null && unit.date() != null) {
            Optional<TypedDataset> hit = cache.read(schema.id(), unit.date(), columns);
            if (hit.isPresent()) return hit.get();
        }
        List<Map<String, Object>> records = fetcher.fetchAll(schema.path(), unit.params(), schema.resultKey());
        TypedDataset ds = normalizer.normalize(schema.id(), records);
        if (cache != null && unit.date() != null && !ds.isEmpty() && unit.date().isBefore(end)) {
            cache.write(schema.id(), unit.date(), ds);
        }
        return ds;
    }

    private static void progress(String endpointId, int done, int total) {
        if (done % PROGRESS_EVERY == 0) log.info("{}: {} / {}", endpointId, done, total);
    }

    private static void cancelAll(List<Future<Indexed>> futures) {
        for (Future<Indexed> f : futures) f.cancel(true);
    }

    private static RuntimeException unwrap(ExecutionException e) throws RefDataException, IOException, InterruptedException {
        Throwable c = e.getCause();
        if (c instanceof RefDataException rde) throw rde;
        if (c instanceof IOException io) throw io;
        if (c instanceof InterruptedException ie) throw ie;
        if (c instanceof UncheckedIOException u) throw u.getCause();
        if (c instanceof RuntimeException re) throw re;
        if (c instanceof Error err) throw err;
        throw new IllegalStateException("unit fetch failed", c);
    }
}
