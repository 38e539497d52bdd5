package io.refdata.financial.merge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Updates several tables side by side. Tables are independent: one failing does not stop the others, and its
 * failure is reported in its {@link TableResult}.
 */
public class TableUpdateRunner {
    private static final Logger log = LoggerFactory.getLogger(TableUpdateRunner.class);

    private final IncrementalMergePipeline pipeline;
    private final int parallelism;

    public TableUpdateRunner(IncrementalMergePipeline pipeline, int parallelism) {
        this.pipeline = pipeline;
        this.parallelism = Math.max(1, parallelism);
    }

    public record TableResult(String table, MergeOutcome outcome, Exception error) {
        public boolean ok() { return error == null; }
    }

    /** Results in the order of {@code tables}. */
    public List<TableResult> runAll(List<TableSpec> tables) throws InterruptedException {
        if (tables.isEmpty()) return List.of();
        AtomicInteger threadNo = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, tables.size()), r -> {
            Thread t = new Thread(r, "table-update-" + threadNo.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        List<Future<MergeOutcome>> futures = new ArrayList<>(tables.size());
        try {
            for (TableSpec spec : tables) futures.add(pool.submit(() -> pipeline.run(spec)));
            List<TableResult> out = new ArrayList<>(tables.size());
            for (int i = 0; i < tables.size(); i++) {
                String name = tables.get(i).name();
                try {
                    out.add(new TableResult(name, futures.get(i).get(), null));
                } catch (ExecutionException e) {
                    Exception cause = e.getCause() instanceof Exception ex ? ex : e;
                    log.error("update of {} failed", name, cause);
                    out.add(new TableResult(name, null, cause));
                }
            }
            return out;
        } catch (InterruptedException e) {
            for (Future<MergeOutcome> f : futures) f.cancel(true);
            throw e;
        } finally {
            pool.shutdownNow();
        }
    }
}
