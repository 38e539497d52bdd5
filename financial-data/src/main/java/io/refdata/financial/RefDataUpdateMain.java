package io.refdata.financial;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.refdata.config.RefDataConfig;
import io.refdata.financial.merge.MergeOutcome;
import io.refdata.financial.merge.TableCatalog;
import io.refdata.financial.merge.TableSpec;
import io.refdata.financial.merge.TableUpdateRunner;
import io.refdata.financial.schema.SubscriptionPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.file.Path;
import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI that brings the reference-data tables up to date. Credentials, endpoint and the remaining settings come from
 * {@link RefDataConfig#fromEnv()}; the options below override them.
 */
@CommandLine.Command(name = "refdata-update", mixinStandardHelpOptions = true,
        description = "Fetch missing days from the market-data API and merge them into the local store")
public final class RefDataUpdateMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(RefDataUpdateMain.class);
    private static final Set<String> STORE_KINDS = Set.of("partitioned", "snapshot");

    @CommandLine.Option(names = {"-t", "--table"}, split = ",", description = "Tables to update (comma-separated or repeat option)",
            defaultValue = "list,price,topix")
    List<String> tables = new ArrayList<>();

    @CommandLine.Option(names = {"-d", "--data-dir"}, description = "Store root directory")
    Path dataDir;

    @CommandLine.Option(names = {"-s", "--store"}, description = "Store kind: partitioned or snapshot")
    String store;

    @CommandLine.Option(names = {"-w", "--workers"}, description = "Parallel fetch workers per table")
    Integer workers;

    @CommandLine.Option(names = {"-r", "--rebuild"}, description = "Ignore stored rows and refetch from the initial start date")
    boolean rebuild;

    @CommandLine.Option(names = {"-p", "--plan"}, description = "Subscription plan: LIGHT, STANDARD or PREMIUM")
    String plan;

    public static void main(String[] args) {
        int code = new CommandLine(new RefDataUpdateMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        RefDataConfig config;
        try {
            config = RefDataConfig.fromEnv();
        } catch (IllegalArgumentException | DateTimeException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            return 2;
        }
        if (dataDir != null) config = config.withDataDir(dataDir);
        if (store != null) config = config.withStoreKind(store);
        if (workers != null) config = config.withWorkers(workers);
        if (plan != null) config = config.withPlan(plan);

        if (!STORE_KINDS.contains(config.storeKind())) {
            System.err.println("Unknown store kind: " + config.storeKind() + " (expected one of " + STORE_KINDS + ")");
            return 2;
        }
        try {
            SubscriptionPlan.of(config.plan());
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            return 2;
        }
        if (!config.hasCredentials()) {
            System.err.println("No API credentials: set REFDATA_MAIL and REFDATA_PASSWORD");
            return 2;
        }

        Injector injector = Guice.createInjector(new RefDataModule(config, rebuild));
        TableCatalog catalog = injector.getInstance(TableCatalog.class);
        List<TableSpec> selected = new ArrayList<>();
        for (String name : tables) {
            String t = name.trim();
            if (t.isEmpty()) continue;
            if (!catalog.contains(t)) {
                System.err.println("Unknown table: " + t + " (known: " + catalog.names() + ")");
                return 2;
            }
            selected.add(catalog.get(t));
        }
        if (selected.isEmpty()) {
            System.err.println("No tables selected");
            return 2;
        }

        log.info("updating {} with {}", selected.stream().map(TableSpec::name).toList(), config);
        List<TableUpdateRunner.TableResult> results = injector.getInstance(TableUpdateRunner.class).runAll(selected);

        int failed = 0;
        System.out.println("Per-table summary:");
        for (TableUpdateRunner.TableResult r : results) {
            if (r.ok()) {
                MergeOutcome o = r.outcome();
                System.out.println("  " + r.table() + ": " + o.state() + " window=" + o.window()
                        + " fetched=" + o.rowsFetched() + " stored=" + o.rowsPersisted());
            } else {
                failed++;
                System.out.println("  " + r.table() + ": FAILED " + r.error());
            }
        }
        MetricRegistry registry = injector.getInstance(MetricRegistry.class);
        System.out.println("HTTP attempts=" + registry.counter("http.attempts").getCount()
                + " retries=" + registry.counter("http.retries").getCount()
                + " pages=" + registry.counter("pages.fetched").getCount());
        return failed == 0 ? 0 : 1;
    }
}
