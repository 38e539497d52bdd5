package io.refdata.financial;

import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.refdata.budget.Budget;
import io.refdata.budget.SimpleBudgetManager;
import io.refdata.config.RefDataConfig;
import io.refdata.financial.auth.Credentials;
import io.refdata.financial.auth.TokenManager;
import io.refdata.financial.http.ApiTransport;
import io.refdata.financial.http.JdkApiTransport;
import io.refdata.financial.http.PaginatedFetcher;
import io.refdata.financial.http.RetryingHttpClient;
import io.refdata.financial.merge.AdjustmentFactorCheck;
import io.refdata.financial.merge.IncrementalMergePipeline;
import io.refdata.financial.merge.TableCatalog;
import io.refdata.financial.merge.TableUpdateRunner;
import io.refdata.financial.range.RangeFetchOrchestrator;
import io.refdata.financial.range.UnitCache;
import io.refdata.financial.schema.DatasetNormalizer;
import io.refdata.financial.schema.EndpointCatalog;
import io.refdata.financial.schema.SubscriptionPlan;
import io.refdata.metrics.Metrics;
import io.refdata.notify.FallbackNotifier;
import io.refdata.notify.FileNotifier;
import io.refdata.notify.Notifier;
import io.refdata.notify.WebhookNotifier;
import io.refdata.store.PartitionedCsvStore;
import io.refdata.store.SnapshotFileStore;
import io.refdata.store.TimeSeriesStore;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.LocalTime;

/**
 * Wires the update job from a {@link RefDataConfig}. The transport is overridable for tests.
 */
public class RefDataModule extends AbstractModule {
    private final RefDataConfig config;
    private final boolean rebuild;

    public RefDataModule(RefDataConfig config, boolean rebuild) {
        this.config = config;
        this.rebuild = rebuild;
    }

    public RefDataModule(RefDataConfig config) { this(config, false); }

    @Override
    protected void configure() {
        bind(RefDataConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton ObjectMapper objectMapper() { return new ObjectMapper(); }

    @Provides @Singleton Clock clock() { return Clock.systemUTC(); }

    @Provides @Singleton Budget budget() { return new SimpleBudgetManager(config.externalQps()); }

    @Provides @Singleton ApiTransport transport() { return new JdkApiTransport(JdkApiTransport.DEFAULT_TIMEOUT); }

    @Provides @Singleton SubscriptionPlan plan() { return SubscriptionPlan.of(config.plan()); }

    @Provides @Singleton EndpointCatalog endpointCatalog(ObjectMapper mapper) { return EndpointCatalog.load(mapper); }

    @Provides @Singleton DatasetNormalizer normalizer(EndpointCatalog catalog, SubscriptionPlan plan) {
        return new DatasetNormalizer(catalog, plan);
    }

    @Provides @Singleton TokenManager tokenManager(ApiTransport transport, Budget budget, Metrics metrics, ObjectMapper mapper, Clock clock) {
        RetryingHttpClient exchange = new RetryingHttpClient(config.baseUrl(), transport,
                RetryingHttpClient.defaultRetryPolicy(), null, budget, metrics.scoped("auth"), mapper);
        return new TokenManager(new Credentials(config.mailAddress(), config.password()), exchange, clock, mapper);
    }

    @Provides @Singleton RetryingHttpClient httpClient(ApiTransport transport, TokenManager tokens, Budget budget, Metrics metrics, ObjectMapper mapper) {
        return new RetryingHttpClient(config.baseUrl(), transport, RetryingHttpClient.defaultRetryPolicy(), tokens, budget, metrics, mapper);
    }

    @Provides @Singleton PaginatedFetcher fetcher(RetryingHttpClient client, Metrics metrics) {
        return new PaginatedFetcher(client, config.maxPages(), metrics);
    }

    @Provides @Singleton RangeFetchOrchestrator orchestrator(PaginatedFetcher fetcher, DatasetNormalizer normalizer, Metrics metrics) {
        UnitCache cache = config.cacheDir() == null ? null : new UnitCache(config.cacheDir());
        return new RangeFetchOrchestrator(fetcher, normalizer, config.workers(), cache, metrics);
    }

    @Provides @Singleton JQuantsApi api(PaginatedFetcher fetcher, DatasetNormalizer normalizer, RangeFetchOrchestrator orchestrator) {
        return new JQuantsApi(fetcher, normalizer, orchestrator);
    }

    @Provides @Singleton TimeSeriesStore store(Clock clock) throws IOException {
        return switch (config.storeKind()) {
            case "partitioned" -> new PartitionedCsvStore(config.dataDir());
            case "snapshot" -> new SnapshotFileStore(config.dataDir(), clock);
            default -> throw new IllegalArgumentException("unknown store kind " + config.storeKind());
        };
    }

    /** Webhook first when one is set; the fallback webhook, else the message file, else the log catches failures. */
    @Provides @Singleton Notifier notifier(Clock clock) throws IOException {
        Notifier local = config.notifyFile() == null ? Notifier.logging() : new FileNotifier(config.notifyFile(), clock);
        if (config.webhookUrl() == null) return local;
        Notifier primary = new WebhookNotifier(URI.create(config.webhookUrl()));
        Notifier fallback = config.fallbackWebhookUrl() == null
                ? local
                : new WebhookNotifier(URI.create(config.fallbackWebhookUrl()));
        return new FallbackNotifier(primary, fallback);
    }

    @Provides @Singleton TableCatalog tables() { return TableCatalog.defaults(LocalTime.of(config.cutoffHour(), 0)); }

    @Provides @Singleton IncrementalMergePipeline pipeline(RangeFetchOrchestrator orchestrator, TimeSeriesStore store, Notifier notifier, Clock clock, Metrics metrics) {
        return IncrementalMergePipeline.builder()
                .orchestrator(orchestrator)
                .store(store)
                .notifier(notifier)
                .clock(clock)
                .zone(config.zone())
                .initialStart(config.initialStart())
                .lookbackMonths(config.lookbackMonths())
                .symbol(config.symbol())
                .rebuild(rebuild)
                .check(new AdjustmentFactorCheck())
                .metrics(metrics)
                .build();
    }

    @Provides @Singleton TableUpdateRunner runner(IncrementalMergePipeline pipeline) {
        return new TableUpdateRunner(pipeline, TableCatalog.DEFAULT_TABLES.size());
    }
}
