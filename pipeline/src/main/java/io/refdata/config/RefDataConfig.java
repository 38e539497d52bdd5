package io.refdata.config;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Process configuration. Each value is read from a system property first, then an environment variable,
 * then falls back to a default.
 */
public record RefDataConfig(
        String baseUrl,
        String mailAddress,
        String password,
        Path dataDir,
        String storeKind,
        int workers,
        long externalQps,
        String plan,
        ZoneId zone,
        int cutoffHour,
        LocalDate initialStart,
        int lookbackMonths,
        String symbol,
        String webhookUrl,
        String fallbackWebhookUrl,
        Path cacheDir,
        int maxPages,
        Path notifyFile
) {
    public static final String DEFAULT_BASE_URL = "https://api.jquants.com/v1";

    public static RefDataConfig fromEnv() {
        String baseUrl = setting("refdata.baseUrl", "REFDATA_BASE_URL", DEFAULT_BASE_URL);
        String mail = setting("refdata.mail", "REFDATA_MAIL", "");
        String password = setting("refdata.password", "REFDATA_PASSWORD", "");
        Path dataDir = Path.of(setting("refdata.dataDir", "REFDATA_DATA_DIR", "data"));
        String store = setting("refdata.store", "REFDATA_STORE", "partitioned");
        int workers = Integer.parseInt(setting("refdata.workers", "REFDATA_WORKERS", "1"));
        long qps = Long.parseLong(setting("refdata.qps", "REFDATA_QPS", "5"));
        String plan = setting("refdata.plan", "REFDATA_PLAN", "PREMIUM");
        ZoneId zone = ZoneId.of(setting("refdata.zone", "REFDATA_ZONE", "Asia/Tokyo"));
        int cutoff = Integer.parseInt(setting("refdata.cutoffHour", "REFDATA_CUTOFF_HOUR", "19"));
        LocalDate initial = LocalDate.parse(setting("refdata.initialStart", "REFDATA_INITIAL_START", "2024-01-01"));
        int lookback = Integer.parseInt(setting("refdata.lookbackMonths", "REFDATA_LOOKBACK_MONTHS", "1"));
        String symbol = setting("refdata.symbol", "REFDATA_SYMBOL", "jquants_api");
        String webhook = blankToNull(setting("refdata.webhookUrl", "REFDATA_WEBHOOK_URL", ""));
        String fallback = blankToNull(setting("refdata.fallbackWebhookUrl", "REFDATA_FALLBACK_WEBHOOK_URL", ""));
        String cache = blankToNull(setting("refdata.cacheDir", "REFDATA_CACHE_DIR", ""));
        int maxPages = Integer.parseInt(setting("refdata.maxPages", "REFDATA_MAX_PAGES", "10000"));
        String notifyFile = blankToNull(setting("refdata.notifyFile", "REFDATA_NOTIFY_FILE", ""));
        return new RefDataConfig(baseUrl, mail, password, dataDir, store, workers, qps, plan, zone, cutoff,
                initial, lookback, symbol, webhook, fallback, cache == null ? null : Path.of(cache), maxPages,
                notifyFile == null ? null : Path.of(notifyFile));
    }

    public RefDataConfig withDataDir(Path dir) {
        return new RefDataConfig(baseUrl, mailAddress, password, dir, storeKind, workers, externalQps, plan, zone,
                cutoffHour, initialStart, lookbackMonths, symbol, webhookUrl, fallbackWebhookUrl, cacheDir, maxPages,
                notifyFile);
    }

    public RefDataConfig withStoreKind(String kind) {
        return new RefDataConfig(baseUrl, mailAddress, password, dataDir, kind, workers, externalQps, plan, zone,
                cutoffHour, initialStart, lookbackMonths, symbol, webhookUrl, fallbackWebhookUrl, cacheDir, maxPages,
                notifyFile);
    }

    public RefDataConfig withWorkers(int n) {
        return new RefDataConfig(baseUrl, mailAddress, password, dataDir, storeKind, Math.max(1, n), externalQps, plan,
                zone, cutoffHour, initialStart, lookbackMonths, symbol, webhookUrl, fallbackWebhookUrl, cacheDir, maxPages,
                notifyFile);
    }

    public RefDataConfig withPlan(String p) {
        return new RefDataConfig(baseUrl, mailAddress, password, dataDir, storeKind, workers, externalQps, p, zone,
                cutoffHour, initialStart, lookbackMonths, symbol, webhookUrl, fallbackWebhookUrl, cacheDir, maxPages,
                notifyFile);
    }

    public boolean hasCredentials() {
        return !mailAddress.isBlank() && !password.isBlank();
    }

    @Override
    public String toString() {
        // keep the password out of logs
        return "RefDataConfig{baseUrl=" + baseUrl + ", mailAddress=" + mailAddress + ", dataDir=" + dataDir
                + ", store=" + storeKind + ", workers=" + workers + ", qps=" + externalQps + ", plan=" + plan
                + ", zone=" + zone + ", cutoffHour=" + cutoffHour + ", initialStart=" + initialStart
                + ", lookbackMonths=" + lookbackMonths + ", symbol=" + symbol + ", cacheDir=" + cacheDir
                + ", maxPages=" + maxPages + ", notifyFile=" + notifyFile + "}";
    }

    static String setting(String property, String env, String fallback) {
        return System.getProperty(property, System.getenv().getOrDefault(env, fallback));
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
