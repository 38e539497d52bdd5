package io.refdata.financial;

import io.refdata.dataset.TypedDataset;
import io.refdata.error.RefDataException;
import io.refdata.financial.http.PaginatedFetcher;
import io.refdata.financial.range.RangeFetchOrchestrator;
import io.refdata.financial.schema.DatasetNormalizer;
import io.refdata.financial.schema.EndpointSchema;

import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One call per endpoint, each returning the normalized dataset for the given filters. Null arguments are left out
 * of the query.
 */
public class JQuantsApi {
    private static final DateTimeFormatter BASIC = DateTimeFormatter.BASIC_ISO_DATE;

    private final PaginatedFetcher fetcher;
    private final DatasetNormalizer normalizer;
    private final RangeFetchOrchestrator orchestrator;

    public JQuantsApi(PaginatedFetcher fetcher, DatasetNormalizer normalizer, RangeFetchOrchestrator orchestrator) {
        this.fetcher = fetcher;
        this.normalizer = normalizer;
        this.orchestrator = orchestrator;
    }

    public TypedDataset listedInfo(String code, LocalDate date) throws RefDataException, InterruptedException {
        return call("listed_info", query("code", code, "date", date));
    }

    public TypedDataset dailyQuotes(String code, LocalDate date) throws RefDataException, InterruptedException {
        return call("daily_quotes", query("code", code, "date", date));
    }

    public TypedDataset dailyQuotes(String code, LocalDate from, LocalDate to) throws RefDataException, InterruptedException {
        Map<String, String> q = query("code", code, "from", from);
        putDate(q, "to", to);
        return call("daily_quotes", q);
    }

    public TypedDataset statements(String code, LocalDate date) throws RefDataException, InterruptedException {
        return call("statements", query("code", code, "date", date));
    }

    /** Earnings announcements scheduled for the next business day. */
    public TypedDataset announcement() throws RefDataException, InterruptedException {
        return call("announcement", Map.of());
    }

    public TypedDataset dividend(String code, LocalDate date) throws RefDataException, InterruptedException {
        return call("dividend", query("code", code, "date", date));
    }

    public TypedDataset indexOption(LocalDate date) throws RefDataException, InterruptedException {
        return call("index_option", query(null, null, "date", date));
    }

    /** Trading by investor type; both bounds null fetches the whole history. */
    public TypedDataset tradesSpec(LocalDate from, LocalDate to) throws RefDataException, InterruptedException {
        Map<String, String> q = query(null, null, "from", from);
        putDate(q, "to", to);
        return call("trades_spec", q);
    }

    public TypedDataset weeklyMarginInterest(String code, LocalDate date) throws RefDataException, InterruptedException {
        return call("weekly_margin_interest", query("code", code, "date", date));
    }

    public TypedDataset shortSelling(LocalDate date) throws RefDataException, InterruptedException {
        return call("short_selling", query(null, null, "date", date));
    }

    public TypedDataset breakdown(String code, LocalDate date) throws RefDataException, InterruptedException {
        return call("breakdown", query("code", code, "date", date));
    }

    public TypedDataset topix(LocalDate from, LocalDate to) throws RefDataException, InterruptedException {
        Map<String, String> q = query(null, null, "from", from);
        putDate(q, "to", to);
        return call("topix", q);
    }

    /** Whole-range fetch using the endpoint's own step. */
    public Optional<TypedDataset> range(String endpointId, LocalDate start, LocalDate end)
            throws RefDataException, IOException, InterruptedException {
        return orchestrator.fetchRange(endpointId, start, end);
    }

    private TypedDataset call(String endpointId, Map<String, String> params) throws RefDataException, InterruptedException {
        EndpointSchema schema = normalizer.catalog().get(endpointId);
        return normalizer.normalize(endpointId, fetcher.fetchAll(schema.path(), params, schema.resultKey()));
    }

    private static Map<String, String> query(String codeKey, String code, String dateKey, LocalDate date) {
        Map<String, String> q = new LinkedHashMap<>();
        if (codeKey != null && code != null && !code.isBlank()) q.put(codeKey, code);
        putDate(q, dateKey, date);
        return q;
    }

    private static void putDate(Map<String, String> q, String key, LocalDate d) {
        if (d != null) q.put(key, BASIC.format(d));
    }
}
