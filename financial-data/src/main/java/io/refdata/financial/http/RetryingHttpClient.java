package io.refdata.financial.http;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Timer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.refdata.budget.Budget;
import io.refdata.error.RefDataException;
import io.refdata.metrics.Metrics;
import io.refdata.retry.ExponentialBackoffRetryPolicy;
import io.refdata.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * JSON-over-HTTP client with bounded retries. Status 429, 500, 502, 503 and 504, request timeouts and connection
 * failures are transient and retried while the {@link RetryPolicy} allows; every other non-2xx status fails on the
 * attempt that produced it.
 */
public class RetryingHttpClient {
    private static final Logger log = LoggerFactory.getLogger(RetryingHttpClient.class);

    public static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 500, 502, 503, 504);

    private final String baseUrl;
    private final ApiTransport transport;
    private final RetryPolicy retry;
    private final AuthHeaderProvider auth;
    private final Budget budget;
    private final ObjectMapper mapper;

    private final Counter attempts;
    private final Counter retries;
    private final Counter failures;
    private final Timer requestTime;

    /**
     * @param auth supplies the bearer header for {@link #get}; may be null for a client that only performs
     *             token exchanges
     */
    public RetryingHttpClient(String baseUrl, ApiTransport transport, RetryPolicy retry, AuthHeaderProvider auth,
                              Budget budget, Metrics metrics, ObjectMapper mapper) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.transport = transport;
        this.retry = retry;
        this.auth = auth;
        this.budget = budget == null ? Budget.unlimited() : budget;
        this.mapper = mapper;
        this.attempts = metrics.counter("http.attempts");
        this.retries = metrics.counter("http.retries");
        this.failures = metrics.counter("http.failures");
        this.requestTime = metrics.timer("http.request.time");
    }

    /** Three attempts in total, 0.5s then 1s between them. */
    public static RetryPolicy defaultRetryPolicy() {
        return retryPolicy(3, 500, 8_000);
    }

    /** Backoff policy that only retries {@link #isTransient transient} failures. */
    public static RetryPolicy retryPolicy(int maxAttempts, long baseMillis, long maxMillis) {
        return new ExponentialBackoffRetryPolicy(maxAttempts, baseMillis, maxMillis, RetryingHttpClient::isTransient);
    }

    /** Authenticated GET. */
    public JsonNode get(String path, Map<String, String> params) throws RefDataException, InterruptedException {
        if (auth == null) throw new IllegalStateException("client has no auth header provider");
        URI uri = uri(path, params);
        return execute(() -> ApiRequest.get(uri, auth.authHeader()));
    }

    /** Unauthenticated POST used for credential and token exchanges. Retried like a GET. */
    public JsonNode postExchange(String path, Map<String, String> params, String jsonBody)
            throws RefDataException, InterruptedException {
        URI uri = uri(path, params);
        Map<String, String> headers = jsonBody == null ? Map.of() : Map.of("Content-Type", "application/json");
        return execute(() -> ApiRequest.post(uri, headers, jsonBody));
    }

    @FunctionalInterface
    private interface RequestFactory {
        ApiRequest create() throws RefDataException, InterruptedException;
    }

    private JsonNode execute(RequestFactory factory) throws RefDataException, InterruptedException {
        int attempt = 0;
        while (true) {
            attempt++;
            // built per attempt so a token refreshed between attempts is picked up
            ApiRequest request = factory.create();
            budget.acquireExternalOp();
            attempts.inc();
            HttpStatusException failure;
            try (Timer.Context ignored = requestTime.time()) {
                ApiResponse resp = transport.send(request);
                if (resp.isSuccess()) return parse(request, resp);
                failure = new HttpStatusException(resp.status(), resp.body(),
                        request.method() + " " + describe(request.uri()) + " returned " + resp.status());
                if (resp.status() == 401 && auth != null) auth.invalidate();
            } catch (HttpTimeoutException e) {
                failure = new RequestTimeoutException(request.method() + " " + describe(request.uri()) + " timed out", e);
            } catch (IOException e) {
                failure = new HttpStatusException(0, "", request.method() + " " + describe(request.uri()) + " failed: " + e, e);
            }
            if (!retry.shouldRetry(attempt, failure)) {
                failures.inc();
                throw failure;
            }
            retries.inc();
            long backoff = retry.backoffMillis(attempt);
            log.warn("attempt {}/{} of {} {} failed ({}), retrying in {}ms", attempt, retry.maxAttempts(),
                    request.method(), describe(request.uri()), failure.getMessage(), backoff);
            if (backoff > 0) Thread.sleep(backoff);
        }
    }

    static boolean isTransient(Exception e) {
        return e instanceof HttpStatusException h && (h.status() == 0 || RETRYABLE_STATUSES.contains(h.status()));
    }

    private JsonNode parse(ApiRequest request, ApiResponse resp) throws ProtocolViolationException {
        String body = resp.body();
        if (body == null || body.isBlank()) return mapper.createObjectNode();
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProtocolViolationException("malformed JSON from " + describe(request.uri()), e);
        }
    }

    URI uri(String path, Map<String, String> params) {
        StringBuilder sb = new StringBuilder(baseUrl).append('/').append(path.startsWith("/") ? path.substring(1) : path);
        if (params != null && !params.isEmpty()) {
            char sep = '?';
            for (Map.Entry<String, String> e : new LinkedHashMap<>(params).entrySet()) {
                if (e.getValue() == null) continue;
                sb.append(sep).append(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8))
                        .append('=').append(URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8));
                sep = '&';
            }
        }
        return URI.create(sb.toString());
    }

    // query strings may carry refresh tokens
    private static String describe(URI uri) {
        return uri.getPath();
    }
}
