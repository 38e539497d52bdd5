package io.refdata.financial.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.refdata.error.RefDataException;
import io.refdata.financial.http.AuthHeaderProvider;
import io.refdata.financial.http.RetryingHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds the session tokens. The refresh token is obtained from the credentials on first use and kept for the life
 * of the manager; the id token is re-derived from it whenever it has expired. All exchanges happen under the
 * manager's lock, so threads racing on first use trigger a single pair of exchanges. Waiting for the lock is
 * interruptible.
 */
public final class TokenManager implements AuthHeaderProvider {
    private static final Logger log = LoggerFactory.getLogger(TokenManager.class);

    public static final String AUTH_USER_PATH = "token/auth_user";
    public static final String AUTH_REFRESH_PATH = "token/auth_refresh";
    public static final Duration ID_TOKEN_LIFETIME = Duration.ofHours(23);

    private final Credentials credentials;
    private final RetryingHttpClient exchangeClient;
    private final Clock clock;
    private final ObjectMapper mapper;

    private final ReentrantLock lock = new ReentrantLock();

    private String refreshToken;
    private String idToken;
    private Instant expiresAt = Instant.MIN;

    /**
     * @param exchangeClient client without an auth provider; it only issues the two token POSTs
     */
    public TokenManager(Credentials credentials, RetryingHttpClient exchangeClient, Clock clock, ObjectMapper mapper) {
        this.credentials = credentials;
        this.exchangeClient = exchangeClient;
        this.clock = clock;
        this.mapper = mapper;
    }

    @Override
    public Map<String, String> authHeader() throws AuthException, InterruptedException {
        lock.lockInterruptibly();
        try {
            if (refreshToken == null) refreshToken = exchangeCredentials();
            if (idToken == null || !clock.instant().isBefore(expiresAt)) {
                idToken = exchangeRefreshToken();
                expiresAt = clock.instant().plus(ID_TOKEN_LIFETIME);
                log.debug("id token refreshed, valid until {}", expiresAt);
            }
            return Map.of("Authorization", "Bearer " + idToken);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void invalidate() {
        lock.lock();
        try {
            idToken = null;
            expiresAt = Instant.MIN;
        } finally {
            lock.unlock();
        }
    }

    Instant expiresAt() {
        lock.lock();
        try {
            return expiresAt;
        } finally {
            lock.unlock();
        }
    }

    private String exchangeCredentials() throws AuthException, InterruptedException {
        ObjectNode body = mapper.createObjectNode();
        body.put("mailaddress", credentials.address());
        body.put("password", credentials.passcode());
        JsonNode resp = exchange(AUTH_USER_PATH, Map.of(), body.toString());
        log.info("obtained refresh token for {}", credentials.address());
        return field(resp, "refreshToken", AUTH_USER_PATH);
    }

    private String exchangeRefreshToken() throws AuthException, InterruptedException {
        JsonNode resp = exchange(AUTH_REFRESH_PATH, Map.of("refreshtoken", refreshToken), null);
        return field(resp, "idToken", AUTH_REFRESH_PATH);
    }

    private JsonNode exchange(String path, Map<String, String> params, String body) throws AuthException, InterruptedException {
        try {
            return exchangeClient.postExchange(path, params, body);
        } catch (RefDataException e) {
            throw new AuthException(path + " exchange failed: " + e.getMessage(), e);
        }
    }

    private static String field(JsonNode resp, String name, String path) throws AuthException {
        JsonNode v = resp.get(name);
        if (v == null || !v.isTextual() || v.textValue().isBlank()) {
            throw new AuthException(path + " response has no " + name);
        }
        return v.textValue();
    }
}
