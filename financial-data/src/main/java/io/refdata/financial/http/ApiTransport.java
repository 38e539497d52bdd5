package io.refdata.financial.http;

import java.io.IOException;

/**
 * One HTTP exchange, no retries. Implementations throw {@link java.net.http.HttpTimeoutException} when the request
 * timeout elapses and other {@link IOException}s when no response arrives.
 */
public interface ApiTransport {
    ApiResponse send(ApiRequest request) throws IOException, InterruptedException;
}
