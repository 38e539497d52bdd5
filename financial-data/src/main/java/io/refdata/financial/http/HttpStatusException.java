package io.refdata.financial.http;

import io.refdata.error.RefDataException;

/**
 * A request that ended without a usable 2xx response. Status 0 means no response was received at all.
 */
public class HttpStatusException extends RefDataException {
    private final int status;
    private final String body;

    public HttpStatusException(int status, String body, String message) {
        super(message);
        this.status = status;
        this.body = body;
    }

    public HttpStatusException(int status, String body, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.body = body;
    }

    public int status() { return status; }
    public String body() { return body; }
}
