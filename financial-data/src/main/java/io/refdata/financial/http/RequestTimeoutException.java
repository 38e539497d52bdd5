package io.refdata.financial.http;

public class RequestTimeoutException extends HttpStatusException {
    public RequestTimeoutException(String message, Throwable cause) {
        super(0, "", message, cause);
    }
}
