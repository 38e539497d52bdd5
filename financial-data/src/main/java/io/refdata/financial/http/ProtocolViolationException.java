package io.refdata.financial.http;

import io.refdata.error.RefDataException;

/** The server answered 2xx but the body breaks the response contract (bad JSON, missing results, endless paging). */
public class ProtocolViolationException extends RefDataException {
    public ProtocolViolationException(String message) { super(message); }
    public ProtocolViolationException(String message, Throwable cause) { super(message, cause); }
}
