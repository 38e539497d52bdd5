package io.refdata.financial.auth;

import io.refdata.error.RefDataException;

/**
 * Credentials were rejected or a refresh token no longer works. Not recoverable in-process: build a new
 * {@link TokenManager} with valid credentials.
 */
public class AuthException extends RefDataException {
    public AuthException(String message) { super(message); }
    public AuthException(String message, Throwable cause) { super(message, cause); }
}
