package io.refdata.financial.http;

import io.refdata.error.RefDataException;

import java.util.Map;

public interface AuthHeaderProvider {
    Map<String, String> authHeader() throws RefDataException, InterruptedException;

    /** Forget the current short-lived credential so the next call derives a fresh one. */
    default void invalidate() {}
}
