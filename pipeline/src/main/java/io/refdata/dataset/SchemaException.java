package io.refdata.dataset;

import io.refdata.error.RefDataException;

/**
 * A value or column set does not match the declared schema. Signals an upstream contract break and is never retried.
 */
public class SchemaException extends RefDataException {
    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
