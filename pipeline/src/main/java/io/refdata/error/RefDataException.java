package io.refdata.error;

/**
 * Root of the checked failures raised while fetching, normalizing or merging reference data.
 */
public class RefDataException extends Exception {
    public RefDataException(String message) {
        super(message);
    }

    public RefDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
