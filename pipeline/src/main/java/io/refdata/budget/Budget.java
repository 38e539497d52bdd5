package io.refdata.budget;

/**
 * Budget governs how fast the process may call external services.
 */
public interface Budget extends AutoCloseable {
    /** Block as needed to respect external QPS budget (one op). */
    void acquireExternalOp() throws InterruptedException;

    @Override
    default void close() {}

    static Budget unlimited() {
        return new SimpleBudgetManager(0);
    }
}
