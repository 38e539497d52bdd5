package io.refdata.notify;

import java.io.IOException;

/**
 * Outbound status messages. Callers treat delivery as best effort and log failures instead of aborting.
 */
public interface Notifier {
    void send(String message) throws IOException;

    static Notifier logging() { return new LoggingNotifier(); }
}
