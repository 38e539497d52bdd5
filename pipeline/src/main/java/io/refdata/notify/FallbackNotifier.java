package io.refdata.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Sends through {@code primary}; when that fails, reports the failure and the message through {@code fallback}.
 */
public class FallbackNotifier implements Notifier {
    private static final Logger log = LoggerFactory.getLogger(FallbackNotifier.class);

    private final Notifier primary;
    private final Notifier fallback;

    public FallbackNotifier(Notifier primary, Notifier fallback) {
        this.primary = primary;
        this.fallback = fallback;
    }

    @Override
    public void send(String message) throws IOException {
        try {
            primary.send(message);
        } catch (IOException | RuntimeException e) {
            log.warn("primary notifier {} failed, using fallback", primary, e);
            fallback.send("notification failed (" + e + "): " + message);
        }
    }
}
