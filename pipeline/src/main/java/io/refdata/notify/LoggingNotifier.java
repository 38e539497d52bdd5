package io.refdata.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingNotifier implements Notifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public void send(String message) {
        log.info("notify: {}", message);
    }
}
