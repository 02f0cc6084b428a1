package com.crosswatch.infrastructure.notification;

import com.crosswatch.application.ports.NotifierPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Used when Telegram is disabled: notifications go to the log. */
public class ConsoleNotifier implements NotifierPort {

    private static final Logger log = LoggerFactory.getLogger("crosswatch.notify");

    @Override
    public void send(String message) {
        log.info("[NOTIFY] {}", message);
    }
}
