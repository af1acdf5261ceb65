package dev.notifyqueue.signal;

import dev.notifyqueue.model.CloseReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sink used when no transport is attached. Records each close at debug level.
 */
public final class LoggingCloseSignalSink implements CloseSignalSink {
    private static final Logger logger = LoggerFactory.getLogger(LoggingCloseSignalSink.class);

    @Override
    public void notificationClosed(long id, CloseReason reason) {
        logger.debug("NotificationClosed id={} reason={} (code {})", id, reason, reason.code());
    }
}
