package dev.notifyqueue.signal;

import dev.notifyqueue.model.CloseReason;

/**
 * Transport-side receiver of close events, typically the message bus emitting {@code NotificationClosed}.
 *
 * <p>Called exactly once per close of a live notification, on the queue's control thread, after the
 * notification has left the waiting or displayed queue.
 */
@FunctionalInterface
public interface CloseSignalSink {
    void notificationClosed(long id, CloseReason reason);
}
