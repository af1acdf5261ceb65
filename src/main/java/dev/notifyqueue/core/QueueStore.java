package dev.notifyqueue.core;

import dev.notifyqueue.queue.InMemoryNotificationQueue;
import dev.notifyqueue.queue.NotificationQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Owns the waiting, displayed and history sequences and keeps each entry's {@link QueueLocation} in step
 * with the sequence that holds it.
 *
 * <p>Waiting and displayed are disjoint. History is bounded by {@code historyLength} (0 = unbounded);
 * pushing past the bound evicts the oldest entry.
 */
final class QueueStore {
    private static final Logger logger = LoggerFactory.getLogger(QueueStore.class);

    private final NotificationQueue waiting = new InMemoryNotificationQueue();
    private final NotificationQueue displayed = new InMemoryNotificationQueue();
    private final NotificationQueue history = new InMemoryNotificationQueue();

    private final int historyLength;
    private int displayedLimit;

    QueueStore(int displayedLimit, int historyLength) {
        if (historyLength < 0) {
            throw new IllegalArgumentException("historyLength must be non-negative, got " + historyLength);
        }
        setDisplayedLimit(displayedLimit);
        this.historyLength = historyLength;
    }

    NotificationQueue waiting() {
        return waiting;
    }

    NotificationQueue displayed() {
        return displayed;
    }

    NotificationQueue history() {
        return history;
    }

    int displayedLimit() {
        return displayedLimit;
    }

    void setDisplayedLimit(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("displayed limit must be non-negative, got " + limit);
        }
        this.displayedLimit = limit;
    }

    boolean hasDisplaySlot() {
        return displayedLimit == 0 || displayed.size() < displayedLimit;
    }

    void appendWaiting(QueuedNotification entry) {
        entry.setDisplayedAtMillis(QueuedNotification.UNSET);
        entry.setLocation(QueueLocation.WAITING);
        waiting.addLast(entry);
    }

    /**
     * Moves a waiting entry to the tail of displayed and stamps its display time.
     */
    void promote(QueuedNotification entry, long now) {
        if (!waiting.remove(entry)) {
            throw new IllegalStateException("not waiting: " + entry);
        }
        entry.setDisplayedAtMillis(now);
        entry.setLocation(QueueLocation.DISPLAYED);
        displayed.addLast(entry);
    }

    /**
     * Moves displayed entries back to the front of waiting, keeping their relative order.
     */
    void pushBack(List<QueuedNotification> entries) {
        for (int i = entries.size() - 1; i >= 0; i--) {
            QueuedNotification entry = entries.get(i);
            if (!displayed.remove(entry)) {
                throw new IllegalStateException("not displayed: " + entry);
            }
            entry.setDisplayedAtMillis(QueuedNotification.UNSET);
            entry.setLocation(QueueLocation.WAITING);
            waiting.addFirst(entry);
        }
    }

    /**
     * Removes a live entry from whichever of waiting/displayed holds it and marks it detached.
     * @return false if the entry is in neither
     */
    boolean removeLive(QueuedNotification entry) {
        boolean removed;
        switch (entry.getLocation()) {
            case WAITING:
                removed = waiting.remove(entry);
                break;
            case DISPLAYED:
                removed = displayed.remove(entry);
                break;
            default:
                removed = false;
        }
        if (removed) {
            entry.setLocation(QueueLocation.DETACHED);
        }
        return removed;
    }

    /**
     * Puts {@code replacement} at {@code existing}'s position in waiting or displayed.
     */
    void replaceLive(QueuedNotification existing, QueuedNotification replacement, long now) {
        QueueLocation location = existing.getLocation();
        NotificationQueue queue = location == QueueLocation.DISPLAYED ? displayed : waiting;
        if (!location.isLive() || !queue.replace(existing, replacement)) {
            throw new IllegalStateException("not live: " + existing);
        }
        replacement.setLocation(location);
        replacement.setDisplayedAtMillis(location == QueueLocation.DISPLAYED ? now : QueuedNotification.UNSET);
        existing.setLocation(QueueLocation.DETACHED);
    }

    void pushHistory(QueuedNotification entry) {
        entry.setLocation(QueueLocation.HISTORY);
        history.addLast(entry);
        while (historyLength > 0 && history.size() > historyLength) {
            QueuedNotification evicted = history.pollFirst();
            evicted.setLocation(QueueLocation.DETACHED);
            logger.debug("History full ({}), evicted notification {}", historyLength, evicted.getId());
        }
    }

    /**
     * Removes and returns the newest history entry, detached, or null if history is empty.
     */
    QueuedNotification popHistory() {
        QueuedNotification entry = history.pollLast();
        if (entry != null) {
            entry.setLocation(QueueLocation.DETACHED);
        }
        return entry;
    }

    void clear() {
        for (NotificationQueue queue : new NotificationQueue[]{waiting, displayed, history}) {
            for (QueuedNotification entry : queue) {
                entry.setLocation(QueueLocation.DETACHED);
            }
            queue.clear();
        }
    }
}
