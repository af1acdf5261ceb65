package dev.notifyqueue.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps live ids to the single waiting or displayed entry holding them, and hands out new ids.
 *
 * <p>Ids are assigned from a monotonic counter and never reuse {@code 0}. Explicitly supplied ids advance
 * the counter so a later fresh id is always greater than any id seen so far. History entries are not
 * registered: an id is retired as soon as its entry leaves waiting/displayed.
 */
final class NotificationRegistry {
    private static final Logger logger = LoggerFactory.getLogger(NotificationRegistry.class);

    private final IdSequence ids;
    private final Map<Long, QueuedNotification> live = new HashMap<>();

    NotificationRegistry(IdSequence ids) {
        this.ids = Objects.requireNonNull(ids, "ids cannot be null");
    }

    long nextId() {
        return ids.next();
    }

    /**
     * Records an id chosen by the caller rather than by {@link #nextId()}.
     */
    void observeExplicitId(long id) {
        long before = ids.current();
        if (ids.skipPast(id)) {
            logger.debug("Advancing id sequence from {} to explicit id {}", before, id);
        }
    }

    void register(QueuedNotification entry) {
        QueuedNotification previous = live.putIfAbsent(entry.getId(), entry);
        if (previous != null && previous != entry) {
            throw new IllegalStateException("id " + entry.getId() + " is already live: " + previous);
        }
    }

    QueuedNotification lookup(long id) {
        return live.get(id);
    }

    boolean isLive(long id) {
        return live.containsKey(id);
    }

    /**
     * Drops the id mapping if it still points at {@code entry}.
     */
    boolean retire(QueuedNotification entry) {
        return live.remove(entry.getId(), entry);
    }

    int size() {
        return live.size();
    }

    void clear() {
        live.clear();
    }
}
