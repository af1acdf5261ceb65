package dev.notifyqueue.queue;

import dev.notifyqueue.core.QueuedNotification;

import java.util.Iterator;
import java.util.List;

/**
 * A minimal ordered sequence of queued notifications.
 *
 * Covers the subset of deque and list operations the queue store needs:
 * - pollFirst / pollLast
 * - addFirst / addLast
 * - remove and in-place replace of a given entry
 * - size, isEmpty, clear
 * - iteration in queue order (Iterable)
 *
 * Entries are compared by identity.
 */
public interface NotificationQueue extends Iterable<QueuedNotification> {
    QueuedNotification pollFirst();

    QueuedNotification pollLast();

    void addFirst(QueuedNotification e);

    void addLast(QueuedNotification e);

    /**
     * Removes the given entry.
     * @return true if it was a member
     */
    boolean remove(QueuedNotification e);

    /**
     * Puts {@code replacement} at the position currently held by {@code existing}.
     * @return false if {@code existing} is not a member, in which case nothing changes
     */
    boolean replace(QueuedNotification existing, QueuedNotification replacement);

    int size();

    boolean isEmpty();

    void clear();

    /**
     * Immutable copy of the current members in queue order.
     */
    List<QueuedNotification> snapshot();

    @Override
    Iterator<QueuedNotification> iterator();
}
