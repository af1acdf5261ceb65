package dev.notifyqueue.queue;

import dev.notifyqueue.core.QueuedNotification;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Simple in-memory implementation backed by ArrayList.
 * Queues are bounded in practice by the displayed limit and history length, so linear scans are fine.
 */
public final class InMemoryNotificationQueue implements NotificationQueue {
    private final List<QueuedNotification> items = new ArrayList<>();

    @Override
    public QueuedNotification pollFirst() {
        return items.isEmpty() ? null : items.remove(0);
    }

    @Override
    public QueuedNotification pollLast() {
        return items.isEmpty() ? null : items.remove(items.size() - 1);
    }

    @Override
    public void addFirst(QueuedNotification e) {
        items.add(0, e);
    }

    @Override
    public void addLast(QueuedNotification e) {
        items.add(e);
    }

    @Override
    public boolean remove(QueuedNotification e) {
        int idx = indexOf(e);
        if (idx < 0) {
            return false;
        }
        items.remove(idx);
        return true;
    }

    @Override
    public boolean replace(QueuedNotification existing, QueuedNotification replacement) {
        int idx = indexOf(existing);
        if (idx < 0) {
            return false;
        }
        items.set(idx, replacement);
        return true;
    }

    @Override
    public int size() {
        return items.size();
    }

    @Override
    public boolean isEmpty() {
        return items.isEmpty();
    }

    @Override
    public void clear() {
        items.clear();
    }

    @Override
    public List<QueuedNotification> snapshot() {
        return List.copyOf(items);
    }

    @Override
    public Iterator<QueuedNotification> iterator() {
        return Collections.unmodifiableList(items).iterator();
    }

    // identity, not equals: two entries may carry equal content
    private int indexOf(QueuedNotification e) {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i) == e) {
                return i;
            }
        }
        return -1;
    }
}
