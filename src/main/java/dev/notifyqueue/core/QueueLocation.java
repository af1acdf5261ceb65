package dev.notifyqueue.core;

/**
 * Which collection currently owns a {@link QueuedNotification}.
 */
public enum QueueLocation {
    WAITING,
    DISPLAYED,
    HISTORY,
    /** Removed from every queue; may be handed back through {@code historyPush}. */
    DETACHED;

    public boolean isLive() {
        return this == WAITING || this == DISPLAYED;
    }
}
