package dev.notifyqueue.core;

import dev.notifyqueue.model.CloseReason;
import dev.notifyqueue.model.Notification;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.util.Objects;

/**
 * Engine-owned wrapper around a {@link Notification}, carrying its queue lifecycle state.
 *
 * <p>Callers see instances through read-only views and may hold on to them, but only the engine mutates them.
 * Once archived in history an entry is frozen: its repeat count and close reason no longer change until it is
 * popped back into the waiting queue.
 *
 * <p>A sticky entry never times out, whatever its content asks for.
 */
@Getter
@Setter(AccessLevel.PACKAGE)
public final class QueuedNotification {
    public static final long UNSET = -1L;

    private long id;
    private Notification content;
    private int repeatCount;
    private long createdAtMillis;
    private long displayedAtMillis = UNSET;
    private CloseReason closeReason;
    private boolean redisplayed;
    private boolean sticky;
    private QueueLocation location = QueueLocation.DETACHED;

    QueuedNotification(long id, Notification content, long createdAtMillis) {
        if (id <= 0) {
            throw new IllegalArgumentException("id must be positive, got " + id);
        }
        this.id = id;
        this.content = Objects.requireNonNull(content, "content cannot be null");
        this.createdAtMillis = createdAtMillis;
    }

    void incrementRepeatCount() {
        repeatCount++;
    }

    public boolean isDisplayed() {
        return location == QueueLocation.DISPLAYED;
    }

    @Override
    public String toString() {
        return "QueuedNotification{id=" + id
                + ", app='" + content.appName() + '\''
                + ", summary='" + content.summary() + '\''
                + ", location=" + location
                + ", repeatCount=" + repeatCount
                + (closeReason != null ? ", closeReason=" + closeReason : "")
                + '}';
    }
}
