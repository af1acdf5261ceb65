package dev.notifyqueue.api;

import dev.notifyqueue.core.QueuedNotification;
import dev.notifyqueue.model.CloseReason;
import dev.notifyqueue.model.Notification;

import java.util.List;

/**
 * Queue management for a notification daemon: waiting, displayed and history.
 *
 * Semantics:
 * - Notifications arrive into waiting, are promoted to displayed by {@link #update(boolean)} up to the
 *   displayed limit, and leave through a close, which archives them in history according to the close reason.
 * - A live id (waiting or displayed) is unique. History entries keep their id but are frozen.
 * - Not-found targets are not errors: replace reports {@code false}, close and history pop do nothing.
 * - Operations are synchronous and meant for a single control thread. Callers must resynchronize the display
 *   after any operation that changes waiting or displayed; the queues never render.
 * - Every operation throws {@link IllegalStateException} once the queues are closed.
 */
public interface NotificationQueues extends AutoCloseable {

    /** Returned by {@link #getNextDataChange(long)} when no displayed notification will change. */
    long NO_DATA_CHANGE = -1L;

    /**
     * Sets the displayed cap applied by the next {@link #update(boolean)}; 0 means unlimited.
     * Lowering the cap does not evict notifications already displayed.
     */
    void setDisplayedLimit(int limit);

    /**
     * Displayed notifications in display order, as an immutable snapshot. Entries are read-only.
     */
    List<QueuedNotification> getDisplayed();

    List<QueuedNotification> getWaiting();

    /**
     * History, oldest first.
     */
    List<QueuedNotification> getHistory();

    int lengthWaiting();

    int lengthDisplayed();

    int lengthHistory();

    /**
     * Inserts a notification.
     *
     * <ul>
     *   <li>{@code replacesId != 0}: replaces the live notification with that id in place, or appends to
     *       waiting under that id if there is none.</li>
     *   <li>{@code replacesId == 0} with a stack tag matching a live notification: replaces it in place under
     *       a new id.</li>
     *   <li>{@code replacesId == 0} duplicating a live notification: merges into it and returns {@code 0}.</li>
     *   <li>otherwise: appends to waiting under a new id.</li>
     * </ul>
     *
     * @return the id of the resulting entry, or {@code 0} if the notification was merged into an existing one
     */
    long insert(Notification notification);

    /**
     * Replaces, in place, the live notification whose id equals {@code notification.replacesId()}.
     *
     * @return true if found and replaced; false leaves every queue untouched
     * @throws IllegalArgumentException if {@code replacesId} is 0
     */
    boolean replaceById(Notification notification);

    /**
     * Closes the live notification with the given id; does nothing if there is none.
     */
    void closeById(long id, CloseReason reason);

    /**
     * Closes a notification previously obtained from these queues. Ownership passes to the queues.
     * Does nothing if the entry is no longer waiting or displayed.
     */
    void closeNotification(QueuedNotification notification, CloseReason reason);

    /**
     * Moves the newest history entry back to the tail of waiting, clearing its close reason.
     * Does nothing if history is empty.
     */
    void historyPop();

    /**
     * Archives an entry that is no longer in waiting or displayed.
     *
     * @throws IllegalStateException if the entry is still queued or already in history
     */
    void historyPush(QueuedNotification notification);

    /**
     * Closes every waiting, then every displayed notification as dismissed by the user.
     */
    void historyPushAll();

    /**
     * Closes displayed notifications whose timeout has passed.
     *
     * @param idle       whether the user is idle; non-transient notifications do not age while idle
     * @param fullscreen whether a fullscreen window is active; overrides idle
     */
    void checkTimeouts(boolean idle, boolean fullscreen);

    /**
     * Promotes waiting notifications to displayed, oldest first, up to the displayed limit.
     * Does nothing while paused.
     *
     * @param fullscreen whether a fullscreen window is active; delayed notifications stay waiting
     */
    void update(boolean fullscreen);

    /**
     * Milliseconds from {@code now} until a displayed notification next changes visibly (timeout or age label),
     * or {@link #NO_DATA_CHANGE}.
     */
    long getNextDataChange(long now);

    void pauseOn();

    void pauseOff();

    boolean isPaused();

    QueueSnapshot snapshot();

    /**
     * {@link #snapshot()} in its JSON wire form, for history listings.
     */
    byte[] exportSnapshot();

    /**
     * Tears the queues down, releasing every notification in every queue. Idempotent.
     */
    @Override
    void close();
}
