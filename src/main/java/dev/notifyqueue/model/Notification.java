package dev.notifyqueue.model;

import lombok.Builder;

import java.util.Objects;

/**
 * Immutable content of a notification as handed to the queues.
 *
 * <p>Fields are assumed normalized by the transport layer. The queues never modify a {@code Notification};
 * lifecycle state (assigned id, repeat count, timestamps, close reason) lives on the engine-owned wrapper.
 *
 * @param replacesId     id of the live notification this one replaces, or {@code 0} for a fresh arrival
 * @param appName        sending application, part of the duplicate key
 * @param summary        summary line, part of the duplicate key
 * @param body           body text, part of the duplicate key
 * @param urgency        urgency level, selects the default timeout
 * @param transientHint  whether the notification uses the shortened, idle-insensitive lifetime
 * @param timeoutMillis  {@link #DEFAULT_TIMEOUT} for the urgency default, {@code 0} for never, otherwise an override
 * @param stackTag       optional tag; a fresh arrival replaces the live notification with the same tag and app
 * @param progress       progress value, or {@link #NO_PROGRESS}
 * @param fullscreen     behavior while the desktop is fullscreen
 * @param historyIgnore  discard instead of archiving when closed
 */
@Builder(toBuilder = true)
public record Notification(
        long replacesId,
        String appName,
        String summary,
        String body,
        Urgency urgency,
        boolean transientHint,
        long timeoutMillis,
        String stackTag,
        int progress,
        FullscreenBehavior fullscreen,
        boolean historyIgnore
) {
    public static final long DEFAULT_TIMEOUT = -1;
    public static final int NO_PROGRESS = -1;

    public Notification {
        if (replacesId < 0) {
            throw new IllegalArgumentException("replacesId must be non-negative, got " + replacesId);
        }
        if (timeoutMillis < DEFAULT_TIMEOUT) {
            throw new IllegalArgumentException("timeoutMillis must be -1, 0 or positive, got " + timeoutMillis);
        }
        appName = Objects.requireNonNullElse(appName, "");
        summary = Objects.requireNonNullElse(summary, "");
        body = Objects.requireNonNullElse(body, "");
        urgency = Objects.requireNonNullElse(urgency, Urgency.NORMAL);
        fullscreen = Objects.requireNonNullElse(fullscreen, FullscreenBehavior.SHOW);
    }

    /**
     * Builder preset with the protocol defaults: urgency default timeout and no progress.
     */
    public static NotificationBuilder builder() {
        return new NotificationBuilder()
                .timeoutMillis(DEFAULT_TIMEOUT)
                .progress(NO_PROGRESS);
    }

    public boolean hasStackTag() {
        return stackTag != null && !stackTag.isEmpty();
    }

    /**
     * Returns a copy of this content addressed at the given live id.
     */
    public Notification withReplacesId(long id) {
        return toBuilder().replacesId(id).build();
    }
}
