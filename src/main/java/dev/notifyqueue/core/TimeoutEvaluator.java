package dev.notifyqueue.core;

import dev.notifyqueue.config.QueueConfig;
import dev.notifyqueue.model.Notification;
import dev.notifyqueue.model.Urgency;

import java.util.Objects;
import java.util.Set;

/**
 * Computes how long a displayed notification may stay on screen and when the next visible change happens.
 *
 * <p>All times are in milliseconds on the engine clock.
 */
final class TimeoutEvaluator {
    static final long ONE_SECOND_MILLIS = 1000L;

    private final QueueConfig config;

    TimeoutEvaluator(QueueConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    /**
     * Effective timeout of a notification, 0 meaning it never expires.
     *
     * <p>An explicit timeout wins over the urgency default. Transient notifications are capped at the
     * configured transient timeout, which also applies when they would otherwise never expire.
     */
    long effectiveTimeout(Notification n) {
        long timeout = n.timeoutMillis() == Notification.DEFAULT_TIMEOUT
                ? config.timeoutFor(n.urgency())
                : n.timeoutMillis();
        long cap = config.getTransientTimeoutMillis();
        if (n.transientHint() && cap > 0) {
            timeout = timeout == 0 ? cap : Math.min(timeout, cap);
        }
        return timeout;
    }

    long effectiveTimeout(QueuedNotification entry) {
        return entry.isSticky() ? 0 : effectiveTimeout(entry.getContent());
    }

    /**
     * Whether the entry's timeout is currently suspended. Fullscreen overrides idle; while idle only transient
     * notifications keep aging. Configured urgencies are also held while fullscreen.
     */
    boolean isHeld(QueuedNotification entry, boolean idle, boolean fullscreen) {
        Notification n = entry.getContent();
        if (fullscreen) {
            Set<Urgency> held = config.getFullscreenHoldUrgencies();
            return held != null && held.contains(n.urgency());
        }
        return idle && !n.transientHint();
    }

    boolean isExpired(QueuedNotification entry, long now) {
        long timeout = effectiveTimeout(entry);
        return timeout > 0 && now - entry.getDisplayedAtMillis() > timeout;
    }

    /**
     * Milliseconds until the next change of the entry's rendered state, {@code 0} if it is already past its
     * timeout, or {@link Long#MAX_VALUE} if nothing will change.
     *
     * <p>The age label appears once the age reaches the show-age threshold and then changes every second;
     * minute and hour rollovers of the label always land on a second boundary.
     */
    long nextChange(QueuedNotification entry, long now) {
        long sleep = Long.MAX_VALUE;

        long timeout = effectiveTimeout(entry);
        if (timeout > 0) {
            long ttl = timeout - (now - entry.getDisplayedAtMillis());
            if (ttl <= 0) {
                return 0;
            }
            sleep = ttl;
        }

        long threshold = config.getShowAgeThresholdMillis();
        if (threshold >= 0) {
            long age = Math.max(0, now - entry.getCreatedAtMillis());
            if (age > threshold - ONE_SECOND_MILLIS) {
                sleep = Math.min(sleep, ONE_SECOND_MILLIS - (age % ONE_SECOND_MILLIS));
            } else {
                sleep = Math.min(sleep, threshold - age);
            }
        }
        return sleep;
    }
}
