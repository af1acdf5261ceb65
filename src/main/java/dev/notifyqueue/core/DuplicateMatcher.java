package dev.notifyqueue.core;

import dev.notifyqueue.model.Notification;
import dev.notifyqueue.queue.NotificationQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds live notifications that an incoming fresh arrival should be folded into, either because it carries
 * the same stack tag or because it is a duplicate by content.
 */
final class DuplicateMatcher {
    private static final Logger logger = LoggerFactory.getLogger(DuplicateMatcher.class);

    /**
     * Content identity used for duplicate stacking: origin, summary and body.
     */
    record DedupKey(String appName, String summary, String body) {
        static DedupKey of(Notification n) {
            return new DedupKey(n.appName(), n.summary(), n.body());
        }
    }

    /**
     * Returns the first entry, scanning the queues in the given order, whose content is a duplicate of
     * {@code incoming}, or null.
     */
    QueuedNotification findDuplicate(Notification incoming, NotificationQueue... queues) {
        DedupKey key = DedupKey.of(incoming);
        for (NotificationQueue queue : queues) {
            for (QueuedNotification candidate : queue) {
                if (key.equals(DedupKey.of(candidate.getContent()))) {
                    return candidate;
                }
            }
        }
        return null;
    }

    /**
     * Returns the live entry sharing {@code incoming}'s stack tag and application, or null.
     */
    QueuedNotification findByStackTag(Notification incoming, NotificationQueue... queues) {
        if (!incoming.hasStackTag()) {
            return null;
        }
        for (NotificationQueue queue : queues) {
            for (QueuedNotification candidate : queue) {
                Notification c = candidate.getContent();
                if (incoming.stackTag().equals(c.stackTag()) && incoming.appName().equals(c.appName())) {
                    return candidate;
                }
            }
        }
        return null;
    }

    /**
     * Folds {@code incoming} into {@code existing}, which keeps its id and queue position.
     *
     * <p>A changed progress value is an update, not a repeat: the progress is taken over and the repeat count
     * stays. Otherwise the repeat count goes up by one. Either way the creation time is refreshed and, if the
     * entry is on screen, its timeout restarts.
     */
    void merge(QueuedNotification existing, Notification incoming, long now) {
        Notification current = existing.getContent();
        if (current.progress() == incoming.progress()) {
            existing.incrementRepeatCount();
        } else {
            existing.setContent(current.toBuilder().progress(incoming.progress()).build());
        }
        existing.setCreatedAtMillis(now);
        if (existing.isDisplayed()) {
            existing.setDisplayedAtMillis(now);
        }
        if (logger.isDebugEnabled()) {
            logger.debug("Merged duplicate into notification {} (repeatCount={}, progress={})",
                    existing.getId(), existing.getRepeatCount(), existing.getContent().progress());
        }
    }
}
