package dev.notifyqueue.api;

import dev.notifyqueue.model.CloseReason;
import dev.notifyqueue.model.Urgency;

import java.util.List;

/**
 * Point-in-time, immutable copy of all three queues, suitable for listing and JSON export.
 */
public record QueueSnapshot(
        boolean paused,
        int displayedLimit,
        List<Entry> waiting,
        List<Entry> displayed,
        List<Entry> history
) {
    public QueueSnapshot {
        waiting = List.copyOf(waiting);
        displayed = List.copyOf(displayed);
        history = List.copyOf(history);
    }

    /**
     * One notification as seen at snapshot time. {@code displayedAtMillis} is -1 when not displayed,
     * {@code closeReason} is null unless the entry is in history.
     */
    public record Entry(
            long id,
            String appName,
            String summary,
            String body,
            Urgency urgency,
            int progress,
            int repeatCount,
            long createdAtMillis,
            long displayedAtMillis,
            CloseReason closeReason
    ) {
    }
}
