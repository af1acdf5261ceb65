package dev.notifyqueue.ser;

import dev.notifyqueue.api.QueueSnapshot;

/**
 * Wire form of a {@link QueueSnapshot}, used for history listings and diagnostics dumps.
 */
public interface SnapshotSerializer {
    byte[] serialize(QueueSnapshot snapshot);

    QueueSnapshot deserialize(byte[] bytes);
}
