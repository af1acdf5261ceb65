package dev.notifyqueue.core;

import dev.notifyqueue.api.NotificationQueues;
import dev.notifyqueue.api.QueueSnapshot;
import dev.notifyqueue.config.QueueConfig;
import dev.notifyqueue.model.CloseReason;
import dev.notifyqueue.testing.MutableClock;
import dev.notifyqueue.testing.RecordingCloseSignalSink;
import org.junit.jupiter.api.Test;

import static dev.notifyqueue.testing.Notifications.simple;
import static org.junit.jupiter.api.Assertions.*;

class NotificationQueueEngineLifecycleTest {

    private final MutableClock clock = MutableClock.startingAtMillis(0L);

    @Test
    void closedQueuesRejectEveryOperation() {
        NotificationQueueEngine queues = new NotificationQueueEngine(new QueueConfig(), new RecordingCloseSignalSink(), clock);
        queues.insert(simple("a"));
        queues.close();

        assertTrue(queues.isClosed());
        assertThrows(IllegalStateException.class, () -> queues.insert(simple("b")));
        assertThrows(IllegalStateException.class, queues::lengthWaiting);
        assertThrows(IllegalStateException.class, () -> queues.update(false));
        assertThrows(IllegalStateException.class, () -> queues.closeById(1, CloseReason.DISMISSED_BY_USER));
        assertThrows(IllegalStateException.class, queues::historyPop);
        assertThrows(IllegalStateException.class, queues::pauseOn);
        assertThrows(IllegalStateException.class, () -> queues.getNextDataChange(0));
    }

    @Test
    void closeIsIdempotent() {
        NotificationQueueEngine queues = new NotificationQueueEngine(new QueueConfig());
        queues.close();
        assertDoesNotThrow(queues::close);
    }

    @Test
    void teardownReleasesNotificationsInAllQueues() {
        RecordingCloseSignalSink sink = new RecordingCloseSignalSink();
        NotificationQueueEngine queues = new NotificationQueueEngine(new QueueConfig().setDisplayedLimit(1), sink, clock);
        long a = queues.insert(simple("a"));
        queues.insert(simple("b"));
        queues.insert(simple("c"));
        queues.update(false);
        queues.closeById(a, CloseReason.DISMISSED_BY_USER);
        queues.update(false);
        QueuedNotification displayed = queues.getDisplayed().get(0);
        QueuedNotification waiting = queues.getWaiting().get(0);
        QueuedNotification archived = queues.getHistory().get(0);

        queues.close();

        assertEquals(QueueLocation.DETACHED, displayed.getLocation());
        assertEquals(QueueLocation.DETACHED, waiting.getLocation());
        assertEquals(QueueLocation.DETACHED, archived.getLocation());
        assertEquals(1, sink.signals().size(), "teardown does not emit close signals");
    }

    @Test
    void instancesAreIndependent() {
        try (NotificationQueues first = new NotificationQueueEngine(new QueueConfig().setName("first"));
             NotificationQueues second = new NotificationQueueEngine(new QueueConfig().setName("second"))) {
            assertEquals(1, first.insert(simple("a")));
            assertEquals(1, second.insert(simple("a")));

            first.pauseOn();
            first.update(false);
            second.update(false);

            assertEquals(0, first.lengthDisplayed());
            assertEquals(1, second.lengthDisplayed());
        }
    }

    @Test
    void negativeHistoryLength_isRejectedAtConstruction() {
        assertThrows(IllegalArgumentException.class,
                () -> new NotificationQueueEngine(new QueueConfig().setHistoryLength(-1)));
    }

    @Test
    void snapshot_reflectsAllThreeQueues() {
        try (NotificationQueueEngine queues = new NotificationQueueEngine(
                new QueueConfig().setDisplayedLimit(1), new RecordingCloseSignalSink(), clock)) {
            long a = queues.insert(simple("a"));
            long b = queues.insert(simple("b"));
            long c = queues.insert(simple("c"));
            queues.update(false);
            queues.closeById(c, CloseReason.CLOSED_BY_SIGNAL);
            queues.pauseOn();

            QueueSnapshot snapshot = queues.snapshot();

            assertTrue(snapshot.paused());
            assertEquals(1, snapshot.displayedLimit());
            assertEquals(a, snapshot.displayed().get(0).id());
            assertEquals(b, snapshot.waiting().get(0).id());
            assertEquals(-1L, snapshot.waiting().get(0).displayedAtMillis());
            assertEquals(c, snapshot.history().get(0).id());
            assertEquals(CloseReason.CLOSED_BY_SIGNAL, snapshot.history().get(0).closeReason());
            assertEquals("a", snapshot.displayed().get(0).summary());
        }
    }
}
